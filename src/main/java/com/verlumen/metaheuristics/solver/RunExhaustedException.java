package com.verlumen.metaheuristics.solver;

/**
 * Thrown when every candidate evaluated in a generation, the initial one included, has an invalid
 * fitness. A generation that evaluated nothing never exhausts the run.
 */
public final class RunExhaustedException extends SolverException {
  RunExhaustedException(String message, Report<?> partialReport) {
    super(message, null, partialReport);
  }
}
