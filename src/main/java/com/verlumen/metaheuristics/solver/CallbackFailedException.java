package com.verlumen.metaheuristics.solver;

/** Thrown when a callback fails; the callback's exception is the cause. */
public final class CallbackFailedException extends SolverException {
  CallbackFailedException(String message, Throwable cause, Report<?> partialReport) {
    super(message, cause, partialReport);
  }
}
