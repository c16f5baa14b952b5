package com.verlumen.metaheuristics.solver;

/** Failure of a run after it started; carries the report up to the failure. */
public abstract class SolverException extends RuntimeException {
  private final Report<?> partialReport;

  SolverException(String message, Throwable cause, Report<?> partialReport) {
    super(message, cause);
    this.partialReport = partialReport;
  }

  public Report<?> partialReport() {
    return partialReport;
  }
}
