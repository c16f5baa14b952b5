package com.verlumen.metaheuristics.solver;

/** Defaults of the solver driver. */
final class SolverConstants {
  static final int DEFAULT_MAX_GENERATIONS = 200;
  static final int DEFAULT_PARETO_LIMIT = 20;
  static final int MAX_POOL_ATTEMPTS_PER_MEMBER = 1_000;

  private SolverConstants() {}
}
