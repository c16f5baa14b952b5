package com.verlumen.metaheuristics.core;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * The function being minimized. Implementations are supplied by the caller.
 *
 * <p>For runs to be reproducible, {@link #evaluate} must be a pure function of its input. It may be
 * called from several threads at once when a parallel {@link CandidateEvaluator} is in use.
 *
 * @param <P> type of the product attached to each fitness, or {@link Void} if there is none
 */
public interface ObjectiveFunction<P> {
  /** Number of parameters the function expects. */
  int dimension();

  /** Number of objectives in each returned fitness. */
  default int objectiveCount() {
    return 1;
  }

  /**
   * Scores one candidate.
   *
   * <p>Returning NaN, or throwing an unchecked exception, marks the candidate invalid instead of
   * failing the run.
   */
  Fitness<P> evaluate(ImmutableDoubleArray position);
}
