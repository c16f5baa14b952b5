package com.verlumen.metaheuristics.core;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.List;

/** Evaluates candidates one after another on the calling thread. */
public final class SequentialEvaluator implements CandidateEvaluator {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  @Override
  public <P> ImmutableList<Fitness<P>> evaluate(
      ObjectiveFunction<P> objective, List<ImmutableDoubleArray> positions) {
    ImmutableList.Builder<Fitness<P>> results = ImmutableList.builderWithExpectedSize(positions.size());
    for (ImmutableDoubleArray position : positions) {
      results.add(evaluateSafely(objective, position));
    }
    return results.build();
  }

  /** Calls {@code objective} once, demoting an unchecked failure to an invalid fitness. */
  static <P> Fitness<P> evaluateSafely(
      ObjectiveFunction<P> objective, ImmutableDoubleArray position) {
    try {
      return objective.evaluate(position);
    } catch (RuntimeException e) {
      logger.atFine().withCause(e).log("Evaluation of %s failed; demoting it", position);
      return Fitness.invalid(objective.objectiveCount());
    }
  }
}
