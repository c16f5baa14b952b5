package com.verlumen.metaheuristics.core;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.List;

/**
 * Evaluates a batch of candidate positions.
 *
 * <p>Results are returned in the order of {@code positions}, whatever order the evaluations ran
 * in. An evaluation that throws is demoted to an invalid fitness rather than failing the batch.
 */
public interface CandidateEvaluator {
  <P> ImmutableList<Fitness<P>> evaluate(
      ObjectiveFunction<P> objective, List<ImmutableDoubleArray> positions);
}
