package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableList.toImmutableList;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import java.util.List;

/**
 * Evaluates candidates concurrently on an executor.
 *
 * <p>Results are reassembled in submission order, so a run produces the same report as it would
 * with {@link SequentialEvaluator}.
 */
public final class ParallelEvaluator implements CandidateEvaluator {
  private final ListeningExecutorService executor;

  public ParallelEvaluator(ListeningExecutorService executor) {
    this.executor = checkNotNull(executor);
  }

  @Override
  public <P> ImmutableList<Fitness<P>> evaluate(
      ObjectiveFunction<P> objective, List<ImmutableDoubleArray> positions) {
    ImmutableList<ListenableFuture<Fitness<P>>> futures =
        positions.stream()
            .map(position -> submit(objective, position))
            .collect(toImmutableList());
    return ImmutableList.copyOf(Futures.getUnchecked(Futures.allAsList(futures)));
  }

  private <P> ListenableFuture<Fitness<P>> submit(
      ObjectiveFunction<P> objective, ImmutableDoubleArray position) {
    return executor.submit(() -> SequentialEvaluator.evaluateSafely(objective, position));
  }
}
