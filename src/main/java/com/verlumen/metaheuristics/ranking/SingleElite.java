package com.verlumen.metaheuristics.ranking;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.RandomStream;

/** Keeps the single best individual. The first of several equal individuals wins. */
final class SingleElite<P> implements Elite<P> {
  private Individual<P> best;

  @Override
  public void update(Iterable<Individual<P>> candidates) {
    for (Individual<P> candidate : candidates) {
      if (best == null || Ranking.isBetter(candidate.fitness(), best.fitness())) {
        best = candidate;
      }
    }
  }

  @Override
  public boolean isEmpty() {
    return best == null;
  }

  @Override
  public Individual<P> best() {
    checkState(best != null, "No individual has been archived yet");
    return best;
  }

  @Override
  public ImmutableList<Individual<P>> members() {
    return best == null ? ImmutableList.of() : ImmutableList.of(best);
  }

  @Override
  public Individual<P> sample(RandomStream random) {
    return best();
  }
}
