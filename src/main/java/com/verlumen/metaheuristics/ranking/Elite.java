package com.verlumen.metaheuristics.ranking;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.RandomStream;

/**
 * Archive of the best individuals found so far.
 *
 * <p>Updates never make the archive worse: a single-objective archive only accepts a strictly
 * better individual, and a Pareto archive only evicts members that a newcomer dominates or that
 * crowd the front beyond its limit.
 */
public interface Elite<P> {
  /** Offers every candidate to the archive, in order. */
  void update(Iterable<Individual<P>> candidates);

  boolean isEmpty();

  /** The single best individual, or the most balanced member of a Pareto front. */
  Individual<P> best();

  /** All archived individuals: the best alone, or the whole Pareto front. */
  ImmutableList<Individual<P>> members();

  /** A leader for guiding moves: the best, or a uniformly drawn front member. */
  Individual<P> sample(RandomStream random);

  static <P> Elite<P> create(int objectiveCount, int paretoLimit) {
    checkArgument(objectiveCount >= 1, "Need at least one objective: %s", objectiveCount);
    return objectiveCount == 1 ? new SingleElite<>() : new ParetoElite<>(paretoLimit);
  }
}
