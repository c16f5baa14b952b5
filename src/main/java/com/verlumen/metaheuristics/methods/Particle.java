package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.ranking.Ranking;

/** A swarm member: the current individual plus its velocity and personal best. */
record Particle<P>(
    Individual<P> current, ImmutableDoubleArray velocity, Individual<P> personalBest) {
  Particle {
    checkNotNull(current);
    checkNotNull(velocity);
    checkNotNull(personalBest);
  }

  static <P> Particle<P> start(Individual<P> individual, ImmutableDoubleArray velocity) {
    return new Particle<>(individual, velocity, individual);
  }

  /** The particle after flying to {@code next}; the personal best follows if {@code next} wins. */
  Particle<P> moveTo(Individual<P> next, ImmutableDoubleArray velocity) {
    Individual<P> best =
        Ranking.replaces(next.fitness(), personalBest.fitness()) ? next : personalBest;
    return new Particle<>(next, velocity, best);
  }
}
