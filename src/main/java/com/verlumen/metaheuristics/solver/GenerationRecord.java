package com.verlumen.metaheuristics.solver;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.ContextView;
import com.verlumen.metaheuristics.core.Fitness;
import com.verlumen.metaheuristics.core.Individual;

/** Progress after one generation: counters plus the best individual at that point. */
public record GenerationRecord<P>(
    long generation, long evaluations, ImmutableDoubleArray bestPosition, Fitness<P> bestFitness,
    int frontSize) {

  static <P> GenerationRecord<P> of(ContextView<P> ctx) {
    Individual<P> best = ctx.best();
    return new GenerationRecord<>(
        ctx.generation(),
        ctx.evaluations(),
        best.position(),
        best.fitness(),
        ctx.paretoFront().size());
  }
}
