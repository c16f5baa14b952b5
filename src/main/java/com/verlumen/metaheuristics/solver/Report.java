package com.verlumen.metaheuristics.solver;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.ContextView;
import com.verlumen.metaheuristics.core.Fitness;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.methods.Method;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of a run.
 *
 * <p>Reports are values: two runs with the same seed, objective, bounds and setting produce equal
 * reports.
 */
@AutoValue
public abstract class Report<P> {
  public abstract Method method();

  /** Seed of the run; replaying it reproduces this report. */
  public abstract long seed();

  /** Last completed generation. */
  public abstract long generation();

  public abstract long evaluations();

  /** Best individual; for multi-objective runs the most balanced front member. */
  public abstract Individual<P> best();

  /** Final Pareto front; for single-objective runs the best individual alone. */
  public abstract ImmutableList<Individual<P>> paretoFront();

  /** Final population. */
  public abstract ImmutableList<Individual<P>> population();

  /** One record per generation, starting with the initial population. */
  public abstract ImmutableList<GenerationRecord<P>> history();

  public ImmutableDoubleArray bestParameters() {
    return best().position();
  }

  public Fitness<P> bestFitness() {
    return best().fitness();
  }

  /** Product the objective attached to the best fitness, if any. */
  public Optional<P> product() {
    return best().fitness().product();
  }

  static <P> Report<P> create(
      Method method, ContextView<P> ctx, List<GenerationRecord<P>> history) {
    return new AutoValue_Report<>(
        method,
        ctx.seed(),
        ctx.generation(),
        ctx.evaluations(),
        ctx.best(),
        ctx.paretoFront(),
        ctx.population(),
        ImmutableList.copyOf(history));
  }
}
