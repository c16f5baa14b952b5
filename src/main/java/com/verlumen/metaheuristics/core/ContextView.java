package com.verlumen.metaheuristics.core;

import com.google.common.collect.ImmutableList;

/**
 * Read-only view of a running search, handed to termination tasks and callbacks.
 *
 * <p>Collections returned here are snapshots; holding on to them does not pin the live state.
 */
public interface ContextView<P> {
  /** Number of completed generation steps. The initial population is generation 0. */
  long generation();

  /** Number of objective evaluations so far, including the initial population. */
  long evaluations();

  /** Seed of the run's random stream. */
  long seed();

  Bounds bounds();

  int objectiveCount();

  default boolean isMultiObjective() {
    return objectiveCount() > 1;
  }

  int populationSize();

  ImmutableList<Individual<P>> population();

  /** Best individual so far; for multi-objective runs the most balanced front member. */
  Individual<P> best();

  default Fitness<P> bestFitness() {
    return best().fitness();
  }

  /**
   * The Pareto front so far; for single-objective runs the best individual alone. Holds only valid
   * individuals, so it is empty while none has been seen.
   */
  ImmutableList<Individual<P>> paretoFront();
}
