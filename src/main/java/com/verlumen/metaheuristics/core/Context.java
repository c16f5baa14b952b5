package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.ranking.Elite;
import java.util.List;

/**
 * Mutable state of one run: population, bounds, random stream, counters and the elite archive.
 *
 * <p>A context is owned by exactly one run. Algorithms read and replace population members and
 * draw from {@link #random()}; all objective calls go through {@link #evaluateAll}, which clips
 * positions into bounds and counts evaluations.
 */
public final class Context<P> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final ObjectiveFunction<P> objective;
  private final Bounds bounds;
  private final RandomStream random;
  private final CandidateEvaluator evaluator;
  private final Elite<P> elite;
  private final ContextView<P> view = new View();

  private Population<P> population;
  private long generation;
  private long evaluations;
  private long generationEvaluations;
  private long generationValid;

  public Context(
      ObjectiveFunction<P> objective,
      Bounds bounds,
      RandomStream random,
      CandidateEvaluator evaluator,
      int paretoLimit) {
    checkArgument(
        objective.dimension() == bounds.dimension(),
        "Objective expects %s dimensions but bounds have %s",
        objective.dimension(),
        bounds.dimension());
    this.objective = objective;
    this.bounds = bounds;
    this.random = checkNotNull(random);
    this.evaluator = checkNotNull(evaluator);
    this.elite = Elite.create(objective.objectiveCount(), paretoLimit);
  }

  /** Evaluates and installs the initial population as generation 0. */
  public void initialize(List<double[]> positions) {
    checkState(population == null, "Context is already initialized");
    generationEvaluations = 0;
    generationValid = 0;
    population = new Population<>(evaluateAll(positions));
    elite.update(population);
  }

  /** Resets the per-generation counters before a generation step. */
  public void beginGeneration() {
    generationEvaluations = 0;
    generationValid = 0;
  }

  /** Closes a generation step: bumps the counter and folds the population into the elite. */
  public void completeGeneration() {
    generation++;
    elite.update(population);
    logger.atFine().log(
        "Generation %d: %d evaluations, %d valid, best %s",
        generation,
        generationEvaluations,
        generationValid,
        elite.isEmpty() ? "none" : elite.best().fitness());
  }

  /**
   * Clips each position into bounds and evaluates the whole batch, in order.
   *
   * @throws ConfigurationException if the objective returns a fitness of the wrong arity
   */
  public ImmutableList<Individual<P>> evaluateAll(List<double[]> positions) {
    ImmutableList.Builder<ImmutableDoubleArray> clipped =
        ImmutableList.builderWithExpectedSize(positions.size());
    for (double[] position : positions) {
      clipped.add(ImmutableDoubleArray.copyOf(bounds.clip(position.clone())));
    }
    ImmutableList<ImmutableDoubleArray> batch = clipped.build();
    ImmutableList<Fitness<P>> results = evaluator.evaluate(objective, batch);
    checkState(
        results.size() == batch.size(),
        "Evaluator returned %s results for %s candidates",
        results.size(),
        batch.size());

    ImmutableList.Builder<Individual<P>> individuals =
        ImmutableList.builderWithExpectedSize(batch.size());
    for (int i = 0; i < batch.size(); i++) {
      Fitness<P> fitness = checkNotNull(results.get(i), "Objective returned a null fitness");
      if (fitness.arity() != objective.objectiveCount()) {
        throw new ConfigurationException(
            "Objective declares %s objectives but returned %s",
            objective.objectiveCount(), fitness.arity());
      }
      if (fitness.isValid()) {
        generationValid++;
      } else {
        logger.atFine().log("Candidate %s has an invalid fitness", batch.get(i));
      }
      individuals.add(Individual.of(batch.get(i), fitness));
    }
    evaluations += batch.size();
    generationEvaluations += batch.size();
    return individuals.build();
  }

  public Individual<P> evaluate(double[] position) {
    return evaluateAll(ImmutableList.of(position)).get(0);
  }

  public ObjectiveFunction<P> objective() {
    return objective;
  }

  public Bounds bounds() {
    return bounds;
  }

  public RandomStream random() {
    return random;
  }

  public Population<P> population() {
    checkState(population != null, "Context is not initialized");
    return population;
  }

  public Elite<P> elite() {
    return elite;
  }

  public int dimension() {
    return bounds.dimension();
  }

  public int objectiveCount() {
    return objective.objectiveCount();
  }

  public boolean isMultiObjective() {
    return objective.objectiveCount() > 1;
  }

  public long generation() {
    return generation;
  }

  public long evaluations() {
    return evaluations;
  }

  public long generationEvaluations() {
    return generationEvaluations;
  }

  public long generationValid() {
    return generationValid;
  }

  /** Best individual; falls back to the first member while the elite is still empty. */
  public Individual<P> best() {
    return elite.isEmpty() ? population().get(0) : elite.best();
  }

  /** A read-only view backed by this context. */
  public ContextView<P> view() {
    return view;
  }

  private final class View implements ContextView<P> {
    @Override
    public long generation() {
      return generation;
    }

    @Override
    public long evaluations() {
      return evaluations;
    }

    @Override
    public long seed() {
      return random.seed();
    }

    @Override
    public Bounds bounds() {
      return bounds;
    }

    @Override
    public int objectiveCount() {
      return objective.objectiveCount();
    }

    @Override
    public int populationSize() {
      return Context.this.population().size();
    }

    @Override
    public ImmutableList<Individual<P>> population() {
      return Context.this.population().snapshot();
    }

    @Override
    public Individual<P> best() {
      return Context.this.best();
    }

    @Override
    public ImmutableList<Individual<P>> paretoFront() {
      return elite.members();
    }
  }
}
