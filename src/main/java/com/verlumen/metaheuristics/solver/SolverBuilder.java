package com.verlumen.metaheuristics.solver;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.Stopwatch;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.FluentLogger;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.CandidateEvaluator;
import com.verlumen.metaheuristics.core.ConfigurationException;
import com.verlumen.metaheuristics.core.Context;
import com.verlumen.metaheuristics.core.ContextView;
import com.verlumen.metaheuristics.core.ObjectiveFunction;
import com.verlumen.metaheuristics.core.RandomStream;
import com.verlumen.metaheuristics.core.SequentialEvaluator;
import com.verlumen.metaheuristics.methods.Algorithm;
import com.verlumen.metaheuristics.methods.AlgorithmSetting;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Collects the configuration of one run and runs it.
 *
 * <p>Only {@link #bounds} is required. Unless told otherwise the run uses a fresh random seed, the
 * setting's default population size, uniform initial positions, sequential evaluation and stops
 * after 200 generations.
 */
public final class SolverBuilder<P> {
  private static final FluentLogger logger = FluentLogger.forEnclosingClass();

  private final AlgorithmSetting setting;
  private final ObjectiveFunction<P> objective;
  private final List<Callback<P>> callbacks = new ArrayList<>();
  private Bounds bounds;
  private Long seed;
  private int populationSize;
  private int paretoLimit = SolverConstants.DEFAULT_PARETO_LIMIT;
  private Predicate<? super ContextView<P>> task =
      Tasks.maxGeneration(SolverConstants.DEFAULT_MAX_GENERATIONS);
  private Pool pool = Pool.uniform();
  private CandidateEvaluator evaluator = new SequentialEvaluator();

  SolverBuilder(AlgorithmSetting setting, ObjectiveFunction<P> objective) {
    this.setting = checkNotNull(setting);
    this.objective = checkNotNull(objective);
  }

  public SolverBuilder<P> bounds(Bounds bounds) {
    this.bounds = checkNotNull(bounds);
    return this;
  }

  /** Fixes the random seed so the run can be replayed. */
  public SolverBuilder<P> seed(long seed) {
    this.seed = seed;
    return this;
  }

  public SolverBuilder<P> populationSize(int populationSize) {
    this.populationSize = populationSize;
    return this;
  }

  /** Largest Pareto front kept by multi-objective runs. Ignored for single objectives. */
  public SolverBuilder<P> paretoLimit(int paretoLimit) {
    this.paretoLimit = paretoLimit;
    return this;
  }

  /** Termination condition, checked before every generation step. */
  public SolverBuilder<P> task(Predicate<? super ContextView<P>> task) {
    this.task = checkNotNull(task);
    return this;
  }

  /** Adds a callback; callbacks run in the order they were added. */
  public SolverBuilder<P> callback(Callback<P> callback) {
    callbacks.add(checkNotNull(callback));
    return this;
  }

  public SolverBuilder<P> initialPool(Pool pool) {
    this.pool = checkNotNull(pool);
    return this;
  }

  public SolverBuilder<P> evaluator(CandidateEvaluator evaluator) {
    this.evaluator = checkNotNull(evaluator);
    return this;
  }

  /**
   * Runs the search until the task says stop.
   *
   * @throws ConfigurationException if the configuration is inconsistent; no evaluation has run
   * @throws RunExhaustedException if every candidate evaluated in a generation is invalid
   * @throws CallbackFailedException if a callback throws
   */
  public Report<P> solve() {
    int size = validate();
    Stopwatch stopwatch = Stopwatch.createStarted();
    RandomStream random = seed == null ? RandomStream.unseeded() : RandomStream.of(seed);
    Context<P> ctx = new Context<>(objective, bounds, random, evaluator, paretoLimit);
    ContextView<P> view = ctx.view();
    logger.atInfo().log(
        "Starting %s: population %d, %d dimensions, %d objectives, seed %d",
        setting.method(), size, bounds.dimension(), objective.objectiveCount(), random.seed());

    List<GenerationRecord<P>> history = new ArrayList<>();
    ctx.initialize(pool.generate(bounds, size, random));
    checkExhausted(ctx, history);
    history.add(GenerationRecord.of(view));

    Algorithm<P> algorithm = setting.createAlgorithm();
    algorithm.init(ctx);
    while (!task.test(view)) {
      ctx.beginGeneration();
      algorithm.step(ctx);
      checkState(
          ctx.population().size() == size,
          "%s changed the population size from %s to %s",
          setting.method(),
          size,
          ctx.population().size());
      ctx.completeGeneration();
      checkExhausted(ctx, history);
      history.add(GenerationRecord.of(view));
      for (Callback<P> callback : callbacks) {
        try {
          callback.onGeneration(view);
        } catch (Exception e) {
          logger.atWarning().withCause(e).log(
              "Callback failed at generation %d; aborting", ctx.generation());
          throw new CallbackFailedException(
              "Callback failed at generation " + ctx.generation(),
              e,
              Report.create(setting.method(), view, history));
        }
      }
    }

    logger.atInfo().log(
        "Finished %s after %d generations and %d evaluations in %s; best %s",
        setting.method(), ctx.generation(), ctx.evaluations(), stopwatch, view.bestFitness());
    return Report.create(setting.method(), view, history);
  }

  private int validate() {
    if (bounds == null) {
      throw new ConfigurationException("Bounds are required");
    }
    if (bounds.isEmpty()) {
      throw new ConfigurationException("Bounds must not be empty");
    }
    if (bounds.dimension() != objective.dimension()) {
      throw new ConfigurationException(
          "Bounds have %s dimensions but the objective expects %s",
          bounds.dimension(), objective.dimension());
    }
    if (objective.objectiveCount() < 1) {
      throw new ConfigurationException(
          "Objective must declare at least one objective: %s", objective.objectiveCount());
    }
    if (paretoLimit < 1) {
      throw new ConfigurationException("Pareto limit must be positive: %s", paretoLimit);
    }
    int size = populationSize > 0 ? populationSize : setting.defaultPopulationSize();
    if (populationSize < 0) {
      throw new ConfigurationException("Population size must not be negative: %s", populationSize);
    }
    if (size < setting.minimumPopulationSize()) {
      throw new ConfigurationException(
          "%s needs a population of at least %s but got %s",
          setting.method(), setting.minimumPopulationSize(), size);
    }
    return size;
  }

  /** Fails the run when a generation evaluated candidates and not one of them was valid. */
  private void checkExhausted(Context<P> ctx, List<GenerationRecord<P>> history) {
    if (ctx.generationEvaluations() > 0 && ctx.generationValid() == 0) {
      logger.atWarning().log(
          "All %d candidates of generation %d are invalid",
          ctx.generationEvaluations(), ctx.generation());
      throw new RunExhaustedException(
          String.format(
              "All %s candidates of generation %s are invalid",
              ctx.generationEvaluations(), ctx.generation()),
          Report.create(setting.method(), ctx.view(), history));
    }
  }
}
