package com.verlumen.metaheuristics.solver;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;
import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.ContextView;
import com.verlumen.metaheuristics.core.Fitness;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Predicate;

/**
 * Common termination tasks. A task is checked before every generation step, including once on the
 * initial population, and the run stops as soon as it returns true.
 *
 * <p>{@link #maxTime} and {@link #plateau} keep state; build a new one for each run.
 */
public final class Tasks {
  private Tasks() {}

  /** Stops once {@code generations} steps have completed. */
  public static Predicate<ContextView<?>> maxGeneration(long generations) {
    checkArgument(generations >= 0, "Generations must be non-negative: %s", generations);
    return ctx -> ctx.generation() >= generations;
  }

  /** Stops once the objective has been evaluated at least {@code evaluations} times. */
  public static Predicate<ContextView<?>> maxEvaluations(long evaluations) {
    checkArgument(evaluations > 0, "Evaluations must be positive: %s", evaluations);
    return ctx -> ctx.evaluations() >= evaluations;
  }

  /** Stops once the best single-objective fitness is at most {@code target}. */
  public static Predicate<ContextView<?>> minFitness(double target) {
    return ctx -> {
      checkArgument(!ctx.isMultiObjective(), "minFitness needs a single-objective run");
      Fitness<?> best = ctx.bestFitness();
      return best.isValid() && best.value() <= target;
    };
  }

  /** Stops once {@code limit} has elapsed since the task was first checked. */
  public static Predicate<ContextView<?>> maxTime(Duration limit) {
    return maxTime(limit, Ticker.systemTicker());
  }

  public static Predicate<ContextView<?>> maxTime(Duration limit, Ticker ticker) {
    checkNotNull(limit);
    Stopwatch stopwatch = Stopwatch.createUnstarted(ticker);
    return ctx -> {
      if (!stopwatch.isRunning()) {
        stopwatch.start();
      }
      return stopwatch.elapsed().compareTo(limit) >= 0;
    };
  }

  /**
   * Stops once the best fitness improved by no more than {@code tolerance} over the last {@code
   * generations} generations. Multi-objective runs track the sum of the best member's objectives.
   */
  public static Predicate<ContextView<?>> plateau(int generations, double tolerance) {
    checkArgument(generations > 0, "Generations must be positive: %s", generations);
    checkArgument(tolerance >= 0, "Tolerance must be non-negative: %s", tolerance);
    return new Plateau(generations, tolerance);
  }

  /** Stops as soon as any of {@code tasks} would. */
  @SafeVarargs
  public static <P> Predicate<ContextView<P>> anyOf(Predicate<? super ContextView<P>>... tasks) {
    ImmutableList<Predicate<? super ContextView<P>>> all = ImmutableList.copyOf(tasks);
    return ctx -> {
      boolean done = false;
      // Every task sees every generation so that stateful ones stay in step.
      for (Predicate<? super ContextView<P>> task : all) {
        done |= task.test(ctx);
      }
      return done;
    };
  }

  private static final class Plateau implements Predicate<ContextView<?>> {
    private final int generations;
    private final double tolerance;
    private final Deque<Double> window = new ArrayDeque<>();
    private long lastGeneration = -1;

    Plateau(int generations, double tolerance) {
      this.generations = generations;
      this.tolerance = tolerance;
    }

    @Override
    public boolean test(ContextView<?> ctx) {
      if (ctx.generation() != lastGeneration) {
        lastGeneration = ctx.generation();
        window.addLast(score(ctx.bestFitness()));
        if (window.size() > generations + 1) {
          window.removeFirst();
        }
      }
      if (window.size() <= generations) {
        return false;
      }
      return window.getFirst() - window.getLast() <= tolerance;
    }

    private static double score(Fitness<?> fitness) {
      if (!fitness.isValid()) {
        return Double.POSITIVE_INFINITY;
      }
      double sum = 0;
      for (int i = 0; i < fitness.arity(); i++) {
        sum += fitness.objective(i);
      }
      return sum;
    }
  }
}
