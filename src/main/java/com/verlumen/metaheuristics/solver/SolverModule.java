package com.verlumen.metaheuristics.solver;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.verlumen.metaheuristics.core.CandidateEvaluator;
import com.verlumen.metaheuristics.core.ParallelEvaluator;
import com.verlumen.metaheuristics.core.SequentialEvaluator;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Wires the solver's evaluation strategy. A parallelism of one evaluates on the calling thread;
 * anything larger uses a fixed pool of daemon threads that is shut down when the JVM exits.
 */
@AutoValue
public abstract class SolverModule extends AbstractModule {
  public static SolverModule create(int parallelism) {
    checkArgument(parallelism >= 1, "Parallelism must be positive: %s", parallelism);
    return new AutoValue_SolverModule(parallelism);
  }

  abstract int parallelism();

  @Provides
  @Singleton
  CandidateEvaluator provideCandidateEvaluator() {
    if (parallelism() == 1) {
      return new SequentialEvaluator();
    }
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            parallelism(),
            parallelism(),
            0L,
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            new ThreadFactoryBuilder().setNameFormat("objective-evaluator-%d").build());
    return new ParallelEvaluator(
        MoreExecutors.listeningDecorator(MoreExecutors.getExitingExecutorService(pool)));
  }
}
