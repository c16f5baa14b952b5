package com.verlumen.metaheuristics.solver;

import com.verlumen.metaheuristics.core.ObjectiveFunction;
import com.verlumen.metaheuristics.methods.AlgorithmSetting;

/**
 * Entry point for running an optimization.
 *
 * <pre>{@code
 * Report<Void> report =
 *     Solver.build(Rga.defaults(), objective)
 *         .bounds(Bounds.uniform(2, -10, 10))
 *         .seed(0)
 *         .task(Tasks.maxGeneration(50))
 *         .solve();
 * }</pre>
 */
public final class Solver {
  private Solver() {}

  public static <P> SolverBuilder<P> build(
      AlgorithmSetting setting, ObjectiveFunction<P> objective) {
    return new SolverBuilder<>(setting, objective);
  }
}
