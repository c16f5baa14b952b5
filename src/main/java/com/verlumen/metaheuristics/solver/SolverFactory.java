package com.verlumen.metaheuristics.solver;

import com.google.inject.Inject;
import com.verlumen.metaheuristics.core.CandidateEvaluator;
import com.verlumen.metaheuristics.core.ObjectiveFunction;
import com.verlumen.metaheuristics.methods.AlgorithmSetting;

/** Creates solver builders pre-wired with the injected {@link CandidateEvaluator}. */
public final class SolverFactory {
  private final CandidateEvaluator evaluator;

  @Inject
  SolverFactory(CandidateEvaluator evaluator) {
    this.evaluator = evaluator;
  }

  public <P> SolverBuilder<P> build(AlgorithmSetting setting, ObjectiveFunction<P> objective) {
    return Solver.build(setting, objective).evaluator(evaluator);
  }
}
