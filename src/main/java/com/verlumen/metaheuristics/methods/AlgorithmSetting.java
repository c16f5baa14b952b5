package com.verlumen.metaheuristics.methods;

/**
 * Immutable operator parameters of an algorithm variant.
 *
 * <p>A setting holds no run state; every run gets a fresh {@link Algorithm} from {@link
 * #createAlgorithm()}.
 */
public interface AlgorithmSetting {
  Method method();

  /** Population size used when the solver is not told otherwise. */
  int defaultPopulationSize();

  /** Smallest population for which the variant's operators are defined. */
  int minimumPopulationSize();

  <P> Algorithm<P> createAlgorithm();
}
