package com.verlumen.metaheuristics.methods;

/**
 * Teaching-learning based optimization.
 *
 * <p>The variant has no operator parameters; only the population size is tunable, through the
 * solver.
 */
public final class Tlbo implements AlgorithmSetting {
  static final int DEFAULT_POPULATION_SIZE = 200;

  private static final Tlbo INSTANCE = new Tlbo();

  private Tlbo() {}

  public static Tlbo create() {
    return INSTANCE;
  }

  @Override
  public Method method() {
    return Method.TLBO;
  }

  @Override
  public int defaultPopulationSize() {
    return DEFAULT_POPULATION_SIZE;
  }

  @Override
  public int minimumPopulationSize() {
    return 2;
  }

  @Override
  public <P> Algorithm<P> createAlgorithm() {
    return new TlboAlgorithm<>();
  }

  @Override
  public String toString() {
    return "Tlbo{}";
  }
}
