package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Real-coded genetic algorithm settings.
 *
 * <p>Parents are chosen by binary tournament, recombined by BLX-alpha crossover and perturbed by
 * non-uniform mutation. Parents and offspring then compete for the next generation, so the best
 * individual always survives.
 */
@AutoValue
public abstract class Rga implements AlgorithmSetting {
  static final double DEFAULT_CROSSOVER_RATE = 0.95;
  static final double DEFAULT_MUTATION_RATE = 0.1;
  static final double DEFAULT_WIN_RATE = 0.95;
  static final double DEFAULT_DELTA = 5.0;
  static final double DEFAULT_BLEND_ALPHA = 0.5;
  static final int DEFAULT_MUTATION_HORIZON = 100;
  static final int DEFAULT_POPULATION_SIZE = 200;

  /** Probability that a pair of parents is recombined. */
  public abstract double crossoverRate();

  /** Per-dimension probability of mutating an offspring. */
  public abstract double mutationRate();

  /** Probability that the better of two tournament contestants wins. */
  public abstract double winRate();

  /** Exponent shrinking the mutation step as the run progresses. */
  public abstract double delta();

  /** How far BLX-alpha crossover may reach beyond the parents, relative to their distance. */
  public abstract double blendAlpha();

  /** Generation at which the mutation step reaches zero; usually the planned run length. */
  public abstract int mutationHorizon();

  public static Rga defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Rga.Builder()
        .crossoverRate(DEFAULT_CROSSOVER_RATE)
        .mutationRate(DEFAULT_MUTATION_RATE)
        .winRate(DEFAULT_WIN_RATE)
        .delta(DEFAULT_DELTA)
        .blendAlpha(DEFAULT_BLEND_ALPHA)
        .mutationHorizon(DEFAULT_MUTATION_HORIZON);
  }

  public abstract Builder toBuilder();

  @Override
  public final Method method() {
    return Method.RGA;
  }

  @Override
  public final int defaultPopulationSize() {
    return DEFAULT_POPULATION_SIZE;
  }

  @Override
  public final int minimumPopulationSize() {
    return 2;
  }

  @Override
  public final <P> Algorithm<P> createAlgorithm() {
    return new RgaAlgorithm<>(this);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder crossoverRate(double crossoverRate);

    public abstract Builder mutationRate(double mutationRate);

    public abstract Builder winRate(double winRate);

    public abstract Builder delta(double delta);

    public abstract Builder blendAlpha(double blendAlpha);

    public abstract Builder mutationHorizon(int mutationHorizon);

    abstract Rga autoBuild();

    public final Rga build() {
      Rga setting = autoBuild();
      checkProbability("crossoverRate", setting.crossoverRate());
      checkProbability("mutationRate", setting.mutationRate());
      checkProbability("winRate", setting.winRate());
      checkArgument(setting.delta() >= 0, "delta must be non-negative: %s", setting.delta());
      checkArgument(
          setting.blendAlpha() >= 0, "blendAlpha must be non-negative: %s", setting.blendAlpha());
      checkArgument(
          setting.mutationHorizon() > 0,
          "mutationHorizon must be positive: %s",
          setting.mutationHorizon());
      return setting;
    }
  }

  static void checkProbability(String name, double value) {
    checkArgument(value >= 0 && value <= 1, "%s must be within [0, 1]: %s", name, value);
  }
}
