package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Firefly algorithm settings.
 *
 * <p>Every firefly is compared with every other one, so a generation costs O(N²·D) arithmetic for
 * N fireflies in D dimensions. It still evaluates only N candidates.
 */
@AutoValue
public abstract class Fa implements AlgorithmSetting {
  static final double DEFAULT_ALPHA = 0.05;
  static final double DEFAULT_ALPHA_DECAY = 0.98;
  static final double DEFAULT_BETA_MIN = 0.2;
  static final double DEFAULT_BETA0 = 1.0;
  static final double DEFAULT_GAMMA = 1.0;
  static final int DEFAULT_POPULATION_SIZE = 80;

  /** Random step size as a fraction of each dimension's width. */
  public abstract double alpha();

  /** Factor applied to {@link #alpha()} once per generation. */
  public abstract double alphaDecay();

  /** Attractiveness left at infinite distance. */
  public abstract double betaMin();

  /** Attractiveness at zero distance. */
  public abstract double beta0();

  /** Light absorption coefficient; attractiveness decays as {@code exp(-gamma * r²)}. */
  public abstract double gamma();

  public static Fa defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Fa.Builder()
        .alpha(DEFAULT_ALPHA)
        .alphaDecay(DEFAULT_ALPHA_DECAY)
        .betaMin(DEFAULT_BETA_MIN)
        .beta0(DEFAULT_BETA0)
        .gamma(DEFAULT_GAMMA);
  }

  public abstract Builder toBuilder();

  @Override
  public final Method method() {
    return Method.FA;
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
    return new FaAlgorithm<>(this);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder alpha(double alpha);

    public abstract Builder alphaDecay(double alphaDecay);

    public abstract Builder betaMin(double betaMin);

    public abstract Builder beta0(double beta0);

    public abstract Builder gamma(double gamma);

    abstract Fa autoBuild();

    public final Fa build() {
      Fa setting = autoBuild();
      checkArgument(setting.alpha() >= 0, "alpha must be non-negative: %s", setting.alpha());
      checkArgument(
          setting.alphaDecay() > 0 && setting.alphaDecay() <= 1,
          "alphaDecay must be within (0, 1]: %s",
          setting.alphaDecay());
      checkArgument(
          setting.betaMin() >= 0 && setting.betaMin() <= setting.beta0(),
          "betaMin must be within [0, beta0]: %s",
          setting.betaMin());
      checkArgument(setting.gamma() >= 0, "gamma must be non-negative: %s", setting.gamma());
      return setting;
    }
  }
}
