package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;

/**
 * Particle swarm optimization settings.
 *
 * <p>Each particle keeps a velocity and its personal best position. The defaults are the
 * constriction-equivalent inertia weight and acceleration coefficients.
 */
@AutoValue
public abstract class Pso implements AlgorithmSetting {
  static final double DEFAULT_INERTIA = 0.729;
  static final double DEFAULT_COGNITION = 1.49445;
  static final double DEFAULT_SOCIAL = 1.49445;
  static final double DEFAULT_VELOCITY_LIMIT = 0.2;
  static final int DEFAULT_POPULATION_SIZE = 200;

  /** Weight of the previous velocity. */
  public abstract double inertia();

  /** Attraction toward the particle's own best position. */
  public abstract double cognition();

  /** Attraction toward the swarm leader. */
  public abstract double social();

  /** Largest velocity component, as a fraction of the dimension's width. */
  public abstract double velocityLimit();

  public static Pso defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_Pso.Builder()
        .inertia(DEFAULT_INERTIA)
        .cognition(DEFAULT_COGNITION)
        .social(DEFAULT_SOCIAL)
        .velocityLimit(DEFAULT_VELOCITY_LIMIT);
  }

  public abstract Builder toBuilder();

  @Override
  public final Method method() {
    return Method.PSO;
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
    return new PsoAlgorithm<>(this);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder inertia(double inertia);

    public abstract Builder cognition(double cognition);

    public abstract Builder social(double social);

    public abstract Builder velocityLimit(double velocityLimit);

    abstract Pso autoBuild();

    public final Pso build() {
      Pso setting = autoBuild();
      checkArgument(setting.inertia() >= 0, "inertia must be non-negative: %s", setting.inertia());
      checkArgument(
          setting.cognition() >= 0, "cognition must be non-negative: %s", setting.cognition());
      checkArgument(setting.social() >= 0, "social must be non-negative: %s", setting.social());
      checkArgument(
          setting.velocityLimit() > 0 && setting.velocityLimit() <= 1,
          "velocityLimit must be within (0, 1]: %s",
          setting.velocityLimit());
      return setting;
    }
  }
}
