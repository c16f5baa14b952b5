package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.auto.value.AutoValue;

/**
 * Differential evolution settings.
 *
 * <p>Each target individual competes against one trial vector built from a weighted difference of
 * other members, and is replaced only if the trial wins.
 */
@AutoValue
public abstract class De implements AlgorithmSetting {
  static final double DEFAULT_WEIGHT = 0.6;
  static final double DEFAULT_CROSSOVER_RATE = 0.9;
  static final int DEFAULT_POPULATION_SIZE = 400;

  /** How the mutant vector is formed. */
  public enum Mutation {
    /** {@code best + F(r0 - r1)} */
    BEST_1(2),
    /** {@code r0 + F(r1 - r2)} */
    RAND_1(3),
    /** {@code x + F(best - x) + F(r0 - r1)} */
    CURRENT_TO_BEST_1(2),
    /** {@code best + F(r0 - r1 + r2 - r3)} */
    BEST_2(4),
    /** {@code r0 + F(r1 - r2 + r3 - r4)} */
    RAND_2(5);

    private final int donors;

    Mutation(int donors) {
      this.donors = donors;
    }

    /** Number of distinct members besides the target this mutation draws. */
    public int donors() {
      return donors;
    }
  }

  /** How the trial vector mixes the target with the mutant. */
  public enum Crossover {
    /** One contiguous run of mutant components, extended while a {@code CR} draw succeeds. */
    EXPONENTIAL,
    /** Each component independently from the mutant with probability {@code CR}. */
    BINOMIAL
  }

  /** The ten classic strategies: five mutations, each with exponential or binomial crossover. */
  public enum Strategy {
    S1(Mutation.BEST_1, Crossover.EXPONENTIAL),
    S2(Mutation.RAND_1, Crossover.EXPONENTIAL),
    S3(Mutation.CURRENT_TO_BEST_1, Crossover.EXPONENTIAL),
    S4(Mutation.BEST_2, Crossover.EXPONENTIAL),
    S5(Mutation.RAND_2, Crossover.EXPONENTIAL),
    S6(Mutation.BEST_1, Crossover.BINOMIAL),
    S7(Mutation.RAND_1, Crossover.BINOMIAL),
    S8(Mutation.CURRENT_TO_BEST_1, Crossover.BINOMIAL),
    S9(Mutation.BEST_2, Crossover.BINOMIAL),
    S10(Mutation.RAND_2, Crossover.BINOMIAL);

    private final Mutation mutation;
    private final Crossover crossover;

    Strategy(Mutation mutation, Crossover crossover) {
      this.mutation = mutation;
      this.crossover = crossover;
    }

    public Mutation mutation() {
      return mutation;
    }

    public Crossover crossover() {
      return crossover;
    }
  }

  public abstract Strategy strategy();

  /** Differential weight {@code F}. */
  public abstract double weight();

  /** Crossover rate {@code CR}. */
  public abstract double crossoverRate();

  public static De defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new AutoValue_De.Builder()
        .strategy(Strategy.S1)
        .weight(DEFAULT_WEIGHT)
        .crossoverRate(DEFAULT_CROSSOVER_RATE);
  }

  public abstract Builder toBuilder();

  @Override
  public final Method method() {
    return Method.DE;
  }

  @Override
  public final int defaultPopulationSize() {
    return DEFAULT_POPULATION_SIZE;
  }

  @Override
  public final int minimumPopulationSize() {
    return strategy().mutation().donors() + 1;
  }

  @Override
  public final <P> Algorithm<P> createAlgorithm() {
    return new DeAlgorithm<>(this);
  }

  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder strategy(Strategy strategy);

    public abstract Builder weight(double weight);

    public abstract Builder crossoverRate(double crossoverRate);

    abstract De autoBuild();

    public final De build() {
      De setting = autoBuild();
      checkNotNull(setting.strategy());
      checkArgument(
          setting.weight() > 0 && setting.weight() <= 2,
          "weight must be within (0, 2]: %s",
          setting.weight());
      Rga.checkProbability("crossoverRate", setting.crossoverRate());
      return setting;
    }
  }
}
