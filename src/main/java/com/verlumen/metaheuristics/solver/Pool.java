package com.verlumen.metaheuristics.solver;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.ConfigurationException;
import com.verlumen.metaheuristics.core.RandomStream;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Source of the initial population's positions.
 *
 * <p>Positions outside the bounds are clipped before evaluation.
 */
@FunctionalInterface
public interface Pool {
  List<double[]> generate(Bounds bounds, int size, RandomStream random);

  /** Uniformly distributed positions. This is the default. */
  static Pool uniform() {
    return (bounds, size, random) -> {
      List<double[]> positions = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        positions.add(uniformPosition(bounds, random));
      }
      return positions;
    };
  }

  /**
   * Uniformly distributed positions that satisfy {@code filter}.
   *
   * @throws ConfigurationException if valid positions are too rare to fill the population
   */
  static Pool uniformWhere(Predicate<double[]> filter) {
    checkNotNull(filter);
    return (bounds, size, random) -> {
      List<double[]> positions = new ArrayList<>(size);
      long attempts = (long) size * SolverConstants.MAX_POOL_ATTEMPTS_PER_MEMBER;
      while (positions.size() < size) {
        if (attempts-- == 0) {
          throw new ConfigurationException(
              "Pool filter accepted only %s of %s positions", positions.size(), size);
        }
        double[] position = uniformPosition(bounds, random);
        if (filter.test(position.clone())) {
          positions.add(position);
        }
      }
      return positions;
    };
  }

  /** Normally distributed positions with per-dimension mean and standard deviation. */
  static Pool gaussian(double[] mean, double[] std) {
    double[] means = mean.clone();
    double[] stds = std.clone();
    return (bounds, size, random) -> {
      if (means.length != bounds.dimension() || stds.length != bounds.dimension()) {
        throw new ConfigurationException(
            "Gaussian pool has %s means and %s deviations for %s dimensions",
            means.length, stds.length, bounds.dimension());
      }
      List<double[]> positions = new ArrayList<>(size);
      for (int i = 0; i < size; i++) {
        double[] position = new double[bounds.dimension()];
        for (int s = 0; s < position.length; s++) {
          position[s] = random.normal(means[s], stds[s]);
        }
        positions.add(position);
      }
      return positions;
    };
  }

  /** Ready-made positions; there must be exactly one per population member. */
  static Pool of(List<double[]> positions) {
    ImmutableList<double[]> copies =
        positions.stream().map(double[]::clone).collect(ImmutableList.toImmutableList());
    return (bounds, size, random) -> {
      if (copies.size() != size) {
        throw new ConfigurationException(
            "Pool holds %s positions but the population size is %s", copies.size(), size);
      }
      List<double[]> result = new ArrayList<>(size);
      for (double[] position : copies) {
        if (position.length != bounds.dimension()) {
          throw new ConfigurationException(
              "Pool position has %s components but bounds have %s dimensions",
              position.length, bounds.dimension());
        }
        result.add(position.clone());
      }
      return result;
    };
  }

  private static double[] uniformPosition(Bounds bounds, RandomStream random) {
    double[] position = new double[bounds.dimension()];
    for (int s = 0; s < position.length; s++) {
      position[s] = random.range(bounds.lower(s), bounds.upper(s));
    }
    return position;
  }
}
