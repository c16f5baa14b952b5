package com.verlumen.metaheuristics.methods;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.Context;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.Population;
import com.verlumen.metaheuristics.core.RandomStream;
import com.verlumen.metaheuristics.ranking.Comparison;
import com.verlumen.metaheuristics.ranking.Ranking;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class FaAlgorithm<P> implements Algorithm<P> {
  private final Fa setting;

  FaAlgorithm(Fa setting) {
    this.setting = setting;
  }

  @Override
  public void step(Context<P> ctx) {
    Population<P> population = ctx.population();
    ImmutableList<Individual<P>> snapshot = population.snapshot();
    Bounds bounds = ctx.bounds();
    RandomStream random = ctx.random();
    double alpha = setting.alpha() * Math.pow(setting.alphaDecay(), ctx.generation());
    int n = snapshot.size();

    List<Integer> movers = new ArrayList<>(n);
    List<double[]> positions = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Individual<P> me = snapshot.get(i);
      double[] x = me.toArray();
      boolean attracted = false;
      for (int j = 0; j < n; j++) {
        Individual<P> other = snapshot.get(j);
        if (j == i || Ranking.compare(other.fitness(), me.fitness()) != Comparison.BETTER) {
          continue;
        }
        double beta =
            (setting.beta0() - setting.betaMin())
                    * Math.exp(-setting.gamma() * squaredDistance(x, other))
                + setting.betaMin();
        for (int s = 0; s < x.length; s++) {
          x[s] += beta * (other.get(s) - x[s]) + jitter(bounds, s, alpha, random);
          x[s] = bounds.clip(s, x[s]);
        }
        attracted = true;
      }
      if (!attracted) {
        for (int s = 0; s < x.length; s++) {
          x[s] = bounds.clip(s, x[s] + jitter(bounds, s, alpha, random));
        }
      }
      if (!Arrays.equals(x, me.toArray())) {
        movers.add(i);
        positions.add(x);
      }
    }

    ImmutableList<Individual<P>> evaluated = ctx.evaluateAll(positions);
    for (int k = 0; k < evaluated.size(); k++) {
      int i = movers.get(k);
      if (Ranking.replaces(evaluated.get(k).fitness(), population.get(i).fitness())) {
        population.set(i, evaluated.get(k));
      }
    }
  }

  private static double jitter(Bounds bounds, int dimension, double alpha, RandomStream random) {
    double scale = alpha * (random.uniform() - 0.5);
    return scale * bounds.upper(dimension) - scale * bounds.lower(dimension);
  }

  private static double squaredDistance(double[] x, Individual<?> other) {
    double sum = 0;
    for (int s = 0; s < x.length; s++) {
      double diff = x[s] - other.get(s);
      sum += diff * diff;
    }
    return sum;
  }
}
