package com.verlumen.metaheuristics.methods;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Context;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.Population;
import com.verlumen.metaheuristics.core.RandomStream;
import com.verlumen.metaheuristics.ranking.Ranking;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class DeAlgorithm<P> implements Algorithm<P> {
  private final De setting;

  DeAlgorithm(De setting) {
    this.setting = setting;
  }

  @Override
  public void step(Context<P> ctx) {
    Population<P> population = ctx.population();
    RandomStream random = ctx.random();
    int n = population.size();

    List<Integer> targets = new ArrayList<>(n);
    List<double[]> trials = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      double[] target = population.get(i).toArray();
      double[] trial = crossover(target, mutant(ctx, i), random);
      ctx.bounds().clip(trial);
      if (!Arrays.equals(trial, target)) {
        targets.add(i);
        trials.add(trial);
      }
    }

    ImmutableList<Individual<P>> evaluated = ctx.evaluateAll(trials);
    for (int k = 0; k < evaluated.size(); k++) {
      int i = targets.get(k);
      if (Ranking.replaces(evaluated.get(k).fitness(), population.get(i).fitness())) {
        population.set(i, evaluated.get(k));
      }
    }
  }

  private double[] mutant(Context<P> ctx, int target) {
    Population<P> population = ctx.population();
    RandomStream random = ctx.random();
    De.Mutation mutation = setting.strategy().mutation();
    int[] r = random.distinctIndices(population.size(), mutation.donors(), target);
    double f = setting.weight();
    int dim = ctx.dimension();
    double[] v = new double[dim];
    switch (mutation) {
      case BEST_1:
        {
          Individual<P> best = ctx.elite().sample(random);
          for (int s = 0; s < dim; s++) {
            v[s] = best.get(s) + f * (x(population, r[0], s) - x(population, r[1], s));
          }
          break;
        }
      case RAND_1:
        for (int s = 0; s < dim; s++) {
          v[s] = x(population, r[0], s) + f * (x(population, r[1], s) - x(population, r[2], s));
        }
        break;
      case CURRENT_TO_BEST_1:
        {
          Individual<P> best = ctx.elite().sample(random);
          for (int s = 0; s < dim; s++) {
            double current = x(population, target, s);
            v[s] =
                current
                    + f * (best.get(s) - current)
                    + f * (x(population, r[0], s) - x(population, r[1], s));
          }
          break;
        }
      case BEST_2:
        {
          Individual<P> best = ctx.elite().sample(random);
          for (int s = 0; s < dim; s++) {
            v[s] =
                best.get(s)
                    + f
                        * (x(population, r[0], s)
                            - x(population, r[1], s)
                            + x(population, r[2], s)
                            - x(population, r[3], s));
          }
          break;
        }
      case RAND_2:
        for (int s = 0; s < dim; s++) {
          v[s] =
              x(population, r[0], s)
                  + f
                      * (x(population, r[1], s)
                          - x(population, r[2], s)
                          + x(population, r[3], s)
                          - x(population, r[4], s));
        }
        break;
    }
    return v;
  }

  private double[] crossover(double[] target, double[] mutant, RandomStream random) {
    int dim = target.length;
    double[] trial = target.clone();
    switch (setting.strategy().crossover()) {
      case BINOMIAL:
        {
          int forced = random.index(dim);
          for (int s = 0; s < dim; s++) {
            if (s == forced || random.maybe(setting.crossoverRate())) {
              trial[s] = mutant[s];
            }
          }
          break;
        }
      case EXPONENTIAL:
        {
          int start = random.index(dim);
          int length = 0;
          do {
            trial[(start + length) % dim] = mutant[(start + length) % dim];
            length++;
          } while (length < dim && random.maybe(setting.crossoverRate()));
          break;
        }
    }
    return trial;
  }

  private static double x(Population<?> population, int index, int dimension) {
    return population.get(index).get(dimension);
  }
}
