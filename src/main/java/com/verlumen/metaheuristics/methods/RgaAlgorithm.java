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

final class RgaAlgorithm<P> implements Algorithm<P> {
  private final Rga setting;

  RgaAlgorithm(Rga setting) {
    this.setting = setting;
  }

  @Override
  public void step(Context<P> ctx) {
    Population<P> population = ctx.population();
    RandomStream random = ctx.random();
    int n = population.size();

    List<Individual<P>> parents = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      parents.add(tournament(population, random));
    }

    List<double[]> offspring = new ArrayList<>(n);
    for (int i = 0; i < n; i += 2) {
      double[] a = parents.get(i).toArray();
      if (i + 1 == n) {
        offspring.add(a);
        continue;
      }
      double[] b = parents.get(i + 1).toArray();
      if (random.maybe(setting.crossoverRate())) {
        offspring.add(blend(ctx.bounds(), a, b, random));
        offspring.add(blend(ctx.bounds(), a, b, random));
      } else {
        offspring.add(a);
        offspring.add(b);
      }
    }
    for (double[] child : offspring) {
      mutate(ctx, child);
    }

    // Offspring identical to their parent are copies and need no evaluation.
    List<double[]> changed = new ArrayList<>();
    for (int i = 0; i < n; i++) {
      if (!Arrays.equals(offspring.get(i), parents.get(i).toArray())) {
        changed.add(offspring.get(i));
      }
    }
    ImmutableList<Individual<P>> children = ctx.evaluateAll(changed);

    List<Individual<P>> candidates = new ArrayList<>(n + children.size());
    candidates.addAll(population.snapshot());
    candidates.addAll(children);
    population.replaceAll(Ranking.survivors(candidates, n));
  }

  private Individual<P> tournament(Population<P> population, RandomStream random) {
    Individual<P> first = population.get(random.index(population.size()));
    Individual<P> second = population.get(random.index(population.size()));
    boolean secondBetter =
        Ranking.compare(second.fitness(), first.fitness()) == Comparison.BETTER;
    Individual<P> better = secondBetter ? second : first;
    Individual<P> worse = secondBetter ? first : second;
    return random.maybe(setting.winRate()) ? better : worse;
  }

  /** BLX-alpha: each component uniform over the parents' interval widened by alpha on each side. */
  private double[] blend(Bounds bounds, double[] a, double[] b, RandomStream random) {
    double[] child = new double[a.length];
    for (int s = 0; s < a.length; s++) {
      double lower = Math.min(a[s], b[s]);
      double upper = Math.max(a[s], b[s]);
      double alpha = setting.blendAlpha();
      double gap = upper - lower;
      // An infinite gap means the parents straddle zero, so the split product cannot be NaN.
      double reach = Double.isFinite(gap) ? alpha * gap : alpha * upper - alpha * lower;
      double from = Math.max(lower - reach, -Double.MAX_VALUE);
      double to = Math.min(upper + reach, Double.MAX_VALUE);
      child[s] = bounds.clip(s, random.range(from, to));
    }
    return child;
  }

  /** Non-uniform mutation: steps toward a random bound, shrinking as generations pass. */
  private void mutate(Context<P> ctx, double[] child) {
    RandomStream random = ctx.random();
    Bounds bounds = ctx.bounds();
    double progress = Math.min((double) ctx.generation() / setting.mutationHorizon(), 1.0);
    double shrink = Math.pow(1.0 - progress, setting.delta());
    for (int s = 0; s < child.length; s++) {
      if (!random.maybe(setting.mutationRate())) {
        continue;
      }
      // Blend form; stays finite for any finite bounds.
      double target = random.maybe(0.5) ? bounds.upper(s) : bounds.lower(s);
      double step = random.uniform() * shrink;
      child[s] = child[s] * (1 - step) + target * step;
      child[s] = bounds.clip(s, child[s]);
    }
  }
}
