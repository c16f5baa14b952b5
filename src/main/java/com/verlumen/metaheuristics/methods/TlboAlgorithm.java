package com.verlumen.metaheuristics.methods;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Context;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.Population;
import com.verlumen.metaheuristics.core.RandomStream;
import com.verlumen.metaheuristics.ranking.Comparison;
import com.verlumen.metaheuristics.ranking.Ranking;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class TlboAlgorithm<P> implements Algorithm<P> {
  @Override
  public void step(Context<P> ctx) {
    teach(ctx);
    learn(ctx);
  }

  /** Moves every learner toward the teacher and away from the class mean. */
  private void teach(Context<P> ctx) {
    Population<P> population = ctx.population();
    RandomStream random = ctx.random();
    int n = population.size();
    int dim = ctx.dimension();

    double[] mean = new double[dim];
    for (Individual<P> learner : population) {
      for (int s = 0; s < dim; s++) {
        mean[s] += learner.get(s) / n;
      }
    }

    List<Integer> learners = new ArrayList<>(n);
    List<double[]> positions = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Individual<P> teacher = ctx.elite().sample(random);
      int teachingFactor = 1 + random.index(2);
      double[] x = population.get(i).toArray();
      for (int s = 0; s < dim; s++) {
        x[s] += random.uniform() * (teacher.get(s) - teachingFactor * mean[s]);
      }
      collect(ctx, i, x, learners, positions);
    }
    accept(ctx, learners, positions);
  }

  /** Moves each learner toward a random classmate, but only toward a better one. */
  private void learn(Context<P> ctx) {
    Population<P> population = ctx.population();
    RandomStream random = ctx.random();
    int n = population.size();

    List<Integer> learners = new ArrayList<>(n);
    List<double[]> positions = new ArrayList<>(n);
    for (int i = 0; i < n; i++) {
      Individual<P> me = population.get(i);
      Individual<P> peer = population.get(random.distinctIndices(n, 1, i)[0]);
      if (Ranking.compare(peer.fitness(), me.fitness()) != Comparison.BETTER) {
        continue;
      }
      double[] x = me.toArray();
      for (int s = 0; s < x.length; s++) {
        x[s] += random.uniform() * (peer.get(s) - x[s]);
      }
      collect(ctx, i, x, learners, positions);
    }
    accept(ctx, learners, positions);
  }

  private void collect(
      Context<P> ctx, int learner, double[] x, List<Integer> learners, List<double[]> positions) {
    ctx.bounds().clip(x);
    if (!Arrays.equals(x, ctx.population().get(learner).toArray())) {
      learners.add(learner);
      positions.add(x);
    }
  }

  private void accept(Context<P> ctx, List<Integer> learners, List<double[]> positions) {
    Population<P> population = ctx.population();
    ImmutableList<Individual<P>> evaluated = ctx.evaluateAll(positions);
    for (int k = 0; k < evaluated.size(); k++) {
      int i = learners.get(k);
      if (Ranking.replaces(evaluated.get(k).fitness(), population.get(i).fitness())) {
        population.set(i, evaluated.get(k));
      }
    }
  }
}
