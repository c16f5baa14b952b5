package com.verlumen.metaheuristics.methods;

import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.Context;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.Population;
import com.verlumen.metaheuristics.core.RandomStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

final class PsoAlgorithm<P> implements Algorithm<P> {
  private final Pso setting;
  private final List<Particle<P>> swarm = new ArrayList<>();

  PsoAlgorithm(Pso setting) {
    this.setting = setting;
  }

  @Override
  public void init(Context<P> ctx) {
    Bounds bounds = ctx.bounds();
    RandomStream random = ctx.random();
    swarm.clear();
    for (Individual<P> individual : ctx.population()) {
      double[] velocity = new double[ctx.dimension()];
      for (int s = 0; s < velocity.length; s++) {
        double limit = maxSpeed(bounds, s);
        velocity[s] = random.range(-limit, limit);
      }
      swarm.add(Particle.start(individual, ImmutableDoubleArray.copyOf(velocity)));
    }
  }

  @Override
  public void step(Context<P> ctx) {
    Population<P> population = ctx.population();
    checkState(swarm.size() == population.size(), "Swarm is not initialized");
    Bounds bounds = ctx.bounds();
    RandomStream random = ctx.random();
    int dim = ctx.dimension();

    List<Integer> moved = new ArrayList<>();
    List<double[]> positions = new ArrayList<>();
    List<ImmutableDoubleArray> velocities = new ArrayList<>(swarm.size());
    for (int i = 0; i < swarm.size(); i++) {
      Particle<P> particle = swarm.get(i);
      Individual<P> leader = ctx.elite().sample(random);
      double[] x = particle.current().toArray();
      double[] v = new double[dim];
      for (int s = 0; s < dim; s++) {
        double limit = maxSpeed(bounds, s);
        double speed =
            setting.inertia() * particle.velocity().get(s)
                + setting.cognition() * random.uniform() * (particle.personalBest().get(s) - x[s])
                + setting.social() * random.uniform() * (leader.get(s) - x[s]);
        v[s] = Math.max(-limit, Math.min(limit, speed));
        double next = x[s] + v[s];
        double clipped = bounds.clip(s, next);
        if (clipped != next) {
          v[s] = 0;
        }
        x[s] = clipped;
      }
      velocities.add(ImmutableDoubleArray.copyOf(v));
      if (!Arrays.equals(x, particle.current().toArray())) {
        moved.add(i);
        positions.add(x);
      }
    }

    ImmutableList<Individual<P>> evaluated = ctx.evaluateAll(positions);
    int k = 0;
    for (int i = 0; i < swarm.size(); i++) {
      Particle<P> particle = swarm.get(i);
      if (k < moved.size() && moved.get(k) == i) {
        swarm.set(i, particle.moveTo(evaluated.get(k), velocities.get(i)));
        k++;
      } else {
        swarm.set(
            i, new Particle<>(particle.current(), velocities.get(i), particle.personalBest()));
      }
      population.set(i, swarm.get(i).current());
    }
  }

  private double maxSpeed(Bounds bounds, int dimension) {
    return Math.min(setting.velocityLimit() * bounds.width(dimension), Double.MAX_VALUE);
  }
}
