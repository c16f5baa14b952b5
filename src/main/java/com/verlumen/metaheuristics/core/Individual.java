package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.primitives.ImmutableDoubleArray;

/**
 * One evaluated candidate. Individuals never change; a variant that moves a candidate creates a
 * new individual for the new position.
 */
public record Individual<P>(ImmutableDoubleArray position, Fitness<P> fitness) {
  public Individual {
    checkNotNull(position);
    checkNotNull(fitness);
  }

  public static <P> Individual<P> of(ImmutableDoubleArray position, Fitness<P> fitness) {
    return new Individual<>(position, fitness);
  }

  public int dimension() {
    return position.length();
  }

  public double get(int dimension) {
    return position.get(dimension);
  }

  /** A fresh mutable copy of the position. */
  public double[] toArray() {
    return position.toArray();
  }
}
