package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.base.MoreObjects;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of evaluating one candidate: one objective value for single-objective problems, several
 * for multi-objective problems, plus an optional product the objective wants kept with the score.
 *
 * <p>Smaller values are better. A fitness with any NaN component is invalid and ranks below every
 * valid fitness.
 *
 * @param <P> type of the attached product
 */
public final class Fitness<P> {
  private final double[] objectives;
  // May be null.
  private final P product;

  private Fitness(double[] objectives, P product) {
    checkArgument(objectives.length > 0, "Fitness needs at least one objective");
    this.objectives = objectives;
    this.product = product;
  }

  public static <P> Fitness<P> of(double value) {
    return new Fitness<>(new double[] {value}, null);
  }

  public static <P> Fitness<P> of(double value, P product) {
    return new Fitness<>(new double[] {value}, checkNotNull(product));
  }

  public static <P> Fitness<P> ofObjectives(double... objectives) {
    return new Fitness<>(objectives.clone(), null);
  }

  public static <P> Fitness<P> ofObjectives(double[] objectives, P product) {
    return new Fitness<>(objectives.clone(), checkNotNull(product));
  }

  /** A fitness carrying NaN in each of {@code arity} objectives. */
  public static <P> Fitness<P> invalid(int arity) {
    double[] objectives = new double[arity];
    Arrays.fill(objectives, Double.NaN);
    return new Fitness<>(objectives, null);
  }

  public int arity() {
    return objectives.length;
  }

  public boolean isMultiObjective() {
    return objectives.length > 1;
  }

  /** The single objective value. */
  public double value() {
    checkState(objectives.length == 1, "Fitness has %s objectives", objectives.length);
    return objectives[0];
  }

  public double objective(int index) {
    return objectives[index];
  }

  public ImmutableDoubleArray objectives() {
    return ImmutableDoubleArray.copyOf(objectives);
  }

  public boolean isValid() {
    for (double objective : objectives) {
      if (Double.isNaN(objective)) {
        return false;
      }
    }
    return true;
  }

  public Optional<P> product() {
    return Optional.ofNullable(product);
  }

  /** Returns a copy of this fitness with {@code product} attached. */
  public <Q> Fitness<Q> withProduct(Q product) {
    return new Fitness<>(objectives, checkNotNull(product));
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Fitness)) {
      return false;
    }
    Fitness<?> that = (Fitness<?>) o;
    return Arrays.equals(objectives, that.objectives) && Objects.equals(product, that.product);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(objectives) + Objects.hashCode(product);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("objectives", Arrays.toString(objectives))
        .add("product", product)
        .omitNullValues()
        .toString();
  }
}
