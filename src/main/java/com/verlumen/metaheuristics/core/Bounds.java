package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.google.common.primitives.ImmutableDoubleArray;

/**
 * Per-dimension box constraints of a search space.
 *
 * <p>Each dimension is a closed {@link Range}. Lower and upper endpoints may be equal, which pins
 * that dimension to a single value.
 */
public final class Bounds {
  private final ImmutableList<Range<Double>> ranges;

  private Bounds(ImmutableList<Range<Double>> ranges) {
    this.ranges = ranges;
  }

  /**
   * Creates bounds from {@code [lower, upper]} pairs, one pair per dimension.
   *
   * @throws IllegalArgumentException if a pair is malformed, not finite, or inverted
   */
  public static Bounds of(double[][] pairs) {
    Builder builder = builder();
    for (double[] pair : pairs) {
      checkArgument(pair.length == 2, "Expected a [lower, upper] pair but got %s values", pair.length);
      builder.add(pair[0], pair[1]);
    }
    return builder.build();
  }

  /** Creates bounds from parallel arrays of lower and upper endpoints. */
  public static Bounds of(double[] lower, double[] upper) {
    checkArgument(
        lower.length == upper.length,
        "Lower and upper bounds differ in length: %s vs %s",
        lower.length,
        upper.length);
    Builder builder = builder();
    for (int i = 0; i < lower.length; i++) {
      builder.add(lower[i], upper[i]);
    }
    return builder.build();
  }

  /** Creates a hypercube with the same range in every dimension. */
  public static Bounds uniform(int dimension, double lower, double upper) {
    checkArgument(dimension >= 0, "Dimension must be non-negative: %s", dimension);
    Builder builder = builder();
    for (int i = 0; i < dimension; i++) {
      builder.add(lower, upper);
    }
    return builder.build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int dimension() {
    return ranges.size();
  }

  public boolean isEmpty() {
    return ranges.isEmpty();
  }

  public Range<Double> range(int dimension) {
    return ranges.get(dimension);
  }

  public double lower(int dimension) {
    return ranges.get(dimension).lowerEndpoint();
  }

  public double upper(int dimension) {
    return ranges.get(dimension).upperEndpoint();
  }

  public double width(int dimension) {
    return upper(dimension) - lower(dimension);
  }

  /** Clamps {@code value} into the range of {@code dimension}. NaN maps to the lower endpoint. */
  public double clip(int dimension, double value) {
    double lower = lower(dimension);
    if (Double.isNaN(value)) {
      return lower;
    }
    return Math.max(lower, Math.min(upper(dimension), value));
  }

  /** Clamps every component of {@code position} in place and returns it. */
  public double[] clip(double[] position) {
    checkArgument(
        position.length == dimension(),
        "Position has %s components but bounds have %s dimensions",
        position.length,
        dimension());
    for (int s = 0; s < position.length; s++) {
      position[s] = clip(s, position[s]);
    }
    return position;
  }

  public boolean contains(ImmutableDoubleArray position) {
    if (position.length() != dimension()) {
      return false;
    }
    for (int s = 0; s < position.length(); s++) {
      if (!ranges.get(s).contains(position.get(s))) {
        return false;
      }
    }
    return true;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof Bounds && ((Bounds) o).ranges.equals(ranges);
  }

  @Override
  public int hashCode() {
    return ranges.hashCode();
  }

  @Override
  public String toString() {
    return ranges.toString();
  }

  /** Accumulates one closed range per dimension. */
  public static final class Builder {
    private final ImmutableList.Builder<Range<Double>> ranges = ImmutableList.builder();

    private Builder() {}

    public Builder add(double lower, double upper) {
      checkArgument(
          Double.isFinite(lower) && Double.isFinite(upper),
          "Bounds must be finite: [%s, %s]",
          lower,
          upper);
      checkArgument(lower <= upper, "Lower bound %s exceeds upper bound %s", lower, upper);
      ranges.add(Range.closed(lower, upper));
      return this;
    }

    public Builder add(Range<Double> range) {
      checkNotNull(range);
      checkArgument(
          range.hasLowerBound() && range.hasUpperBound(), "Range must be bounded: %s", range);
      return add(range.lowerEndpoint(), range.upperEndpoint());
    }

    public Bounds build() {
      return new Bounds(ranges.build());
    }
  }
}
