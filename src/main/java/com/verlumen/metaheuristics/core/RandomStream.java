package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkArgument;

import java.security.SecureRandom;
import java.util.SplittableRandom;

/**
 * Seedable source of random draws owned by a single run.
 *
 * <p>Two streams built from the same seed yield the same sequence of draws. A stream is not
 * thread-safe and must not be shared between runs.
 */
public final class RandomStream {
  private final long seed;
  private final SplittableRandom random;

  private RandomStream(long seed) {
    this.seed = seed;
    this.random = new SplittableRandom(seed);
  }

  public static RandomStream of(long seed) {
    return new RandomStream(seed);
  }

  /** Creates a stream from a freshly drawn seed; {@link #seed()} reports it for replay. */
  public static RandomStream unseeded() {
    return new RandomStream(new SecureRandom().nextLong());
  }

  public long seed() {
    return seed;
  }

  /** Uniform draw in {@code [0, 1)}. */
  public double uniform() {
    return random.nextDouble();
  }

  /**
   * Uniform draw in {@code [lower, upper)}; returns {@code lower} for an empty range.
   *
   * <p>Any finite range is accepted, including one whose width exceeds {@link Double#MAX_VALUE}.
   */
  public double range(double lower, double upper) {
    checkArgument(
        Double.isFinite(lower) && Double.isFinite(upper),
        "Range must be finite: [%s, %s)",
        lower,
        upper);
    checkArgument(lower <= upper, "Empty range [%s, %s)", lower, upper);
    if (lower == upper) {
      return lower;
    }
    double u = random.nextDouble();
    double width = upper - lower;
    double value = Double.isInfinite(width) ? lower * (1 - u) + upper * u : lower + u * width;
    return value >= upper ? Math.nextDown(upper) : Math.max(value, lower);
  }

  /** Uniform index in {@code [0, bound)}. */
  public int index(int bound) {
    checkArgument(bound > 0, "Bound must be positive: %s", bound);
    return random.nextInt(bound);
  }

  /** Returns true with probability {@code p}. */
  public boolean maybe(double p) {
    return uniform() < p;
  }

  public double normal(double mean, double std) {
    return mean + std * random.nextGaussian();
  }

  /**
   * Draws {@code count} distinct indices in {@code [0, bound)}, none equal to {@code exclude}.
   *
   * <p>Pass a negative {@code exclude} to allow every index.
   */
  public int[] distinctIndices(int bound, int count, int exclude) {
    int available = exclude >= 0 && exclude < bound ? bound - 1 : bound;
    checkArgument(
        count <= available, "Cannot draw %s distinct indices from %s candidates", count, available);
    int[] picked = new int[count];
    for (int k = 0; k < count; k++) {
      int candidate;
      do {
        candidate = random.nextInt(bound);
      } while (candidate == exclude || contains(picked, k, candidate));
      picked[k] = candidate;
    }
    return picked;
  }

  private static boolean contains(int[] values, int length, int value) {
    for (int i = 0; i < length; i++) {
      if (values[i] == value) {
        return true;
      }
    }
    return false;
  }
}
