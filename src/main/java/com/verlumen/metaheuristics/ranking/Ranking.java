package com.verlumen.metaheuristics.ranking;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Fitness;
import com.verlumen.metaheuristics.core.Individual;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Fitness comparison shared by every algorithm.
 *
 * <p>Single-objective fitness is ordered ascending. Multi-objective fitness is ordered by Pareto
 * dominance. Invalid fitness is worse than any valid one. Equal values are incomparable, and
 * callers keep the incumbent on a tie.
 */
public final class Ranking {
  /** Ascending single-objective order with invalid values last; stable under {@link List#sort}. */
  private static final Comparator<Individual<?>> SCALAR_ORDER =
      Comparator.<Individual<?>>comparingInt(individual -> individual.fitness().isValid() ? 0 : 1)
          .thenComparingDouble(
              individual ->
                  individual.fitness().isValid() ? individual.fitness().objective(0) : 0.0);

  private Ranking() {}

  public static Comparison compare(Fitness<?> a, Fitness<?> b) {
    checkArgument(
        a.arity() == b.arity(), "Cannot compare fitness of arity %s with %s", a.arity(), b.arity());
    boolean aValid = a.isValid();
    boolean bValid = b.isValid();
    if (!aValid || !bValid) {
      if (aValid) {
        return Comparison.BETTER;
      }
      return bValid ? Comparison.WORSE : Comparison.INCOMPARABLE;
    }
    if (a.arity() == 1) {
      double x = a.objective(0);
      double y = b.objective(0);
      if (x < y) {
        return Comparison.BETTER;
      }
      return y < x ? Comparison.WORSE : Comparison.INCOMPARABLE;
    }
    return dominance(a, b);
  }

  public static boolean isBetter(Fitness<?> a, Fitness<?> b) {
    return compare(a, b) == Comparison.BETTER;
  }

  /**
   * Whether {@code candidate} should take the place of {@code incumbent} in a greedy replacement.
   *
   * <p>Single-objective: only when strictly better. Multi-objective: unless dominated, so that the
   * search keeps moving along the front.
   */
  public static boolean replaces(Fitness<?> candidate, Fitness<?> incumbent) {
    Comparison comparison = compare(candidate, incumbent);
    if (candidate.arity() == 1 || !candidate.isValid()) {
      return comparison == Comparison.BETTER;
    }
    return comparison != Comparison.WORSE;
  }

  /**
   * Picks {@code count} survivors out of {@code candidates}.
   *
   * <p>Single-objective candidates are taken in ascending order, earlier candidates first on ties.
   * Multi-objective candidates are taken front by front, and the last front that does not fit is
   * cut by crowding distance.
   */
  public static <P> ImmutableList<Individual<P>> survivors(
      List<Individual<P>> candidates, int count) {
    checkArgument(
        count <= candidates.size(),
        "Cannot pick %s survivors from %s candidates",
        count,
        candidates.size());
    if (candidates.isEmpty() || candidates.get(0).fitness().arity() == 1) {
      List<Individual<P>> sorted = new ArrayList<>(candidates);
      sorted.sort(SCALAR_ORDER);
      return ImmutableList.copyOf(sorted.subList(0, count));
    }
    ImmutableList.Builder<Individual<P>> survivors = ImmutableList.builderWithExpectedSize(count);
    int remaining = count;
    for (ImmutableList<Individual<P>> front : ParetoFront.sort(candidates)) {
      if (remaining == 0) {
        break;
      }
      if (front.size() <= remaining) {
        survivors.addAll(front);
        remaining -= front.size();
      } else {
        survivors.addAll(ParetoFront.mostSpread(front, remaining));
        remaining = 0;
      }
    }
    return survivors.build();
  }

  private static Comparison dominance(Fitness<?> a, Fitness<?> b) {
    boolean aBetterSomewhere = false;
    boolean bBetterSomewhere = false;
    for (int i = 0; i < a.arity(); i++) {
      double x = a.objective(i);
      double y = b.objective(i);
      if (x < y) {
        aBetterSomewhere = true;
      } else if (y < x) {
        bBetterSomewhere = true;
      }
      if (aBetterSomewhere && bBetterSomewhere) {
        return Comparison.INCOMPARABLE;
      }
    }
    if (aBetterSomewhere) {
      return Comparison.BETTER;
    }
    return bBetterSomewhere ? Comparison.WORSE : Comparison.INCOMPARABLE;
  }
}
