package com.verlumen.metaheuristics.ranking;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Individual;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Pareto front extraction, non-dominated sorting and crowding distance.
 *
 * <p>All operations preserve the input order of the individuals they keep, so results only depend
 * on the candidates and never on hashing or timing.
 */
public final class ParetoFront {
  private ParetoFront() {}

  /** Members of {@code candidates} that no other valid member dominates. Invalid ones are dropped. */
  public static <P> ImmutableList<Individual<P>> nonDominated(List<Individual<P>> candidates) {
    ImmutableList.Builder<Individual<P>> front = ImmutableList.builder();
    for (int i = 0; i < candidates.size(); i++) {
      Individual<P> candidate = candidates.get(i);
      if (!candidate.fitness().isValid()) {
        continue;
      }
      boolean dominated = false;
      for (int j = 0; j < candidates.size() && !dominated; j++) {
        dominated =
            j != i && Ranking.compare(candidates.get(j).fitness(), candidate.fitness())
                == Comparison.BETTER;
      }
      if (!dominated) {
        front.add(candidate);
      }
    }
    return front.build();
  }

  /**
   * Splits {@code candidates} into successive non-dominated fronts, best front first.
   *
   * <p>Invalid candidates form a final front of their own.
   */
  public static <P> ImmutableList<ImmutableList<Individual<P>>> sort(
      List<Individual<P>> candidates) {
    int n = candidates.size();
    List<List<Integer>> dominatedBy = new ArrayList<>(n);
    int[] dominationCount = new int[n];
    List<Integer> current = new ArrayList<>();
    List<Integer> invalid = new ArrayList<>();
    for (int p = 0; p < n; p++) {
      dominatedBy.add(new ArrayList<>());
    }
    for (int p = 0; p < n; p++) {
      if (!candidates.get(p).fitness().isValid()) {
        invalid.add(p);
        continue;
      }
      for (int q = p + 1; q < n; q++) {
        if (!candidates.get(q).fitness().isValid()) {
          continue;
        }
        Comparison comparison =
            Ranking.compare(candidates.get(p).fitness(), candidates.get(q).fitness());
        if (comparison == Comparison.BETTER) {
          dominatedBy.get(p).add(q);
          dominationCount[q]++;
        } else if (comparison == Comparison.WORSE) {
          dominatedBy.get(q).add(p);
          dominationCount[p]++;
        }
      }
    }
    for (int p = 0; p < n; p++) {
      if (dominationCount[p] == 0 && candidates.get(p).fitness().isValid()) {
        current.add(p);
      }
    }

    ImmutableList.Builder<ImmutableList<Individual<P>>> fronts = ImmutableList.builder();
    while (!current.isEmpty()) {
      fronts.add(select(candidates, current));
      List<Integer> next = new ArrayList<>();
      for (int p : current) {
        for (int q : dominatedBy.get(p)) {
          if (--dominationCount[q] == 0) {
            next.add(q);
          }
        }
      }
      next.sort(Comparator.naturalOrder());
      current = next;
    }
    if (!invalid.isEmpty()) {
      fronts.add(select(candidates, invalid));
    }
    return fronts.build();
  }

  /**
   * Crowding distance of each member of {@code front}.
   *
   * <p>Per objective, members are sorted by that objective. The two boundary members get infinite
   * distance. Every interior member adds the gap between its neighbours, divided by the
   * objective's span. An objective with zero or infinite span adds nothing to interior members.
   */
  public static double[] crowdingDistances(List<? extends Individual<?>> front) {
    int n = front.size();
    double[] distances = new double[n];
    if (n <= 2) {
      Arrays.fill(distances, Double.POSITIVE_INFINITY);
      return distances;
    }
    int objectives = front.get(0).fitness().arity();
    Integer[] order = new Integer[n];
    for (int objective = 0; objective < objectives; objective++) {
      for (int i = 0; i < n; i++) {
        order[i] = i;
      }
      final int m = objective;
      Arrays.sort(
          order, Comparator.comparingDouble(i -> front.get(i).fitness().objective(m)));
      double min = front.get(order[0]).fitness().objective(m);
      double max = front.get(order[n - 1]).fitness().objective(m);
      distances[order[0]] = Double.POSITIVE_INFINITY;
      distances[order[n - 1]] = Double.POSITIVE_INFINITY;
      double span = max - min;
      if (!(span > 0) || Double.isInfinite(span)) {
        continue;
      }
      for (int k = 1; k < n - 1; k++) {
        double gap =
            front.get(order[k + 1]).fitness().objective(m)
                - front.get(order[k - 1]).fitness().objective(m);
        distances[order[k]] += gap / span;
      }
    }
    return distances;
  }

  /**
   * The {@code count} members of {@code front} with the largest crowding distance, in their
   * original order. Among equal distances the earlier member is preferred.
   */
  public static <P> ImmutableList<Individual<P>> mostSpread(List<Individual<P>> front, int count) {
    checkArgument(count >= 0 && count <= front.size(), "Cannot keep %s of %s", count, front.size());
    double[] distances = crowdingDistances(front);
    Integer[] order = new Integer[front.size()];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (i, j) -> Double.compare(distances[j], distances[i]));
    List<Integer> kept = new ArrayList<>(Arrays.asList(order).subList(0, count));
    kept.sort(Comparator.naturalOrder());
    return select(front, kept);
  }

  /**
   * Shrinks {@code front} to {@code limit} members by repeatedly dropping the most crowded one and
   * recomputing distances. Among equally crowded members the later one is dropped first.
   */
  public static <P> ImmutableList<Individual<P>> truncate(List<Individual<P>> front, int limit) {
    checkArgument(limit >= 1, "Limit must be positive: %s", limit);
    List<Individual<P>> kept = new ArrayList<>(front);
    while (kept.size() > limit) {
      double[] distances = crowdingDistances(kept);
      int drop = 0;
      for (int i = 1; i < distances.length; i++) {
        if (distances[i] <= distances[drop]) {
          drop = i;
        }
      }
      kept.remove(drop);
    }
    return ImmutableList.copyOf(kept);
  }

  private static <P> ImmutableList<Individual<P>> select(
      List<Individual<P>> candidates, List<Integer> indices) {
    ImmutableList.Builder<Individual<P>> selected =
        ImmutableList.builderWithExpectedSize(indices.size());
    for (int index : indices) {
      selected.add(candidates.get(index));
    }
    return selected.build();
  }
}
