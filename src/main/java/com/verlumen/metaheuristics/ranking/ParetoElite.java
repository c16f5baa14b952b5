package com.verlumen.metaheuristics.ranking;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.RandomStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Keeps a bounded set of mutually non-dominated individuals.
 *
 * <p>Invalid individuals never enter. An individual already archived is not added twice. When the
 * front outgrows its limit it is truncated by crowding distance, which keeps the boundary points.
 */
final class ParetoElite<P> implements Elite<P> {
  private final int limit;
  private ImmutableList<Individual<P>> members = ImmutableList.of();

  ParetoElite(int limit) {
    checkArgument(limit >= 1, "Pareto limit must be positive: %s", limit);
    this.limit = limit;
  }

  @Override
  public void update(Iterable<Individual<P>> candidates) {
    List<Individual<P>> front = new ArrayList<>(members);
    for (Individual<P> candidate : candidates) {
      if (!candidate.fitness().isValid() || isDominatedOrArchived(front, candidate)) {
        continue;
      }
      front.removeIf(
          member -> Ranking.compare(candidate.fitness(), member.fitness()) == Comparison.BETTER);
      front.add(candidate);
    }
    members =
        front.size() > limit ? ParetoFront.truncate(front, limit) : ImmutableList.copyOf(front);
  }

  @Override
  public boolean isEmpty() {
    return members.isEmpty();
  }

  /**
   * The member with the smallest sum of objectives, each normalized to the front's range. The
   * earliest such member wins.
   */
  @Override
  public Individual<P> best() {
    checkState(!members.isEmpty(), "No individual has been archived yet");
    int objectives = members.get(0).fitness().arity();
    double[] min = new double[objectives];
    double[] max = new double[objectives];
    for (int m = 0; m < objectives; m++) {
      min[m] = Double.POSITIVE_INFINITY;
      max[m] = Double.NEGATIVE_INFINITY;
      for (Individual<P> member : members) {
        min[m] = Math.min(min[m], member.fitness().objective(m));
        max[m] = Math.max(max[m], member.fitness().objective(m));
      }
    }
    Individual<P> best = members.get(0);
    double bestScore = Double.POSITIVE_INFINITY;
    for (Individual<P> member : members) {
      double score = 0;
      for (int m = 0; m < objectives; m++) {
        double span = max[m] - min[m];
        if (span > 0 && Double.isFinite(span)) {
          score += (member.fitness().objective(m) - min[m]) / span;
        }
      }
      if (score < bestScore) {
        best = member;
        bestScore = score;
      }
    }
    return best;
  }

  @Override
  public ImmutableList<Individual<P>> members() {
    return members;
  }

  @Override
  public Individual<P> sample(RandomStream random) {
    checkState(!members.isEmpty(), "No individual has been archived yet");
    return members.get(random.index(members.size()));
  }

  private static <P> boolean isDominatedOrArchived(
      List<Individual<P>> front, Individual<P> candidate) {
    for (Individual<P> member : front) {
      if (member.equals(candidate)
          || Ranking.compare(member.fitness(), candidate.fitness()) == Comparison.BETTER) {
        return true;
      }
    }
    return false;
  }
}
