package com.verlumen.metaheuristics.core;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterators;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Stream;

/** Fixed-size ordered slots of individuals. The size never changes once created. */
public final class Population<P> implements Iterable<Individual<P>> {
  private final List<Individual<P>> members;

  public Population(List<Individual<P>> members) {
    checkArgument(!members.isEmpty(), "Population must not be empty");
    this.members = new ArrayList<>(members);
  }

  public int size() {
    return members.size();
  }

  public Individual<P> get(int index) {
    return members.get(index);
  }

  public void set(int index, Individual<P> individual) {
    members.set(index, checkNotNull(individual));
  }

  /** Replaces every slot; {@code next} must hold exactly {@link #size()} individuals. */
  public void replaceAll(List<Individual<P>> next) {
    checkArgument(
        next.size() == members.size(),
        "Population size must stay %s but got %s",
        members.size(),
        next.size());
    for (int i = 0; i < next.size(); i++) {
      set(i, next.get(i));
    }
  }

  public ImmutableList<Individual<P>> snapshot() {
    return ImmutableList.copyOf(members);
  }

  public Stream<Individual<P>> stream() {
    return members.stream();
  }

  @Override
  public Iterator<Individual<P>> iterator() {
    return Iterators.unmodifiableIterator(members.iterator());
  }
}
