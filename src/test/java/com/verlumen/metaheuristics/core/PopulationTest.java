package com.verlumen.metaheuristics.core;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import java.util.Iterator;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PopulationTest {
  private static final Individual<Void> FIRST = individual(0, 1);
  private static final Individual<Void> SECOND = individual(1, 2);
  private static final Individual<Void> THIRD = individual(2, 3);

  @Test
  public void constructor_empty_throwsException() {
    assertThrows(IllegalArgumentException.class, () -> new Population<Void>(ImmutableList.of()));
  }

  @Test
  public void set_replacesSlot() {
    Population<Void> population = new Population<>(ImmutableList.of(FIRST, SECOND));

    population.set(1, THIRD);

    assertThat(population.snapshot()).containsExactly(FIRST, THIRD).inOrder();
  }

  @Test
  public void replaceAll_keepsSize() {
    Population<Void> population = new Population<>(ImmutableList.of(FIRST, SECOND));

    population.replaceAll(ImmutableList.of(THIRD, FIRST));

    assertThat(population.size()).isEqualTo(2);
    assertThat(population.get(0)).isEqualTo(THIRD);
  }

  @Test
  public void replaceAll_differentSize_throwsException() {
    Population<Void> population = new Population<>(ImmutableList.of(FIRST, SECOND));

    assertThrows(
        IllegalArgumentException.class,
        () -> population.replaceAll(ImmutableList.of(FIRST, SECOND, THIRD)));
  }

  @Test
  public void snapshot_isDetachedFromLaterChanges() {
    Population<Void> population = new Population<>(ImmutableList.of(FIRST, SECOND));
    ImmutableList<Individual<Void>> snapshot = population.snapshot();

    population.set(0, THIRD);

    assertThat(snapshot).containsExactly(FIRST, SECOND).inOrder();
  }

  @Test
  public void iterator_doesNotSupportRemoval() {
    Iterator<Individual<Void>> iterator =
        new Population<>(ImmutableList.of(FIRST, SECOND)).iterator();
    iterator.next();

    assertThrows(UnsupportedOperationException.class, iterator::remove);
  }

  private static Individual<Void> individual(double position, double fitness) {
    return Individual.of(ImmutableDoubleArray.of(position), Fitness.of(fitness));
  }
}
