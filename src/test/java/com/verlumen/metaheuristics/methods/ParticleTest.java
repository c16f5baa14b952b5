package com.verlumen.metaheuristics.methods;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.Fitness;
import com.verlumen.metaheuristics.core.Individual;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class ParticleTest {
  private static final ImmutableDoubleArray STILL = ImmutableDoubleArray.of(0);

  @Test
  public void start_personalBestIsStartingPoint() {
    Individual<Void> start = scalar(1, 5);

    Particle<Void> particle = Particle.start(start, STILL);

    assertThat(particle.personalBest()).isEqualTo(start);
    assertThat(particle.current()).isEqualTo(start);
  }

  @Test
  public void moveTo_better_updatesPersonalBest() {
    Individual<Void> better = scalar(2, 1);

    Particle<Void> moved = Particle.start(scalar(1, 5), STILL).moveTo(better, STILL);

    assertThat(moved.personalBest()).isEqualTo(better);
  }

  @Test
  public void moveTo_worseOrEqual_keepsPersonalBest() {
    Individual<Void> start = scalar(1, 5);
    ImmutableDoubleArray velocity = ImmutableDoubleArray.of(0.5);

    Particle<Void> moved =
        Particle.start(start, STILL).moveTo(scalar(2, 9), velocity).moveTo(scalar(3, 5), STILL);

    assertThat(moved.personalBest()).isEqualTo(start);
    assertThat(moved.current()).isEqualTo(scalar(3, 5));
  }

  @Test
  public void moveTo_multiObjectiveIncomparable_followsMove() {
    Individual<Void> start = Individual.of(ImmutableDoubleArray.of(1), Fitness.ofObjectives(1, 3));
    Individual<Void> next = Individual.of(ImmutableDoubleArray.of(2), Fitness.ofObjectives(3, 1));

    Particle<Void> moved = Particle.start(start, STILL).moveTo(next, STILL);

    assertThat(moved.personalBest()).isEqualTo(next);
  }

  private static Individual<Void> scalar(double position, double value) {
    return Individual.of(ImmutableDoubleArray.of(position), Fitness.of(value));
  }
}
