package com.verlumen.metaheuristics.solver;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.ConfigurationException;
import com.verlumen.metaheuristics.core.RandomStream;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public class PoolTest {
  private static final Bounds BOUNDS = Bounds.of(new double[][] {{-1, 1}, {10, 20}});

  @Test
  public void uniform_fillsPopulationWithinBounds() {
    List<double[]> positions = Pool.uniform().generate(BOUNDS, 50, RandomStream.of(0));

    assertThat(positions).hasSize(50);
    for (double[] position : positions) {
      assertThat(BOUNDS.contains(ImmutableDoubleArray.copyOf(position))).isTrue();
    }
  }

  @Test
  public void uniform_sameSeed_samePositions() {
    List<double[]> first = Pool.uniform().generate(BOUNDS, 5, RandomStream.of(3));
    List<double[]> second = Pool.uniform().generate(BOUNDS, 5, RandomStream.of(3));

    for (int i = 0; i < 5; i++) {
      assertThat(second.get(i)).isEqualTo(first.get(i));
    }
  }

  @Test
  public void uniformWhere_onlyKeepsAcceptedPositions() {
    List<double[]> positions =
        Pool.uniformWhere(x -> x[0] > 0).generate(BOUNDS, 30, RandomStream.of(1));

    assertThat(positions).hasSize(30);
    for (double[] position : positions) {
      assertThat(position[0]).isGreaterThan(0.0);
    }
  }

  @Test
  public void uniformWhere_filterNeverAccepts_throwsConfigurationException() {
    Pool pool = Pool.uniformWhere(x -> false);

    ConfigurationException thrown =
        assertThrows(
            ConfigurationException.class, () -> pool.generate(BOUNDS, 2, RandomStream.of(1)));

    assertThat(thrown).hasMessageThat().contains("accepted only 0 of 2 positions");
  }

  @Test
  public void gaussian_zeroDeviation_returnsMean() {
    List<double[]> positions =
        Pool.gaussian(new double[] {0.5, 15}, new double[] {0, 0})
            .generate(BOUNDS, 3, RandomStream.of(2));

    for (double[] position : positions) {
      assertThat(position).usingExactEquality().containsExactly(0.5, 15.0).inOrder();
    }
  }

  @Test
  public void gaussian_wrongDimension_throwsConfigurationException() {
    Pool pool = Pool.gaussian(new double[] {0}, new double[] {1});

    assertThrows(
        ConfigurationException.class, () -> pool.generate(BOUNDS, 3, RandomStream.of(2)));
  }

  @Test
  public void of_returnsCopiesOfGivenPositions() {
    double[] given = {0, 12};
    Pool pool = Pool.of(ImmutableList.of(given));
    given[0] = 99;

    List<double[]> positions = pool.generate(BOUNDS, 1, RandomStream.of(0));
    positions.get(0)[1] = -5;

    assertThat(pool.generate(BOUNDS, 1, RandomStream.of(0)).get(0))
        .usingExactEquality()
        .containsExactly(0.0, 12.0)
        .inOrder();
  }

  @Test
  public void of_wrongComponentCount_throwsConfigurationException() {
    Pool pool = Pool.of(ImmutableList.of(new double[] {0}));

    assertThrows(
        ConfigurationException.class, () -> pool.generate(BOUNDS, 1, RandomStream.of(0)));
  }
}
