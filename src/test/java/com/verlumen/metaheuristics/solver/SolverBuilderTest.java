package com.verlumen.metaheuristics.solver;

import static com.google.common.collect.ImmutableSet.toImmutableSet;
import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.primitives.ImmutableDoubleArray;
import com.verlumen.metaheuristics.TestObjectives;
import com.verlumen.metaheuristics.core.Bounds;
import com.verlumen.metaheuristics.core.ConfigurationException;
import com.verlumen.metaheuristics.core.Fitness;
import com.verlumen.metaheuristics.core.Individual;
import com.verlumen.metaheuristics.core.ObjectiveFunction;
import com.verlumen.metaheuristics.methods.De;
import com.verlumen.metaheuristics.methods.Pso;
import com.verlumen.metaheuristics.methods.Rga;
import com.verlumen.metaheuristics.ranking.Comparison;
import com.verlumen.metaheuristics.ranking.Ranking;
import java.util.ArrayList;
import java.util.List;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public class SolverBuilderTest {
  private static final Bounds PLANE = Bounds.uniform(2, -10, 10);

  @Rule public MockitoRule rule = MockitoJUnit.rule();

  @Mock private ObjectiveFunction<Void> mockObjective;

  @Test
  public void solve_sphere_convergesToOrigin() {
    // Mutation settles by the end of the run.
    Rga setting = Rga.builder().mutationHorizon(50).build();

    Report<Void> report =
        Solver.build(setting, TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(0)
            .populationSize(20)
            .task(Tasks.maxGeneration(50))
            .solve();

    assertThat(report.bestFitness().value()).isWithin(1e-3).of(0.0);
    assertThat(report.generation()).isEqualTo(50);
    assertThat(report.population()).hasSize(20);
    assertThat(report.paretoFront()).containsExactly(report.best());
    assertThat(report.method()).isEqualTo(setting.method());
  }

  @Test
  public void solve_twoObjectives_findsParetoRange() {
    Report<Void> report =
        Solver.build(Rga.defaults(), TestObjectives.schaffer())
            .bounds(TestObjectives.schafferBounds())
            .seed(0)
            .populationSize(40)
            .task(Tasks.maxGeneration(100))
            .solve();

    ImmutableList<Individual<Void>> front = report.paretoFront();
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (Individual<Void> member : front) {
      assertThat(member.get(0)).isAtLeast(-0.05);
      assertThat(member.get(0)).isAtMost(2.05);
      min = Math.min(min, member.get(0));
      max = Math.max(max, member.get(0));
      for (Individual<Void> other : front) {
        assertThat(Ranking.compare(member.fitness(), other.fitness()))
            .isEqualTo(Comparison.INCOMPARABLE);
      }
    }
    assertThat(front.size()).isAtMost(SolverConstants.DEFAULT_PARETO_LIMIT);
    assertThat(min).isLessThan(0.2);
    assertThat(max).isGreaterThan(1.8);
    assertThat(front).contains(report.best());
  }

  @Test
  public void solve_boundsDimensionMismatch_failsBeforeEvaluation() {
    when(mockObjective.dimension()).thenReturn(2);

    ConfigurationException thrown =
        assertThrows(
            ConfigurationException.class,
            () ->
                Solver.build(Rga.defaults(), mockObjective)
                    .bounds(Bounds.uniform(3, 0, 1))
                    .solve());

    assertThat(thrown).hasMessageThat().contains("Bounds have 3 dimensions");
    verify(mockObjective, never()).evaluate(any());
  }

  @Test
  public void solve_withoutBounds_throwsConfigurationException() {
    assertThrows(
        ConfigurationException.class,
        () -> Solver.build(Rga.defaults(), TestObjectives.sphere(2)).solve());
  }

  @Test
  public void solve_emptyBounds_throwsConfigurationException() {
    assertThrows(
        ConfigurationException.class,
        () ->
            Solver.build(Rga.defaults(), TestObjectives.sphere(0))
                .bounds(Bounds.builder().build())
                .solve());
  }

  @Test
  public void solve_populationBelowMinimum_throwsConfigurationException() {
    De setting = De.builder().strategy(De.Strategy.S5).build();

    ConfigurationException thrown =
        assertThrows(
            ConfigurationException.class,
            () ->
                Solver.build(setting, TestObjectives.sphere(2))
                    .bounds(PLANE)
                    .populationSize(4)
                    .solve());

    assertThat(thrown).hasMessageThat().contains("needs a population of at least 6 but got 4");
  }

  @Test
  public void solve_negativePopulation_throwsConfigurationException() {
    assertThrows(
        ConfigurationException.class,
        () ->
            Solver.build(Pso.defaults(), TestObjectives.sphere(2))
                .bounds(PLANE)
                .populationSize(-1)
                .solve());
  }

  @Test
  public void solve_nonPositiveParetoLimit_throwsConfigurationException() {
    assertThrows(
        ConfigurationException.class,
        () ->
            Solver.build(Rga.defaults(), TestObjectives.schaffer())
                .bounds(TestObjectives.schafferBounds())
                .paretoLimit(0)
                .solve());
  }

  @Test
  public void solve_noObjectives_throwsConfigurationException() {
    ObjectiveFunction<Void> objective = TestObjectives.of(1, 0, x -> Fitness.of(0.0));

    assertThrows(
        ConfigurationException.class,
        () -> Solver.build(Rga.defaults(), objective).bounds(Bounds.uniform(1, 0, 1)).solve());
  }

  @Test
  public void solve_wrongFitnessArity_throwsConfigurationException() {
    ObjectiveFunction<Void> objective = TestObjectives.of(1, 2, x -> Fitness.of(x.get(0)));

    assertThrows(
        ConfigurationException.class,
        () ->
            Solver.build(Rga.defaults(), objective)
                .bounds(Bounds.uniform(1, 0, 1))
                .populationSize(4)
                .solve());
  }

  @Test
  public void solve_populationSizeZero_usesSettingDefault() {
    Report<Void> report =
        Solver.build(Rga.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(1)
            .populationSize(0)
            .task(Tasks.maxGeneration(0))
            .solve();

    assertThat(report.population()).hasSize(Rga.defaults().defaultPopulationSize());
  }

  @Test
  public void solve_taskAlreadyMet_evaluatesOnlyInitialPopulation() {
    List<Long> calls = new ArrayList<>();

    Report<Void> report =
        Solver.build(Rga.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(1)
            .populationSize(10)
            .task(Tasks.maxGeneration(0))
            .callback(ctx -> calls.add(ctx.generation()))
            .solve();

    assertThat(report.generation()).isEqualTo(0);
    assertThat(report.evaluations()).isEqualTo(10);
    assertThat(report.history()).hasSize(1);
    assertThat(calls).isEmpty();
  }

  @Test
  public void solve_callbacksRunAfterEveryGenerationInOrder() {
    List<String> calls = new ArrayList<>();

    Solver.build(Pso.defaults(), TestObjectives.sphere(2))
        .bounds(PLANE)
        .seed(2)
        .populationSize(10)
        .task(Tasks.maxGeneration(3))
        .callback(ctx -> calls.add("first@" + ctx.generation()))
        .callback(ctx -> calls.add("second@" + ctx.generation()))
        .solve();

    assertThat(calls)
        .containsExactly(
            "first@1", "second@1", "first@2", "second@2", "first@3", "second@3")
        .inOrder();
  }

  @Test
  public void solve_failingCallback_abortsWithPartialReport() {
    Exception failure = new Exception("disk full");

    CallbackFailedException thrown =
        assertThrows(
            CallbackFailedException.class,
            () ->
                Solver.build(Rga.defaults(), TestObjectives.sphere(2))
                    .bounds(PLANE)
                    .seed(3)
                    .populationSize(10)
                    .task(Tasks.maxGeneration(10))
                    .callback(
                        ctx -> {
                          if (ctx.generation() == 3) {
                            throw failure;
                          }
                        })
                    .solve());

    assertThat(thrown).hasCauseThat().isSameInstanceAs(failure);
    assertThat(thrown.partialReport().generation()).isEqualTo(3);
    assertThat(thrown.partialReport().history()).hasSize(4);
  }

  @Test
  public void solve_everyCandidateInvalid_throwsRunExhaustedException() {
    ObjectiveFunction<Void> objective = TestObjectives.of(1, 1, x -> Fitness.of(Double.NaN));

    RunExhaustedException thrown =
        assertThrows(
            RunExhaustedException.class,
            () ->
                Solver.build(Rga.defaults(), objective)
                    .bounds(Bounds.uniform(1, 0, 1))
                    .seed(4)
                    .populationSize(6)
                    .solve());

    assertThat(thrown.partialReport().generation()).isEqualTo(0);
    assertThat(thrown.partialReport().evaluations()).isEqualTo(6);
  }

  @Test
  public void solve_everyCandidateInvalidWithTwoObjectives_reportsEmptyParetoFront() {
    ObjectiveFunction<Void> objective =
        TestObjectives.of(1, 2, x -> Fitness.ofObjectives(Double.NaN, Double.NaN));

    RunExhaustedException thrown =
        assertThrows(
            RunExhaustedException.class,
            () ->
                Solver.build(Rga.defaults(), objective)
                    .bounds(Bounds.uniform(1, 0, 1))
                    .seed(4)
                    .populationSize(6)
                    .solve());

    assertThat(thrown.partialReport().generation()).isEqualTo(0);
    assertThat(thrown.partialReport().paretoFront()).isEmpty();
  }

  @Test
  public void solve_candidatesFailAfterInitialPool_throwsRunExhaustedException() {
    ImmutableList<double[]> start =
        ImmutableList.of(
            new double[] {-7.31, 2.64},
            new double[] {-5.17, -8.93},
            new double[] {-3.02, 4.41},
            new double[] {-1.56, -0.37},
            new double[] {0.83, 6.12},
            new double[] {1.97, -4.76},
            new double[] {3.29, 8.05},
            new double[] {4.68, -2.21},
            new double[] {6.44, 0.59},
            new double[] {8.71, -6.38});
    ImmutableSet<ImmutableDoubleArray> valid =
        start.stream().map(ImmutableDoubleArray::copyOf).collect(toImmutableSet());
    // Valid only at the starting positions, so every moved candidate fails.
    ObjectiveFunction<Void> objective =
        TestObjectives.of(
            2,
            1,
            x -> valid.contains(x) ? Fitness.of(x.get(0) * x.get(0)) : Fitness.of(Double.NaN));

    RunExhaustedException thrown =
        assertThrows(
            RunExhaustedException.class,
            () ->
                Solver.build(De.defaults(), objective)
                    .bounds(PLANE)
                    .seed(8)
                    .populationSize(10)
                    .initialPool(Pool.of(start))
                    .task(Tasks.maxGeneration(20))
                    .solve());

    Report<?> partial = thrown.partialReport();
    assertThat(partial.generation()).isEqualTo(1);
    assertThat(partial.evaluations()).isGreaterThan(10L);
    assertThat(partial.bestFitness().isValid()).isTrue();
    assertThat(partial.history()).hasSize(1);
  }

  @Test
  public void solve_someCandidatesInvalid_continuesWithValidOnes() {
    // Throws on the left half of the domain and is NaN on a narrow strip.
    ObjectiveFunction<Void> objective =
        TestObjectives.of(
            1,
            1,
            x -> {
              if (x.get(0) < 0) {
                throw new IllegalArgumentException("negative input");
              }
              if (x.get(0) > 4 && x.get(0) < 5) {
                return Fitness.of(Double.NaN);
              }
              return Fitness.of((x.get(0) - 3) * (x.get(0) - 3));
            });

    Report<Void> report =
        Solver.build(De.defaults(), objective)
            .bounds(Bounds.uniform(1, -10, 10))
            .seed(5)
            .populationSize(20)
            .task(Tasks.maxGeneration(60))
            .solve();

    assertThat(report.bestFitness().isValid()).isTrue();
    assertThat(report.bestParameters().get(0)).isWithin(1e-2).of(3.0);
  }

  @Test
  public void solve_exposesProductOfBestFitness() {
    ObjectiveFunction<String> objective =
        TestObjectives.of(
            1,
            1,
            x -> Fitness.of(Math.abs(x.get(0) - 1), String.format("design at %.2f", x.get(0))));

    Report<String> report =
        Solver.build(Rga.defaults(), objective)
            .bounds(Bounds.uniform(1, -2, 2))
            .seed(6)
            .populationSize(10)
            .task(Tasks.maxGeneration(5))
            .solve();

    assertThat(report.product())
        .hasValue(String.format("design at %.2f", report.bestParameters().get(0)));
  }

  @Test
  public void solve_initialPool_seedsPopulation() {
    List<double[]> positions = new ArrayList<>();
    for (int i = 0; i < 5; i++) {
      positions.add(new double[] {i, -i});
    }

    Report<Void> report =
        Solver.build(Rga.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(7)
            .populationSize(5)
            .initialPool(Pool.of(positions))
            .task(Tasks.maxGeneration(0))
            .solve();

    assertThat(report.population().get(4).position()).isEqualTo(ImmutableDoubleArray.of(4, -4));
    assertThat(report.bestParameters()).isEqualTo(ImmutableDoubleArray.of(0, 0));
  }

  @Test
  public void solve_poolOfWrongSize_throwsConfigurationException() {
    assertThrows(
        ConfigurationException.class,
        () ->
            Solver.build(Rga.defaults(), TestObjectives.sphere(2))
                .bounds(PLANE)
                .populationSize(5)
                .initialPool(Pool.of(ImmutableList.of(new double[] {0, 0})))
                .solve());
  }

  @Test
  public void solve_unseeded_reportsReplayableSeed() {
    Report<Void> first =
        Solver.build(Pso.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .populationSize(10)
            .task(Tasks.maxGeneration(5))
            .solve();

    Report<Void> replay =
        Solver.build(Pso.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(first.seed())
            .populationSize(10)
            .task(Tasks.maxGeneration(5))
            .solve();

    assertThat(replay).isEqualTo(first);
  }

  @Test
  public void solve_historyRecordsEveryGeneration() {
    Report<Void> report =
        Solver.build(De.defaults(), TestObjectives.sphere(2))
            .bounds(PLANE)
            .seed(8)
            .populationSize(12)
            .task(Tasks.maxEvaluations(100))
            .solve();

    ImmutableList<GenerationRecord<Void>> history = report.history();
    for (int i = 0; i < history.size(); i++) {
      assertThat(history.get(i).generation()).isEqualTo(i);
      assertThat(history.get(i).frontSize()).isEqualTo(1);
    }
    assertThat(history.get(history.size() - 1).evaluations()).isEqualTo(report.evaluations());
    assertThat(report.evaluations()).isAtLeast(100);
  }
}
