package com.verlumen.metaheuristics.methods;

/** Tag of each supported algorithm variant. */
public enum Method {
  /** Real-coded genetic algorithm. */
  RGA,
  /** Differential evolution. */
  DE,
  /** Particle swarm optimization. */
  PSO,
  /** Firefly algorithm. */
  FA,
  /** Teaching-learning based optimization. */
  TLBO;

  /** The variant's setting with every operator parameter at its default. */
  public AlgorithmSetting defaultSetting() {
    switch (this) {
      case RGA:
        return Rga.defaults();
      case DE:
        return De.defaults();
      case PSO:
        return Pso.defaults();
      case FA:
        return Fa.defaults();
      case TLBO:
        return Tlbo.create();
    }
    throw new AssertionError(this);
  }
}
