package com.verlumen.metaheuristics.methods;

import com.verlumen.metaheuristics.core.Context;

/**
 * One run's instance of an algorithm variant.
 *
 * <p>{@link #step} turns the context's population into the next generation's. It must leave
 * exactly as many individuals as it found, evaluate each new candidate exactly once through
 * {@link Context#evaluateAll}, and take all random draws before or after that call, never during.
 * The driver updates the elite and the generation counter afterwards.
 */
public interface Algorithm<P> {
  /** Prepares per-run state once the initial population is evaluated. */
  default void init(Context<P> ctx) {}

  void step(Context<P> ctx);
}
