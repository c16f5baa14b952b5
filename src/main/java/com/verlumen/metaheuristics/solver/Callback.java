package com.verlumen.metaheuristics.solver;

import com.verlumen.metaheuristics.core.ContextView;

/**
 * Observer invoked once after every completed generation.
 *
 * <p>Throwing aborts the run with a {@link CallbackFailedException} that carries the report so
 * far.
 */
@FunctionalInterface
public interface Callback<P> {
  void onGeneration(ContextView<P> ctx) throws Exception;
}
