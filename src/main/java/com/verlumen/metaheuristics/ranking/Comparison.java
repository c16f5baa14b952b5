package com.verlumen.metaheuristics.ranking;

/** Outcome of comparing one fitness against another. */
public enum Comparison {
  BETTER,
  WORSE,
  INCOMPARABLE;

  /** The outcome seen from the other side of the comparison. */
  public Comparison inverse() {
    switch (this) {
      case BETTER:
        return WORSE;
      case WORSE:
        return BETTER;
      default:
        return INCOMPARABLE;
    }
  }
}
