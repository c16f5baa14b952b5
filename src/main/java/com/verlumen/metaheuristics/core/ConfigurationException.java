package com.verlumen.metaheuristics.core;

/** Thrown when a solver is configured inconsistently. Never recovered within a run. */
public class ConfigurationException extends IllegalArgumentException {
  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String format, Object... args) {
    super(String.format(format, args));
  }
}
