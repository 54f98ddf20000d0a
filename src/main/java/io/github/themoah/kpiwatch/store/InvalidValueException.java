package io.github.themoah.kpiwatch.store;

/**
 * Thrown when a sample cannot be recorded because its value or metric name is unusable.
 */
public class InvalidValueException extends IllegalArgumentException {

  public InvalidValueException(String message) {
    super(message);
  }
}
