package io.github.themoah.kpiwatch.model;

import io.vertx.core.json.JsonObject;
import java.util.Locale;

/**
 * Result of evaluating the newest sample of a series against its reference window.
 *
 * @param status the classification
 * @param sample the evaluated (most recent) sample, null when there was not enough data
 * @param mean mean of the reference window
 * @param stdDev population standard deviation of the reference window
 * @param zScore how many standard deviations the sample lies from the mean (0 when stdDev is 0)
 */
public record AnomalyVerdict(
  Status status,
  Sample sample,
  double mean,
  double stdDev,
  double zScore
) {

  public enum Status {
    INSUFFICIENT_DATA,
    NO_ANOMALY,
    HIGH,
    LOW
  }

  private static final AnomalyVerdict INSUFFICIENT = new AnomalyVerdict(Status.INSUFFICIENT_DATA, null, 0.0, 0.0, 0.0);

  public static AnomalyVerdict insufficientData() {
    return INSUFFICIENT;
  }

  public static AnomalyVerdict noAnomaly(Sample sample, double mean, double stdDev, double zScore) {
    return new AnomalyVerdict(Status.NO_ANOMALY, sample, mean, stdDev, zScore);
  }

  public static AnomalyVerdict anomaly(Status direction, Sample sample, double mean, double stdDev, double zScore) {
    if (direction != Status.HIGH && direction != Status.LOW) {
      throw new IllegalArgumentException("Anomaly direction must be HIGH or LOW, got " + direction);
    }
    return new AnomalyVerdict(direction, sample, mean, stdDev, zScore);
  }

  public boolean isAnomalous() {
    return status == Status.HIGH || status == Status.LOW;
  }

  /**
   * Human-readable explanation of an anomaly, e.g.
   * {@code value 1000.00 is unusually HIGH (mean=100.00, std=3.16)}.
   *
   * @return the reason, or null when the verdict is not an anomaly
   */
  public String reason() {
    if (!isAnomalous()) {
      return null;
    }
    return String.format(Locale.ROOT, "value %.2f is unusually %s (mean=%.2f, std=%.2f)",
      sample.value(), status.name(), mean, stdDev);
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject()
      .put("status", status.name())
      .put("reason", reason());
    if (status != Status.INSUFFICIENT_DATA) {
      json.put("mean", mean).put("std", stdDev).put("zScore", zScore);
    }
    return json;
  }
}
