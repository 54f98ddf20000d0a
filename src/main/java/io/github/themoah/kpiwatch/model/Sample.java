package io.github.themoah.kpiwatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of a KPI.
 *
 * @param timestamp caller-supplied observation time
 * @param value the observed value
 */
public record Sample(
  Instant timestamp,
  double value
) {
  public Sample {
    Objects.requireNonNull(timestamp, "timestamp");
  }
}
