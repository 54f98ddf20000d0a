package io.github.themoah.kpiwatch.model;

import io.vertx.core.json.JsonObject;
import java.time.Instant;

/**
 * Notification raised by a monitor pass for an anomalous metric.
 *
 * @param metricName the metric that triggered
 * @param timestamp timestamp of the triggering sample
 * @param value value of the triggering sample
 * @param direction HIGH or LOW
 * @param reason human-readable explanation including reference mean and deviation
 */
public record Alert(
  String metricName,
  Instant timestamp,
  double value,
  AnomalyVerdict.Status direction,
  String reason
) {

  public static Alert from(String metricName, AnomalyVerdict verdict) {
    if (!verdict.isAnomalous()) {
      throw new IllegalArgumentException("Cannot raise an alert for verdict " + verdict.status());
    }
    return new Alert(
      metricName,
      verdict.sample().timestamp(),
      verdict.sample().value(),
      verdict.status(),
      verdict.reason()
    );
  }

  public JsonObject toJson() {
    return new JsonObject()
      .put("metric_name", metricName)
      .put("timestamp", timestamp.toString())
      .put("value", value)
      .put("reason", reason);
  }
}
