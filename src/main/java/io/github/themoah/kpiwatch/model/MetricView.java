package io.github.themoah.kpiwatch.model;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Read-only view of a metric for display.
 *
 * @param metricName the metric name
 * @param recent most recent samples, ordered by timestamp
 * @param forecast one-step-ahead forecast over the recent values, empty if unavailable
 * @param verdict anomaly verdict over the full retained window
 */
public record MetricView(
  String metricName,
  List<Sample> recent,
  OptionalDouble forecast,
  AnomalyVerdict verdict
) {

  public JsonObject toJson() {
    JsonArray timestamps = new JsonArray();
    JsonArray values = new JsonArray();
    for (Sample sample : recent) {
      timestamps.add(sample.timestamp().toString());
      values.add(sample.value());
    }

    return new JsonObject()
      .put("metric", metricName)
      .put("timestamps", timestamps)
      .put("values", values)
      .put("forecast", forecast.isPresent() ? forecast.getAsDouble() : null)
      .put("anomaly", verdict.toJson());
  }
}
