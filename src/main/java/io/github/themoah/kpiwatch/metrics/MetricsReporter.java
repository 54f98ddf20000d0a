package io.github.themoah.kpiwatch.metrics;

import io.github.themoah.kpiwatch.ingest.IngestionException;
import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.ScanResult;
import io.vertx.core.Future;
import java.util.OptionalDouble;

/**
 * Interface for reporting the service's own operational metrics to external systems.
 * Every method defaults to a no-op so callers never need to null-check.
 */
public interface MetricsReporter {

  /**
   * Reporter that records nothing, used when metrics are disabled.
   */
  MetricsReporter NOOP = new MetricsReporter() {};

  default void recordIngested(String metricName) {}

  default void recordRejected(IngestionException.Kind kind) {}

  default void recordAlert(Alert alert) {}

  default void recordAlertFailure(Alert alert) {}

  /**
   * Records the outcome of one monitor pass.
   *
   * @param result pass counters
   * @param durationMs wall time of the pass, including notification delivery
   * @param trackedMetrics number of metrics in the store
   */
  default void recordScan(ScanResult result, long durationMs, int trackedMetrics) {}

  /**
   * Publishes the latest value and forecast of a metric.
   *
   * @param metricName the metric
   * @param latestValue value of the most recent sample
   * @param forecast forecast of the next value, empty if unavailable
   */
  default void reportSeries(String metricName, double latestValue, OptionalDouble forecast) {}

  default Future<Void> close() {
    return Future.succeededFuture();
  }
}
