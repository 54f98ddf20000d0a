package io.github.themoah.kpiwatch.notify;

import io.github.themoah.kpiwatch.model.Alert;
import io.vertx.core.Future;

/**
 * Destination for alerts raised by the anomaly monitor.
 *
 * <p>Implementations own delivery (log, webhook, mail relay). A failed future is
 * reported by the caller and never affects stored series or other alerts.
 */
public interface NotificationSink {

  /**
   * Delivers one alert.
   *
   * @param alert the alert
   * @return Future that completes when the alert was handed off
   */
  Future<Void> send(Alert alert);

  /**
   * Releases resources held by the sink.
   */
  default Future<Void> close() {
    return Future.succeededFuture();
  }

  /**
   * Calls {@link #send(Alert)}, turning a synchronous exception into a failed future.
   */
  static Future<Void> deliver(NotificationSink sink, Alert alert) {
    try {
      Future<Void> result = sink.send(alert);
      return result != null ? result : Future.succeededFuture();
    } catch (RuntimeException e) {
      return Future.failedFuture(e);
    }
  }
}
