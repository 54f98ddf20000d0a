package io.github.themoah.kpiwatch.notify;

import io.github.themoah.kpiwatch.model.Alert;
import io.vertx.core.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes alerts to the application log at WARN.
 */
public class LoggingNotificationSink implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

  @Override
  public Future<Void> send(Alert alert) {
    log.warn(format(alert));
    return Future.succeededFuture();
  }

  static String format(Alert alert) {
    return "[ALERT] " + alert.timestamp() + ": KPI '" + alert.metricName()
      + "' anomaly detected. Value=" + alert.value() + ". Reason: " + alert.reason();
  }
}
