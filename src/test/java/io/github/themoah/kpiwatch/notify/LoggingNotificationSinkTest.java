package io.github.themoah.kpiwatch.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.AnomalyVerdict.Status;
import java.time.Instant;
import org.junit.jupiter.api.Test;

public class LoggingNotificationSinkTest {

  private static final Alert ALERT = new Alert("inv", Instant.parse("2024-06-01T12:00:00Z"), 1000.0,
    Status.HIGH, "value 1000.00 is unusually HIGH (mean=100.00, std=3.16)");

  @Test
  void format_includesMetricValueAndReason() {
    assertEquals(
      "[ALERT] 2024-06-01T12:00:00Z: KPI 'inv' anomaly detected. Value=1000.0. "
        + "Reason: value 1000.00 is unusually HIGH (mean=100.00, std=3.16)",
      LoggingNotificationSink.format(ALERT));
  }

  @Test
  void send_alwaysSucceeds() {
    assertTrue(new LoggingNotificationSink().send(ALERT).succeeded());
  }
}
