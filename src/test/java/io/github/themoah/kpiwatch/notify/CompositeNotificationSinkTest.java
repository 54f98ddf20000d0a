package io.github.themoah.kpiwatch.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.AnomalyVerdict.Status;
import io.vertx.core.Future;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for CompositeNotificationSink.
 */
public class CompositeNotificationSinkTest {

  private static final Alert ALERT = new Alert("orders", Instant.parse("2024-06-01T12:00:00Z"), -3.0,
    Status.LOW, "value -3.00 is unusually LOW (mean=5.00, std=1.00)");

  @Test
  void send_reachesEverySink() {
    List<String> delivered = new ArrayList<>();
    CompositeNotificationSink composite = new CompositeNotificationSink(List.of(
      alert -> {
        delivered.add("first:" + alert.metricName());
        return Future.succeededFuture();
      },
      alert -> {
        delivered.add("second:" + alert.metricName());
        return Future.succeededFuture();
      }
    ));

    assertTrue(composite.send(ALERT).succeeded());
    assertEquals(List.of("first:orders", "second:orders"), delivered);
  }

  @Test
  void send_failingSinkDoesNotSkipTheRest() {
    AtomicInteger reached = new AtomicInteger();
    CompositeNotificationSink composite = new CompositeNotificationSink(List.of(
      alert -> {
        throw new IllegalStateException("boom");
      },
      alert -> Future.failedFuture("refused"),
      alert -> {
        reached.incrementAndGet();
        return Future.succeededFuture();
      }
    ));

    Future<Void> result = composite.send(ALERT);

    assertTrue(result.failed());
    assertEquals(1, reached.get());
  }

  @Test
  void close_closesEverySink() {
    AtomicInteger closed = new AtomicInteger();
    NotificationSink closing = new NotificationSink() {
      @Override
      public Future<Void> send(Alert alert) {
        return Future.succeededFuture();
      }

      @Override
      public Future<Void> close() {
        closed.incrementAndGet();
        return Future.succeededFuture();
      }
    };

    assertTrue(new CompositeNotificationSink(List.of(closing, closing)).close().succeeded());
    assertEquals(2, closed.get());
  }

  @Test
  void deliver_treatsNullAsSuccess() {
    assertTrue(NotificationSink.deliver(alert -> null, ALERT).succeeded());
  }
}
