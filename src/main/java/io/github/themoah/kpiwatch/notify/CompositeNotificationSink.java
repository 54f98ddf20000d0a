package io.github.themoah.kpiwatch.notify;

import io.github.themoah.kpiwatch.model.Alert;
import io.vertx.core.Future;
import java.util.List;

/**
 * Fans each alert out to several sinks. Every sink is attempted; the result fails if any of
 * them failed.
 */
public class CompositeNotificationSink implements NotificationSink {

  private final List<NotificationSink> sinks;

  public CompositeNotificationSink(List<NotificationSink> sinks) {
    this.sinks = List.copyOf(sinks);
  }

  @Override
  public Future<Void> send(Alert alert) {
    List<Future<Void>> deliveries = sinks.stream()
      .map(sink -> NotificationSink.deliver(sink, alert))
      .toList();
    return Future.join(deliveries).mapEmpty();
  }

  @Override
  public Future<Void> close() {
    List<Future<Void>> closing = sinks.stream()
      .map(NotificationSink::close)
      .toList();
    return Future.join(closing).mapEmpty();
  }

  public List<NotificationSink> sinks() {
    return sinks;
  }
}
