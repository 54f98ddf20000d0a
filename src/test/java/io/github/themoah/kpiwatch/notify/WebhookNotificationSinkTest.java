package io.github.themoah.kpiwatch.notify;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.AnomalyVerdict.Status;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Tests WebhookNotificationSink against a local HTTP server.
 */
@ExtendWith(VertxExtension.class)
public class WebhookNotificationSinkTest {

  private static final Alert ALERT = new Alert("inv", Instant.parse("2024-06-01T12:00:00Z"), 1000.0,
    Status.HIGH, "value 1000.00 is unusually HIGH (mean=100.00, std=3.16)");

  private final List<JsonObject> received = new CopyOnWriteArrayList<>();
  private int port;

  @BeforeEach
  void startReceiver(Vertx vertx, VertxTestContext ctx) {
    vertx.createHttpServer()
      .requestHandler(req -> req.body().onSuccess(body -> {
        received.add(body.toJsonObject());
        int status = req.path().equals("/broken") ? 500 : 204;
        req.response().setStatusCode(status).end();
      }))
      .listen(0)
      .map(HttpServer::actualPort)
      .onComplete(ctx.succeeding(p -> {
        port = p;
        ctx.completeNow();
      }));
  }

  @Test
  void send_postsAlertJson(Vertx vertx, VertxTestContext ctx) {
    WebhookNotificationSink sink = new WebhookNotificationSink(vertx, "http://localhost:" + port + "/hook", 2_000);

    sink.send(ALERT).onComplete(ctx.succeeding(v -> ctx.verify(() -> {
      assertEquals(1, received.size());
      JsonObject json = received.get(0);
      assertEquals("inv", json.getString("metric_name"));
      assertEquals("2024-06-01T12:00:00Z", json.getString("timestamp"));
      assertEquals(1000.0, json.getDouble("value"));
      assertEquals(ALERT.reason(), json.getString("reason"));
      sink.close();
      ctx.completeNow();
    })));
  }

  @Test
  void send_failsOnErrorStatus(Vertx vertx, VertxTestContext ctx) {
    WebhookNotificationSink sink = new WebhookNotificationSink(vertx, "http://localhost:" + port + "/broken", 2_000);

    sink.send(ALERT).onComplete(ctx.failing(err -> ctx.verify(() -> {
      assertTrue(err.getMessage().contains("500"));
      assertEquals(1, received.size());
      sink.close();
      ctx.completeNow();
    })));
  }
}
