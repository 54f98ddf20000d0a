package io.github.themoah.kpiwatch;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kpiwatch.analysis.DetectionConfig;
import io.github.themoah.kpiwatch.config.AppConfig;
import io.github.themoah.kpiwatch.metrics.MetricsConfig;
import io.github.themoah.kpiwatch.notify.AlertConfig;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * End-to-end tests over HTTP against a deployed MainVerticle.
 */
@ExtendWith(VertxExtension.class)
public class TestMainVerticle {

  private MainVerticle verticle;
  private WebClient client;

  @BeforeEach
  void deploy(Vertx vertx, VertxTestContext ctx) {
    verticle = new MainVerticle(
      new AppConfig(0, 100, 30_000, 20),
      DetectionConfig.defaults(),
      MetricsConfig.disabled(),
      AlertConfig.loggingOnly());
    client = WebClient.create(vertx);
    vertx.deployVerticle(verticle).onComplete(ctx.succeedingThenComplete());
  }

  private Future<HttpResponse<Buffer>> ingest(JsonObject body) {
    return client.post(verticle.actualPort(), "localhost", "/ingest").sendJsonObject(body);
  }

  private Future<HttpResponse<Buffer>> ingestRaw(String body) {
    return client.post(verticle.actualPort(), "localhost", "/ingest").sendBuffer(Buffer.buffer(body));
  }

  private Future<HttpResponse<Buffer>> get(String path) {
    return client.get(verticle.actualPort(), "localhost", path).send();
  }

  private static JsonObject sample(String metric, String timestamp, double value) {
    return new JsonObject()
      .put("metric_name", metric)
      .put("timestamp", timestamp)
      .put("value", value);
  }

  @Test
  void ingest_acceptsValidRecord(VertxTestContext ctx) {
    ingest(sample("cpu", "2024-06-01T00:00:00Z", 0.75))
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        JsonObject body = response.bodyAsJsonObject();
        assertEquals("success", body.getString("status"));
        assertEquals("Data ingested for KPI 'cpu'", body.getString("message"));
        assertEquals(1, verticle.store().snapshot("cpu").size());
        ctx.completeNow();
      })));
  }

  @Test
  void ingest_acceptsLegacyFieldName(VertxTestContext ctx) {
    JsonObject legacy = new JsonObject()
      .put("kpi_name", "revenue")
      .put("timestamp", "2024-06-01")
      .put("value", 12);

    ingest(legacy).onComplete(ctx.succeeding(response -> ctx.verify(() -> {
      assertEquals(200, response.statusCode());
      assertTrue(verticle.store().contains("revenue"));
      ctx.completeNow();
    })));
  }

  @Test
  void ingest_rejectsInvalidRecords(VertxTestContext ctx) {
    ingest(sample("cpu", "yesterday", 1))
      .compose(badTimestamp -> {
        ctx.verify(() -> {
          assertEquals(400, badTimestamp.statusCode());
          assertEquals("Invalid timestamp format", badTimestamp.bodyAsJsonObject().getString("error"));
        });
        return ingest(new JsonObject().put("metric_name", "cpu").put("timestamp", "2024-06-01T00:00:00Z")
          .put("value", "high"));
      })
      .compose(badValue -> {
        ctx.verify(() -> assertEquals(400, badValue.statusCode()));
        return ingestRaw("not json");
      })
      .compose(badJson -> {
        ctx.verify(() -> assertEquals(400, badJson.statusCode()));
        return ingestRaw("");
      })
      .onComplete(ctx.succeeding(empty -> ctx.verify(() -> {
        assertEquals(400, empty.statusCode());
        assertTrue(empty.bodyAsJsonObject().containsKey("error"));
        assertEquals(0, verticle.store().metricCount());
        ctx.completeNow();
      })));
  }

  @Test
  void constantSeriesWithSpike_endToEnd(VertxTestContext ctx) {
    Future<HttpResponse<Buffer>> chain = Future.succeededFuture();
    for (int i = 0; i < 9; i++) {
      String timestamp = String.format("2024-06-01T00:%02d:00Z", i);
      chain = chain.compose(prev -> ingest(sample("inv", timestamp, 100)));
    }

    chain
      .compose(prev -> get("/api/metrics/inv"))
      .compose(before -> {
        ctx.verify(() -> {
          assertEquals(200, before.statusCode());
          JsonObject anomaly = before.bodyAsJsonObject().getJsonObject("anomaly");
          assertEquals("INSUFFICIENT_DATA", anomaly.getString("status"));
        });
        return ingest(sample("inv", "2024-06-01T00:09:00Z", 1000));
      })
      .compose(prev -> get("/api/metrics/inv"))
      .onComplete(ctx.succeeding(after -> ctx.verify(() -> {
        JsonObject body = after.bodyAsJsonObject();
        assertEquals("inv", body.getString("metric"));
        assertEquals(10, body.getJsonArray("values").size());
        assertEquals("NO_ANOMALY", body.getJsonObject("anomaly").getString("status"));
        assertEquals(100.0, body.getJsonObject("anomaly").getDouble("mean"));
        assertNull(body.getJsonObject("anomaly").getString("reason"));
        ctx.completeNow();
      })));
  }

  @Test
  void dashboard_listsAllMetrics(VertxTestContext ctx) {
    ingest(sample("b_metric", "2024-06-01T00:00:00Z", 2))
      .compose(prev -> ingest(sample("a_metric", "2024-06-01T00:00:00Z", 1)))
      .compose(prev -> get("/api/dashboard"))
      .onComplete(ctx.succeeding(response -> ctx.verify(() -> {
        assertEquals(200, response.statusCode());
        JsonArray metrics = response.bodyAsJsonObject().getJsonArray("metrics");
        assertEquals(2, metrics.size());
        assertEquals("a_metric", metrics.getJsonObject(0).getString("metric"));
        assertEquals(1.0, metrics.getJsonObject(0).getDouble("forecast"));
        ctx.completeNow();
      })));
  }

  @Test
  void unknownMetricAndRoute_return404(VertxTestContext ctx) {
    get("/api/metrics/nope")
      .compose(unknownMetric -> {
        ctx.verify(() -> {
          assertEquals(404, unknownMetric.statusCode());
          assertEquals("Unknown metric 'nope'", unknownMetric.bodyAsJsonObject().getString("error"));
        });
        return get("/does-not-exist");
      })
      .onComplete(ctx.succeeding(unknownRoute -> ctx.verify(() -> {
        assertEquals(404, unknownRoute.statusCode());
        ctx.completeNow();
      })));
  }

  @Test
  void healthEndpoints(VertxTestContext ctx) {
    get("/healthz")
      .compose(liveness -> {
        ctx.verify(() -> {
          assertEquals(200, liveness.statusCode());
          assertEquals("{\"status\":\"UP\"}", liveness.bodyAsString());
        });
        return get("/readyz");
      })
      .onComplete(ctx.succeeding(readiness -> ctx.verify(() -> {
        assertEquals(200, readiness.statusCode());
        assertEquals("running", readiness.bodyAsJsonObject().getString("monitor"));
        assertTrue(verticle.monitor().isRunning());
        ctx.completeNow();
      })));
  }
}
