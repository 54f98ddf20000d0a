package io.github.themoah.kpiwatch.ingest;

import io.github.themoah.kpiwatch.ingest.IngestionException.Kind;
import io.github.themoah.kpiwatch.metrics.MetricsReporter;
import io.github.themoah.kpiwatch.store.InvalidValueException;
import io.github.themoah.kpiwatch.store.SeriesStore;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for the KPI ingestion endpoint.
 * Only structurally valid records reach the series store.
 */
public class IngestHandler {

  private static final Logger log = LoggerFactory.getLogger(IngestHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";
  private static final long MAX_BODY_BYTES = 64 * 1024;

  private final SeriesStore store;
  private final MetricsReporter reporter;

  public IngestHandler(SeriesStore store, MetricsReporter reporter) {
    this.store = store;
    this.reporter = reporter;
  }

  /**
   * Registers POST /ingest on the router.
   */
  public void registerRoutes(Router router) {
    router.post("/ingest")
      .handler(BodyHandler.create().setBodyLimit(MAX_BODY_BYTES))
      .handler(this::handleIngest);
    log.info("Ingestion route registered: POST /ingest");
  }

  private void handleIngest(RoutingContext ctx) {
    IngestRequest request;
    try {
      request = IngestRequest.parse(ctx.body().buffer());
      store.append(request.metricName(), request.timestamp(), request.value());
    } catch (IngestionException e) {
      reject(ctx, e.kind(), e.getMessage());
      return;
    } catch (InvalidValueException e) {
      reject(ctx, Kind.INVALID_VALUE, e.getMessage());
      return;
    }

    reporter.recordIngested(request.metricName());
    JsonObject body = new JsonObject()
      .put("status", "success")
      .put("message", "Data ingested for KPI '" + request.metricName() + "'");
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(200)
      .end(body.encode());
  }

  private void reject(RoutingContext ctx, Kind kind, String reason) {
    log.warn("Rejected ingestion request ({}): {}", kind, reason);
    reporter.recordRejected(kind);
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(400)
      .end(new JsonObject().put("error", reason).encode());
  }
}
