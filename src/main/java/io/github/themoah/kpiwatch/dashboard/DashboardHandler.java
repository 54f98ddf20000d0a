package io.github.themoah.kpiwatch.dashboard;

import io.github.themoah.kpiwatch.model.MetricView;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler exposing current series, forecasts and anomaly state as JSON.
 */
public class DashboardHandler {

  private static final Logger log = LoggerFactory.getLogger(DashboardHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final DashboardService dashboardService;

  public DashboardHandler(DashboardService dashboardService) {
    this.dashboardService = dashboardService;
  }

  public void registerRoutes(Router router) {
    router.get("/api/dashboard").handler(this::handleDashboard);
    router.get("/api/metrics/:name").handler(this::handleMetric);
    log.info("Dashboard routes registered: /api/dashboard, /api/metrics/:name");
  }

  private void handleDashboard(RoutingContext ctx) {
    JsonArray metrics = new JsonArray();
    for (MetricView view : dashboardService.currentViews()) {
      metrics.add(view.toJson());
    }
    respond(ctx, 200, new JsonObject().put("metrics", metrics));
  }

  private void handleMetric(RoutingContext ctx) {
    String name = ctx.pathParam("name");
    Optional<MetricView> view = dashboardService.view(name);
    if (view.isEmpty()) {
      respond(ctx, 404, new JsonObject().put("error", "Unknown metric '" + name + "'"));
      return;
    }
    respond(ctx, 200, view.get().toJson());
  }

  private void respond(RoutingContext ctx, int statusCode, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(statusCode)
      .end(body.encode());
  }
}
