package io.github.themoah.kpiwatch;

import io.github.themoah.kpiwatch.analysis.AnomalyDetector;
import io.github.themoah.kpiwatch.analysis.DetectionConfig;
import io.github.themoah.kpiwatch.analysis.SmoothingForecaster;
import io.github.themoah.kpiwatch.config.AppConfig;
import io.github.themoah.kpiwatch.dashboard.DashboardHandler;
import io.github.themoah.kpiwatch.dashboard.DashboardService;
import io.github.themoah.kpiwatch.health.HealthCheckHandler;
import io.github.themoah.kpiwatch.ingest.IngestHandler;
import io.github.themoah.kpiwatch.metrics.MetricsConfig;
import io.github.themoah.kpiwatch.metrics.MetricsReporter;
import io.github.themoah.kpiwatch.metrics.MicrometerConfig;
import io.github.themoah.kpiwatch.metrics.MicrometerReporter;
import io.github.themoah.kpiwatch.metrics.PrometheusHandler;
import io.github.themoah.kpiwatch.monitor.AnomalyMonitor;
import io.github.themoah.kpiwatch.notify.AlertConfig;
import io.github.themoah.kpiwatch.notify.CompositeNotificationSink;
import io.github.themoah.kpiwatch.notify.LoggingNotificationSink;
import io.github.themoah.kpiwatch.notify.NotificationSink;
import io.github.themoah.kpiwatch.notify.WebhookNotificationSink;
import io.github.themoah.kpiwatch.store.SeriesStore;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for kpiwatch.
 * Wires the series store, analysis engine, anomaly monitor, notification sinks and HTTP server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AppConfig appConfig;
  private final DetectionConfig detectionConfig;
  private final MetricsConfig metricsConfig;
  private final AlertConfig alertConfig;

  private SeriesStore store;
  private MetricsReporter reporter;
  private NotificationSink notificationSink;
  private AnomalyMonitor monitor;
  private HttpServer httpServer;

  public MainVerticle() {
    this(AppConfig.fromEnvironment(), DetectionConfig.fromEnvironment(),
      MetricsConfig.fromEnvironment(), AlertConfig.fromEnvironment());
  }

  public MainVerticle(
    AppConfig appConfig,
    DetectionConfig detectionConfig,
    MetricsConfig metricsConfig,
    AlertConfig alertConfig
  ) {
    this.appConfig = appConfig;
    this.detectionConfig = detectionConfig;
    this.metricsConfig = metricsConfig;
    this.alertConfig = alertConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting kpiwatch MainVerticle");

    store = new SeriesStore(appConfig.windowSize());
    AnomalyDetector detector = new AnomalyDetector(detectionConfig);
    SmoothingForecaster forecaster = new SmoothingForecaster(detectionConfig);

    Router router = Router.router(vertx);

    // Also registers /metrics when the Prometheus registry is in use
    reporter = createMetricsReporter(metricsConfig, router);
    notificationSink = createNotificationSink(alertConfig);
    monitor = new AnomalyMonitor(vertx, store, detector, forecaster, notificationSink, reporter,
      appConfig.scanIntervalMs());

    new IngestHandler(store, reporter).registerRoutes(router);
    new DashboardHandler(new DashboardService(store, detector, forecaster, appConfig.dashboardRecentSamples()))
      .registerRoutes(router);
    new HealthCheckHandler(monitor).registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader("content-type", "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    monitor.start()
      .compose(v -> startHttpServer(router, appConfig.httpPort()))
      .onSuccess(server -> {
        httpServer = server;
        log.info("kpiwatch started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start kpiwatch", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping kpiwatch MainVerticle");

    Future<Void> stopMonitor = (monitor != null)
      ? monitor.stop()
      : Future.succeededFuture();

    stopMonitor
      .compose(v -> notificationSink != null ? notificationSink.close() : Future.<Void>succeededFuture())
      .compose(v -> httpServer != null ? httpServer.close() : Future.<Void>succeededFuture())
      .compose(v -> reporter != null ? reporter.close() : Future.<Void>succeededFuture())
      .onSuccess(v -> {
        log.info("kpiwatch stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during kpiwatch shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * @return the bound HTTP port, or -1 before the server has started
   */
  public int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  SeriesStore store() {
    return store;
  }

  AnomalyMonitor monitor() {
    return monitor;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private NotificationSink createNotificationSink(AlertConfig config) {
    NotificationSink logging = new LoggingNotificationSink();
    if (!config.webhookEnabled()) {
      return logging;
    }
    log.info("Alert webhook enabled");
    return new CompositeNotificationSink(List.of(
      logging,
      new WebhookNotificationSink(vertx, config.webhookUrl(), config.webhookTimeoutMs())
    ));
  }

  private MetricsReporter createMetricsReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.NOOP;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.NOOP;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
