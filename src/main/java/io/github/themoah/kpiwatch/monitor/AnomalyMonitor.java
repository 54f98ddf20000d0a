package io.github.themoah.kpiwatch.monitor;

import io.github.themoah.kpiwatch.analysis.AnomalyDetector;
import io.github.themoah.kpiwatch.analysis.SmoothingForecaster;
import io.github.themoah.kpiwatch.metrics.MetricsReporter;
import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.AnomalyVerdict;
import io.github.themoah.kpiwatch.model.Sample;
import io.github.themoah.kpiwatch.model.ScanResult;
import io.github.themoah.kpiwatch.notify.NotificationSink;
import io.github.themoah.kpiwatch.store.SeriesStore;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically scans every known metric and raises an alert for each HIGH or LOW verdict.
 *
 * <p>No alert state is kept between passes: a metric that stays anomalous is alerted
 * again on every pass. Suppression belongs in a {@link NotificationSink}.
 *
 * <p>A pass takes snapshots, so no store lock is held while notifications are in
 * flight. A tick that fires while the previous pass is still delivering is skipped.
 */
public class AnomalyMonitor {

  private static final Logger log = LoggerFactory.getLogger(AnomalyMonitor.class);

  public static final long DEFAULT_INTERVAL_MS = 30_000L;

  private final Vertx vertx;
  private final SeriesStore store;
  private final AnomalyDetector detector;
  private final SmoothingForecaster forecaster;
  private final NotificationSink sink;
  private final MetricsReporter reporter;
  private final long intervalMs;

  private final AtomicBoolean scanning = new AtomicBoolean(false);
  private final AtomicReference<Future<ScanResult>> inFlight = new AtomicReference<>();
  private volatile Long timerId;
  private volatile boolean stopped;

  public AnomalyMonitor(
    Vertx vertx,
    SeriesStore store,
    AnomalyDetector detector,
    SmoothingForecaster forecaster,
    NotificationSink sink,
    MetricsReporter reporter,
    long intervalMs
  ) {
    this.vertx = vertx;
    this.store = store;
    this.detector = detector;
    this.forecaster = forecaster;
    this.sink = sink;
    this.reporter = reporter;
    this.intervalMs = intervalMs;
  }

  /**
   * Runs a first pass immediately, then schedules one every interval.
   *
   * @return Future that completes when the first pass finishes
   */
  public Future<Void> start() {
    log.info("Starting anomaly monitor with scan interval: {}ms", intervalMs);
    stopped = false;

    return runScheduledPass()
      .onComplete(ar -> {
        if (stopped) {
          log.info("Anomaly monitor stopped during its first scan, not scheduling further scans");
          return;
        }
        long id = vertx.setPeriodic(intervalMs, tick -> runScheduledPass());
        timerId = id;
        if (stopped) {
          // stop() ran between the check above and the timer being set
          vertx.cancelTimer(id);
          timerId = null;
          return;
        }
        log.info("Anomaly monitor started, timer ID: {}", id);
      })
      .mapEmpty();
  }

  /**
   * Stops scheduling new passes, including when called before the first pass has finished.
   * A pass already running is not interrupted.
   *
   * @return Future that completes once the in-flight pass, including its notifications, is done
   */
  public Future<Void> stop() {
    log.info("Stopping anomaly monitor");
    stopped = true;
    Long id = timerId;
    timerId = null;
    if (id != null) {
      vertx.cancelTimer(id);
    }

    Future<ScanResult> current = inFlight.get();
    if (current == null || current.isComplete()) {
      return Future.succeededFuture();
    }
    log.info("Waiting for in-flight scan to finish");
    return current.transform(ar -> Future.<Void>succeededFuture());
  }

  public boolean isRunning() {
    return timerId != null;
  }

  public boolean isScanning() {
    return scanning.get();
  }

  private Future<ScanResult> runScheduledPass() {
    if (!scanning.compareAndSet(false, true)) {
      log.debug("Previous scan still in progress, skipping this tick");
      Future<ScanResult> current = inFlight.get();
      return current != null ? current : Future.succeededFuture(new ScanResult(0, 0, 0, 0));
    }

    Future<ScanResult> pass = doScan()
      .onComplete(ar -> scanning.set(false));
    inFlight.set(pass);
    return pass;
  }

  /**
   * Runs a single pass over the metrics known at its start.
   *
   * @return Future with the pass counters, completed after every alert has been delivered or failed
   */
  public Future<ScanResult> scanOnce() {
    return runScheduledPass();
  }

  private Future<ScanResult> doScan() {
    long startNanos = System.nanoTime();
    Set<String> metricNames = store.listMetricNames();
    log.debug("Scanning {} metrics", metricNames.size());

    List<Future<Void>> deliveries = new ArrayList<>();
    AtomicInteger sinkFailures = new AtomicInteger();
    int evaluationFailures = 0;
    int scanned = 0;

    for (String metricName : metricNames) {
      Alert alert;
      try {
        alert = evaluate(metricName);
        if (alert != null) {
          reporter.recordAlert(alert);
        }
        scanned++;
      } catch (RuntimeException e) {
        evaluationFailures++;
        log.warn("Failed to evaluate metric '{}', skipping", metricName, e);
        continue;
      }

      if (alert != null) {
        deliveries.add(NotificationSink.deliver(sink, alert)
          .recover(err -> {
            sinkFailures.incrementAndGet();
            reporter.recordAlertFailure(alert);
            log.error("Notification sink failed for alert on '{}': {}", metricName, err.getMessage());
            return Future.succeededFuture();
          }));
      }
    }

    int alertsRaised = deliveries.size();
    int metricsScanned = scanned;
    int failedEvaluations = evaluationFailures;

    return Future.join(deliveries)
      .transform(ar -> {
        ScanResult result = new ScanResult(metricsScanned, alertsRaised, failedEvaluations, sinkFailures.get());
        long durationMs = (System.nanoTime() - startNanos) / 1_000_000L;
        reporter.recordScan(result, durationMs, store.metricCount());
        if (alertsRaised > 0 || failedEvaluations > 0) {
          log.info("Scan finished: {} metrics, {} alerts ({} undelivered), {} evaluation failures in {}ms",
            metricsScanned, alertsRaised, result.sinkFailures(), failedEvaluations, durationMs);
        } else {
          log.debug("Scan finished: {} metrics, no alerts in {}ms", metricsScanned, durationMs);
        }
        return Future.succeededFuture(result);
      });
  }

  /**
   * @return the alert to raise for this metric, or null if its newest sample is not anomalous
   */
  private Alert evaluate(String metricName) {
    List<Sample> samples = store.snapshot(metricName);
    if (!samples.isEmpty()) {
      Sample latest = samples.get(samples.size() - 1);
      reporter.reportSeries(metricName, latest.value(), forecaster.forecastSamples(samples));
    }

    AnomalyVerdict verdict = detector.classify(samples);
    if (!verdict.isAnomalous()) {
      return null;
    }
    return Alert.from(metricName, verdict);
  }
}
