package io.github.themoah.kpiwatch.metrics;

import io.github.themoah.kpiwatch.ingest.IngestionException;
import io.github.themoah.kpiwatch.model.Alert;
import io.github.themoah.kpiwatch.model.ScanResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.time.Duration;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Prometheus, Datadog, OTLP).
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  // Gauge values are stored as raw double bits so a plain AtomicLong can back them
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();
  private final Counter ingested;
  private final Counter evaluationFailures;
  private final Timer scanDuration;

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
    this.ingested = Counter.builder("kpiwatch.samples.ingested")
      .description("Samples accepted by the ingestion endpoint")
      .register(registry);
    this.evaluationFailures = Counter.builder("kpiwatch.scan.evaluation_failures")
      .description("Metrics skipped in a monitor pass because evaluation failed")
      .register(registry);
    this.scanDuration = Timer.builder("kpiwatch.scan.duration")
      .description("Duration of a monitor pass including alert delivery")
      .register(registry);
  }

  @Override
  public void recordIngested(String metricName) {
    ingested.increment();
  }

  @Override
  public void recordRejected(IngestionException.Kind kind) {
    Counter.builder("kpiwatch.samples.rejected")
      .tags(Tags.of("kind", kind.name().toLowerCase()))
      .register(registry)
      .increment();
  }

  @Override
  public void recordAlert(Alert alert) {
    Counter.builder("kpiwatch.alerts")
      .tags(Tags.of("metric", alert.metricName(), "direction", alert.direction().name().toLowerCase()))
      .register(registry)
      .increment();
  }

  @Override
  public void recordAlertFailure(Alert alert) {
    Counter.builder("kpiwatch.alerts.failed")
      .tags(Tags.of("metric", alert.metricName()))
      .register(registry)
      .increment();
  }

  @Override
  public void recordScan(ScanResult result, long durationMs, int trackedMetrics) {
    scanDuration.record(Duration.ofMillis(durationMs));
    if (result.evaluationFailures() > 0) {
      evaluationFailures.increment(result.evaluationFailures());
    }
    recordGauge("kpiwatch.kpi.tracked", Tags.empty(), trackedMetrics);
    log.debug("Recorded scan: {} metrics, {} alerts in {}ms", result.metricsScanned(), result.alertsRaised(), durationMs);
  }

  @Override
  public void reportSeries(String metricName, double latestValue, OptionalDouble forecast) {
    Tags tags = Tags.of("metric", metricName);
    recordGauge("kpiwatch.kpi.value", tags, latestValue);
    if (forecast.isPresent()) {
      recordGauge("kpiwatch.kpi.forecast", tags, forecast.getAsDouble());
    }
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  private void recordGauge(String name, Tags tags, double value) {
    String key = name + tags.toString();
    long bits = Double.doubleToRawLongBits(value);
    AtomicLong holder = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(bits);
      Gauge.builder(name, newValue, v -> Double.longBitsToDouble(v.get()))
        .tags(tags)
        .register(registry);
      return newValue;
    });
    holder.set(bits);
  }

  MeterRegistry registry() {
    return registry;
  }
}
