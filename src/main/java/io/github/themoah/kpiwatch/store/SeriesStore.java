package io.github.themoah.kpiwatch.store;

import io.github.themoah.kpiwatch.model.Sample;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory store of recent samples for every known metric.
 *
 * <p>Series are created lazily on first append and live for the lifetime of the process.
 * Appends are serialized per metric; independent metrics do not share a lock.
 */
public class SeriesStore {

  private static final Logger log = LoggerFactory.getLogger(SeriesStore.class);

  public static final int DEFAULT_WINDOW_SIZE = 100;

  private final Map<String, MetricSeries> series = new ConcurrentHashMap<>();
  private final int windowSize;

  public SeriesStore() {
    this(DEFAULT_WINDOW_SIZE);
  }

  public SeriesStore(int windowSize) {
    if (windowSize <= 0) {
      throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
    }
    this.windowSize = windowSize;
  }

  /**
   * Records a sample, creating the series if this is the first one for the metric.
   * Out-of-order timestamps are accepted and kept in arrival order.
   *
   * @param metricName the metric name
   * @param timestamp the observation time
   * @param value the observed value, must be finite
   * @throws InvalidValueException if the value is NaN or infinite, or the name is blank
   */
  public void append(String metricName, Instant timestamp, double value) {
    if (metricName == null || metricName.isBlank()) {
      throw new InvalidValueException("Metric name must not be blank");
    }
    if (!Double.isFinite(value)) {
      throw new InvalidValueException("Value for '" + metricName + "' must be a finite number, got " + value);
    }
    Sample sample = new Sample(timestamp, value);

    series.computeIfAbsent(metricName, name -> {
      log.info("Tracking new metric '{}' with window size {}", name, windowSize);
      return new MetricSeries(name, windowSize);
    }).append(sample);

    log.trace("Appended sample to '{}': ts={}, value={}", metricName, timestamp, value);
  }

  /**
   * Returns a consistent copy of a metric's samples in arrival order.
   *
   * @param metricName the metric name
   * @return the samples, or an empty list if the metric is unknown
   */
  public List<Sample> snapshot(String metricName) {
    MetricSeries metricSeries = series.get(metricName);
    if (metricSeries == null) {
      return List.of();
    }
    return metricSeries.snapshot();
  }

  /**
   * Returns the names of all metrics seen so far, in natural order.
   */
  public Set<String> listMetricNames() {
    return Collections.unmodifiableSet(new TreeSet<>(series.keySet()));
  }

  public boolean contains(String metricName) {
    return series.containsKey(metricName);
  }

  public int metricCount() {
    return series.size();
  }

  public int windowSize() {
    return windowSize;
  }
}
