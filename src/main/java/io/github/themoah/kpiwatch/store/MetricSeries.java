package io.github.themoah.kpiwatch.store;

import io.github.themoah.kpiwatch.model.Sample;
import java.util.ArrayDeque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded, arrival-ordered sample buffer for a single metric.
 *
 * <p>All access goes through the series' own monitor, so writers of one metric never
 * contend with writers of another and readers always see a whole buffer.
 */
public class MetricSeries {
  private static final Logger log = LoggerFactory.getLogger(MetricSeries.class);

  private final String metricName;
  private final ArrayDeque<Sample> samples;
  private final int maxSize;
  private boolean hasLoggedWindowFull = false;

  public MetricSeries(String metricName, int windowSize) {
    this.metricName = metricName;
    this.samples = new ArrayDeque<>(windowSize);
    this.maxSize = windowSize;
  }

  public synchronized void append(Sample sample) {
    if (samples.size() >= maxSize) {
      samples.removeFirst();  // Evict oldest

      if (!hasLoggedWindowFull) {
        log.debug("Window of {} samples filled for '{}', evicting oldest from now on", maxSize, metricName);
        hasLoggedWindowFull = true;
      }
    }
    samples.addLast(sample);
  }

  /**
   * Returns a point-in-time copy of the buffer, oldest first.
   */
  public synchronized List<Sample> snapshot() {
    return List.copyOf(samples);
  }

  public synchronized int size() {
    return samples.size();
  }

  public String metricName() {
    return metricName;
  }
}
