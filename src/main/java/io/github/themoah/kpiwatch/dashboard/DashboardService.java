package io.github.themoah.kpiwatch.dashboard;

import io.github.themoah.kpiwatch.analysis.AnomalyDetector;
import io.github.themoah.kpiwatch.analysis.SmoothingForecaster;
import io.github.themoah.kpiwatch.model.AnomalyVerdict;
import io.github.themoah.kpiwatch.model.MetricView;
import io.github.themoah.kpiwatch.model.Sample;
import io.github.themoah.kpiwatch.store.SeriesStore;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Read-only composition of the series store and analysis engine for display.
 *
 * <p>Recent samples are sorted by timestamp before the last {@code recentLimit} are taken,
 * so late arrivals show up in chronological position. The forecast runs over those
 * displayed values; the anomaly verdict runs over the whole window in arrival order,
 * exactly as the monitor sees it.
 */
public class DashboardService {

  public static final int DEFAULT_RECENT_LIMIT = 20;

  private static final Comparator<Sample> BY_TIMESTAMP = Comparator.comparing(Sample::timestamp);

  private final SeriesStore store;
  private final AnomalyDetector detector;
  private final SmoothingForecaster forecaster;
  private final int recentLimit;

  public DashboardService(SeriesStore store, AnomalyDetector detector, SmoothingForecaster forecaster, int recentLimit) {
    if (recentLimit <= 0) {
      throw new IllegalArgumentException("recentLimit must be positive, got " + recentLimit);
    }
    this.store = store;
    this.detector = detector;
    this.forecaster = forecaster;
    this.recentLimit = recentLimit;
  }

  /**
   * @return one view per known metric, ordered by metric name
   */
  public List<MetricView> currentViews() {
    List<MetricView> views = new ArrayList<>();
    for (String metricName : store.listMetricNames()) {
      views.add(buildView(metricName, store.snapshot(metricName)));
    }
    return views;
  }

  /**
   * @param metricName the metric
   * @return the view, or empty if the metric has never been ingested
   */
  public Optional<MetricView> view(String metricName) {
    if (!store.contains(metricName)) {
      return Optional.empty();
    }
    return Optional.of(buildView(metricName, store.snapshot(metricName)));
  }

  private MetricView buildView(String metricName, List<Sample> samples) {
    List<Sample> sorted = new ArrayList<>(samples);
    sorted.sort(BY_TIMESTAMP);
    List<Sample> recent = List.copyOf(sorted.subList(Math.max(0, sorted.size() - recentLimit), sorted.size()));

    OptionalDouble forecast = forecaster.forecastSamples(recent);
    AnomalyVerdict verdict = detector.classify(samples);
    return new MetricView(metricName, recent, forecast, verdict);
  }
}
