package io.github.themoah.kpiwatch.analysis;

import io.github.themoah.kpiwatch.analysis.StatisticalUtils.Stats;
import io.github.themoah.kpiwatch.model.AnomalyVerdict;
import io.github.themoah.kpiwatch.model.AnomalyVerdict.Status;
import io.github.themoah.kpiwatch.model.Sample;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies the newest sample of a series against the samples before it.
 *
 * <p>The reference window is every sample except the most recent one, so the value under
 * test never widens its own band. A value strictly outside
 * {@code mean ± sigmaMultiplier * stdDev} is HIGH or LOW; values on the boundary are not
 * anomalous. A reference window with zero deviation never produces an anomaly.
 *
 * <p>Stateless; safe to share between threads.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  private final double sigmaMultiplier;
  private final int minSamples;

  public AnomalyDetector(DetectionConfig config) {
    this.sigmaMultiplier = config.sigmaMultiplier();
    this.minSamples = config.minSamples();
  }

  /**
   * Classifies the last sample of an arrival-ordered series.
   *
   * @param samples samples in arrival order
   * @return the verdict, {@link Status#INSUFFICIENT_DATA} below {@code minSamples}
   */
  public AnomalyVerdict classify(List<Sample> samples) {
    if (samples == null || samples.size() < minSamples) {
      return AnomalyVerdict.insufficientData();
    }

    Sample latest = samples.get(samples.size() - 1);
    List<Double> reference = new ArrayList<>(samples.size() - 1);
    for (int i = 0; i < samples.size() - 1; i++) {
      reference.add(samples.get(i).value());
    }

    Stats stats = StatisticalUtils.calculateStats(reference);
    double zScore = StatisticalUtils.zScore(latest.value(), stats.mean(), stats.stdDev());

    if (StatisticalUtils.isAboveBand(latest.value(), stats.mean(), stats.stdDev(), sigmaMultiplier)) {
      return logged(AnomalyVerdict.anomaly(Status.HIGH, latest, stats.mean(), stats.stdDev(), zScore));
    }
    if (StatisticalUtils.isBelowBand(latest.value(), stats.mean(), stats.stdDev(), sigmaMultiplier)) {
      return logged(AnomalyVerdict.anomaly(Status.LOW, latest, stats.mean(), stats.stdDev(), zScore));
    }
    return AnomalyVerdict.noAnomaly(latest, stats.mean(), stats.stdDev(), zScore);
  }

  private AnomalyVerdict logged(AnomalyVerdict verdict) {
    log.debug("Anomaly classified: status={}, value={}, mean={}, stdDev={}, zScore={}",
      verdict.status(), verdict.sample().value(), verdict.mean(), verdict.stdDev(), verdict.zScore());
    return verdict;
  }
}
