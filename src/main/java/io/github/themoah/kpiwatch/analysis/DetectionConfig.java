package io.github.themoah.kpiwatch.analysis;

import io.github.themoah.kpiwatch.config.EnvReader;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global anomaly detection and forecasting parameters.
 *
 * @param sigmaMultiplier standard deviations from the reference mean before a value is anomalous (default 2.0)
 * @param minSamples minimum samples, including the newest, before classification (default 10)
 * @param smoothingAlpha weight of the newest observation in exponential smoothing (default 0.3)
 */
public record DetectionConfig(
  double sigmaMultiplier,
  int minSamples,
  double smoothingAlpha
) {

  private static final Logger log = LoggerFactory.getLogger(DetectionConfig.class);

  public static final double DEFAULT_SIGMA_MULTIPLIER = 2.0;
  public static final int DEFAULT_MIN_SAMPLES = 10;
  public static final double DEFAULT_SMOOTHING_ALPHA = 0.3;

  public DetectionConfig {
    if (!(sigmaMultiplier > 0) || !Double.isFinite(sigmaMultiplier)) {
      throw new IllegalArgumentException("sigmaMultiplier must be a positive number, got " + sigmaMultiplier);
    }
    // The reference window needs at least two points for a deviation to mean anything
    if (minSamples < 3) {
      throw new IllegalArgumentException("minSamples must be at least 3, got " + minSamples);
    }
    if (!(smoothingAlpha > 0 && smoothingAlpha <= 1)) {
      throw new IllegalArgumentException("smoothingAlpha must be in (0, 1], got " + smoothingAlpha);
    }
  }

  public static DetectionConfig defaults() {
    return new DetectionConfig(DEFAULT_SIGMA_MULTIPLIER, DEFAULT_MIN_SAMPLES, DEFAULT_SMOOTHING_ALPHA);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>ANOMALY_SIGMA_MULTIPLIER - Band width in standard deviations (default: 2.0)</li>
   *   <li>ANOMALY_MIN_SAMPLES - Samples required before classification (default: 10)</li>
   *   <li>FORECAST_SMOOTHING_ALPHA - Exponential smoothing factor (default: 0.3)</li>
   * </ul>
   */
  public static DetectionConfig fromEnvironment() {
    return from(System::getenv);
  }

  public static DetectionConfig from(Function<String, String> env) {
    EnvReader reader = new EnvReader(env);
    double sigma = reader.getDouble("ANOMALY_SIGMA_MULTIPLIER", DEFAULT_SIGMA_MULTIPLIER);
    int minSamples = reader.getInt("ANOMALY_MIN_SAMPLES", DEFAULT_MIN_SAMPLES);
    double alpha = reader.getDouble("FORECAST_SMOOTHING_ALPHA", DEFAULT_SMOOTHING_ALPHA);

    DetectionConfig config = new DetectionConfig(sigma, minSamples, alpha);
    log.info("Detection config: sigma={}, minSamples={}, smoothingAlpha={}", sigma, minSamples, alpha);
    return config;
  }
}
