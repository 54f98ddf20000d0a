package io.github.themoah.kpiwatch.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Application configuration loaded from environment variables.
 *
 * @param httpPort HTTP server port (0 picks a free port)
 * @param windowSize samples retained per metric
 * @param scanIntervalMs period of the anomaly monitor in milliseconds
 * @param dashboardRecentSamples samples shown per metric by the dashboard endpoints
 */
public record AppConfig(
  int httpPort,
  int windowSize,
  long scanIntervalMs,
  int dashboardRecentSamples
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final int DEFAULT_WINDOW_SIZE = 100;
  private static final long DEFAULT_SCAN_INTERVAL_MS = 30_000L;
  private static final int DEFAULT_DASHBOARD_RECENT_SAMPLES = 20;

  public AppConfig {
    if (windowSize <= 0) {
      throw new IllegalArgumentException("windowSize must be positive, got " + windowSize);
    }
    if (scanIntervalMs < 1) {
      throw new IllegalArgumentException("scanIntervalMs must be at least 1, got " + scanIntervalMs);
    }
    if (dashboardRecentSamples <= 0) {
      throw new IllegalArgumentException("dashboardRecentSamples must be positive, got " + dashboardRecentSamples);
    }
  }

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    return from(System::getenv);
  }

  public static AppConfig from(Function<String, String> env) {
    EnvReader reader = new EnvReader(env);
    int port = reader.getInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    int windowSize = reader.getInt("KPI_WINDOW_SIZE", DEFAULT_WINDOW_SIZE);
    long interval = reader.getLong("KPI_SCAN_INTERVAL_MS", DEFAULT_SCAN_INTERVAL_MS);
    int recent = reader.getInt("KPI_DASHBOARD_RECENT_SAMPLES", DEFAULT_DASHBOARD_RECENT_SAMPLES);

    log.info("AppConfig loaded: httpPort={}, windowSize={}, scanIntervalMs={}, dashboardRecentSamples={}",
      port, windowSize, interval, recent);
    return new AppConfig(port, windowSize, interval, recent);
  }
}
