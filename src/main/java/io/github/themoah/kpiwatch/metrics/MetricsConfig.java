package io.github.themoah.kpiwatch.metrics;

import io.github.themoah.kpiwatch.config.EnvReader;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the service's own operational metrics.
 *
 * @param enabled whether a meter registry is created at all
 * @param reporterType "prometheus", "datadog" or "otlp"
 * @param jvmMetricsEnabled whether JVM memory/GC/thread/CPU meters are bound
 */
public record MetricsConfig(
  boolean enabled,
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final boolean DEFAULT_ENABLED = true;
  private static final String DEFAULT_REPORTER = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS = false;

  public boolean isEnabled() {
    return enabled;
  }

  public static MetricsConfig disabled() {
    return new MetricsConfig(false, DEFAULT_REPORTER, false);
  }

  /**
   * Loads configuration from METRICS_ENABLED, METRICS_REPORTER and METRICS_JVM_ENABLED.
   */
  public static MetricsConfig fromEnvironment() {
    return from(System::getenv);
  }

  public static MetricsConfig from(Function<String, String> env) {
    EnvReader reader = new EnvReader(env);
    boolean enabled = reader.getBoolean("METRICS_ENABLED", DEFAULT_ENABLED);
    String reporter = reader.getString("METRICS_REPORTER", DEFAULT_REPORTER);
    boolean jvm = reader.getBoolean("METRICS_JVM_ENABLED", DEFAULT_JVM_METRICS);

    log.info("Metrics config: enabled={}, reporter={}, jvmMetrics={}", enabled, reporter, jvm);
    return new MetricsConfig(enabled, reporter, jvm);
  }
}
