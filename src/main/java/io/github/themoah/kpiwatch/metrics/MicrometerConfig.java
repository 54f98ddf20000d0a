package io.github.themoah.kpiwatch.metrics;

import io.github.themoah.kpiwatch.config.EnvReader;
import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating Micrometer registries.
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  static final String SERVICE_NAME = "kpiwatch";

  private MicrometerConfig() {}

  /**
   * Creates a Datadog meter registry from DD_API_KEY, DD_APP_KEY and DD_SITE.
   */
  public static MeterRegistry createDatadogRegistry() {
    log.info("Creating Datadog meter registry");
    EnvReader env = EnvReader.system();

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return env.getString("DD_API_KEY", null);
      }

      @Override
      public String applicationKey() {
        return env.getString("DD_APP_KEY", null);
      }

      @Override
      public String uri() {
        return "https://api." + env.getString("DD_SITE", "datadoghq.com");
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * Creates an OTLP (HTTP) meter registry.
   * Endpoint: OTLP_ENDPOINT, else OTEL_EXPORTER_OTLP_ENDPOINT + /v1/metrics, else localhost:4318.
   * Step: OTLP_STEP_MS (default 60s).
   */
  public static MeterRegistry createOtlpRegistry() {
    log.info("Creating OTLP meter registry");
    EnvReader env = EnvReader.system();

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        String url = env.getString("OTLP_ENDPOINT", null);
        if (url != null) {
          return url;
        }
        String base = env.getString("OTEL_EXPORTER_OTLP_ENDPOINT", null);
        if (base != null) {
          return base.endsWith("/v1/metrics") ? base : base + "/v1/metrics";
        }
        return "http://localhost:4318/v1/metrics";
      }

      @Override
      public Duration step() {
        return Duration.ofMillis(env.getLong("OTLP_STEP_MS", 60_000L));
      }

      @Override
      public Map<String, String> resourceAttributes() {
        Map<String, String> attributes = new HashMap<>();
        attributes.put("service.name", env.getString("OTEL_SERVICE_NAME", SERVICE_NAME));
        return attributes;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    OtlpMeterRegistry registry = new OtlpMeterRegistry(config, Clock.SYSTEM);
    log.info("OTLP registry created - endpoint: {}", config.url());
    return registry;
  }

  /**
   * Creates a meter registry based on the reporter type.
   *
   * @param reporterType "prometheus", "datadog" or "otlp"
   * @return the configured MeterRegistry, or null if type is unknown
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    MeterRegistry registry = switch (reporterType.toLowerCase()) {
      case "datadog" -> createDatadogRegistry();
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
    if (registry != null) {
      registry.config().commonTags("service", SERVICE_NAME);
    }
    return registry;
  }

  /**
   * Binds JVM metrics (memory, GC, threads, CPU) to the given registry.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }
}
