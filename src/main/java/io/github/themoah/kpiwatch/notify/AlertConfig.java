package io.github.themoah.kpiwatch.notify;

import io.github.themoah.kpiwatch.config.EnvReader;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Alert delivery configuration.
 *
 * @param webhookUrl absolute URL alerts are POSTed to, null to only log alerts
 * @param webhookTimeoutMs request timeout for webhook delivery
 */
public record AlertConfig(
  String webhookUrl,
  long webhookTimeoutMs
) {

  private static final Logger log = LoggerFactory.getLogger(AlertConfig.class);

  private static final long DEFAULT_WEBHOOK_TIMEOUT_MS = 5_000L;

  public boolean webhookEnabled() {
    return webhookUrl != null && !webhookUrl.isBlank();
  }

  public static AlertConfig loggingOnly() {
    return new AlertConfig(null, DEFAULT_WEBHOOK_TIMEOUT_MS);
  }

  /**
   * Loads ALERT_WEBHOOK_URL and ALERT_WEBHOOK_TIMEOUT_MS.
   */
  public static AlertConfig fromEnvironment() {
    return from(System::getenv);
  }

  public static AlertConfig from(Function<String, String> env) {
    EnvReader reader = new EnvReader(env);
    String url = reader.getString("ALERT_WEBHOOK_URL", null);
    long timeout = reader.getLong("ALERT_WEBHOOK_TIMEOUT_MS", DEFAULT_WEBHOOK_TIMEOUT_MS);

    log.info("Alert config: webhook={}, timeoutMs={}", url != null ? "enabled" : "disabled", timeout);
    return new AlertConfig(url, timeout);
  }
}
