package io.github.themoah.kpiwatch.notify;

import io.github.themoah.kpiwatch.model.Alert;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.ext.web.client.WebClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * POSTs alerts as JSON to an HTTP endpoint (chat integration, mail relay).
 * Any non-2xx response counts as a delivery failure.
 */
public class WebhookNotificationSink implements NotificationSink {

  private static final Logger log = LoggerFactory.getLogger(WebhookNotificationSink.class);

  private final WebClient client;
  private final String url;
  private final long timeoutMs;

  public WebhookNotificationSink(Vertx vertx, String url, long timeoutMs) {
    this(WebClient.create(vertx), url, timeoutMs);
  }

  WebhookNotificationSink(WebClient client, String url, long timeoutMs) {
    this.client = client;
    this.url = url;
    this.timeoutMs = timeoutMs;
  }

  @Override
  public Future<Void> send(Alert alert) {
    return client.postAbs(url)
      .timeout(timeoutMs)
      .sendJsonObject(alert.toJson())
      .compose(response -> {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
          log.debug("Delivered alert for '{}' to webhook, status {}", alert.metricName(), status);
          return Future.<Void>succeededFuture();
        }
        return Future.<Void>failedFuture(new IllegalStateException(
          "Webhook responded with status " + status + " for alert on '" + alert.metricName() + "'"));
      });
  }

  @Override
  public Future<Void> close() {
    log.info("Closing webhook notification sink");
    client.close();
    return Future.succeededFuture();
  }
}
