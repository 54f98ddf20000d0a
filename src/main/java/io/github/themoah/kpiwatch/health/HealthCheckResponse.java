package io.github.themoah.kpiwatch.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param monitor anomaly monitor state (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String monitor
) {

  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Ready once the anomaly monitor is scheduled.
   */
  public static HealthCheckResponse readiness(boolean monitorRunning) {
    return new HealthCheckResponse(HealthStatus.of(monitorRunning), monitorRunning ? "running" : "stopped");
  }

  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.name());
    if (monitor != null) {
      json.put("monitor", monitor);
    }
    return json;
  }
}
