package io.github.themoah.kpiwatch.health;

/**
 * Health of the service as reported to liveness and readiness checks.
 */
public enum HealthStatus {
  UP(200),
  DOWN(503);

  private final int httpStatus;

  HealthStatus(int httpStatus) {
    this.httpStatus = httpStatus;
  }

  public int httpStatus() {
    return httpStatus;
  }

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }
}
