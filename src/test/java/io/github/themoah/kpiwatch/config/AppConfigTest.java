package io.github.themoah.kpiwatch.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for AppConfig.
 */
public class AppConfigTest {

  @Test
  void defaults() {
    AppConfig config = AppConfig.from(name -> null);

    assertEquals(8888, config.httpPort());
    assertEquals(100, config.windowSize());
    assertEquals(30_000L, config.scanIntervalMs());
    assertEquals(20, config.dashboardRecentSamples());
  }

  @Test
  void overridesFromEnvironment() {
    AppConfig config = AppConfig.from(Map.of(
      "HTTP_PORT", "9000",
      "KPI_WINDOW_SIZE", "250",
      "KPI_SCAN_INTERVAL_MS", "5000",
      "KPI_DASHBOARD_RECENT_SAMPLES", "50"
    )::get);

    assertEquals(9000, config.httpPort());
    assertEquals(250, config.windowSize());
    assertEquals(5000L, config.scanIntervalMs());
    assertEquals(50, config.dashboardRecentSamples());
  }

  @Test
  void invalidWindowSize_rejected() {
    assertThrows(IllegalArgumentException.class,
      () -> AppConfig.from(Map.of("KPI_WINDOW_SIZE", "0")::get));
  }
}
