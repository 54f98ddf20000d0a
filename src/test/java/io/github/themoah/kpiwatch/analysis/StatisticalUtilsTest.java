package io.github.themoah.kpiwatch.analysis;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.kpiwatch.analysis.StatisticalUtils.Stats;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatisticalUtils.
 */
public class StatisticalUtilsTest {

  @Test
  void calculateStats_empty() {
    Stats stats = StatisticalUtils.calculateStats(List.of());

    assertEquals(0.0, stats.mean());
    assertEquals(0.0, stats.stdDev());
  }

  @Test
  void calculateStats_populationStdDev() {
    // 2, 4, 4, 4, 5, 5, 7, 9: mean 5, population stdDev 2
    Stats stats = StatisticalUtils.calculateStats(List.of(2.0, 4.0, 4.0, 4.0, 5.0, 5.0, 7.0, 9.0));

    assertEquals(5.0, stats.mean(), 1e-12);
    assertEquals(2.0, stats.stdDev(), 1e-12);
  }

  @Test
  void calculateStats_oneToNine() {
    Stats stats = StatisticalUtils.calculateStats(List.of(1.0, 2.0, 3.0, 4.0, 5.0, 6.0, 7.0, 8.0, 9.0));

    assertEquals(5.0, stats.mean(), 1e-12);
    assertEquals(Math.sqrt(20.0 / 3.0), stats.stdDev(), 1e-12);
  }

  @Test
  void calculateStats_identicalValues_exactlyZeroDeviation() {
    // 0.1 does not sum exactly, deviation must still be exactly zero
    Stats stats = StatisticalUtils.calculateStats(Collections.nCopies(9, 0.1));

    assertEquals(0.1, stats.mean());
    assertEquals(0.0, stats.stdDev());
  }

  @Test
  void bands_nonStrictBoundary() {
    assertFalse(StatisticalUtils.isAboveBand(3.0, 1.0, 1.0, 2.0));
    assertTrue(StatisticalUtils.isAboveBand(3.0001, 1.0, 1.0, 2.0));
    assertFalse(StatisticalUtils.isBelowBand(-1.0, 1.0, 1.0, 2.0));
    assertTrue(StatisticalUtils.isBelowBand(-1.0001, 1.0, 1.0, 2.0));
  }

  @Test
  void bands_zeroVariance_neverOutside() {
    assertFalse(StatisticalUtils.isAboveBand(1e9, 100.0, 0.0, 2.0));
    assertFalse(StatisticalUtils.isBelowBand(-1e9, 100.0, 0.0, 2.0));
  }

  @Test
  void bands_tinyVariance_stillApplies() {
    assertTrue(StatisticalUtils.isAboveBand(1.0, 1e-11, 1e-11, 2.0));
    assertTrue(StatisticalUtils.isBelowBand(-1.0, 1e-11, 1e-11, 2.0));
    assertFalse(StatisticalUtils.isAboveBand(2e-11, 1e-11, 1e-11, 2.0));
  }

  @Test
  void zScore() {
    assertEquals(2.5, StatisticalUtils.zScore(10.0, 5.0, 2.0), 1e-12);
    assertEquals(-1.0, StatisticalUtils.zScore(3.0, 5.0, 2.0), 1e-12);
    assertEquals(0.0, StatisticalUtils.zScore(10.0, 5.0, 0.0));
  }
}
