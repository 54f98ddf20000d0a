package io.github.themoah.kpiwatch.analysis;

import java.util.List;

/**
 * Utility methods for the statistics behind anomaly classification.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates mean and population standard deviation (divide by n, not n-1).
   *
   * <p>When every value is identical the deviation is exactly zero and the mean is
   * that value, regardless of floating-point rounding in the summation.
   *
   * @param values the values to analyze
   * @return statistics containing mean and standard deviation
   */
  public static Stats calculateStats(List<Double> values) {
    if (values == null || values.isEmpty()) {
      return new Stats(0.0, 0.0);
    }

    double first = values.get(0);
    boolean allEqual = true;
    double sum = 0.0;
    for (double value : values) {
      sum += value;
      allEqual &= value == first;
    }
    if (allEqual) {
      return new Stats(first, 0.0);
    }

    int n = values.size();
    double mean = sum / n;

    double sumSquaredDiffs = 0.0;
    for (double value : values) {
      double diff = value - mean;
      sumSquaredDiffs += diff * diff;
    }
    return new Stats(mean, Math.sqrt(sumSquaredDiffs / n));
  }

  /**
   * A deviation of exactly zero has no band; any positive deviation, however small, does.
   *
   * @return true if value > mean + (sigmaMultiplier * stdDev)
   */
  public static boolean isAboveBand(double value, double mean, double stdDev, double sigmaMultiplier) {
    if (stdDev == 0.0) {
      return false;  // No variance means no band
    }
    return value > mean + (sigmaMultiplier * stdDev);
  }

  /**
   * @return true if value < mean - (sigmaMultiplier * stdDev)
   */
  public static boolean isBelowBand(double value, double mean, double stdDev, double sigmaMultiplier) {
    if (stdDev == 0.0) {
      return false;
    }
    return value < mean - (sigmaMultiplier * stdDev);
  }

  /**
   * Calculates how many standard deviations a value is from the mean.
   *
   * @return (value - mean) / stdDev, or 0 if stdDev is zero
   */
  public static double zScore(double value, double mean, double stdDev) {
    if (stdDev == 0.0) {
      return 0.0;
    }
    return (value - mean) / stdDev;
  }

  /**
   * @param mean the arithmetic mean
   * @param stdDev the population standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}
