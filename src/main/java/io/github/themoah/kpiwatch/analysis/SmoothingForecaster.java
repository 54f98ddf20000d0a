package io.github.themoah.kpiwatch.analysis;

import io.github.themoah.kpiwatch.model.Sample;
import java.util.List;
import java.util.OptionalDouble;

/**
 * One-step-ahead forecast by simple exponential smoothing.
 *
 * <p>The state starts at the first value and each later value updates it as
 * {@code state = alpha * value + (1 - alpha) * state}. No trend or seasonality.
 */
public class SmoothingForecaster {

  private final double alpha;

  public SmoothingForecaster(double alpha) {
    if (!(alpha > 0 && alpha <= 1)) {
      throw new IllegalArgumentException("alpha must be in (0, 1], got " + alpha);
    }
    this.alpha = alpha;
  }

  public SmoothingForecaster(DetectionConfig config) {
    this(config.smoothingAlpha());
  }

  /**
   * @param values observations, oldest first
   * @return the forecast of the next value, or empty if there are no values
   */
  public OptionalDouble forecast(List<Double> values) {
    if (values == null || values.isEmpty()) {
      return OptionalDouble.empty();
    }
    double state = values.get(0);
    for (int i = 1; i < values.size(); i++) {
      state = alpha * values.get(i) + (1 - alpha) * state;
    }
    return OptionalDouble.of(state);
  }

  public OptionalDouble forecastSamples(List<Sample> samples) {
    return forecast(samples.stream().map(Sample::value).toList());
  }

  public double alpha() {
    return alpha;
  }
}
