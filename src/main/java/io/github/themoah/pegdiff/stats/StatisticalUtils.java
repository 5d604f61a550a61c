package io.github.themoah.pegdiff.stats;

import java.util.OptionalDouble;

/**
 * Descriptive statistics used for period comparison.
 */
public final class StatisticalUtils {

  private StatisticalUtils() {}

  /**
   * Calculates the mean and sample standard deviation (divide by n-1) of a period.
   * A period is a sample of the counter, not its whole population.
   *
   * @param values the observations
   * @return mean and standard deviation; stdDev is 0 for fewer than two values
   */
  public static Stats calculateStats(double[] values) {
    if (values == null || values.length == 0) {
      return new Stats(0.0, 0.0);
    }

    int n = values.length;
    double mean = mean(values);
    if (n < 2) {
      return new Stats(mean, 0.0);
    }

    double sumSquaredDiffs = 0.0;
    for (double value : values) {
      double diff = value - mean;
      sumSquaredDiffs += diff * diff;
    }
    double variance = sumSquaredDiffs / (n - 1);

    return new Stats(mean, Math.sqrt(variance));
  }

  public static double mean(double[] values) {
    if (values.length == 0) {
      return 0.0;
    }
    double sum = 0.0;
    for (double value : values) {
      sum += value;
    }
    return sum / values.length;
  }

  /**
   * Relative standard deviation, stdDev / |mean| * 100.
   *
   * @return the RSD in percent, or empty when the mean is exactly 0
   */
  public static OptionalDouble relativeStdDevPercent(double mean, double stdDev) {
    if (mean == 0.0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of(stdDev / Math.abs(mean) * 100.0);
  }

  /**
   * Relative change (to - from) / from * 100.
   *
   * @return the change in percent, or empty when {@code from} is exactly 0
   */
  public static OptionalDouble percentChange(double from, double to) {
    if (from == 0.0) {
      return OptionalDouble.empty();
    }
    return OptionalDouble.of((to - from) / from * 100.0);
  }

  /**
   * Statistics result record containing mean and standard deviation.
   *
   * @param mean the arithmetic mean
   * @param stdDev the standard deviation
   */
  public record Stats(double mean, double stdDev) {}
}
