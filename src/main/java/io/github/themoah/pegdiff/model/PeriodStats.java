package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.stats.StatisticalUtils;
import io.github.themoah.pegdiff.stats.StatisticalUtils.Stats;
import java.util.OptionalDouble;

/**
 * Descriptive statistics of one period.
 *
 * @param mean arithmetic mean (0 when count is 0)
 * @param count number of observations
 * @param stdDev sample standard deviation (0 when count is below 2)
 * @param rsdPercent relative standard deviation in percent, empty when the mean is 0
 */
public record PeriodStats(
  double mean,
  int count,
  double stdDev,
  OptionalDouble rsdPercent
) {

  public static final PeriodStats EMPTY = new PeriodStats(0.0, 0, 0.0, OptionalDouble.empty());

  public static PeriodStats fromObservations(double[] values) {
    if (values.length == 0) {
      return EMPTY;
    }
    Stats stats = StatisticalUtils.calculateStats(values);
    return new PeriodStats(
      stats.mean(),
      values.length,
      stats.stdDev(),
      StatisticalUtils.relativeStdDevPercent(stats.mean(), stats.stdDev())
    );
  }

  public static PeriodStats fromAggregate(PeriodAggregate aggregate) {
    if (aggregate.count() <= 0) {
      return EMPTY;
    }
    return new PeriodStats(
      aggregate.mean(),
      aggregate.count(),
      aggregate.stdDev(),
      StatisticalUtils.relativeStdDevPercent(aggregate.mean(), aggregate.stdDev())
    );
  }

  static PeriodStats resolve(double[] values, PeriodAggregate aggregate) {
    if (values.length > 0) {
      return fromObservations(values);
    }
    return aggregate != null ? fromAggregate(aggregate) : EMPTY;
  }

  /**
   * Returns true if the period has no data.
   */
  public boolean isEmpty() {
    return count == 0;
  }
}
