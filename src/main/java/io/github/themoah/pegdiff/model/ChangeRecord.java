package io.github.themoah.pegdiff.model;

import java.util.OptionalDouble;

/**
 * Period-over-period comparison of one metric.
 *
 * @param name metric name
 * @param weight importance weight
 * @param weightBucket bucket of the weight
 * @param period1 N-1 statistics
 * @param period2 N statistics
 * @param comparable true when both periods have data
 * @param absoluteChange mean2 - mean1 (0 when not comparable)
 * @param percentChange change relative to mean1, empty when not comparable or mean1 is 0
 * @param ratioUndefined true when the N-1 mean is 0 so no ratio exists
 * @param trend direction of the change
 * @param severity grade of |percentChange|
 */
public record ChangeRecord(
  String name,
  double weight,
  WeightBucket weightBucket,
  PeriodStats period1,
  PeriodStats period2,
  boolean comparable,
  double absoluteChange,
  OptionalDouble percentChange,
  boolean ratioUndefined,
  Trend trend,
  Severity severity
) {

  /**
   * Returns |percentChange|, or 0 when it is undefined.
   */
  public double magnitude() {
    return percentChange.isPresent() ? Math.abs(percentChange.getAsDouble()) : 0.0;
  }
}
