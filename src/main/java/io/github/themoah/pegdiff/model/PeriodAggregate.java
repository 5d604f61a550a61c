package io.github.themoah.pegdiff.model;

/**
 * Caller-supplied summary of a period when raw observations are not available.
 *
 * @param mean the period mean
 * @param count number of observations behind the mean
 * @param stdDev sample standard deviation of the observations
 */
public record PeriodAggregate(
  double mean,
  int count,
  double stdDev
) {}
