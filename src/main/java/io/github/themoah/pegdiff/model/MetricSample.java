package io.github.themoah.pegdiff.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * One PEG observed over the baseline (N-1) and current (N) periods.
 *
 * <p>Raw observations take precedence. When a period has no raw observations its
 * {@link PeriodAggregate}, if present, supplies the descriptive statistics; such a metric
 * can be screened and ranked but never hypothesis-tested.
 *
 * @param name metric name, unique within a comparison run
 * @param period1 raw N-1 observations (may be empty)
 * @param period2 raw N observations (may be empty)
 * @param weight caller-supplied importance, used only for ranking
 * @param aggregate1 N-1 summary, or null
 * @param aggregate2 N summary, or null
 */
public record MetricSample(
  String name,
  double[] period1,
  double[] period2,
  double weight,
  PeriodAggregate aggregate1,
  PeriodAggregate aggregate2
) {

  public static final double DEFAULT_WEIGHT = 5.0;

  public MetricSample {
    Objects.requireNonNull(name, "name");
    period1 = period1 == null ? new double[0] : period1.clone();
    period2 = period2 == null ? new double[0] : period2.clone();
  }

  /**
   * Creates a sample from raw observations.
   */
  public static MetricSample of(String name, double[] period1, double[] period2, double weight) {
    return new MetricSample(name, period1, period2, weight, null, null);
  }

  /**
   * Creates a sample from raw observations with the default weight.
   */
  public static MetricSample of(String name, double[] period1, double[] period2) {
    return of(name, period1, period2, DEFAULT_WEIGHT);
  }

  /**
   * Creates a sample that carries only per-period summaries.
   */
  public static MetricSample ofAggregates(
      String name, PeriodAggregate aggregate1, PeriodAggregate aggregate2, double weight) {
    return new MetricSample(name, null, null, weight, aggregate1, aggregate2);
  }

  @Override
  public double[] period1() {
    return period1.clone();
  }

  @Override
  public double[] period2() {
    return period2.clone();
  }

  /**
   * Descriptive statistics of the N-1 period.
   */
  public PeriodStats period1Stats() {
    return PeriodStats.resolve(period1, aggregate1);
  }

  /**
   * Descriptive statistics of the N period.
   */
  public PeriodStats period2Stats() {
    return PeriodStats.resolve(period2, aggregate2);
  }

  /**
   * Returns true if both periods hold at least {@code minObservations} raw observations.
   */
  public boolean hasRawObservations(int minObservations) {
    return period1.length >= minObservations && period2.length >= minObservations;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MetricSample other)) {
      return false;
    }
    return name.equals(other.name)
      && Double.compare(weight, other.weight) == 0
      && Arrays.equals(period1, other.period1)
      && Arrays.equals(period2, other.period2)
      && Objects.equals(aggregate1, other.aggregate1)
      && Objects.equals(aggregate2, other.aggregate2);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(name, weight, aggregate1, aggregate2);
    result = 31 * result + Arrays.hashCode(period1);
    result = 31 * result + Arrays.hashCode(period2);
    return result;
  }

  @Override
  public String toString() {
    return "MetricSample[name=" + name
      + ", period1=" + Arrays.toString(period1)
      + ", period2=" + Arrays.toString(period2)
      + ", weight=" + weight
      + ", aggregate1=" + aggregate1
      + ", aggregate2=" + aggregate2 + "]";
  }
}
