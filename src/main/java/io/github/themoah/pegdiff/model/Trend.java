package io.github.themoah.pegdiff.model;

/**
 * Direction of a period-over-period change.
 */
public enum Trend {
  UP,
  DOWN,
  STABLE;

  /**
   * Classifies a percent change. The threshold is exclusive: a change of exactly
   * {@code threshold} percent is still stable.
   *
   * @param percentChange the change in percent
   * @param threshold the trend threshold in percent
   * @return the trend
   */
  public static Trend fromPercentChange(double percentChange, double threshold) {
    if (percentChange > threshold) {
      return UP;
    }
    if (percentChange < -threshold) {
      return DOWN;
    }
    return STABLE;
  }

  /**
   * Returns a lowercase representation for JSON output and metric labels.
   */
  public String toJsonValue() {
    return name().toLowerCase();
  }
}
