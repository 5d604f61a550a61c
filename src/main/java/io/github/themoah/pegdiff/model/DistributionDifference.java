package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.config.DistributionThresholds;

/**
 * Magnitude label for the KS D statistic.
 */
public enum DistributionDifference {
  SMALL,
  MEDIUM,
  LARGE;

  public static DistributionDifference fromStatistic(double d, DistributionThresholds thresholds) {
    if (d >= thresholds.large()) {
      return LARGE;
    }
    if (d >= thresholds.medium()) {
      return MEDIUM;
    }
    return SMALL;
  }

  public String toJsonValue() {
    return name().toLowerCase();
  }
}
