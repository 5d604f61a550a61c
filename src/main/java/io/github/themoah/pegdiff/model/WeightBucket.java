package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.config.WeightBuckets;

/**
 * Importance bucket of a metric weight.
 */
public enum WeightBucket {
  HIGH,
  MEDIUM,
  LOW;

  public static WeightBucket fromWeight(double weight, WeightBuckets buckets) {
    if (weight >= buckets.high()) {
      return HIGH;
    }
    if (weight >= buckets.medium()) {
      return MEDIUM;
    }
    return LOW;
  }

  public String toJsonValue() {
    return name().toLowerCase();
  }
}
