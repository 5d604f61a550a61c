package io.github.themoah.pegdiff.config;

/**
 * Weight boundaries for the high/medium/low importance buckets.
 *
 * @param high weights at or above this are high
 * @param medium weights at or above this (and below high) are medium
 */
public record WeightBuckets(
  double high,
  double medium
) {

  public static WeightBuckets parse(String value) {
    String[] parts = value.split(",");
    if (parts.length != 2) {
      throw new InvalidConfigException("Expected two comma separated weights, got: " + value);
    }
    try {
      return new WeightBuckets(
        Double.parseDouble(parts[0].trim()),
        Double.parseDouble(parts[1].trim())
      );
    } catch (NumberFormatException e) {
      throw new InvalidConfigException("Invalid weight bucket value: " + value);
    }
  }

  void validate() {
    if (!Double.isFinite(high) || !Double.isFinite(medium) || medium >= high) {
      throw new InvalidConfigException("Weight buckets must satisfy medium < high: " + this);
    }
  }
}
