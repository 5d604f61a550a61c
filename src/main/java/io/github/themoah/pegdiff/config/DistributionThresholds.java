package io.github.themoah.pegdiff.config;

/**
 * Cut points on the KS D statistic for the small/medium/large distribution difference label.
 *
 * @param medium D at or above this is at least medium
 * @param large D at or above this is large
 */
public record DistributionThresholds(
  double medium,
  double large
) {

  public static DistributionThresholds parse(String value) {
    String[] parts = value.split(",");
    if (parts.length != 2) {
      throw new InvalidConfigException("Expected two comma separated thresholds, got: " + value);
    }
    try {
      return new DistributionThresholds(
        Double.parseDouble(parts[0].trim()),
        Double.parseDouble(parts[1].trim())
      );
    } catch (NumberFormatException e) {
      throw new InvalidConfigException("Invalid threshold value: " + value);
    }
  }

  void validate() {
    if (!(medium > 0 && medium < large && large <= 1)) {
      throw new InvalidConfigException(
        "Distribution thresholds must satisfy 0 < medium < large <= 1: " + this);
    }
  }
}
