package io.github.themoah.pegdiff.config;

/**
 * Three ascending cut points shared by severity (percent change) and alarm (abnormal score)
 * classification.
 *
 * @param caution lower bound of the caution band
 * @param warning lower bound of the warning band
 * @param critical lower bound of the critical band
 */
public record Thresholds(
  double caution,
  double warning,
  double critical
) {

  /**
   * Parses a comma separated triple such as {@code "10,20,30"}.
   *
   * @param value the raw value
   * @return parsed thresholds
   * @throws InvalidConfigException if the value does not hold exactly three numbers
   */
  public static Thresholds parse(String value) {
    String[] parts = value.split(",");
    if (parts.length != 3) {
      throw new InvalidConfigException("Expected three comma separated thresholds, got: " + value);
    }
    try {
      return new Thresholds(
        Double.parseDouble(parts[0].trim()),
        Double.parseDouble(parts[1].trim()),
        Double.parseDouble(parts[2].trim())
      );
    } catch (NumberFormatException e) {
      throw new InvalidConfigException("Invalid threshold value: " + value);
    }
  }

  void validate(String name) {
    if (!Double.isFinite(caution) || !Double.isFinite(warning) || !Double.isFinite(critical)) {
      throw new InvalidConfigException(name + " must be finite: " + this);
    }
    if (caution < 0) {
      throw new InvalidConfigException(name + " must not be negative: " + this);
    }
    if (!(caution < warning && warning < critical)) {
      throw new InvalidConfigException(name + " must be strictly increasing: " + this);
    }
  }
}
