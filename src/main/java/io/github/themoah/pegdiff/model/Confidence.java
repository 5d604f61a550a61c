package io.github.themoah.pegdiff.model;

/**
 * How strongly the hypothesis tests back a metric's change.
 */
public enum Confidence {
  LOW,
  MEDIUM,
  HIGH;

  /**
   * HIGH when both tests are significant, MEDIUM when exactly one is, LOW otherwise.
   *
   * @param significantCount number of significant tests
   * @param testCount number of tests that ran
   */
  public static Confidence fromSignificantCount(int significantCount, int testCount) {
    if (testCount == 0 || significantCount == 0) {
      return LOW;
    }
    return significantCount >= testCount ? HIGH : MEDIUM;
  }

  public String toJsonValue() {
    return name().toLowerCase();
  }
}
