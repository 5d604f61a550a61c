package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.config.Thresholds;

/**
 * Severity of a single metric's change, graded on |percent change|.
 */
public enum Severity {
  NONE,
  CAUTION,
  WARNING,
  CRITICAL;

  /**
   * Grades an absolute percent change. Each band includes its lower bound.
   *
   * @param absPercentChange |percent change|
   * @param thresholds caution/warning/critical cut points
   * @return the severity
   */
  public static Severity fromPercentChange(double absPercentChange, Thresholds thresholds) {
    if (absPercentChange >= thresholds.critical()) {
      return CRITICAL;
    }
    if (absPercentChange >= thresholds.warning()) {
      return WARNING;
    }
    if (absPercentChange >= thresholds.caution()) {
      return CAUTION;
    }
    return NONE;
  }

  public String toJsonValue() {
    return name().toLowerCase();
  }
}
