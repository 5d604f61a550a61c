package io.github.themoah.pegdiff.model;

import io.github.themoah.pegdiff.config.Thresholds;

/**
 * Coarse severity of a whole comparison run.
 */
public enum AlarmLevel {
  NORMAL,
  CAUTION,
  WARNING,
  CRITICAL;

  /**
   * Grades an abnormal score (abnormal / total metrics). Thresholds are exclusive:
   * a score equal to a cut point stays in the lower band.
   */
  public static AlarmLevel fromScore(double abnormalScore, Thresholds thresholds) {
    if (abnormalScore > thresholds.critical()) {
      return CRITICAL;
    }
    if (abnormalScore > thresholds.warning()) {
      return WARNING;
    }
    if (abnormalScore > thresholds.caution()) {
      return CAUTION;
    }
    return NORMAL;
  }

  public String toJsonValue() {
    return name().toLowerCase();
  }
}
