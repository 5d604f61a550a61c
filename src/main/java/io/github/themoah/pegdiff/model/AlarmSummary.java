package io.github.themoah.pegdiff.model;

/**
 * Run-level screening outcome.
 *
 * @param totalMetricCount all metrics in the run, including ones missing a period
 * @param abnormalMetricCount metrics whose |percent change| exceeded the screening threshold
 * @param abnormalScore abnormal / total, 0 for an empty run
 * @param alarmLevel grade of the abnormal score
 * @param description short human readable verdict
 */
public record AlarmSummary(
  int totalMetricCount,
  int abnormalMetricCount,
  double abnormalScore,
  AlarmLevel alarmLevel,
  String description
) {

  public static final String ABNORMAL_DESCRIPTION = "abnormal pattern detected";
  public static final String NORMAL_DESCRIPTION = "within normal range";
}
