package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.AlarmLevel;
import io.github.themoah.pegdiff.model.AlarmSummary;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.MetricSample;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * First-pass screening: flags metrics whose |percent change| exceeds the screening
 * threshold and grades the whole run by the share of flagged metrics.
 *
 * <p>Metrics missing a period, or with an N-1 mean of 0, are never abnormal but still count
 * towards the total.
 */
public class ChangeScreener {

  private static final Logger log = LoggerFactory.getLogger(ChangeScreener.class);

  /**
   * Screens all samples.
   *
   * @param samples metrics of one comparison run
   * @param config thresholds
   * @return alarm summary and abnormal metrics
   */
  public ScreeningResult screen(List<MetricSample> samples, ComparisonConfig config) {
    List<ScreenedMetric> abnormal = new ArrayList<>();

    for (MetricSample sample : samples) {
      ChangeRecord change = ChangeCalculator.compute(sample, config);
      if (!change.comparable() || change.percentChange().isEmpty()) {
        if (change.ratioUndefined()) {
          log.debug("Skipping {}: N-1 mean is 0, percent change undefined", sample.name());
        }
        continue;
      }

      if (change.magnitude() > config.screeningThreshold()) {
        abnormal.add(new ScreenedMetric(sample, change));
        log.debug("Abnormal metric: name={}, change={}%, severity={}",
          sample.name(), String.format("%.2f", change.percentChange().getAsDouble()),
          change.severity());
      }
    }

    AlarmSummary summary = summarize(samples.size(), abnormal.size(), config);
    log.info("Screened {} metrics: abnormal={}, score={}, alarm={}",
      summary.totalMetricCount(), summary.abnormalMetricCount(),
      String.format("%.3f", summary.abnormalScore()), summary.alarmLevel());

    return new ScreeningResult(summary, abnormal);
  }

  static AlarmSummary summarize(int total, int abnormal, ComparisonConfig config) {
    double score = total == 0 ? 0.0 : (double) abnormal / total;
    AlarmLevel level = AlarmLevel.fromScore(score, config.alarmThresholds());
    String description = score > config.alarmThresholds().caution()
      ? AlarmSummary.ABNORMAL_DESCRIPTION
      : AlarmSummary.NORMAL_DESCRIPTION;
    return new AlarmSummary(total, abnormal, score, level, description);
  }
}
