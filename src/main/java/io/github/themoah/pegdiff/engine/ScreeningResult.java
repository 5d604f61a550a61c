package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.model.AlarmSummary;
import java.util.List;

/**
 * Output of {@link ChangeScreener#screen}.
 *
 * @param summary run-level alarm
 * @param abnormal abnormal metrics in input order
 */
public record ScreeningResult(
  AlarmSummary summary,
  List<ScreenedMetric> abnormal
) {

  public ScreeningResult {
    abnormal = List.copyOf(abnormal);
  }
}
