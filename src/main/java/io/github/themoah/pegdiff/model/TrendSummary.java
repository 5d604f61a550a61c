package io.github.themoah.pegdiff.model;

import java.util.List;

/**
 * Trend counts and average change over a page of comparison rows.
 *
 * @param improved rows trending up
 * @param declined rows trending down
 * @param stable rows that are stable
 * @param avgChange mean absolute change
 * @param weightedAvgChange weight-averaged absolute change, 0 when the weights sum to 0
 */
public record TrendSummary(
  int improved,
  int declined,
  int stable,
  double avgChange,
  double weightedAvgChange
) {

  public static TrendSummary of(List<ChangeRecord> records) {
    int up = 0;
    int down = 0;
    int flat = 0;
    double changeSum = 0.0;
    double weightedSum = 0.0;
    double weightSum = 0.0;

    for (ChangeRecord record : records) {
      switch (record.trend()) {
        case UP -> up++;
        case DOWN -> down++;
        case STABLE -> flat++;
      }
      changeSum += record.absoluteChange();
      weightedSum += record.absoluteChange() * record.weight();
      weightSum += record.weight();
    }

    double avg = records.isEmpty() ? 0.0 : changeSum / records.size();
    double weighted = weightSum == 0.0 ? 0.0 : weightedSum / weightSum;
    return new TrendSummary(up, down, flat, avg, weighted);
  }
}
