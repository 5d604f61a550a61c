package io.github.themoah.pegdiff.model;

import java.util.List;

/**
 * Roll-up of the drill-down entries.
 *
 * @param totalAnalyzed number of entries
 * @param statisticallySignificant entries with medium or high confidence
 * @param highConfidenceFindings entries with high confidence
 * @param distributionChanges entries whose distribution test was significant
 */
public record DiagnosticSummary(
  int totalAnalyzed,
  int statisticallySignificant,
  int highConfidenceFindings,
  int distributionChanges
) {

  public static DiagnosticSummary of(List<DiagnosticEntry> entries, String distributionTestName) {
    int significant = 0;
    int high = 0;
    int distribution = 0;
    for (DiagnosticEntry entry : entries) {
      if (entry.confidence() != Confidence.LOW) {
        significant++;
      }
      if (entry.confidence() == Confidence.HIGH) {
        high++;
      }
      if (entry.isSignificant(distributionTestName)) {
        distribution++;
      }
    }
    return new DiagnosticSummary(entries.size(), significant, high, distribution);
  }
}
