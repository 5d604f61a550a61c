package io.github.themoah.pegdiff.model;

import java.util.List;

/**
 * Everything one comparison run produces.
 *
 * @param alarm run-level screening outcome
 * @param abnormal abnormal metrics in input order
 * @param diagnostics drill-down for the top abnormal metrics, most changed first
 * @param diagnosticSummary roll-up of the drill-down
 * @param table requested page of the comparison table
 */
public record ComparisonReport(
  AlarmSummary alarm,
  List<ChangeRecord> abnormal,
  List<DiagnosticEntry> diagnostics,
  DiagnosticSummary diagnosticSummary,
  RankedPage table
) {

  public ComparisonReport {
    abnormal = List.copyOf(abnormal);
    diagnostics = List.copyOf(diagnostics);
  }
}
