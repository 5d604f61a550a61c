package io.github.themoah.pegdiff.model;

/**
 * One aggregated row as returned by the KPI backend.
 *
 * @param kpiName PEG name
 * @param period "N-1" or "N"
 * @param avg the aggregated value
 */
public record StatRow(
  String kpiName,
  String period,
  double avg
) {

  public static final String PERIOD_BASELINE = "N-1";
  public static final String PERIOD_CURRENT = "N";
}
