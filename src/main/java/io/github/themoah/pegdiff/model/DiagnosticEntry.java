package io.github.themoah.pegdiff.model;

import java.util.List;

/**
 * Drill-down result for one abnormal metric.
 *
 * @param change the metric's comparison
 * @param tests hypothesis test results, empty when tests could not run
 * @param confidence how strongly the tests back the change
 * @param reason why tests were skipped or failed, null when they all ran
 * @param period1SampleSize raw N-1 observations available
 * @param period2SampleSize raw N observations available
 */
public record DiagnosticEntry(
  ChangeRecord change,
  List<TestResult> tests,
  Confidence confidence,
  String reason,
  int period1SampleSize,
  int period2SampleSize
) {

  public static final String INSUFFICIENT_RAW_DATA = "insufficient raw data for hypothesis testing";

  public DiagnosticEntry {
    tests = List.copyOf(tests);
  }

  /**
   * Returns true if the named test ran and was significant.
   */
  public boolean isSignificant(String testName) {
    return tests.stream()
      .anyMatch(t -> t.testName().equals(testName) && t.significant());
  }
}
