package io.github.themoah.pegdiff.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one hypothesis test on one metric.
 *
 * @param testName name of the test
 * @param statistics named statistic values in report order
 * @param pValue two-sided p-value in [0, 1]
 * @param significant true when pValue is below the significance level
 * @param interpretation human readable summary
 * @param distributionDifference KS magnitude label, null for other tests
 */
public record TestResult(
  String testName,
  Map<String, Double> statistics,
  double pValue,
  boolean significant,
  String interpretation,
  DistributionDifference distributionDifference
) {

  public TestResult {
    statistics = Collections.unmodifiableMap(new LinkedHashMap<>(statistics));
  }

  /**
   * Returns a named statistic.
   *
   * @throws IllegalArgumentException if the test did not produce it
   */
  public double statistic(String name) {
    Double value = statistics.get(name);
    if (value == null) {
      throw new IllegalArgumentException(testName + " has no statistic " + name);
    }
    return value;
  }
}
