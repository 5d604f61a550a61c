package io.github.themoah.pegdiff.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.DistributionDifference;
import io.github.themoah.pegdiff.model.TestResult;
import java.util.Random;
import org.apache.commons.math3.stat.inference.KolmogorovSmirnovTest;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DistributionTest (two-sample Kolmogorov-Smirnov).
 */
public class DistributionTestTest {

  private final DistributionTest test =
    new DistributionTest(0.05, ComparisonConfig.DEFAULT_DISTRIBUTION_THRESHOLDS);

  @Test
  void run_identicalSamples_noDifference() throws InsufficientDataException {
    double[] values = {3, 1, 4, 1, 5, 9, 2, 6};

    TestResult result = test.run(values, values.clone());

    assertEquals(0.0, result.statistic(DistributionTest.STAT_D));
    assertEquals(1.0, result.pValue());
    assertFalse(result.significant());
    assertEquals(DistributionDifference.SMALL, result.distributionDifference());
  }

  @Test
  void run_disjointSamples_largeDifference() throws InsufficientDataException {
    TestResult result = test.run(new double[]{1, 2, 3, 4, 5}, new double[]{6, 7, 8, 9, 10});

    assertEquals(1.0, result.statistic(DistributionTest.STAT_D));
    double lambda = Math.sqrt(25.0 / 10.0);
    assertEquals(lambda, result.statistic(DistributionTest.STAT_LAMBDA), 1e-12);
    double expectedP = 2 * (Math.exp(-2 * lambda * lambda) - Math.exp(-8 * lambda * lambda)
      + Math.exp(-18 * lambda * lambda));
    assertEquals(expectedP, result.pValue(), 1e-9);
    assertTrue(result.significant());
    assertEquals(DistributionDifference.LARGE, result.distributionDifference());
  }

  @Test
  void statistic_tieFreeData_matchesCommonsMath() {
    Random random = new Random(5);
    KolmogorovSmirnovTest reference = new KolmogorovSmirnovTest();

    for (int round = 0; round < 20; round++) {
      double[] a = RankSumTestTest.gaussian(random, 10 + round, 50, 4);
      double[] b = RankSumTestTest.gaussian(random, 8 + 2 * round, 51, 6);

      assertEquals(reference.kolmogorovSmirnovStatistic(a, b), DistributionTest.statistic(a, b), 1e-12);
    }
  }

  @Test
  void statistic_tiesAcrossSamples_evaluatedAfterWholeTieGroup() {
    // ECDFs after value 2: 3/4 vs 1/3; stepping one value at a time would report a spurious 0.75
    double d = DistributionTest.statistic(new double[]{1, 2, 2, 3}, new double[]{2, 3, 3});

    assertEquals(0.75 - 1.0 / 3.0, d, 1e-12);
  }

  @Test
  void kolmogorovTail_knownValues() {
    assertEquals(1.0, DistributionTest.kolmogorovTail(0.0));
    assertEquals(0.9639452, DistributionTest.kolmogorovTail(0.5), 1e-6);
    assertEquals(0.2699997, DistributionTest.kolmogorovTail(1.0), 1e-6);
    assertEquals(0.0500, DistributionTest.kolmogorovTail(1.3581), 1e-4);
  }

  @Test
  void kolmogorovTail_continuousAtNegligibleLambdaCutoff() {
    assertEquals(1.0, DistributionTest.kolmogorovTail(0.0999999));
    assertEquals(1.0, DistributionTest.kolmogorovTail(0.1000001), 1e-12);
  }

  @Test
  void kolmogorovTail_matchesThetaForm() {
    for (double lambda = 0.3; lambda < 1.2; lambda += 0.1) {
      double sum = 0.0;
      for (int k = 1; k <= 50; k++) {
        double odd = 2.0 * k - 1.0;
        sum += Math.exp(-odd * odd * Math.PI * Math.PI / (8.0 * lambda * lambda));
      }
      double expected = 1.0 - Math.sqrt(2.0 * Math.PI) / lambda * sum;
      assertEquals(expected, DistributionTest.kolmogorovTail(lambda), 1e-10, "lambda=" + lambda);
    }
  }

  @Test
  void run_swappedSamples_sameDAndPValue() throws InsufficientDataException {
    double[] a = {12.1, 14.3, 11.8, 15.0, 13.2, 12.9, 14.3};
    double[] b = {14.8, 16.1, 15.5, 13.9, 17.2, 14.3};

    TestResult forward = test.run(a, b);
    TestResult backward = test.run(b, a);

    assertEquals(forward.statistic(DistributionTest.STAT_D), backward.statistic(DistributionTest.STAT_D), 1e-12);
    assertEquals(forward.pValue(), backward.pValue(), 1e-12);
  }

  @Test
  void run_largerShift_nonDecreasingD() throws InsufficientDataException {
    double[] base = {10.13, 12.37, 11.71, 13.02, 9.46, 10.88, 11.24, 12.05};
    double previousD = 0.0;
    double previousP = 1.0;
    for (double shift = 0.0; shift <= 5.0; shift += 0.25) {
      double[] shifted = new double[base.length];
      for (int i = 0; i < base.length; i++) {
        shifted[i] = base[i] + shift;
      }
      TestResult result = test.run(base, shifted);
      double d = result.statistic(DistributionTest.STAT_D);
      assertTrue(d >= previousD - 1e-12, "D decreased at shift " + shift);
      assertTrue(result.pValue() <= previousP + 1e-12, "p increased at shift " + shift);
      previousD = d;
      previousP = result.pValue();
    }
    assertEquals(1.0, previousD);
  }

  @Test
  void kolmogorovTail_monotoneDecreasing() {
    double previous = 1.0;
    for (double lambda = 0.05; lambda < 3.0; lambda += 0.05) {
      double tail = DistributionTest.kolmogorovTail(lambda);
      assertTrue(tail <= previous + 1e-12, "tail increased at lambda=" + lambda);
      assertTrue(tail >= 0.0 && tail <= 1.0);
      previous = tail;
    }
  }

  @Test
  void run_mediumD_labelledMedium() throws InsufficientDataException {
    // ECDF gap peaks at 3/20 = 0.15 after the three extra low values in period 1
    double[] a = new double[20];
    double[] b = new double[20];
    for (int i = 0; i < 20; i++) {
      a[i] = i;
      b[i] = i + 3;
    }

    TestResult result = test.run(a, b);

    assertEquals(0.15, result.statistic(DistributionTest.STAT_D), 1e-12);
    assertEquals(DistributionDifference.MEDIUM, result.distributionDifference());
  }

  @Test
  void run_tooFewObservations_insufficientData() {
    assertThrows(InsufficientDataException.class,
      () -> test.run(new double[]{1, 2}, new double[0]));
  }
}
