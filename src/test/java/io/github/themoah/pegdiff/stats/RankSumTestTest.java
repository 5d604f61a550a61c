package io.github.themoah.pegdiff.stats;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.pegdiff.model.TestResult;
import java.util.Random;
import org.apache.commons.math3.stat.inference.MannWhitneyUTest;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for RankSumTest (Mann-Whitney U).
 */
public class RankSumTestTest {

  private final RankSumTest test = new RankSumTest(0.05);

  @Test
  void run_separatedSamples_significant() throws InsufficientDataException {
    TestResult result = test.run(new double[]{1, 2, 3, 4, 5}, new double[]{6, 7, 8, 9, 10});

    assertEquals(RankSumTest.NAME, result.testName());
    assertEquals(0.0, result.statistic(RankSumTest.STAT_U));
    assertEquals(15.0, result.statistic(RankSumTest.STAT_RANK_SUM));
    double expectedZ = -12.5 / Math.sqrt(25.0 * 11 / 12);
    assertEquals(expectedZ, result.statistic(RankSumTest.STAT_Z), 1e-12);
    assertEquals(Math.abs(expectedZ) / Math.sqrt(10), result.statistic(RankSumTest.STAT_EFFECT_SIZE), 1e-12);
    assertTrue(result.pValue() < 0.01);
    assertTrue(result.significant());
    assertTrue(result.interpretation().startsWith("statistically significant"));
    assertNull(result.distributionDifference());
  }

  @Test
  void run_ties_applyVarianceCorrection() throws InsufficientDataException {
    TestResult result = test.run(new double[]{1, 2, 2, 3}, new double[]{2, 3, 4, 5});

    assertEquals(2.5, result.statistic(RankSumTest.STAT_U));
    double variance = 16.0 * 9 / 12 - 16.0 * 30 / (12.0 * 8 * 7);
    assertEquals((2.5 - 8.0) / Math.sqrt(variance), result.statistic(RankSumTest.STAT_Z), 1e-12);
  }

  @Test
  void run_allValuesTied_zeroZ_pValueOne() throws InsufficientDataException {
    TestResult result = test.run(new double[]{5, 5, 5}, new double[]{5, 5, 5});

    assertEquals(0.0, result.statistic(RankSumTest.STAT_Z));
    assertEquals(1.0, result.pValue());
    assertFalse(result.significant());
  }

  @Test
  void run_identicalSamples_uAtMean() throws InsufficientDataException {
    double[] values = {3.2, 1.5, 4.8, 2.2};

    TestResult result = test.run(values, values.clone());

    assertEquals(8.0, result.statistic(RankSumTest.STAT_U));
    assertEquals(0.0, result.statistic(RankSumTest.STAT_Z), 1e-12);
    assertFalse(result.significant());
  }

  @Test
  void run_largerShift_smallerPValueLargerAbsZ() throws InsufficientDataException {
    double[] base = {10.13, 12.37, 11.71, 13.02, 9.46, 10.88};
    double previous = 1.0;
    double previousAbsZ = 0.0;
    for (double shift = 0.5; shift <= 4.0; shift += 0.5) {
      double[] shifted = new double[base.length];
      for (int i = 0; i < base.length; i++) {
        shifted[i] = base[i] + shift;
      }
      TestResult result = test.run(base, shifted);
      double p = result.pValue();
      double absZ = Math.abs(result.statistic(RankSumTest.STAT_Z));
      assertTrue(p <= previous + 1e-12, "p increased at shift " + shift);
      assertTrue(absZ >= previousAbsZ - 1e-12, "|z| decreased at shift " + shift);
      previous = p;
      previousAbsZ = absZ;
    }
  }

  @Test
  void run_swappedSamples_sameUAndPValue() throws InsufficientDataException {
    double[] a = {12.1, 14.3, 11.8, 15.0, 13.2, 12.9};
    double[] b = {14.8, 16.1, 15.5, 13.9, 17.2};

    TestResult forward = test.run(a, b);
    TestResult backward = test.run(b, a);

    assertEquals(forward.statistic(RankSumTest.STAT_U), backward.statistic(RankSumTest.STAT_U), 1e-12);
    assertEquals(forward.pValue(), backward.pValue(), 1e-12);
  }

  @Test
  void run_tieFreeData_matchesCommonsMath() throws InsufficientDataException {
    Random random = new Random(11);
    MannWhitneyUTest reference = new MannWhitneyUTest();

    for (int round = 0; round < 20; round++) {
      double[] a = gaussian(random, 15 + round, 100, 5);
      double[] b = gaussian(random, 12 + round, 102, 5);

      TestResult result = test.run(a, b);

      double referenceU = reference.mannWhitneyU(a, b);
      assertEquals(a.length * b.length - referenceU, result.statistic(RankSumTest.STAT_U), 1e-9);
      assertEquals(reference.mannWhitneyUTest(a, b), result.pValue(), 1e-9);
    }
  }

  @Test
  void run_singleObservation_insufficientData() {
    assertThrows(InsufficientDataException.class,
      () -> test.run(new double[]{1.0}, new double[]{1, 2, 3}));
  }

  @Test
  void run_nonFiniteObservation_insufficientData() {
    assertThrows(InsufficientDataException.class,
      () -> test.run(new double[]{1.0, Double.NaN}, new double[]{1, 2, 3}));
  }

  @Test
  void clamp_boundsAndNaN() {
    assertEquals(0.0, RankSumTest.clamp(-1e-17));
    assertEquals(1.0, RankSumTest.clamp(1.0000001));
    assertEquals(1.0, RankSumTest.clamp(Double.NaN));
    assertEquals(0.3, RankSumTest.clamp(0.3));
  }

  static double[] gaussian(Random random, int size, double mean, double stdDev) {
    double[] values = new double[size];
    for (int i = 0; i < size; i++) {
      values[i] = mean + stdDev * random.nextGaussian();
    }
    return values;
  }
}
