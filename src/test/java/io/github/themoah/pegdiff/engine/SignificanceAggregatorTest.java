package io.github.themoah.pegdiff.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.Confidence;
import io.github.themoah.pegdiff.model.DiagnosticEntry;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.PeriodAggregate;
import io.github.themoah.pegdiff.model.TestResult;
import io.github.themoah.pegdiff.stats.DistributionTest;
import io.github.themoah.pegdiff.stats.HypothesisTest;
import io.github.themoah.pegdiff.stats.InsufficientDataException;
import io.github.themoah.pegdiff.stats.RankSumTest;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for SignificanceAggregator.
 */
public class SignificanceAggregatorTest {

  private final ComparisonConfig config = ComparisonConfig.defaults();

  @Test
  void diagnose_clearShift_highConfidence() {
    MetricSample sample = MetricSample.of("DL_THROUGHPUT",
      new double[]{100, 101, 99, 102, 98, 100, 101, 99, 100, 100},
      new double[]{150, 151, 149, 152, 148, 150, 151, 149, 150, 150});

    List<DiagnosticEntry> entries = new SignificanceAggregator().diagnose(List.of(screened(sample)), config);

    assertEquals(1, entries.size());
    DiagnosticEntry entry = entries.get(0);
    assertEquals(Confidence.HIGH, entry.confidence());
    assertEquals(2, entry.tests().size());
    assertEquals(RankSumTest.NAME, entry.tests().get(0).testName());
    assertEquals(DistributionTest.NAME, entry.tests().get(1).testName());
    assertEquals(10, entry.period1SampleSize());
    assertEquals(10, entry.period2SampleSize());
    assertNull(entry.reason());
  }

  @Test
  void diagnose_aggregatesOnly_lowConfidenceWithoutTests() {
    MetricSample sample = MetricSample.ofAggregates("ERAB_DROP",
      new PeriodAggregate(1.0, 96, 0.1), new PeriodAggregate(2.0, 96, 0.1), 9.0);

    DiagnosticEntry entry = new SignificanceAggregator().diagnose(List.of(screened(sample)), config).get(0);

    assertEquals(Confidence.LOW, entry.confidence());
    assertTrue(entry.tests().isEmpty());
    assertEquals(DiagnosticEntry.INSUFFICIENT_RAW_DATA, entry.reason());
    assertEquals(0, entry.period1SampleSize());
  }

  @Test
  void diagnose_singleObservation_lowConfidence() {
    MetricSample sample = MetricSample.of("CELL_AVAIL", new double[]{90}, new double[]{50, 51, 49});

    DiagnosticEntry entry = new SignificanceAggregator().diagnose(List.of(screened(sample)), config).get(0);

    assertEquals(Confidence.LOW, entry.confidence());
    assertEquals(DiagnosticEntry.INSUFFICIENT_RAW_DATA, entry.reason());
  }

  @Test
  void diagnose_limitsToTopKMostChanged() {
    List<ScreenedMetric> abnormal = new ArrayList<>();
    for (int i = 1; i <= 7; i++) {
      abnormal.add(screened(ChangeScreenerTest.constant("M" + i, 100, 100 + 10 * i + 1)));
    }

    List<DiagnosticEntry> entries = new SignificanceAggregator().diagnose(abnormal, config);

    assertEquals(5, entries.size());
    assertEquals("M7", entries.get(0).change().name());
    assertEquals("M3", entries.get(4).change().name());
  }

  @Test
  void diagnose_equalMagnitude_orderedByName() {
    List<ScreenedMetric> abnormal = List.of(
      screened(ChangeScreenerTest.constant("B", 100, 150)),
      screened(ChangeScreenerTest.constant("A", 100, 50)));

    List<DiagnosticEntry> entries = new SignificanceAggregator().diagnose(abnormal, config);

    assertEquals("A", entries.get(0).change().name());
    assertEquals("B", entries.get(1).change().name());
  }

  @Test
  void diagnose_testLackingData_lowConfidenceWithReason() {
    HypothesisTest needy = new HypothesisTest() {
      @Override
      public String name() {
        return "needy";
      }

      @Override
      public TestResult run(double[] sample1, double[] sample2) throws InsufficientDataException {
        throw new InsufficientDataException("needy needs more data");
      }
    };
    HypothesisTest alwaysSignificant = new HypothesisTest() {
      @Override
      public String name() {
        return "always";
      }

      @Override
      public TestResult run(double[] sample1, double[] sample2) {
        return new TestResult("always", Map.of(), 0.0, true, "always significant", null);
      }
    };
    SignificanceAggregator aggregator =
      new SignificanceAggregator(c -> List.of(alwaysSignificant, needy), null);

    DiagnosticEntry entry = aggregator
      .diagnose(List.of(screened(ChangeScreenerTest.constant("X", 1, 2))), config).get(0);

    assertEquals(Confidence.LOW, entry.confidence());
    assertEquals(1, entry.tests().size());
    assertEquals("needy needs more data", entry.reason());
  }

  @Test
  void diagnose_withExecutor_sameResultsAsSequential() {
    List<ScreenedMetric> abnormal = new ArrayList<>();
    for (int i = 1; i <= 6; i++) {
      double shift = 10 * i + 5;
      abnormal.add(screened(MetricSample.of("M" + i,
        new double[]{100, 102, 98, 101, 99},
        new double[]{100 + shift, 103 + shift, 97 + shift, 101 + shift, 99 + shift})));
    }
    ExecutorService executor = Executors.newFixedThreadPool(3);
    try {
      List<DiagnosticEntry> parallel =
        new SignificanceAggregator(SignificanceAggregator::defaultTests, executor).diagnose(abnormal, config);
      List<DiagnosticEntry> sequential = new SignificanceAggregator().diagnose(abnormal, config);

      assertEquals(sequential, parallel);
    } finally {
      executor.shutdownNow();
    }
  }

  static ScreenedMetric screened(MetricSample sample) {
    return new ScreenedMetric(sample, ChangeCalculator.compute(sample, ComparisonConfig.defaults()));
  }
}
