package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.Confidence;
import io.github.themoah.pegdiff.model.DiagnosticEntry;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.TestResult;
import io.github.themoah.pegdiff.stats.DistributionTest;
import io.github.themoah.pegdiff.stats.HypothesisTest;
import io.github.themoah.pegdiff.stats.InsufficientDataException;
import io.github.themoah.pegdiff.stats.RankSumTest;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Second-pass drill-down: runs the hypothesis tests on the most changed abnormal metrics and
 * grades each by how many tests agree.
 *
 * <p>Tests only ever see the caller's raw observations. Metrics supplied as aggregates only
 * get {@link Confidence#LOW} with {@link DiagnosticEntry#INSUFFICIENT_RAW_DATA}.
 */
public class SignificanceAggregator {

  private static final Logger log = LoggerFactory.getLogger(SignificanceAggregator.class);

  private static final Comparator<ScreenedMetric> MOST_CHANGED_FIRST =
    Comparator.comparingDouble((ScreenedMetric m) -> m.change().magnitude()).reversed()
      .thenComparing(m -> m.change().name());

  private final Function<ComparisonConfig, List<HypothesisTest>> testFactory;
  private final Executor executor;

  /**
   * Runs the rank-sum and distribution tests on the calling thread.
   */
  public SignificanceAggregator() {
    this(SignificanceAggregator::defaultTests, null);
  }

  /**
   * @param testFactory builds the tests to run for a given configuration
   * @param executor fans per-metric work out when non-null; results keep ranked order
   */
  public SignificanceAggregator(
      Function<ComparisonConfig, List<HypothesisTest>> testFactory, Executor executor) {
    this.testFactory = testFactory;
    this.executor = executor;
  }

  /**
   * The default test list: Mann-Whitney U, then Kolmogorov-Smirnov.
   */
  public static List<HypothesisTest> defaultTests(ComparisonConfig config) {
    return List.of(
      new RankSumTest(config.significanceAlpha()),
      new DistributionTest(config.significanceAlpha(), config.distributionThresholds())
    );
  }

  /**
   * Diagnoses the top-K abnormal metrics by |percent change|.
   *
   * @param abnormal screened abnormal metrics
   * @param config thresholds, including topK
   * @return one entry per selected metric, most changed first
   */
  public List<DiagnosticEntry> diagnose(List<ScreenedMetric> abnormal, ComparisonConfig config) {
    List<ScreenedMetric> selected = abnormal.stream()
      .sorted(MOST_CHANGED_FIRST)
      .limit(config.topK())
      .collect(Collectors.toList());

    List<HypothesisTest> tests = testFactory.apply(config);

    List<DiagnosticEntry> entries;
    if (executor == null || selected.size() < 2) {
      entries = new ArrayList<>(selected.size());
      for (ScreenedMetric metric : selected) {
        entries.add(diagnoseOne(metric, tests));
      }
    } else {
      List<CompletableFuture<DiagnosticEntry>> futures = selected.stream()
        .map(m -> CompletableFuture.supplyAsync(() -> diagnoseOne(m, tests), executor))
        .collect(Collectors.toList());
      entries = new ArrayList<>(futures.size());
      for (CompletableFuture<DiagnosticEntry> future : futures) {
        entries.add(join(future));
      }
    }

    log.debug("Diagnosed {} of {} abnormal metrics", entries.size(), abnormal.size());
    return entries;
  }

  DiagnosticEntry diagnoseOne(ScreenedMetric metric, List<HypothesisTest> tests) {
    MetricSample sample = metric.sample();
    ChangeRecord change = metric.change();
    double[] period1 = sample.period1();
    double[] period2 = sample.period2();

    if (!sample.hasRawObservations(HypothesisTest.MIN_OBSERVATIONS)) {
      log.debug("No hypothesis tests for {}: n1={}, n2={}", sample.name(), period1.length, period2.length);
      return new DiagnosticEntry(change, List.of(), Confidence.LOW,
        DiagnosticEntry.INSUFFICIENT_RAW_DATA, period1.length, period2.length);
    }

    List<TestResult> results = new ArrayList<>(tests.size());
    String reason = null;
    for (HypothesisTest test : tests) {
      try {
        results.add(test.run(period1, period2));
      } catch (InsufficientDataException e) {
        log.warn("Hypothesis test {} skipped for {}: {}", test.name(), sample.name(), e.getMessage());
        reason = e.getMessage();
      }
    }

    Confidence confidence;
    if (reason != null) {
      confidence = Confidence.LOW;
    } else {
      int significant = (int) results.stream().filter(TestResult::significant).count();
      confidence = Confidence.fromSignificantCount(significant, results.size());
    }

    return new DiagnosticEntry(change, results, confidence, reason, period1.length, period2.length);
  }

  private static DiagnosticEntry join(CompletableFuture<DiagnosticEntry> future) {
    try {
      return future.join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException runtime) {
        throw runtime;
      }
      throw e;
    }
  }
}
