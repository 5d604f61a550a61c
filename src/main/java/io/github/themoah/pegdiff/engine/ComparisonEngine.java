package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.ComparisonReport;
import io.github.themoah.pegdiff.model.DiagnosticEntry;
import io.github.themoah.pegdiff.model.DiagnosticSummary;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.RankQuery;
import io.github.themoah.pegdiff.model.RankedPage;
import io.github.themoah.pegdiff.stats.DistributionTest;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a full two-period comparison: screening, drill-down on the top abnormal metrics and
 * the ranked comparison table.
 *
 * <p>Stateless; one instance can serve any number of threads.
 */
public class ComparisonEngine {

  private static final Logger log = LoggerFactory.getLogger(ComparisonEngine.class);

  private final ChangeScreener screener;
  private final SignificanceAggregator aggregator;
  private final ComparisonRanker ranker;

  public ComparisonEngine() {
    this(new ChangeScreener(), new SignificanceAggregator(), new ComparisonRanker());
  }

  public ComparisonEngine(
      ChangeScreener screener, SignificanceAggregator aggregator, ComparisonRanker ranker) {
    this.screener = screener;
    this.aggregator = aggregator;
    this.ranker = ranker;
  }

  /**
   * Compares the two periods of every metric.
   *
   * @param samples metrics of the run, names unique
   * @param query table filters, sort and page
   * @param config thresholds
   * @return the full report
   * @throws io.github.themoah.pegdiff.config.InvalidConfigException if config or query is out of range
   * @throws IllegalArgumentException if two samples share a name
   */
  public ComparisonReport compare(List<MetricSample> samples, RankQuery query, ComparisonConfig config) {
    validate(samples, query, config);

    ScreeningResult screening = screener.screen(samples, config);
    List<DiagnosticEntry> diagnostics = aggregator.diagnose(screening.abnormal(), config);
    DiagnosticSummary diagnosticSummary = DiagnosticSummary.of(diagnostics, DistributionTest.NAME);
    RankedPage table = ranker.rank(samples, query, config);

    List<ChangeRecord> abnormal = screening.abnormal().stream()
      .map(ScreenedMetric::change)
      .collect(Collectors.toList());

    log.info("Comparison complete: metrics={}, alarm={}, diagnosed={}, significant={}",
      samples.size(), screening.summary().alarmLevel(), diagnosticSummary.totalAnalyzed(),
      diagnosticSummary.statisticallySignificant());

    return new ComparisonReport(screening.summary(), abnormal, diagnostics, diagnosticSummary, table);
  }

  /**
   * Builds only the comparison table.
   */
  public RankedPage table(List<MetricSample> samples, RankQuery query, ComparisonConfig config) {
    validate(samples, query, config);
    return ranker.rank(samples, query, config);
  }

  private static void validate(List<MetricSample> samples, RankQuery query, ComparisonConfig config) {
    config.validate();
    query.validate();
    Set<String> names = new HashSet<>();
    for (MetricSample sample : samples) {
      if (!names.add(sample.name())) {
        throw new IllegalArgumentException("Duplicate metric name: " + sample.name());
      }
    }
  }
}
