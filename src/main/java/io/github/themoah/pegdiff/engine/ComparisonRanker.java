package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.RankQuery;
import io.github.themoah.pegdiff.model.RankQuery.SortDirection;
import io.github.themoah.pegdiff.model.RankedPage;
import io.github.themoah.pegdiff.model.TrendSummary;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the comparison table: one row per metric, filtered, sorted and sliced into a page.
 *
 * <p>Independent of screening. Ties on the sort key fall back to the metric name so identical
 * inputs always produce an identical page.
 */
public class ComparisonRanker {

  private static final Logger log = LoggerFactory.getLogger(ComparisonRanker.class);

  private static final Comparator<ChangeRecord> BY_NAME = Comparator.comparing(ChangeRecord::name);

  /**
   * Ranks all metrics.
   *
   * @param samples metrics of one comparison run
   * @param query filters, sort and page
   * @param config thresholds used to derive trend, severity and weight bucket
   * @return the requested page
   */
  public RankedPage rank(List<MetricSample> samples, RankQuery query, ComparisonConfig config) {
    query.validate();

    List<ChangeRecord> rows = samples.stream()
      .map(sample -> ChangeCalculator.compute(sample, config))
      .filter(row -> query.matchesName(row.name()))
      .filter(row -> query.matchesWeight(row.weightBucket()))
      .filter(row -> query.matchesTrend(row.trend()))
      .sorted(comparator(query))
      .collect(Collectors.toList());

    int total = rows.size();
    int totalPages = (total + query.pageSize() - 1) / query.pageSize();
    long from = (long) query.page() * query.pageSize();
    List<ChangeRecord> page = from >= total
      ? List.of()
      : rows.subList((int) from, (int) Math.min(total, from + query.pageSize()));

    log.debug("Ranked {} of {} metrics, page {}/{} has {} rows",
      total, samples.size(), query.page(), totalPages, page.size());

    return new RankedPage(page, total, totalPages, query.page(), query.pageSize(), TrendSummary.of(page));
  }

  static Comparator<ChangeRecord> comparator(RankQuery query) {
    boolean descending = query.direction() == SortDirection.DESC;
    Comparator<ChangeRecord> primary = switch (query.sortKey()) {
      case WEIGHT -> directed(Comparator.comparingDouble(ChangeRecord::weight), descending);
      case NAME -> directed(BY_NAME, descending);
      case PERCENT_CHANGE -> Comparator
        .comparing((ChangeRecord r) -> r.percentChange().isEmpty())
        .thenComparing(directed(
          Comparator.comparingDouble(r -> r.percentChange().orElse(0.0)), descending));
    };
    return primary.thenComparing(BY_NAME);
  }

  private static Comparator<ChangeRecord> directed(Comparator<ChangeRecord> comparator, boolean descending) {
    return descending ? comparator.reversed() : comparator;
  }
}
