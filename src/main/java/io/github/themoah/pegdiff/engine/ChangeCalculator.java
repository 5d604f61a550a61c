package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.PeriodStats;
import io.github.themoah.pegdiff.model.Severity;
import io.github.themoah.pegdiff.model.Trend;
import io.github.themoah.pegdiff.model.WeightBucket;
import io.github.themoah.pegdiff.stats.StatisticalUtils;
import java.util.OptionalDouble;

/**
 * Builds the {@link ChangeRecord} of a metric from its two periods.
 *
 * <p>An undefined ratio (N-1 mean of 0) or a missing period yields an empty percent change,
 * a stable trend and no severity.
 */
public final class ChangeCalculator {

  private ChangeCalculator() {}

  public static ChangeRecord compute(MetricSample sample, ComparisonConfig config) {
    PeriodStats p1 = sample.period1Stats();
    PeriodStats p2 = sample.period2Stats();
    WeightBucket bucket = WeightBucket.fromWeight(sample.weight(), config.weightBuckets());

    if (p1.isEmpty() || p2.isEmpty()) {
      return new ChangeRecord(sample.name(), sample.weight(), bucket, p1, p2,
        false, 0.0, OptionalDouble.empty(), false, Trend.STABLE, Severity.NONE);
    }

    double absoluteChange = p2.mean() - p1.mean();
    OptionalDouble percentChange = StatisticalUtils.percentChange(p1.mean(), p2.mean());
    if (percentChange.isEmpty()) {
      return new ChangeRecord(sample.name(), sample.weight(), bucket, p1, p2,
        true, absoluteChange, percentChange, true, Trend.STABLE, Severity.NONE);
    }

    double pct = percentChange.getAsDouble();
    return new ChangeRecord(
      sample.name(),
      sample.weight(),
      bucket,
      p1,
      p2,
      true,
      absoluteChange,
      percentChange,
      false,
      Trend.fromPercentChange(pct, config.trendThreshold()),
      Severity.fromPercentChange(Math.abs(pct), config.severityThresholds())
    );
  }
}
