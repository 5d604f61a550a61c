package io.github.themoah.pegdiff.api;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.RankQuery;
import java.util.List;

/**
 * Parsed comparison request.
 *
 * @param samples metrics to compare
 * @param query table parameters
 * @param config effective thresholds (server defaults with request overrides)
 */
public record ComparisonRequest(
  List<MetricSample> samples,
  RankQuery query,
  ComparisonConfig config
) {

  public ComparisonRequest {
    samples = List.copyOf(samples);
  }
}
