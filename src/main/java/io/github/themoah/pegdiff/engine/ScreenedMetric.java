package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.MetricSample;

/**
 * A metric flagged by screening, kept together with its raw sample for drill-down.
 *
 * @param sample the input sample
 * @param change its comparison
 */
public record ScreenedMetric(
  MetricSample sample,
  ChangeRecord change
) {}
