package io.github.themoah.pegdiff.engine;

import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.StatRow;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Groups backend stat rows into per-PEG samples.
 *
 * <p>Each row contributes one observation to the N-1 or N period of its PEG. Weights come
 * from the PEG definitions and default to {@link MetricSample#DEFAULT_WEIGHT}.
 */
public final class MetricSampleAssembler {

  private static final Logger log = LoggerFactory.getLogger(MetricSampleAssembler.class);

  private MetricSampleAssembler() {}

  /**
   * @param rows backend rows, in any order
   * @param weights PEG name to weight; may be empty
   * @return one sample per PEG, in order of first appearance
   */
  public static List<MetricSample> assemble(List<StatRow> rows, Map<String, Double> weights) {
    Map<String, Periods> byName = new LinkedHashMap<>();
    int skipped = 0;

    for (StatRow row : rows) {
      Periods periods = byName.computeIfAbsent(row.kpiName(), k -> new Periods());
      if (StatRow.PERIOD_BASELINE.equals(row.period())) {
        periods.baseline.add(row.avg());
      } else if (StatRow.PERIOD_CURRENT.equals(row.period())) {
        periods.current.add(row.avg());
      } else {
        skipped++;
      }
    }

    if (skipped > 0) {
      log.warn("Skipped {} stat rows with unknown period labels", skipped);
    }

    List<MetricSample> samples = new ArrayList<>(byName.size());
    for (Map.Entry<String, Periods> entry : byName.entrySet()) {
      String name = entry.getKey();
      Double weight = weights.get(name);
      samples.add(MetricSample.of(
        name,
        toArray(entry.getValue().baseline),
        toArray(entry.getValue().current),
        weight != null ? weight : MetricSample.DEFAULT_WEIGHT
      ));
    }
    return samples;
  }

  private static double[] toArray(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).toArray();
  }

  private static final class Periods {
    private final List<Double> baseline = new ArrayList<>();
    private final List<Double> current = new ArrayList<>();
  }
}
