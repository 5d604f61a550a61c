package io.github.themoah.pegdiff.api;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.config.DistributionThresholds;
import io.github.themoah.pegdiff.config.Thresholds;
import io.github.themoah.pegdiff.config.WeightBuckets;
import io.github.themoah.pegdiff.engine.MetricSampleAssembler;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.PeriodAggregate;
import io.github.themoah.pegdiff.model.RankQuery;
import io.github.themoah.pegdiff.model.StatRow;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns a JSON request body into a {@link ComparisonRequest}.
 *
 * <p>Metrics come either as {@code metrics} (explicit per-period arrays or aggregates) or as
 * backend {@code stats} rows; both may be combined. Weights resolve in order: the metric's own
 * {@code weight}, the {@code weights} map, then the default.
 */
public class ComparisonRequestParser {

  private final ComparisonConfig defaults;

  public ComparisonRequestParser(ComparisonConfig defaults) {
    this.defaults = defaults;
  }

  /**
   * @throws ComparisonRequestException if a field has the wrong type or an unknown value
   */
  public ComparisonRequest parse(JsonObject body) {
    if (body == null) {
      throw new ComparisonRequestException("Request body is required");
    }
    try {
      Map<String, Double> weights = parseWeights(body.getJsonObject("weights"));
      List<MetricSample> samples = new ArrayList<>();

      JsonArray metrics = body.getJsonArray("metrics");
      if (metrics != null) {
        for (int i = 0; i < metrics.size(); i++) {
          samples.add(parseMetric(metrics.getJsonObject(i), weights));
        }
      }

      JsonArray stats = body.getJsonArray("stats");
      if (stats != null) {
        samples.addAll(MetricSampleAssembler.assemble(parseStatRows(stats), weights));
      }

      return new ComparisonRequest(
        samples,
        parseQuery(body.getJsonObject("query")),
        parseConfig(body.getJsonObject("config"))
      );
    } catch (ClassCastException e) {
      throw new ComparisonRequestException("Malformed request: " + e.getMessage(), e);
    }
  }

  private static Map<String, Double> parseWeights(JsonObject json) {
    Map<String, Double> weights = new HashMap<>();
    if (json != null) {
      for (String name : json.fieldNames()) {
        Double weight = json.getDouble(name);
        if (weight == null) {
          throw new ComparisonRequestException("weights." + name + " must be a number");
        }
        weights.put(name, weight);
      }
    }
    return weights;
  }

  private static MetricSample parseMetric(JsonObject json, Map<String, Double> weights) {
    if (json == null) {
      throw new ComparisonRequestException("metrics entries must be objects");
    }
    String name = json.getString("name");
    if (name == null || name.isBlank()) {
      throw new ComparisonRequestException("metric name is required");
    }
    Double weight = json.getDouble("weight");
    if (weight == null) {
      weight = weights.getOrDefault(name, MetricSample.DEFAULT_WEIGHT);
    }
    return new MetricSample(
      name,
      toArray(json.getJsonArray("period1")),
      toArray(json.getJsonArray("period2")),
      weight,
      parseAggregate(json.getJsonObject("aggregate1")),
      parseAggregate(json.getJsonObject("aggregate2"))
    );
  }

  private static PeriodAggregate parseAggregate(JsonObject json) {
    if (json == null) {
      return null;
    }
    Double mean = json.getDouble("mean");
    Integer count = json.getInteger("count");
    if (mean == null || count == null) {
      throw new ComparisonRequestException("aggregate requires mean and count");
    }
    double stdDev = doubleOr(json, "stdDev", 0.0);
    if (!Double.isFinite(mean) || !Double.isFinite(stdDev)) {
      throw new ComparisonRequestException("aggregate mean and stdDev must be finite");
    }
    if (count < 0 || stdDev < 0) {
      throw new ComparisonRequestException("aggregate count and stdDev must not be negative");
    }
    return new PeriodAggregate(mean, count, stdDev);
  }

  private static List<StatRow> parseStatRows(JsonArray json) {
    List<StatRow> rows = new ArrayList<>(json.size());
    for (int i = 0; i < json.size(); i++) {
      JsonObject row = json.getJsonObject(i);
      if (row == null) {
        throw new ComparisonRequestException("stats entries must be objects");
      }
      String name = row.getString("kpi_name");
      Double avg = row.getDouble("avg");
      if (name == null || avg == null) {
        throw new ComparisonRequestException("stats rows require kpi_name and avg");
      }
      rows.add(new StatRow(name, row.getString("period"), avg));
    }
    return rows;
  }

  private static double[] toArray(JsonArray json) {
    if (json == null) {
      return new double[0];
    }
    double[] values = new double[json.size()];
    for (int i = 0; i < json.size(); i++) {
      Double value = json.getDouble(i);
      if (value == null) {
        throw new ComparisonRequestException("period observations must be numbers");
      }
      values[i] = value;
    }
    return values;
  }

  RankQuery parseQuery(JsonObject json) {
    if (json == null) {
      return RankQuery.defaults();
    }
    return new RankQuery(
      json.getString("name"),
      parseEnum(RankQuery.WeightFilter.class, json.getString("weight")),
      parseEnum(RankQuery.TrendFilter.class, json.getString("trend")),
      parseEnum(RankQuery.SortKey.class, json.getString("sort")),
      parseEnum(RankQuery.SortDirection.class, json.getString("direction")),
      intOr(json, "page", 0),
      intOr(json, "pageSize", RankQuery.DEFAULT_PAGE_SIZE)
    );
  }

  ComparisonConfig parseConfig(JsonObject json) {
    if (json == null) {
      return defaults;
    }
    return new ComparisonConfig(
      doubleOr(json, "screeningThreshold", defaults.screeningThreshold()),
      doubleOr(json, "significanceAlpha", defaults.significanceAlpha()),
      doubleOr(json, "trendThreshold", defaults.trendThreshold()),
      parseThresholds(json.getJsonArray("severityThresholds"), defaults.severityThresholds()),
      parseThresholds(json.getJsonArray("alarmThresholds"), defaults.alarmThresholds()),
      parseDistributionThresholds(
        json.getJsonArray("distributionThresholds"), defaults.distributionThresholds()),
      parseWeightBuckets(json.getJsonArray("weightBuckets"), defaults.weightBuckets()),
      intOr(json, "topK", defaults.topK())
    );
  }

  private static Thresholds parseThresholds(JsonArray json, Thresholds fallback) {
    if (json == null) {
      return fallback;
    }
    double[] values = requireSize(json, 3, "severity/alarm thresholds");
    return new Thresholds(values[0], values[1], values[2]);
  }

  private static DistributionThresholds parseDistributionThresholds(
      JsonArray json, DistributionThresholds fallback) {
    if (json == null) {
      return fallback;
    }
    double[] values = requireSize(json, 2, "distributionThresholds");
    return new DistributionThresholds(values[0], values[1]);
  }

  private static WeightBuckets parseWeightBuckets(JsonArray json, WeightBuckets fallback) {
    if (json == null) {
      return fallback;
    }
    double[] values = requireSize(json, 2, "weightBuckets");
    return new WeightBuckets(values[0], values[1]);
  }

  private static double doubleOr(JsonObject json, String key, double fallback) {
    Double value = json.getDouble(key);
    return value == null ? fallback : value;
  }

  private static int intOr(JsonObject json, String key, int fallback) {
    Integer value = json.getInteger(key);
    return value == null ? fallback : value;
  }

  private static double[] requireSize(JsonArray json, int size, String field) {
    if (json.size() != size) {
      throw new ComparisonRequestException(field + " must have " + size + " values");
    }
    return toArray(json);
  }

  /**
   * Accepts enum names case-insensitively, in camelCase or snake_case.
   */
  static <E extends Enum<E>> E parseEnum(Class<E> type, String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String normalized = value.trim()
      .replaceAll("([a-z])([A-Z])", "$1_$2")
      .replace('-', '_')
      .toUpperCase(Locale.ROOT);
    try {
      return Enum.valueOf(type, normalized);
    } catch (IllegalArgumentException e) {
      throw new ComparisonRequestException(
        "Unknown " + type.getSimpleName() + " value: " + value, e);
    }
  }
}
