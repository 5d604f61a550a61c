package io.github.themoah.pegdiff.api;

import io.github.themoah.pegdiff.model.AlarmSummary;
import io.github.themoah.pegdiff.model.ChangeRecord;
import io.github.themoah.pegdiff.model.ComparisonReport;
import io.github.themoah.pegdiff.model.DiagnosticEntry;
import io.github.themoah.pegdiff.model.DiagnosticSummary;
import io.github.themoah.pegdiff.model.PeriodStats;
import io.github.themoah.pegdiff.model.RankedPage;
import io.github.themoah.pegdiff.model.TestResult;
import io.github.themoah.pegdiff.model.TrendSummary;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import java.util.List;
import java.util.OptionalDouble;

/**
 * JSON views of engine results. Undefined ratios are written as {@code null}, never as
 * NaN or Infinity.
 */
public final class ComparisonJson {

  private ComparisonJson() {}

  public static JsonObject toJson(ComparisonReport report) {
    return new JsonObject()
      .put("alarm", toJson(report.alarm()))
      .put("abnormal", changes(report.abnormal()))
      .put("diagnostics", diagnostics(report.diagnostics()))
      .put("diagnosticSummary", toJson(report.diagnosticSummary()))
      .put("table", toJson(report.table()));
  }

  public static JsonObject toJson(AlarmSummary alarm) {
    return new JsonObject()
      .put("totalMetricCount", alarm.totalMetricCount())
      .put("abnormalMetricCount", alarm.abnormalMetricCount())
      .put("abnormalScore", alarm.abnormalScore())
      .put("alarmLevel", alarm.alarmLevel().toJsonValue())
      .put("description", alarm.description());
  }

  public static JsonObject toJson(DiagnosticSummary summary) {
    return new JsonObject()
      .put("totalAnalyzed", summary.totalAnalyzed())
      .put("statisticallySignificant", summary.statisticallySignificant())
      .put("highConfidenceFindings", summary.highConfidenceFindings())
      .put("distributionChanges", summary.distributionChanges());
  }

  public static JsonObject toJson(RankedPage page) {
    return new JsonObject()
      .put("items", changes(page.items()))
      .put("totalItems", page.totalItems())
      .put("totalPages", page.totalPages())
      .put("page", page.page())
      .put("pageSize", page.pageSize())
      .put("summary", toJson(page.summary()));
  }

  public static JsonObject toJson(TrendSummary summary) {
    return new JsonObject()
      .put("improved", summary.improved())
      .put("declined", summary.declined())
      .put("stable", summary.stable())
      .put("avgChange", summary.avgChange())
      .put("weightedAvgChange", summary.weightedAvgChange());
  }

  public static JsonObject toJson(ChangeRecord change) {
    JsonObject json = new JsonObject()
      .put("name", change.name())
      .put("weight", change.weight())
      .put("weightBucket", change.weightBucket().toJsonValue())
      .put("period1", toJson(change.period1()))
      .put("period2", toJson(change.period2()))
      .put("comparable", change.comparable())
      .put("absoluteChange", change.absoluteChange());
    putOptional(json, "percentChange", change.percentChange());
    return json
      .put("ratioUndefined", change.ratioUndefined())
      .put("trend", change.trend().toJsonValue())
      .put("severity", change.severity().toJsonValue());
  }

  public static JsonObject toJson(PeriodStats stats) {
    JsonObject json = new JsonObject()
      .put("mean", stats.mean())
      .put("count", stats.count())
      .put("stdDev", stats.stdDev());
    putOptional(json, "rsdPercent", stats.rsdPercent());
    return json;
  }

  public static JsonObject toJson(DiagnosticEntry entry) {
    JsonArray tests = new JsonArray();
    for (TestResult test : entry.tests()) {
      tests.add(toJson(test));
    }
    JsonObject json = new JsonObject()
      .put("change", toJson(entry.change()))
      .put("tests", tests)
      .put("confidence", entry.confidence().toJsonValue())
      .put("sampleSizes", new JsonObject()
        .put("n1", entry.period1SampleSize())
        .put("n2", entry.period2SampleSize()));
    if (entry.reason() != null) {
      json.put("reason", entry.reason());
    }
    return json;
  }

  public static JsonObject toJson(TestResult test) {
    JsonObject statistics = new JsonObject();
    test.statistics().forEach(statistics::put);
    JsonObject json = new JsonObject()
      .put("test", test.testName())
      .put("statistics", statistics)
      .put("pValue", test.pValue())
      .put("significant", test.significant())
      .put("interpretation", test.interpretation());
    if (test.distributionDifference() != null) {
      json.put("distributionDifference", test.distributionDifference().toJsonValue());
    }
    return json;
  }

  private static JsonArray changes(List<ChangeRecord> changes) {
    JsonArray array = new JsonArray();
    for (ChangeRecord change : changes) {
      array.add(toJson(change));
    }
    return array;
  }

  private static JsonArray diagnostics(List<DiagnosticEntry> entries) {
    JsonArray array = new JsonArray();
    for (DiagnosticEntry entry : entries) {
      array.add(toJson(entry));
    }
    return array;
  }

  private static void putOptional(JsonObject json, String key, OptionalDouble value) {
    if (value.isPresent()) {
      json.put(key, value.getAsDouble());
    } else {
      json.putNull(key);
    }
  }
}
