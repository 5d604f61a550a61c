package io.github.themoah.pegdiff.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.config.Thresholds;
import io.github.themoah.pegdiff.model.MetricSample;
import io.github.themoah.pegdiff.model.RankQuery;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ComparisonRequestParser.
 */
public class ComparisonRequestParserTest {

  private final ComparisonRequestParser parser = new ComparisonRequestParser(ComparisonConfig.defaults());

  @Test
  void parse_metricsWithRawPeriods() {
    JsonObject body = new JsonObject()
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "DL_THROUGHPUT")
        .put("period1", new JsonArray().add(140).add(142.5))
        .put("period2", new JsonArray().add(150).add(149))
        .put("weight", 7)));

    ComparisonRequest request = parser.parse(body);

    MetricSample sample = request.samples().get(0);
    assertEquals("DL_THROUGHPUT", sample.name());
    assertArrayEquals(new double[]{140, 142.5}, sample.period1());
    assertEquals(7.0, sample.weight());
    assertEquals(ComparisonConfig.defaults(), request.config());
    assertEquals(RankQuery.defaults(), request.query());
  }

  @Test
  void parse_aggregatesAndWeightMap() {
    JsonObject body = new JsonObject()
      .put("weights", new JsonObject().put("CELL_AVAIL", 10))
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "CELL_AVAIL")
        .put("aggregate1", new JsonObject().put("mean", 99.0).put("count", 96).put("stdDev", 0.5))
        .put("aggregate2", new JsonObject().put("mean", 97.0).put("count", 96))));

    MetricSample sample = parser.parse(body).samples().get(0);

    assertEquals(10.0, sample.weight());
    assertEquals(99.0, sample.aggregate1().mean());
    assertEquals(0.0, sample.aggregate2().stdDev());
    assertEquals(0, sample.period1().length);
  }

  @Test
  void parse_statRows() {
    JsonObject body = new JsonObject()
      .put("stats", new JsonArray()
        .add(new JsonObject().put("kpi_name", "RRC_SR").put("period", "N-1").put("avg", 98.1))
        .add(new JsonObject().put("kpi_name", "RRC_SR").put("period", "N").put("avg", 97.3)));

    MetricSample sample = parser.parse(body).samples().get(0);

    assertEquals("RRC_SR", sample.name());
    assertArrayEquals(new double[]{98.1}, sample.period1());
    assertArrayEquals(new double[]{97.3}, sample.period2());
    assertEquals(MetricSample.DEFAULT_WEIGHT, sample.weight());
  }

  @Test
  void parseQuery_enumsInAnyCase() {
    RankQuery query = parser.parseQuery(new JsonObject()
      .put("name", "thr")
      .put("weight", "high")
      .put("trend", "Down")
      .put("sort", "percentChange")
      .put("direction", "asc")
      .put("page", 2)
      .put("pageSize", 25));

    assertEquals("thr", query.nameFilter());
    assertEquals(RankQuery.WeightFilter.HIGH, query.weightFilter());
    assertEquals(RankQuery.TrendFilter.DOWN, query.trendFilter());
    assertEquals(RankQuery.SortKey.PERCENT_CHANGE, query.sortKey());
    assertEquals(RankQuery.SortDirection.ASC, query.direction());
    assertEquals(2, query.page());
    assertEquals(25, query.pageSize());
  }

  @Test
  void parseEnum_snakeAndDashes() {
    assertEquals(RankQuery.SortKey.PERCENT_CHANGE,
      ComparisonRequestParser.parseEnum(RankQuery.SortKey.class, "percent_change"));
    assertEquals(RankQuery.SortKey.PERCENT_CHANGE,
      ComparisonRequestParser.parseEnum(RankQuery.SortKey.class, "percent-change"));
    assertNull(ComparisonRequestParser.parseEnum(RankQuery.SortKey.class, " "));
  }

  @Test
  void parseEnum_unknownValue_rejected() {
    assertThrows(ComparisonRequestException.class,
      () -> ComparisonRequestParser.parseEnum(RankQuery.SortKey.class, "severity"));
  }

  @Test
  void parseConfig_overridesOnlyGivenFields() {
    ComparisonConfig config = parser.parseConfig(new JsonObject()
      .put("screeningThreshold", 15)
      .put("severityThresholds", new JsonArray().add(5).add(10).add(15))
      .put("topK", 3));

    assertEquals(15.0, config.screeningThreshold());
    assertEquals(new Thresholds(5, 10, 15), config.severityThresholds());
    assertEquals(3, config.topK());
    assertEquals(ComparisonConfig.DEFAULT_SIGNIFICANCE_ALPHA, config.significanceAlpha());
    assertEquals(ComparisonConfig.DEFAULT_ALARM_THRESHOLDS, config.alarmThresholds());
  }

  @Test
  void parseConfig_wrongThresholdCount_rejected() {
    assertThrows(ComparisonRequestException.class, () -> parser.parseConfig(new JsonObject()
      .put("alarmThresholds", new JsonArray().add(0.1).add(0.2))));
  }

  @Test
  void parse_missingName_rejected() {
    JsonObject body = new JsonObject()
      .put("metrics", new JsonArray().add(new JsonObject().put("period1", new JsonArray().add(1))));

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_wrongFieldType_rejected() {
    JsonObject body = new JsonObject().put("metrics", "not-an-array");

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_nonNumericObservation_rejected() {
    JsonObject body = new JsonObject()
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "X")
        .put("period1", new JsonArray().add("abc"))));

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_nullWeightEntry_rejected() {
    JsonObject body = new JsonObject()
      .put("weights", new JsonObject().putNull("A"))
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "A")
        .put("period1", new JsonArray().add(1).add(2))
        .put("period2", new JsonArray().add(3).add(4))));

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_nullStatRow_rejected() {
    JsonObject body = new JsonObject()
      .put("stats", new JsonArray()
        .add(new JsonObject().put("kpi_name", "RRC_SR").put("period", "N-1").put("avg", 98.1))
        .addNull());

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_negativeAggregateStdDev_rejected() {
    JsonObject body = new JsonObject()
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "CELL_AVAIL")
        .put("aggregate1", new JsonObject().put("mean", 99.0).put("count", 96).put("stdDev", -0.5))
        .put("aggregate2", new JsonObject().put("mean", 97.0).put("count", 96))));

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parse_nonFiniteAggregateMean_rejected() {
    JsonObject body = new JsonObject()
      .put("metrics", new JsonArray().add(new JsonObject()
        .put("name", "CELL_AVAIL")
        .put("aggregate1", new JsonObject().put("mean", Double.NaN).put("count", 96))));

    assertThrows(ComparisonRequestException.class, () -> parser.parse(body));
  }

  @Test
  void parseConfig_explicitNullFields_fallBackToDefaults() {
    ComparisonConfig config = parser.parseConfig(new JsonObject()
      .putNull("screeningThreshold")
      .putNull("topK"));

    assertEquals(ComparisonConfig.defaults(), config);
  }
}
