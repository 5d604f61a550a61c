package io.github.themoah.pegdiff.metrics;

import io.github.themoah.pegdiff.model.AlarmSummary;
import io.github.themoah.pegdiff.model.ComparisonReport;
import io.github.themoah.pegdiff.model.DiagnosticEntry;
import io.github.themoah.pegdiff.model.RankedPage;
import io.github.themoah.pegdiff.model.TestResult;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.vertx.core.Future;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports metrics using Micrometer MeterRegistry.
 * Works with any Micrometer-supported backend (Datadog, Prometheus, OTLP).
 */
public class MicrometerReporter implements MetricsReporter {

  private static final Logger log = LoggerFactory.getLogger(MicrometerReporter.class);

  private final MeterRegistry registry;
  private final Map<String, AtomicLong> gaugeValues = new ConcurrentHashMap<>();

  public MicrometerReporter(MeterRegistry registry) {
    this.registry = registry;
  }

  @Override
  public void reportComparison(ComparisonReport report, Duration elapsed) {
    AlarmSummary alarm = report.alarm();
    log.debug("Reporting comparison metrics: alarm={}, metrics={}",
      alarm.alarmLevel(), alarm.totalMetricCount());

    Counter.builder("pegdiff.comparison.runs")
      .tags(Tags.of("alarm_level", alarm.alarmLevel().toJsonValue()))
      .register(registry)
      .increment();

    Timer.builder("pegdiff.comparison.duration")
      .tags(Tags.of("operation", "compare"))
      .register(registry)
      .record(elapsed);

    recordGauge("pegdiff.comparison.metrics", Tags.empty(), alarm.totalMetricCount());
    recordGauge("pegdiff.comparison.abnormal", Tags.empty(), alarm.abnormalMetricCount());
    // scaled by 1000 so the score survives the long gauge
    recordGauge("pegdiff.comparison.abnormal_score_permille", Tags.empty(),
      Math.round(alarm.abnormalScore() * 1000));

    for (DiagnosticEntry entry : report.diagnostics()) {
      Counter.builder("pegdiff.diagnostics")
        .tags(Tags.of("confidence", entry.confidence().toJsonValue()))
        .register(registry)
        .increment();
      for (TestResult test : entry.tests()) {
        Counter.builder("pegdiff.hypothesis.tests")
          .tags(Tags.of(
            "test", test.testName(),
            "significant", String.valueOf(test.significant())
          ))
          .register(registry)
          .increment();
      }
    }
  }

  @Override
  public void reportTable(RankedPage page, Duration elapsed) {
    Timer.builder("pegdiff.comparison.duration")
      .tags(Tags.of("operation", "table"))
      .register(registry)
      .record(elapsed);
    recordGauge("pegdiff.table.rows", Tags.empty(), page.totalItems());
  }

  @Override
  public void reportRejected(String reason) {
    Counter.builder("pegdiff.comparison.rejected")
      .tags(Tags.of("reason", reason))
      .register(registry)
      .increment();
  }

  @Override
  public Future<Void> close() {
    log.info("Closing MicrometerReporter");
    if (registry != null) {
      registry.close();
    }
    return Future.succeededFuture();
  }

  /**
   * Current value of a gauge registered by this reporter, for tests.
   */
  long gaugeValue(String name) {
    AtomicLong value = gaugeValues.get(name + Tags.empty());
    return value == null ? -1 : value.get();
  }

  private void recordGauge(String name, Tags tags, long value) {
    String key = name + tags.toString();
    AtomicLong atomicValue = gaugeValues.computeIfAbsent(key, k -> {
      AtomicLong newValue = new AtomicLong(value);
      Gauge.builder(name, newValue, AtomicLong::get)
        .tags(tags)
        .register(registry);
      return newValue;
    });
    atomicValue.set(value);
  }
}
