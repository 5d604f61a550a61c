package io.github.themoah.pegdiff.metrics;

import io.micrometer.core.instrument.Clock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.datadog.DatadogConfig;
import io.micrometer.datadog.DatadogMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.micrometer.registry.otlp.OtlpConfig;
import io.micrometer.registry.otlp.OtlpMeterRegistry;
import java.time.Duration;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Micrometer registry selected by METRICS_REPORTER.
 *
 * <p>Push registries (Datadog, OTLP) share one publish interval, METRICS_STEP_SECONDS
 * (default 60).
 */
public final class MicrometerConfig {

  private static final Logger log = LoggerFactory.getLogger(MicrometerConfig.class);

  private static final String SERVICE_NAME = "pegdiff";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(60);
  private static final String DEFAULT_OTLP_URL = "http://localhost:4318/v1/metrics";

  private MicrometerConfig() {}

  /**
   * Datadog registry; DD_API_KEY is required, DD_APP_KEY and DD_SITE are optional.
   */
  public static MeterRegistry createDatadogRegistry() {
    Duration step = step();
    String site = env("DD_SITE", "datadoghq.com");
    log.info("Creating Datadog meter registry: site={}, step={}", site, step);

    DatadogConfig config = new DatadogConfig() {
      @Override
      public String apiKey() {
        return System.getenv("DD_API_KEY");
      }

      @Override
      public String applicationKey() {
        return System.getenv("DD_APP_KEY");
      }

      @Override
      public String uri() {
        return "https://api." + site;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new DatadogMeterRegistry(config, Clock.SYSTEM);
  }

  public static PrometheusMeterRegistry createPrometheusRegistry() {
    log.info("Creating Prometheus meter registry");
    return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
  }

  /**
   * OTLP/HTTP registry. Endpoint from OTEL_EXPORTER_OTLP_METRICS_ENDPOINT, service name from
   * OTEL_SERVICE_NAME (default "pegdiff").
   */
  public static MeterRegistry createOtlpRegistry() {
    Duration step = step();
    String url = env("OTEL_EXPORTER_OTLP_METRICS_ENDPOINT", DEFAULT_OTLP_URL);
    Map<String, String> resource = Map.of("service.name", env("OTEL_SERVICE_NAME", SERVICE_NAME));
    log.info("Creating OTLP meter registry: endpoint={}, step={}", url, step);

    OtlpConfig config = new OtlpConfig() {
      @Override
      public String url() {
        return url;
      }

      @Override
      public Duration step() {
        return step;
      }

      @Override
      public Map<String, String> resourceAttributes() {
        return resource;
      }

      @Override
      public String get(String key) {
        return null;
      }
    };

    return new OtlpMeterRegistry(config, Clock.SYSTEM);
  }

  /**
   * @param reporterType "datadog", "prometheus" or "otlp"
   * @return the registry, or null for an unknown type
   */
  public static MeterRegistry createRegistry(String reporterType) {
    if (reporterType == null) {
      return null;
    }

    return switch (reporterType.toLowerCase()) {
      case "datadog" -> createDatadogRegistry();
      case "prometheus" -> createPrometheusRegistry();
      case "otlp" -> createOtlpRegistry();
      default -> {
        log.warn("Unknown reporter type: {}", reporterType);
        yield null;
      }
    };
  }

  /**
   * Binds JVM memory, GC, thread and CPU metrics.
   */
  public static void bindJvmMetrics(MeterRegistry registry) {
    log.info("Binding JVM metrics to registry");
    new JvmMemoryMetrics().bindTo(registry);
    new JvmGcMetrics().bindTo(registry);
    new JvmThreadMetrics().bindTo(registry);
    new ProcessorMetrics().bindTo(registry);
  }

  static Duration step() {
    String value = System.getenv("METRICS_STEP_SECONDS");
    if (value == null || value.isBlank()) {
      return DEFAULT_STEP;
    }
    try {
      long seconds = Long.parseLong(value.trim());
      if (seconds > 0) {
        return Duration.ofSeconds(seconds);
      }
      log.warn("METRICS_STEP_SECONDS must be positive, got {}, using default {}", seconds, DEFAULT_STEP);
    } catch (NumberFormatException e) {
      log.warn("Invalid METRICS_STEP_SECONDS: '{}', using default {}", value, DEFAULT_STEP);
    }
    return DEFAULT_STEP;
  }

  private static String env(String name, String defaultValue) {
    String value = System.getenv(name);
    return (value == null || value.isBlank()) ? defaultValue : value.trim();
  }
}
