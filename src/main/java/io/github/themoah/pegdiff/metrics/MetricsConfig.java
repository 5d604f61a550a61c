package io.github.themoah.pegdiff.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics reporting configuration.
 *
 * @param reporterType "prometheus", "datadog", "otlp" or "none"
 * @param jvmMetricsEnabled whether JVM binders are attached to the registry
 */
public record MetricsConfig(
  String reporterType,
  boolean jvmMetricsEnabled
) {

  private static final Logger log = LoggerFactory.getLogger(MetricsConfig.class);

  private static final String DEFAULT_REPORTER = "prometheus";
  private static final boolean DEFAULT_JVM_METRICS_ENABLED = true;

  /**
   * Returns true unless the reporter type is "none".
   */
  public boolean isEnabled() {
    return reporterType != null && !"none".equalsIgnoreCase(reporterType);
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>METRICS_REPORTER - prometheus, datadog, otlp or none (default: prometheus)</li>
   *   <li>METRICS_JVM_ENABLED - bind JVM metrics (default: true)</li>
   * </ul>
   */
  public static MetricsConfig fromEnvironment() {
    String reporter = System.getenv("METRICS_REPORTER");
    if (reporter == null || reporter.isBlank()) {
      reporter = DEFAULT_REPORTER;
    }
    String jvm = System.getenv("METRICS_JVM_ENABLED");
    boolean jvmEnabled = (jvm == null || jvm.isBlank())
      ? DEFAULT_JVM_METRICS_ENABLED
      : Boolean.parseBoolean(jvm);

    MetricsConfig config = new MetricsConfig(reporter.trim(), jvmEnabled);
    log.info("Metrics config: reporter={}, jvmMetrics={}", config.reporterType(), jvmEnabled);
    return config;
  }
}
