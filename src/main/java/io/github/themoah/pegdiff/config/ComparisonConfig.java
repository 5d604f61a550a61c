package io.github.themoah.pegdiff.config;

import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thresholds driving screening, classification and significance testing.
 *
 * @param screeningThreshold |percent change| above which a metric is abnormal (default 10)
 * @param significanceAlpha p-value cut-off for hypothesis tests (default 0.05)
 * @param trendThreshold percent change beyond which a metric trends up or down (default 5)
 * @param severityThresholds |percent change| cut points for caution/warning/critical (default 10/20/30)
 * @param alarmThresholds abnormal score cut points for caution/warning/critical (default 0.1/0.2/0.3)
 * @param distributionThresholds KS D cut points for medium/large difference (default 0.1/0.2)
 * @param weightBuckets weight cut points for high/medium buckets (default 8/6)
 * @param topK number of abnormal metrics that get hypothesis tests (default 5)
 */
public record ComparisonConfig(
  double screeningThreshold,
  double significanceAlpha,
  double trendThreshold,
  Thresholds severityThresholds,
  Thresholds alarmThresholds,
  DistributionThresholds distributionThresholds,
  WeightBuckets weightBuckets,
  int topK
) {

  private static final Logger log = LoggerFactory.getLogger(ComparisonConfig.class);

  public static final double DEFAULT_SCREENING_THRESHOLD = 10.0;
  public static final double DEFAULT_SIGNIFICANCE_ALPHA = 0.05;
  public static final double DEFAULT_TREND_THRESHOLD = 5.0;
  public static final Thresholds DEFAULT_SEVERITY_THRESHOLDS = new Thresholds(10.0, 20.0, 30.0);
  public static final Thresholds DEFAULT_ALARM_THRESHOLDS = new Thresholds(0.1, 0.2, 0.3);
  public static final DistributionThresholds DEFAULT_DISTRIBUTION_THRESHOLDS =
    new DistributionThresholds(0.1, 0.2);
  public static final WeightBuckets DEFAULT_WEIGHT_BUCKETS = new WeightBuckets(8.0, 6.0);
  public static final int DEFAULT_TOP_K = 5;

  /**
   * Returns the default configuration.
   */
  public static ComparisonConfig defaults() {
    return new ComparisonConfig(
      DEFAULT_SCREENING_THRESHOLD,
      DEFAULT_SIGNIFICANCE_ALPHA,
      DEFAULT_TREND_THRESHOLD,
      DEFAULT_SEVERITY_THRESHOLDS,
      DEFAULT_ALARM_THRESHOLDS,
      DEFAULT_DISTRIBUTION_THRESHOLDS,
      DEFAULT_WEIGHT_BUCKETS,
      DEFAULT_TOP_K
    );
  }

  /**
   * Loads configuration from environment variables.
   *
   * <p>Supported environment variables:
   * <ul>
   *   <li>PEGDIFF_SCREENING_THRESHOLD - abnormal change threshold in percent (default: 10)</li>
   *   <li>PEGDIFF_SIGNIFICANCE_ALPHA - significance level (default: 0.05)</li>
   *   <li>PEGDIFF_TREND_THRESHOLD - trend threshold in percent (default: 5)</li>
   *   <li>PEGDIFF_SEVERITY_THRESHOLDS - "caution,warning,critical" percent (default: 10,20,30)</li>
   *   <li>PEGDIFF_ALARM_THRESHOLDS - "caution,warning,critical" score (default: 0.1,0.2,0.3)</li>
   *   <li>PEGDIFF_DISTRIBUTION_THRESHOLDS - "medium,large" KS D (default: 0.1,0.2)</li>
   *   <li>PEGDIFF_WEIGHT_BUCKETS - "high,medium" weight (default: 8,6)</li>
   *   <li>PEGDIFF_TOP_K - metrics given hypothesis tests (default: 5)</li>
   * </ul>
   *
   * @throws InvalidConfigException if the resulting configuration is out of range
   */
  public static ComparisonConfig fromEnvironment() {
    ComparisonConfig config = new ComparisonConfig(
      parseDouble("PEGDIFF_SCREENING_THRESHOLD", DEFAULT_SCREENING_THRESHOLD),
      parseDouble("PEGDIFF_SIGNIFICANCE_ALPHA", DEFAULT_SIGNIFICANCE_ALPHA),
      parseDouble("PEGDIFF_TREND_THRESHOLD", DEFAULT_TREND_THRESHOLD),
      parse("PEGDIFF_SEVERITY_THRESHOLDS", Thresholds::parse, DEFAULT_SEVERITY_THRESHOLDS),
      parse("PEGDIFF_ALARM_THRESHOLDS", Thresholds::parse, DEFAULT_ALARM_THRESHOLDS),
      parse("PEGDIFF_DISTRIBUTION_THRESHOLDS", DistributionThresholds::parse,
        DEFAULT_DISTRIBUTION_THRESHOLDS),
      parse("PEGDIFF_WEIGHT_BUCKETS", WeightBuckets::parse, DEFAULT_WEIGHT_BUCKETS),
      parseInt("PEGDIFF_TOP_K", DEFAULT_TOP_K)
    );
    config.validate();

    log.info("Comparison config: screening={}%, alpha={}, trend={}%, severity={}, alarm={}, "
        + "distribution={}, weights={}, topK={}",
      config.screeningThreshold(), config.significanceAlpha(), config.trendThreshold(),
      config.severityThresholds(), config.alarmThresholds(), config.distributionThresholds(),
      config.weightBuckets(), config.topK());

    return config;
  }

  /**
   * Checks every threshold against its valid range.
   *
   * @throws InvalidConfigException on the first out-of-range value
   */
  public void validate() {
    if (!(significanceAlpha > 0 && significanceAlpha < 1)) {
      throw new InvalidConfigException("significanceAlpha must be in (0, 1): " + significanceAlpha);
    }
    if (topK <= 0) {
      throw new InvalidConfigException("topK must be positive: " + topK);
    }
    if (!Double.isFinite(screeningThreshold) || screeningThreshold < 0) {
      throw new InvalidConfigException("screeningThreshold must not be negative: " + screeningThreshold);
    }
    if (!Double.isFinite(trendThreshold) || trendThreshold < 0) {
      throw new InvalidConfigException("trendThreshold must not be negative: " + trendThreshold);
    }
    if (severityThresholds == null || alarmThresholds == null
        || distributionThresholds == null || weightBuckets == null) {
      throw new InvalidConfigException("Threshold sets must not be null");
    }
    severityThresholds.validate("severityThresholds");
    alarmThresholds.validate("alarmThresholds");
    distributionThresholds.validate();
    weightBuckets.validate();
  }

  private static double parseDouble(String envVar, double defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static int parseInt(String envVar, int defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }

  private static <T> T parse(String envVar, Function<String, T> parser, T defaultValue) {
    String value = System.getenv(envVar);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return parser.apply(value);
    } catch (InvalidConfigException e) {
      log.warn("Invalid value for {}: '{}', using default: {}", envVar, value, defaultValue);
      return defaultValue;
    }
  }
}
