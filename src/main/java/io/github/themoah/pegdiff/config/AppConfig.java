package io.github.themoah.pegdiff.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP settings of the comparison service, loaded from environment variables.
 *
 * @param httpPort HTTP server port
 * @param maxBodySizeBytes largest accepted comparison request body
 */
public record AppConfig(
  int httpPort,
  long maxBodySizeBytes
) {
  private static final Logger log = LoggerFactory.getLogger(AppConfig.class);

  private static final int DEFAULT_HTTP_PORT = 8888;
  private static final int MAX_PORT = 65535;
  private static final long DEFAULT_MAX_BODY_SIZE_BYTES = 10L * 1024 * 1024;

  /**
   * Loads configuration from environment variables with defaults.
   *
   * @return AppConfig instance
   */
  public static AppConfig fromEnvironment() {
    int port = getEnvInt("HTTP_PORT", DEFAULT_HTTP_PORT);
    if (port < 0 || port > MAX_PORT) {
      log.warn("HTTP_PORT {} is outside 0-{}, using default: {}", port, MAX_PORT, DEFAULT_HTTP_PORT);
      port = DEFAULT_HTTP_PORT;
    }
    long maxBody = getEnvLong("HTTP_MAX_BODY_SIZE_BYTES", DEFAULT_MAX_BODY_SIZE_BYTES);
    if (maxBody <= 0) {
      // a non-positive limit would reject every comparison body
      log.warn("HTTP_MAX_BODY_SIZE_BYTES must be positive, got {}, using default: {}",
        maxBody, DEFAULT_MAX_BODY_SIZE_BYTES);
      maxBody = DEFAULT_MAX_BODY_SIZE_BYTES;
    }

    log.info("AppConfig loaded: httpPort={}, maxBodySizeBytes={}", port, maxBody);
    return new AppConfig(port, maxBody);
  }

  private static int getEnvInt(String name, int defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Integer.parseInt(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid integer for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }

  private static long getEnvLong(String name, long defaultValue) {
    String value = System.getenv(name);
    if (value != null && !value.isBlank()) {
      try {
        return Long.parseLong(value);
      } catch (NumberFormatException e) {
        log.warn("Invalid long for {}: {}, using default: {}", name, value, defaultValue);
      }
    }
    return defaultValue;
  }
}
