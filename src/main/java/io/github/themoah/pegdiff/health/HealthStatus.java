package io.github.themoah.pegdiff.health;

/**
 * Health of the service as reported by /healthz and /readyz, with the HTTP status each maps to.
 */
public enum HealthStatus {
  UP("UP", 200),
  DOWN("DOWN", 503);

  private final String value;
  private final int httpStatus;

  HealthStatus(String value, int httpStatus) {
    this.value = value;
    this.httpStatus = httpStatus;
  }

  public static HealthStatus of(boolean healthy) {
    return healthy ? UP : DOWN;
  }

  public String getValue() {
    return value;
  }

  public int httpStatus() {
    return httpStatus;
  }
}
