package io.github.themoah.pegdiff.health;

import io.vertx.core.json.JsonObject;

/**
 * Immutable health check response.
 *
 * @param status overall health status
 * @param engine comparison engine state (null for liveness check)
 */
public record HealthCheckResponse(
  HealthStatus status,
  String engine
) {
  /**
   * Creates a liveness response (HTTP server only).
   */
  public static HealthCheckResponse liveness() {
    return new HealthCheckResponse(HealthStatus.UP, null);
  }

  /**
   * Creates a readiness response.
   *
   * @param ready true once the comparison routes accept requests
   */
  public static HealthCheckResponse readiness(boolean ready) {
    return new HealthCheckResponse(HealthStatus.of(ready), ready ? "ready" : "starting");
  }

  /**
   * Converts to JSON for HTTP response.
   */
  public JsonObject toJson() {
    JsonObject json = new JsonObject().put("status", status.getValue());
    if (engine != null) {
      json.put("engine", engine);
    }
    return json;
  }
}
