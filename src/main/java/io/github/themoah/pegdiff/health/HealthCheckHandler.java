package io.github.themoah.pegdiff.health;

import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for health check endpoints.
 */
public class HealthCheckHandler {

  private static final Logger log = LoggerFactory.getLogger(HealthCheckHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  private final BooleanSupplier readiness;

  /**
   * @param readiness reports whether the service accepts comparison requests
   */
  public HealthCheckHandler(BooleanSupplier readiness) {
    this.readiness = readiness;
  }

  /**
   * Registers health check routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.get("/healthz").handler(this::handleLiveness);
    router.get("/readyz").handler(this::handleReadiness);
    log.info("Health check routes registered: /healthz, /readyz");
  }

  /**
   * Liveness probe - always 200 while the HTTP server responds.
   */
  private void handleLiveness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.liveness());
  }

  /**
   * Readiness probe - 200 once started, 503 before that or while stopping.
   */
  private void handleReadiness(RoutingContext ctx) {
    respond(ctx, HealthCheckResponse.readiness(readiness.getAsBoolean()));
  }

  private static void respond(RoutingContext ctx, HealthCheckResponse response) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(response.status().httpStatus())
      .end(response.toJson().encode());
  }
}
