package io.github.themoah.pegdiff.metrics;

import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.vertx.core.http.HttpHeaders;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the Prometheus scrape endpoint when the Prometheus reporter is active.
 */
public class PrometheusHandler {

  private static final Logger log = LoggerFactory.getLogger(PrometheusHandler.class);
  public static final String METRICS_PATH = "/metrics";

  private final PrometheusMeterRegistry registry;

  public PrometheusHandler(PrometheusMeterRegistry registry) {
    this.registry = registry;
  }

  public void registerRoutes(Router router) {
    router.get(METRICS_PATH).handler(this::scrape);
    log.info("Prometheus scrape endpoint registered at {}", METRICS_PATH);
  }

  private void scrape(RoutingContext ctx) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004)
      .setStatusCode(200)
      .end(registry.scrape(TextFormat.CONTENT_TYPE_004));
  }
}
