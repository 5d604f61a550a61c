package io.github.themoah.pegdiff.metrics;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.Vertx;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.client.WebClient;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

/**
 * Unit tests for PrometheusHandler.
 */
@ExtendWith(VertxExtension.class)
public class PrometheusHandlerTest {

  @Test
  void scrape_exposesReporterMeters(Vertx vertx, VertxTestContext testContext) {
    PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    new MicrometerReporter(registry).reportRejected("invalid_config");

    Router router = Router.router(vertx);
    new PrometheusHandler(registry).registerRoutes(router);
    WebClient client = WebClient.create(vertx);

    vertx.createHttpServer()
      .requestHandler(router)
      .listen(0)
      .compose(server -> client.get(server.actualPort(), "localhost", PrometheusHandler.METRICS_PATH).send())
      .onComplete(testContext.succeeding(response -> testContext.verify(() -> {
        assertEquals(200, response.statusCode());
        assertTrue(response.getHeader("content-type").startsWith("text/plain"));
        String body = response.bodyAsString();
        assertTrue(body.contains("pegdiff_comparison_rejected_total{"));
        assertTrue(body.contains("reason=\"invalid_config\""));
        testContext.completeNow();
      })));
  }
}
