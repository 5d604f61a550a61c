package io.github.themoah.pegdiff;

import io.github.themoah.pegdiff.api.ComparisonHandler;
import io.github.themoah.pegdiff.api.ComparisonRequestParser;
import io.github.themoah.pegdiff.config.AppConfig;
import io.github.themoah.pegdiff.config.ComparisonConfig;
import io.github.themoah.pegdiff.engine.ComparisonEngine;
import io.github.themoah.pegdiff.health.HealthCheckHandler;
import io.github.themoah.pegdiff.metrics.MetricsConfig;
import io.github.themoah.pegdiff.metrics.MetricsReporter;
import io.github.themoah.pegdiff.metrics.MicrometerConfig;
import io.github.themoah.pegdiff.metrics.MicrometerReporter;
import io.github.themoah.pegdiff.metrics.PrometheusHandler;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.http.HttpServer;
import io.vertx.ext.web.Router;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main verticle for pegdiff - PEG period comparison service.
 * Loads configuration, wires the engine into the HTTP router and starts the server.
 */
public class MainVerticle extends AbstractVerticle {

  private static final Logger log = LoggerFactory.getLogger(MainVerticle.class);

  private final AtomicBoolean ready = new AtomicBoolean(false);

  private AppConfig appConfig;
  private ComparisonConfig comparisonConfig;
  private MetricsConfig metricsConfig;

  private MetricsReporter reporter = MetricsReporter.NOOP;
  private HttpServer httpServer;

  /**
   * Creates a verticle that reads its configuration from the environment on start.
   */
  public MainVerticle() {
  }

  /**
   * Creates a verticle with fixed configuration; the environment is not consulted.
   */
  MainVerticle(AppConfig appConfig, ComparisonConfig comparisonConfig, MetricsConfig metricsConfig) {
    this.appConfig = appConfig;
    this.comparisonConfig = comparisonConfig;
    this.metricsConfig = metricsConfig;
  }

  @Override
  public void start(Promise<Void> startPromise) {
    log.info("Starting pegdiff MainVerticle");

    try {
      if (appConfig == null) {
        appConfig = AppConfig.fromEnvironment();
      }
      if (comparisonConfig == null) {
        comparisonConfig = ComparisonConfig.fromEnvironment();
      }
    } catch (RuntimeException e) {
      log.error("Invalid configuration", e);
      startPromise.fail(e);
      return;
    }
    if (metricsConfig == null) {
      metricsConfig = MetricsConfig.fromEnvironment();
    }

    Router router = Router.router(vertx);
    new HealthCheckHandler(ready::get).registerRoutes(router);

    reporter = createReporter(metricsConfig, router);

    ComparisonHandler comparisonHandler = new ComparisonHandler(
      vertx,
      new ComparisonEngine(),
      new ComparisonRequestParser(comparisonConfig),
      reporter,
      appConfig.maxBodySizeBytes()
    );
    comparisonHandler.registerRoutes(router);

    router.route().handler(ctx -> {
      ctx.response()
        .setStatusCode(404)
        .putHeader(HttpHeaders.CONTENT_TYPE, "application/json")
        .end("{\"error\": \"Not Found\"}");
    });

    startHttpServer(router, appConfig.httpPort())
      .onSuccess(server -> {
        httpServer = server;
        ready.set(true);
        log.info("pegdiff started successfully on port {}", server.actualPort());
        startPromise.complete();
      })
      .onFailure(err -> {
        log.error("Failed to start pegdiff", err);
        startPromise.fail(err);
      });
  }

  @Override
  public void stop(Promise<Void> stopPromise) {
    log.info("Stopping pegdiff MainVerticle");
    ready.set(false);

    Future<Void> stopHttpServer = (httpServer != null)
      ? httpServer.close()
      : Future.succeededFuture();

    stopHttpServer
      .compose(v -> reporter.close())
      .onSuccess(v -> {
        log.info("pegdiff stopped successfully");
        stopPromise.complete();
      })
      .onFailure(err -> {
        log.error("Error during pegdiff shutdown", err);
        stopPromise.fail(err);
      });
  }

  /**
   * Port the server is bound to, or -1 before start. Lets tests bind to port 0.
   */
  int actualPort() {
    return httpServer != null ? httpServer.actualPort() : -1;
  }

  private Future<HttpServer> startHttpServer(Router router, int port) {
    return vertx.createHttpServer()
      .requestHandler(router)
      .listen(port)
      .onSuccess(server -> log.info("HTTP server started on port {}", server.actualPort()))
      .onFailure(err -> log.error("Failed to start HTTP server", err));
  }

  private MetricsReporter createReporter(MetricsConfig config, Router router) {
    if (!config.isEnabled()) {
      log.info("Metrics reporting is disabled");
      return MetricsReporter.NOOP;
    }

    MeterRegistry registry = MicrometerConfig.createRegistry(config.reporterType());
    if (registry == null) {
      log.warn("Failed to create meter registry for type: {}", config.reporterType());
      return MetricsReporter.NOOP;
    }

    if (config.jvmMetricsEnabled()) {
      MicrometerConfig.bindJvmMetrics(registry);
      log.info("JVM metrics enabled");
    }

    if (registry instanceof PrometheusMeterRegistry prometheusRegistry) {
      new PrometheusHandler(prometheusRegistry).registerRoutes(router);
    }

    return new MicrometerReporter(registry);
  }
}
