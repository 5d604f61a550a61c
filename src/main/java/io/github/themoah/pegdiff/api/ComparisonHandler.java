package io.github.themoah.pegdiff.api;

import io.github.themoah.pegdiff.config.InvalidConfigException;
import io.github.themoah.pegdiff.engine.ComparisonEngine;
import io.github.themoah.pegdiff.metrics.MetricsReporter;
import io.github.themoah.pegdiff.model.ComparisonReport;
import io.github.themoah.pegdiff.model.RankedPage;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.core.http.HttpHeaders;
import io.vertx.core.json.DecodeException;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.BodyHandler;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for comparison endpoints. The engine runs on the worker pool so the event loop
 * never waits on ranking or hypothesis tests.
 */
public class ComparisonHandler {

  private static final Logger log = LoggerFactory.getLogger(ComparisonHandler.class);
  private static final String CONTENT_TYPE_JSON = "application/json";

  public static final String COMPARISONS_PATH = "/api/v1/comparisons";
  public static final String TABLE_PATH = "/api/v1/comparisons/table";

  private final Vertx vertx;
  private final ComparisonEngine engine;
  private final ComparisonRequestParser parser;
  private final MetricsReporter reporter;
  private final long maxBodySizeBytes;

  public ComparisonHandler(
      Vertx vertx,
      ComparisonEngine engine,
      ComparisonRequestParser parser,
      MetricsReporter reporter,
      long maxBodySizeBytes) {
    this.vertx = vertx;
    this.engine = engine;
    this.parser = parser;
    this.reporter = reporter;
    this.maxBodySizeBytes = maxBodySizeBytes;
  }

  /**
   * Registers the comparison routes on the router.
   *
   * @param router the Vert.x router
   */
  public void registerRoutes(Router router) {
    router.post("/api/v1/*").handler(BodyHandler.create().setBodyLimit(maxBodySizeBytes));
    router.post(TABLE_PATH).handler(this::handleTable);
    router.post(COMPARISONS_PATH).handler(this::handleCompare);
    log.info("Comparison routes registered: {}, {}", COMPARISONS_PATH, TABLE_PATH);
  }

  private void handleCompare(RoutingContext ctx) {
    ComparisonRequest request;
    try {
      request = parser.parse(readBody(ctx));
    } catch (ComparisonRequestException e) {
      reject(ctx, "malformed_request", e);
      return;
    }

    vertx.executeBlocking(() -> {
        long start = System.nanoTime();
        ComparisonReport report = engine.compare(request.samples(), request.query(), request.config());
        reporter.reportComparison(report, Duration.ofNanos(System.nanoTime() - start));
        return report;
      }, false)
      .onSuccess(report -> respond(ctx, 200, ComparisonJson.toJson(report)))
      .onFailure(err -> fail(ctx, err));
  }

  private void handleTable(RoutingContext ctx) {
    ComparisonRequest request;
    try {
      request = parser.parse(readBody(ctx));
    } catch (ComparisonRequestException e) {
      reject(ctx, "malformed_request", e);
      return;
    }

    vertx.executeBlocking(() -> {
        long start = System.nanoTime();
        RankedPage page = engine.table(request.samples(), request.query(), request.config());
        reporter.reportTable(page, Duration.ofNanos(System.nanoTime() - start));
        return page;
      }, false)
      .onSuccess(page -> respond(ctx, 200, ComparisonJson.toJson(page)))
      .onFailure(err -> fail(ctx, err));
  }

  private static JsonObject readBody(RoutingContext ctx) {
    Buffer buffer = ctx.body().buffer();
    if (buffer == null || buffer.length() == 0) {
      throw new ComparisonRequestException("Request body is required");
    }
    try {
      return new JsonObject(buffer);
    } catch (DecodeException e) {
      throw new ComparisonRequestException("Request body is not valid JSON", e);
    }
  }

  private void fail(RoutingContext ctx, Throwable err) {
    if (err instanceof InvalidConfigException) {
      reject(ctx, "invalid_config", err);
    } else if (err instanceof IllegalArgumentException || err instanceof ComparisonRequestException) {
      reject(ctx, "invalid_input", err);
    } else {
      log.error("Comparison failed", err);
      reporter.reportRejected("internal_error");
      respond(ctx, 500, new JsonObject().put("error", "Internal Server Error"));
    }
  }

  private void reject(RoutingContext ctx, String reason, Throwable err) {
    log.debug("Rejected comparison request ({}): {}", reason, err.getMessage());
    reporter.reportRejected(reason);
    respond(ctx, 400, new JsonObject().put("error", err.getMessage()));
  }

  private static void respond(RoutingContext ctx, int status, JsonObject body) {
    ctx.response()
      .putHeader(HttpHeaders.CONTENT_TYPE, CONTENT_TYPE_JSON)
      .setStatusCode(status)
      .end(body.encode());
  }
}
