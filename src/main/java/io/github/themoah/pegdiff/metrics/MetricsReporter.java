package io.github.themoah.pegdiff.metrics;

import io.github.themoah.pegdiff.model.ComparisonReport;
import io.github.themoah.pegdiff.model.RankedPage;
import io.vertx.core.Future;
import java.time.Duration;

/**
 * Interface for reporting comparison activity to external systems.
 */
public interface MetricsReporter {

  /**
   * Reporter used when metrics are disabled.
   */
  MetricsReporter NOOP = new MetricsReporter() {
    @Override
    public void reportComparison(ComparisonReport report, Duration elapsed) {
    }

    @Override
    public Future<Void> close() {
      return Future.succeededFuture();
    }
  };

  /**
   * Records a completed comparison run.
   *
   * @param report the engine output
   * @param elapsed engine wall time
   */
  void reportComparison(ComparisonReport report, Duration elapsed);

  /**
   * Records a table-only request.
   *
   * @param page the returned page
   * @param elapsed engine wall time
   */
  default void reportTable(RankedPage page, Duration elapsed) {
    // Default no-op implementation for non-Micrometer reporters
  }

  /**
   * Records a rejected request.
   *
   * @param reason short error category used as a tag
   */
  default void reportRejected(String reason) {
    // Default no-op implementation for non-Micrometer reporters
  }

  /**
   * Closes the reporter and releases resources.
   *
   * @return Future that completes when closed
   */
  Future<Void> close();
}
