package io.github.themoah.pegdiff.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x configuration. Comparisons run on the worker pool, sized via
 * VERTX_WORKER_POOL_SIZE.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_WORKER_POOL_SIZE = "VERTX_WORKER_POOL_SIZE";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    options.setPreferNativeTransport(true);
    options.setWorkerPoolSize(workerPoolSize());
    return options;
  }

  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions();
  }

  public static int workerPoolSize() {
    String value = System.getenv(ENV_WORKER_POOL_SIZE);
    if (value == null || value.isBlank()) {
      return VertxOptions.DEFAULT_WORKER_POOL_SIZE;
    }
    try {
      int size = Integer.parseInt(value);
      if (size > 0) {
        log.info("Worker pool size set to {}", size);
        return size;
      }
      log.warn("{} must be positive, got {}", ENV_WORKER_POOL_SIZE, size);
    } catch (NumberFormatException e) {
      log.warn("Invalid value for {}: '{}'", ENV_WORKER_POOL_SIZE, value);
    }
    return VertxOptions.DEFAULT_WORKER_POOL_SIZE;
  }
}
