package io.github.themoah.pegdiff;

import io.github.themoah.pegdiff.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the pegdiff service. Comparisons run on the Vert.x worker pool, so its size
 * bounds how many requests are ranked and tested at once.
 */
public class PegdiffLauncher {

  private static final Logger log = LoggerFactory.getLogger(PegdiffLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);
    log.info("pegdiff starting with {} comparison workers", vertxOptions.getWorkerPoolSize());

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> log.info("pegdiff comparison service deployed ({})", id))
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }
}
