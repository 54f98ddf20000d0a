package io.github.themoah.kpiwatch;

import io.github.themoah.kpiwatch.config.VertxConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point: deploys {@link MainVerticle} and undeploys it cleanly on SIGTERM/SIGINT.
 */
public class KpiwatchLauncher {

  private static final Logger log = LoggerFactory.getLogger(KpiwatchLauncher.class);

  public static void main(String[] args) {
    VertxOptions vertxOptions = VertxConfig.createVertxOptions();
    Vertx vertx = Vertx.vertx(vertxOptions);

    DeploymentOptions deploymentOptions = VertxConfig.createDeploymentOptions();

    vertx.deployVerticle(new MainVerticle(), deploymentOptions)
      .onSuccess(id -> {
        log.info("MainVerticle deployed with ID: {}", id);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> shutdown(vertx), "kpiwatch-shutdown"));
      })
      .onFailure(err -> {
        log.error("Failed to deploy MainVerticle", err);
        vertx.close();
        System.exit(1);
      });
  }

  // Vertx.close() undeploys the verticle, which lets the monitor finish its current pass
  private static void shutdown(Vertx vertx) {
    log.info("Shutdown signal received, closing Vert.x");
    try {
      vertx.close().toCompletionStage().toCompletableFuture().get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while closing Vert.x");
    } catch (ExecutionException e) {
      log.error("Error while closing Vert.x", e.getCause());
    }
  }
}
