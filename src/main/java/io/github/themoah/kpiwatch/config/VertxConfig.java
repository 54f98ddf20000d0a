package io.github.themoah.kpiwatch.config;

import io.vertx.core.DeploymentOptions;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Vert.x instance and deployment options.
 * Native transport can be turned off with VERTX_PREFER_NATIVE_TRANSPORT=false.
 */
public class VertxConfig {

  private static final Logger log = LoggerFactory.getLogger(VertxConfig.class);
  private static final String ENV_PREFER_NATIVE_TRANSPORT = "VERTX_PREFER_NATIVE_TRANSPORT";

  public static VertxOptions createVertxOptions() {
    VertxOptions options = new VertxOptions();
    boolean nativeTransport = EnvReader.system().getBoolean(ENV_PREFER_NATIVE_TRANSPORT, true);
    options.setPreferNativeTransport(nativeTransport);
    log.info("Vert.x options: preferNativeTransport={}", nativeTransport);
    return options;
  }

  /**
   * A single instance: the series store and monitor are owned by one verticle.
   */
  public static DeploymentOptions createDeploymentOptions() {
    return new DeploymentOptions().setInstances(1);
  }
}
