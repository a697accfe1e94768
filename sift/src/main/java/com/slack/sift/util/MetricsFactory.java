package com.slack.sift.util;

import com.slack.sift.config.SiftConfigs;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

public class MetricsFactory {
  private static PrometheusMeterRegistry _instance = null;

  public static void init(SiftConfigs.SiftConfig config) {
    if (_instance == null) {
      _instance = initPrometheusMeterRegistry(config);
    }
  }

  private static PrometheusMeterRegistry initPrometheusMeterRegistry(
      SiftConfigs.SiftConfig config) {
    PrometheusMeterRegistry prometheusMeterRegistry =
        new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
    prometheusMeterRegistry
        .config()
        .commonTags(
            "sift_cluster_name",
            config.getClusterConfig().getClusterName(),
            "sift_env",
            config.getClusterConfig().getEnv(),
            "sift_org",
            config.getTransportConfig().getOrgId());
    return prometheusMeterRegistry;
  }

  public static PrometheusMeterRegistry getRegistry() {
    if (_instance == null) {
      throw new IllegalStateException("MetricsFactory not initialized");
    }
    return _instance;
  }

  static void reset() {
    _instance = null;
  }
}
