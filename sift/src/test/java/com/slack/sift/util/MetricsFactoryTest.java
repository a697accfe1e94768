package com.slack.sift.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.slack.sift.config.SiftConfig;
import com.slack.sift.config.SiftConfigs;
import io.micrometer.core.instrument.Counter;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class MetricsFactoryTest {
  private static final String CONFIG =
      String.join(
          "\n",
          "clusterConfig:",
          "  clusterName: c1",
          "  env: staging",
          "transportConfig:",
          "  orgId: acme");

  @BeforeEach
  public void setUp() {
    MetricsFactory.reset();
  }

  @AfterEach
  public void tearDown() {
    MetricsFactory.reset();
  }

  @Test
  public void testRegistryBeforeInit() {
    assertThatExceptionOfType(IllegalStateException.class)
        .isThrownBy(MetricsFactory::getRegistry);
  }

  @Test
  public void testRegistryCarriesClusterTags() throws IOException {
    SiftConfigs.SiftConfig config = SiftConfig.fromYamlConfig(CONFIG);

    MetricsFactory.init(config);
    PrometheusMeterRegistry registry = MetricsFactory.getRegistry();
    MetricsFactory.init(config);

    assertThat(MetricsFactory.getRegistry()).isSameAs(registry);
    Counter counter = registry.counter("sift_test_counter");
    assertThat(counter.getId().getTag("sift_cluster_name")).isEqualTo("c1");
    assertThat(counter.getId().getTag("sift_env")).isEqualTo("staging");
    assertThat(counter.getId().getTag("sift_org")).isEqualTo("acme");
  }
}
