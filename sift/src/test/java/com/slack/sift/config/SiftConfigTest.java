package com.slack.sift.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.AssertionsForClassTypes.assertThatExceptionOfType;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.apache.commons.text.lookup.StringLookupFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SiftConfigTest {

  @TempDir Path tempDir;

  @BeforeEach
  public void setUp() {
    SiftConfig.reset();
  }

  @AfterEach
  public void tearDown() {
    SiftConfig.reset();
  }

  private static Path resource(String name) throws URISyntaxException {
    return Path.of(SiftConfigTest.class.getClassLoader().getResource(name).toURI());
  }

  @Test
  public void testInitWithMissingConfigFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SiftConfig.initFromFile(Path.of("missing_config_file.yaml")));
  }

  @Test
  public void testGetBeforeInit() {
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(SiftConfig::get);
  }

  @Test
  public void testEmptyJsonCfgFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SiftConfig.fromJsonConfig(""));
  }

  @Test
  public void testEmptyYamlCfgFile() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SiftConfig.fromYamlConfig(""));
  }

  @Test
  public void testUnsupportedFileExtension() throws IOException {
    Path config = Files.writeString(tempDir.resolve("config.toml"), "rowsPerPage = 1");
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SiftConfig.initFromFile(config));
  }

  @Test
  public void testParseYamlConfigFile() throws IOException, URISyntaxException {
    SiftConfig.initFromFile(resource("test_config.yaml"));
    SiftConfigs.SiftConfig config = SiftConfig.get();

    assertThat(config.getClusterConfig().getEnv()).isEqualTo("test");
    SiftConfigs.SearchConfig searchConfig = config.getSearchConfig();
    assertThat(searchConfig.getRowsPerPage()).isEqualTo(100);
    assertThat(searchConfig.getTimestampColumn()).isEqualTo("_timestamp");
    assertThat(searchConfig.getSqlBase64Enabled()).isTrue();
    assertThat(searchConfig.getMinAutoRefreshInterval()).isEqualTo(10);
    assertThat(searchConfig.getHistogramEnabled()).isFalse();
    assertThat(searchConfig.getStreamType()).isEqualTo("logs");

    SiftConfigs.TransportConfig transportConfig = config.getTransportConfig();
    assertThat(transportConfig.getOrgId()).isEqualTo("test_org");
    assertThat(transportConfig.getWebsocketEnabled()).isFalse();
    assertThat(transportConfig.getUseCache()).isFalse();
    assertThat(transportConfig.getRequestTimeoutMs()).isEqualTo(5000);
  }

  @Test
  public void testParseJsonConfigFileUsesDefaultsForMissingFields()
      throws IOException, URISyntaxException {
    SiftConfig.initFromFile(resource("test_config.json"));
    SiftConfigs.SiftConfig config = SiftConfig.get();

    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("json_cluster");
    assertThat(config.getSearchConfig().getRowsPerPage()).isEqualTo(25);
    assertThat(config.getSearchConfig().getTimestampColumn()).isEqualTo("ts");
    assertThat(config.getSearchConfig().getMinAutoRefreshInterval()).isEqualTo(5);
    assertThat(config.getSearchConfig().getStreamType()).isEqualTo("logs");
    assertThat(config.getTransportConfig().getBaseUri()).isEqualTo("http://search.example.com");
    assertThat(config.getTransportConfig().getWebsocketPath()).isEqualTo("/api/{org}/ws/v2");
    assertThat(config.getTransportConfig().getWebsocketEnabled()).isTrue();
  }

  @Test
  public void testEnvironmentVariablesAreSubstituted() throws IOException {
    String yaml =
        "clusterConfig:\n"
            + "  clusterName: ${CLUSTER_NAME}\n"
            + "  env: ${MISSING_ENV:-staging}\n"
            + "searchConfig:\n"
            + "  rowsPerPage: ${ROWS}\n";
    Map<String, String> env = Map.of("CLUSTER_NAME", "c1", "ROWS", "75");
    SiftConfigs.SiftConfig config =
        SiftConfig.fromYamlConfig(yaml, StringLookupFactory.INSTANCE.mapStringLookup(env));

    assertThat(config.getClusterConfig().getClusterName()).isEqualTo("c1");
    assertThat(config.getClusterConfig().getEnv()).isEqualTo("staging");
    assertThat(config.getSearchConfig().getRowsPerPage()).isEqualTo(75);
  }

  @Test
  public void testUnknownFieldsAreIgnored() throws IOException {
    SiftConfigs.SiftConfig config =
        SiftConfig.fromJsonConfig("{\"searchConfig\": {\"rowsPerPage\": 10, \"unknown\": 1}}");
    assertThat(config.getSearchConfig().getRowsPerPage()).isEqualTo(10);
  }

  @Test
  public void testInvalidRowsPerPage() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> SiftConfig.fromJsonConfig("{\"searchConfig\": {\"rowsPerPage\": 0}}"));
  }

  @Test
  public void testInvalidRequestTimeout() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(
            () ->
                SiftConfig.fromJsonConfig(
                    "{\"transportConfig\": {\"requestTimeoutMs\": 10}}"));
  }

  @Test
  public void testEmptyOrgId() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(
            () -> SiftConfig.fromJsonConfig("{\"transportConfig\": {\"orgId\": \"\"}}"));
  }
}
