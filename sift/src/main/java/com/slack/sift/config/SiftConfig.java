package com.slack.sift.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.util.JsonUtil;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.text.StringSubstitutor;
import org.apache.commons.text.lookup.StringLookup;

/** SiftConfig holds the process wide config, loaded once from a yaml or json file. */
public class SiftConfig {

  private static SiftConfig _instance = null;

  // Parse a json string as a SiftConfig struct.
  @VisibleForTesting
  static SiftConfigs.SiftConfig fromJsonConfig(String jsonStr) throws IOException {
    if (jsonStr == null || jsonStr.isBlank()) {
      throw new IllegalArgumentException("Config can't be empty");
    }
    SiftConfigs.SiftConfig config = JsonUtil.read(jsonStr, SiftConfigs.SiftConfig.class);
    ValidateSiftConfig.validateConfig(config);
    return config;
  }

  // Parse a yaml string as a SiftConfig struct, resolving ${VAR} references from the environment.
  @VisibleForTesting
  public static SiftConfigs.SiftConfig fromYamlConfig(String yamlStr) throws IOException {
    return fromYamlConfig(yamlStr, System::getenv);
  }

  @VisibleForTesting
  public static SiftConfigs.SiftConfig fromYamlConfig(
      String yamlStr, StringLookup variableResolver) throws IOException {
    if (yamlStr == null || yamlStr.isBlank()) {
      throw new IllegalArgumentException("Config can't be empty");
    }
    StringSubstitutor substitute = new StringSubstitutor(variableResolver);
    ObjectMapper yamlReader = new ObjectMapper(new YAMLFactory());
    ObjectMapper jsonWriter = new ObjectMapper();

    Object obj = yamlReader.readValue(substitute.replace(yamlStr), Object.class);
    if (obj == null) {
      throw new IllegalArgumentException("Config can't be empty");
    }
    return fromJsonConfig(jsonWriter.writeValueAsString(obj));
  }

  @VisibleForTesting
  static void reset() {
    _instance = null;
  }

  public static void initFromFile(Path cfgFilePath) throws IOException {
    if (_instance == null) {
      if (Files.notExists(cfgFilePath)) {
        throw new IllegalArgumentException(
            "Missing config file at: " + cfgFilePath.toAbsolutePath());
      }

      String filename = cfgFilePath.getFileName().toString();
      if (filename.endsWith(".yaml")) {
        _instance = new SiftConfig(fromYamlConfig(Files.readString(cfgFilePath)));
      } else if (filename.endsWith(".json")) {
        _instance = new SiftConfig(fromJsonConfig(Files.readString(cfgFilePath)));
      } else {
        throw new IllegalArgumentException(
            "Invalid config file format provided - must be either .json or .yaml");
      }
    }
  }

  public static SiftConfigs.SiftConfig get() {
    if (_instance == null) {
      throw new IllegalStateException("SiftConfig not initialized");
    }
    return _instance.config;
  }

  private final SiftConfigs.SiftConfig config;

  private SiftConfig(SiftConfigs.SiftConfig config) {
    this.config = config;
  }
}
