package com.slack.sift.config;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.Strings;

public class ValidateSiftConfig {

  /**
   * ValidateConfig ensures the config values are usable before any search is issued. Classes
   * consuming a config value may still apply their own checks.
   */
  public static void validateConfig(SiftConfigs.SiftConfig siftConfig) {
    validateSearchConfig(siftConfig.getSearchConfig());
    validateTransportConfig(siftConfig.getTransportConfig());
  }

  private static void validateSearchConfig(SiftConfigs.SearchConfig searchConfig) {
    checkArgument(searchConfig.getRowsPerPage() > 0, "SearchConfig rowsPerPage must be positive");
    checkArgument(
        !Strings.isNullOrEmpty(searchConfig.getTimestampColumn()),
        "SearchConfig timestampColumn can't be empty");
    checkArgument(
        searchConfig.getMinAutoRefreshInterval() >= 1,
        "SearchConfig minAutoRefreshInterval cannot be less than 1s");
    checkArgument(
        !Strings.isNullOrEmpty(searchConfig.getStreamType()),
        "SearchConfig streamType can't be empty");
  }

  private static void validateTransportConfig(SiftConfigs.TransportConfig transportConfig) {
    checkArgument(
        !Strings.isNullOrEmpty(transportConfig.getBaseUri()),
        "TransportConfig baseUri can't be empty");
    checkArgument(
        !Strings.isNullOrEmpty(transportConfig.getOrgId()),
        "TransportConfig orgId can't be empty");
    checkArgument(
        transportConfig.getRequestTimeoutMs() >= 1000,
        "TransportConfig requestTimeoutMs cannot less than 1000ms");
  }
}
