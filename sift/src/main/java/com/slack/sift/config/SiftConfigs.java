package com.slack.sift.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Config structs bound from the yaml or json config file. Every field has a default so a partial
 * config file is valid input; {@link ValidateSiftConfig} enforces the value ranges.
 */
public final class SiftConfigs {

  private SiftConfigs() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SiftConfig {
    @JsonProperty private ClusterConfig clusterConfig = new ClusterConfig();
    @JsonProperty private SearchConfig searchConfig = new SearchConfig();
    @JsonProperty private TransportConfig transportConfig = new TransportConfig();

    public ClusterConfig getClusterConfig() {
      return clusterConfig;
    }

    public SearchConfig getSearchConfig() {
      return searchConfig;
    }

    public TransportConfig getTransportConfig() {
      return transportConfig;
    }

    @Override
    public String toString() {
      return "SiftConfig{"
          + "clusterConfig="
          + clusterConfig
          + ", searchConfig="
          + searchConfig
          + ", transportConfig="
          + transportConfig
          + '}';
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class ClusterConfig {
    @JsonProperty private String clusterName = "";
    @JsonProperty private String env = "";

    public String getClusterName() {
      return clusterName;
    }

    public String getEnv() {
      return env;
    }

    @Override
    public String toString() {
      return "ClusterConfig{clusterName='" + clusterName + "', env='" + env + "'}";
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class SearchConfig {
    @JsonProperty private int rowsPerPage = 50;
    @JsonProperty private String timestampColumn = "_timestamp";
    @JsonProperty private boolean sqlBase64Enabled = false;
    @JsonProperty private int minAutoRefreshInterval = 5;
    @JsonProperty private boolean histogramEnabled = true;
    @JsonProperty private String streamType = "logs";

    public int getRowsPerPage() {
      return rowsPerPage;
    }

    public String getTimestampColumn() {
      return timestampColumn;
    }

    public boolean getSqlBase64Enabled() {
      return sqlBase64Enabled;
    }

    public int getMinAutoRefreshInterval() {
      return minAutoRefreshInterval;
    }

    public boolean getHistogramEnabled() {
      return histogramEnabled;
    }

    public String getStreamType() {
      return streamType;
    }

    @Override
    public String toString() {
      return "SearchConfig{"
          + "rowsPerPage="
          + rowsPerPage
          + ", timestampColumn='"
          + timestampColumn
          + '\''
          + ", sqlBase64Enabled="
          + sqlBase64Enabled
          + ", minAutoRefreshInterval="
          + minAutoRefreshInterval
          + ", histogramEnabled="
          + histogramEnabled
          + ", streamType='"
          + streamType
          + '\''
          + '}';
    }
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public static class TransportConfig {
    @JsonProperty private String baseUri = "http://localhost:5080";
    @JsonProperty private String websocketPath = "/api/{org}/ws/v2";
    @JsonProperty private String orgId = "default";
    @JsonProperty private boolean websocketEnabled = true;
    @JsonProperty private boolean useCache = true;
    @JsonProperty private long requestTimeoutMs = 300000;

    public String getBaseUri() {
      return baseUri;
    }

    public String getWebsocketPath() {
      return websocketPath;
    }

    public String getOrgId() {
      return orgId;
    }

    public boolean getWebsocketEnabled() {
      return websocketEnabled;
    }

    public boolean getUseCache() {
      return useCache;
    }

    public long getRequestTimeoutMs() {
      return requestTimeoutMs;
    }

    @Override
    public String toString() {
      return "TransportConfig{"
          + "baseUri='"
          + baseUri
          + '\''
          + ", websocketPath='"
          + websocketPath
          + '\''
          + ", orgId='"
          + orgId
          + '\''
          + ", websocketEnabled="
          + websocketEnabled
          + ", useCache="
          + useCache
          + ", requestTimeoutMs="
          + requestTimeoutMs
          + '}';
    }
  }
}
