package com.slack.sift.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of one search call. Over http this is the response body; over the websocket it is
 * accumulated from the streamed frames of one trace.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class SearchResponse {
  @JsonProperty("hits")
  private List<JsonNode> hits = new ArrayList<>();

  @JsonProperty("total")
  private long total;

  @JsonProperty("from")
  private int from;

  @JsonProperty("took")
  private long took;

  @JsonProperty("scan_size")
  private double scanSize;

  @JsonProperty("result_cache_ratio")
  private int resultCacheRatio;

  @JsonProperty("function_error")
  private String functionError;

  @JsonProperty("new_start_time")
  private Long newStartTime;

  @JsonProperty("new_end_time")
  private Long newEndTime;

  @JsonProperty("is_histogram_eligible")
  private Boolean histogramEligible;

  @JsonProperty("histogram_interval")
  private Long histogramInterval;

  // [[field, "asc"|"desc"], ...]
  @JsonProperty("order_by_metadata")
  private List<List<String>> orderByMetadata = new ArrayList<>();

  @JsonProperty("time_offset")
  private TimeOffset timeOffset;

  @JsonProperty("streaming_aggs")
  private boolean streamingAggs;

  @JsonProperty("trace_id")
  private String traceId;

  public SearchResponse() {}

  public SearchResponse(List<JsonNode> hits, long total, int from, long took, double scanSize) {
    this.hits = new ArrayList<>(hits);
    this.total = total;
    this.from = from;
    this.took = took;
    this.scanSize = scanSize;
  }

  /**
   * Folds the next streamed chunk of the same trace into this response: hits are appended, the
   * counters are summed and the latest non-null metadata wins.
   */
  public void merge(SearchResponse next) {
    hits.addAll(next.hits);
    total += next.total;
    took += next.took;
    scanSize += next.scanSize;
    resultCacheRatio = Math.max(resultCacheRatio, next.resultCacheRatio);
    mergeMetadata(next);
  }

  /** Merges only the metadata of a chunk that carries no hits. */
  public void mergeMetadata(SearchResponse next) {
    if (next.functionError != null && !next.functionError.isEmpty()) {
      functionError = next.functionError;
    }
    if (next.newStartTime != null) {
      newStartTime = next.newStartTime;
    }
    if (next.newEndTime != null) {
      newEndTime = next.newEndTime;
    }
    if (next.histogramEligible != null) {
      histogramEligible = next.histogramEligible;
    }
    if (next.histogramInterval != null) {
      histogramInterval = next.histogramInterval;
    }
    if (next.orderByMetadata != null && !next.orderByMetadata.isEmpty()) {
      orderByMetadata = next.orderByMetadata;
    }
    if (next.timeOffset != null) {
      timeOffset = next.timeOffset;
    }
    streamingAggs |= next.streamingAggs;
    if (next.traceId != null) {
      traceId = next.traceId;
    }
  }

  public List<JsonNode> getHits() {
    return hits;
  }

  public void setHits(List<JsonNode> hits) {
    this.hits = new ArrayList<>(hits);
  }

  public long getTotal() {
    return total;
  }

  public void setTotal(long total) {
    this.total = total;
  }

  public int getFrom() {
    return from;
  }

  public void setFrom(int from) {
    this.from = from;
  }

  public long getTook() {
    return took;
  }

  public void setTook(long took) {
    this.took = took;
  }

  public double getScanSize() {
    return scanSize;
  }

  public void setScanSize(double scanSize) {
    this.scanSize = scanSize;
  }

  public int getResultCacheRatio() {
    return resultCacheRatio;
  }

  public String getFunctionError() {
    return functionError;
  }

  public void setFunctionError(String functionError) {
    this.functionError = functionError;
  }

  public Long getNewStartTime() {
    return newStartTime;
  }

  public Long getNewEndTime() {
    return newEndTime;
  }

  public void setNewTimeRange(Long newStartTime, Long newEndTime) {
    this.newStartTime = newStartTime;
    this.newEndTime = newEndTime;
  }

  public Boolean getHistogramEligible() {
    return histogramEligible;
  }

  public void setHistogramEligible(Boolean histogramEligible) {
    this.histogramEligible = histogramEligible;
  }

  public Long getHistogramInterval() {
    return histogramInterval;
  }

  public List<List<String>> getOrderByMetadata() {
    return orderByMetadata;
  }

  public void setOrderByMetadata(List<List<String>> orderByMetadata) {
    this.orderByMetadata = orderByMetadata;
  }

  public TimeOffset getTimeOffset() {
    return timeOffset;
  }

  public void setTimeOffset(TimeOffset timeOffset) {
    this.timeOffset = timeOffset;
  }

  public boolean isStreamingAggs() {
    return streamingAggs;
  }

  public void setStreamingAggs(boolean streamingAggs) {
    this.streamingAggs = streamingAggs;
  }

  public String getTraceId() {
    return traceId;
  }

  public void setTraceId(String traceId) {
    this.traceId = traceId;
  }

  @Override
  public String toString() {
    return "SearchResponse{"
        + "hits="
        + hits.size()
        + ", total="
        + total
        + ", from="
        + from
        + ", took="
        + took
        + ", scanSize="
        + scanSize
        + ", functionError='"
        + functionError
        + '\''
        + ", traceId='"
        + traceId
        + '\''
        + '}';
  }
}
