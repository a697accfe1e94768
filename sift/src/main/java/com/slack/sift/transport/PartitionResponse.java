package com.slack.sift.transport;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/** Response of the partition service: the time ranges the window is split into. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PartitionResponse {
  @JsonProperty("trace_id")
  private String traceId;

  // [[start_time, end_time], ...]
  @JsonProperty("partitions")
  private List<List<Long>> partitions = new ArrayList<>();

  @JsonProperty("records")
  private long records;

  @JsonProperty("histogram_interval")
  private Long histogramInterval;

  @JsonProperty("is_histogram_eligible")
  private Boolean histogramEligible;

  @JsonProperty("streaming_aggs")
  private boolean streamingAggs;

  @JsonProperty("streaming_id")
  private String streamingId;

  @JsonProperty("order_by")
  private String orderBy;

  public PartitionResponse() {}

  public PartitionResponse(List<List<Long>> partitions, long records) {
    this.partitions = partitions;
    this.records = records;
  }

  public String getTraceId() {
    return traceId;
  }

  public List<List<Long>> getPartitions() {
    return partitions;
  }

  public long getRecords() {
    return records;
  }

  public Long getHistogramInterval() {
    return histogramInterval;
  }

  public void setHistogramInterval(Long histogramInterval) {
    this.histogramInterval = histogramInterval;
  }

  public Boolean getHistogramEligible() {
    return histogramEligible;
  }

  public void setHistogramEligible(Boolean histogramEligible) {
    this.histogramEligible = histogramEligible;
  }

  public boolean isStreamingAggs() {
    return streamingAggs;
  }

  public void setStreaming(boolean streamingAggs, String streamingId) {
    this.streamingAggs = streamingAggs;
    this.streamingId = streamingId;
  }

  public String getStreamingId() {
    return streamingId;
  }

  public String getOrderBy() {
    return orderBy;
  }
}
