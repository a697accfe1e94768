package com.slack.sift.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.transport.SearchResponse;
import com.slack.sift.transport.TimeOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Results of the current run. Pages read from several partitions are appended into one hit list;
 * {@code total} is the number of rows known to match, kept in step with the partition totals.
 */
public class QueryResults {
  private List<JsonNode> hits = new ArrayList<>();
  private long total = 0;
  private int from = 0;
  private long took = 0;
  private double scanSize = 0;
  private int resultCacheRatio = 0;
  private String functionError;
  private Boolean histogramEligible;
  private Long histogramInterval;
  private List<List<String>> orderByMetadata;
  private TimeOffset timeOffset;
  private boolean streamingAggs = false;
  private PartitionDetail partitionDetail = PartitionDetail.empty();

  public void reset() {
    hits = new ArrayList<>();
    total = 0;
    from = 0;
    took = 0;
    scanSize = 0;
    resultCacheRatio = 0;
    functionError = null;
    histogramEligible = null;
    histogramInterval = null;
    orderByMetadata = null;
    timeOffset = null;
    streamingAggs = false;
    partitionDetail = PartitionDetail.empty();
  }

  /** Replaces the page with {@code response}. The total is left to the partition totals. */
  public void replace(SearchResponse response) {
    hits = new ArrayList<>(response.getHits());
    from = response.getFrom();
    took = response.getTook();
    scanSize = response.getScanSize();
    acceptMetadata(response);
  }

  /** Adds the next slice of a page. */
  public void append(SearchResponse response) {
    hits.addAll(response.getHits());
    from += response.getFrom();
    took += response.getTook();
    scanSize += response.getScanSize();
    acceptMetadata(response);
  }

  private void acceptMetadata(SearchResponse response) {
    resultCacheRatio = response.getResultCacheRatio();
    functionError = response.getFunctionError();
    if (response.getHistogramEligible() != null) {
      histogramEligible = response.getHistogramEligible();
    }
    if (response.getOrderByMetadata() != null && !response.getOrderByMetadata().isEmpty()) {
      orderByMetadata = response.getOrderByMetadata();
    }
    if (response.getTimeOffset() != null) {
      timeOffset = response.getTimeOffset();
    }
    streamingAggs = streamingAggs || response.isStreamingAggs();
  }

  public void addCounters(long took, double scanSize) {
    this.took += took;
    this.scanSize += scanSize;
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

  public long getTook() {
    return took;
  }

  public double getScanSize() {
    return scanSize;
  }

  public int getResultCacheRatio() {
    return resultCacheRatio;
  }

  public String getFunctionError() {
    return functionError;
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

  public void setHistogramInterval(Long histogramInterval) {
    this.histogramInterval = histogramInterval;
  }

  public List<List<String>> getOrderByMetadata() {
    return orderByMetadata;
  }

  public TimeOffset getTimeOffset() {
    return timeOffset;
  }

  public boolean isStreamingAggs() {
    return streamingAggs;
  }

  public PartitionDetail getPartitionDetail() {
    return partitionDetail;
  }

  public void setPartitionDetail(PartitionDetail partitionDetail) {
    this.partitionDetail = partitionDetail;
  }

  @Override
  public String toString() {
    return "QueryResults{"
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
        + ", partitions="
        + partitionDetail.size()
        + '}';
  }
}
