package com.slack.sift.histogram;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.query.ChartInterval;
import com.slack.sift.query.QueryBuilder;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Zero filled buckets covering the searched window, into which the per partition histogram results
 * are merged. Buckets are keyed by their formatted start time, which sorts chronologically.
 */
public class HistogramSkeleton {
  private static final Logger LOG = LoggerFactory.getLogger(HistogramSkeleton.class);

  private final TreeMap<String, HistogramBucket> buckets;
  private int mergedPartitions = 0;

  @VisibleForTesting
  HistogramSkeleton(TreeMap<String, HistogramBucket> buckets) {
    this.buckets = buckets;
  }

  /**
   * Lays out empty buckets from the aligned start of the window up to its end.
   *
   * @param serverIntervalSeconds bucket width reported by the server, used instead of the chart
   *     interval width when present
   */
  public static HistogramSkeleton build(
      long startTimeMicros,
      long endTimeMicros,
      ChartInterval chartInterval,
      Long serverIntervalSeconds) {
    long widthMicros =
        serverIntervalSeconds != null && serverIntervalSeconds > 0
            ? serverIntervalSeconds * 1_000_000L
            : chartInterval.widthMicros();

    Instant start =
        chartInterval.alignStart(Instant.EPOCH.plus(startTimeMicros, ChronoUnit.MICROS));
    long bucketMicros = ChronoUnit.MICROS.between(Instant.EPOCH, start);

    TreeMap<String, HistogramBucket> buckets = new TreeMap<>();
    while (bucketMicros < endTimeMicros) {
      String key = ChartInterval.formatKey(Instant.EPOCH.plus(bucketMicros, ChronoUnit.MICROS));
      buckets.put(key, new HistogramBucket(key));
      bucketMicros += widthMicros;
    }
    LOG.debug("Built histogram skeleton of {} buckets, width {}us", buckets.size(), widthMicros);
    return new HistogramSkeleton(buckets);
  }

  /**
   * Adds one partition's {@code zo_sql_key}/{@code zo_sql_num} rows. Counts of an existing key are
   * summed, keys outside the skeleton are added.
   *
   * @return the number of events in the merged rows
   */
  public long merge(List<JsonNode> rows) {
    long partitionCount = 0;
    for (JsonNode row : rows) {
      JsonNode key = row.get(QueryBuilder.HISTOGRAM_KEY);
      if (key == null || key.isNull()) {
        LOG.debug("Skipping histogram row without key {}", row);
        continue;
      }
      long count = row.path(QueryBuilder.HISTOGRAM_COUNT).asLong(0);
      String bucketKey = normalizeKey(key.asText());
      buckets.computeIfAbsent(bucketKey, HistogramBucket::new).increment(count);
      partitionCount += count;
    }
    mergedPartitions++;
    return partitionCount;
  }

  // Server keys may carry fractional seconds or a zone suffix.
  @VisibleForTesting
  static String normalizeKey(String key) {
    return key.length() > 19 ? key.substring(0, 19) : key;
  }

  public int getMergedPartitions() {
    return mergedPartitions;
  }

  public long total() {
    long total = 0;
    for (HistogramBucket bucket : buckets.values()) {
      total += bucket.getCount();
    }
    return total;
  }

  public List<HistogramBucket> getBuckets() {
    return new ArrayList<>(buckets.values());
  }

  public HistogramData toData(String title) {
    List<String> xData = new ArrayList<>(buckets.size());
    List<Long> yData = new ArrayList<>(buckets.size());
    for (Map.Entry<String, HistogramBucket> entry : buckets.entrySet()) {
      xData.add(entry.getKey());
      yData.add(entry.getValue().getCount());
    }
    return new HistogramData(xData, yData, title, 0, "", "");
  }
}
