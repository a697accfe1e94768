package com.slack.sift.partition;

import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.transport.PartitionResponse;
import com.slack.sift.transport.SearchApi;
import com.slack.sift.transport.SearchException;
import com.slack.sift.transport.SearchFutures;
import com.slack.sift.transport.SearchRequests;
import com.slack.sift.transport.SearchTrace;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits the searched window into the partitions the server wants queried. LIMIT queries are read
 * in one piece; everything else asks the partition endpoint.
 */
public class PartitionPlanner {
  private static final Logger LOG = LoggerFactory.getLogger(PartitionPlanner.class);

  public static final String PARTITION_REQUESTS = "sift_partition_requests";
  public static final String PARTITION_FAILURES = "sift_partition_failures";

  private final SearchApi searchApi;
  private final boolean sqlBase64Enabled;
  private final Duration requestTimeout;
  private final Counter partitionRequests;
  private final Counter partitionFailures;

  public PartitionPlanner(
      SearchApi searchApi,
      boolean sqlBase64Enabled,
      Duration requestTimeout,
      MeterRegistry meterRegistry) {
    this.searchApi = searchApi;
    this.sqlBase64Enabled = sqlBase64Enabled;
    this.requestTimeout = requestTimeout;
    this.partitionRequests = meterRegistry.counter(PARTITION_REQUESTS);
    this.partitionFailures = meterRegistry.counter(PARTITION_FAILURES);
  }

  /**
   * @throws SearchException when the partition call fails
   */
  public PartitionPlan getQueryPartitions(
      BuiltQuery builtQuery, String orgId, String streamType, SearchTrace trace) {
    QueryRequest request = builtQuery.request;
    if (builtQuery.isLimitQuery()) {
      PartitionDetail detail =
          PartitionDetail.single(
              request.getStartTime(),
              request.getEndTime(),
              request.getFrom() == null ? 0 : request.getFrom(),
              request.getSize());
      return new PartitionPlan(detail, null, null, 0);
    }

    partitionRequests.increment();
    PartitionResponse response;
    try {
      response =
          SearchFutures.await(
              searchApi.partition(
                  orgId,
                  streamType,
                  SearchRequests.partitionBody(request, sqlBase64Enabled),
                  trace.traceparent()),
              requestTimeout,
              trace.traceId());
    } catch (SearchException e) {
      partitionFailures.increment();
      LOG.error("Partition request failed, trace {}", trace.traceId(), e);
      throw e;
    }

    PartitionDetail detail =
        PartitionDetail.seeded(
            toRanges(response.getPartitions()),
            builtQuery.parameters.rowsPerPage,
            response.isStreamingAggs(),
            response.getStreamingId());
    LOG.debug(
        "Planned {} partitions for [{}, {}], trace {}",
        detail.size(),
        request.getStartTime(),
        request.getEndTime(),
        trace.traceId());
    return new PartitionPlan(
        detail,
        response.getHistogramEligible(),
        response.getHistogramInterval(),
        request.isMultiSql() ? response.getRecords() : 0);
  }

  @VisibleForTesting
  static List<PartitionRange> toRanges(List<List<Long>> partitions) {
    List<PartitionRange> ranges = new ArrayList<>();
    if (partitions == null) {
      return ranges;
    }
    for (List<Long> partition : partitions) {
      if (partition.size() != 2) {
        throw new IllegalArgumentException("Malformed partition " + partition);
      }
      ranges.add(new PartitionRange(partition.get(0), partition.get(1)));
    }
    return ranges;
  }
}
