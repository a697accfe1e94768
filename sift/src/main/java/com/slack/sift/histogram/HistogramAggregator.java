package com.slack.sift.histogram;

import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.partition.PartitionRange;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.search.SearchErrors;
import com.slack.sift.search.SearchNotifier;
import com.slack.sift.search.SearchSession;
import com.slack.sift.search.StepResult;
import com.slack.sift.transport.SearchCall;
import com.slack.sift.transport.SearchCancelledException;
import com.slack.sift.transport.SearchException;
import com.slack.sift.transport.SearchFutures;
import com.slack.sift.transport.SearchResponse;
import com.slack.sift.transport.SearchTrace;
import com.slack.sift.transport.SearchTransport;
import com.slack.sift.transport.SearchType;
import com.slack.sift.transport.TraceContextFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the histogram query of a search one partition at a time and merges the counts into a zero
 * filled skeleton. Each partition's count also becomes that partition's measured total.
 *
 * <p>A failed partition leaves a gap and the remaining partitions still run. Cancellation stops
 * the loop before the next partition.
 */
public class HistogramAggregator {
  private static final Logger LOG = LoggerFactory.getLogger(HistogramAggregator.class);

  public static final String HISTOGRAM_REQUESTS = "sift_histogram_requests";
  public static final String HISTOGRAM_FAILURES = "sift_histogram_failures";

  private final TraceContextFactory traceContextFactory;
  private final SearchNotifier notifier;
  private final Duration requestTimeout;
  private final Counter histogramRequests;
  private final Counter histogramFailures;

  public HistogramAggregator(
      TraceContextFactory traceContextFactory,
      SearchNotifier notifier,
      Duration requestTimeout,
      MeterRegistry meterRegistry) {
    this.traceContextFactory = traceContextFactory;
    this.notifier = notifier;
    this.requestTimeout = requestTimeout;
    this.histogramRequests = meterRegistry.counter(HISTOGRAM_REQUESTS);
    this.histogramFailures = meterRegistry.counter(HISTOGRAM_FAILURES);
  }

  public void run(SearchSession session, SearchTransport transport) {
    BuiltQuery builtQuery = session.getBuiltQuery();
    QueryRequest histogramQuery = session.getHistogramQuery().copy();
    String sql = HistogramQueries.forRun(builtQuery);
    if (sql.isEmpty()) {
      LOG.info("No stream left to build a histogram for");
      session.setHistogram(HistogramData.EMPTY.withTitle(session.histogramTitle()));
      return;
    }
    histogramQuery.setSql(sql);

    PartitionDetail detail = session.getPartitionDetail();
    HistogramRun run =
        new HistogramRun(
            HistogramSkeleton.build(
                histogramQuery.getStartTime(),
                histogramQuery.getEndTime(),
                builtQuery.chartInterval,
                session.getQueryResults().getHistogramInterval()));

    session.setLoadingHistogram(true);
    try {
      for (int index : visitOrder(detail.size(), builtQuery.isOrderedAscending())) {
        if (nextPartition(session, transport, histogramQuery, detail, index, run)
            == StepResult.DONE) {
          break;
        }
      }
    } finally {
      session.setLoadingHistogram(false);
    }

    HistogramData data = run.skeleton.toData(session.histogramTitle());
    if (run.errorMsg != null) {
      data = data.withError(run.errorMsg, run.errorCode);
    }
    session.setHistogram(data);
  }

  /** Partition indexes in visiting order. Ascending queries count the newest partition last. */
  @VisibleForTesting
  static List<Integer> visitOrder(int partitionCount, boolean orderedAscending) {
    List<Integer> order = new ArrayList<>(partitionCount);
    for (int i = 0; i < partitionCount; i++) {
      order.add(i);
    }
    if (orderedAscending && partitionCount > 1) {
      Collections.reverse(order);
    }
    return order;
  }

  private StepResult nextPartition(
      SearchSession session,
      SearchTransport transport,
      QueryRequest histogramQuery,
      PartitionDetail detail,
      int index,
      HistogramRun run) {
    if (session.consumeCancel()) {
      return cancelled(session, run);
    }

    PartitionRange partition = detail.getPartition(index);
    histogramQuery.setStartTime(partition.startTime());
    histogramQuery.setEndTime(partition.endTime());

    SearchTrace trace = traceContextFactory.newTrace();
    session.trackTrace(trace.traceId());
    histogramRequests.increment();
    try {
      SearchResponse response =
          SearchFutures.await(
              transport.search(
                  new SearchCall(
                      histogramQuery.copy(),
                      SearchType.HISTOGRAM,
                      false,
                      trace,
                      session.getOrgId(),
                      session.getStreamType())),
              requestTimeout,
              trace.traceId());
      long partitionCount = run.skeleton.merge(response.getHits());
      detail.setTotal(index, partitionCount);
      return StepResult.CONTINUE;
    } catch (SearchCancelledException e) {
      session.consumeCancel();
      return cancelled(session, run);
    } catch (SearchException e) {
      if (session.consumeCancel()) {
        return cancelled(session, run);
      }
      histogramFailures.increment();
      LOG.warn(
          "Histogram failed for partition [{}, {}], trace {}",
          partition.startTime(),
          partition.endTime(),
          trace.traceId(),
          e);
      if (e.isRateLimited()) {
        run.errorMsg = e.getServerMessage();
        run.errorCode = e.getStatus();
      }
      return StepResult.CONTINUE;
    } finally {
      session.untrackTrace(trace.traceId());
    }
  }

  private StepResult cancelled(SearchSession session, HistogramRun run) {
    if (run.skeleton.getMergedPartitions() == 0) {
      run.errorMsg = SearchErrors.CANCELLED_MESSAGE;
    }
    session.notifyCancelOnce(notifier, SearchErrors.OPERATION_CANCELLED_MESSAGE);
    return StepResult.DONE;
  }

  private static class HistogramRun {
    private final HistogramSkeleton skeleton;
    private String errorMsg;
    private int errorCode = 0;

    HistogramRun(HistogramSkeleton skeleton) {
      this.skeleton = skeleton;
    }
  }
}
