package com.slack.sift.search;

import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.partition.PartitionPaginator;
import com.slack.sift.partition.PartitionRange;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.transport.SearchCall;
import com.slack.sift.transport.SearchCancelledException;
import com.slack.sift.transport.SearchException;
import com.slack.sift.transport.SearchFutures;
import com.slack.sift.transport.SearchResponse;
import com.slack.sift.transport.SearchTrace;
import com.slack.sift.transport.SearchTransport;
import com.slack.sift.transport.SearchType;
import com.slack.sift.transport.TimeOffset;
import com.slack.sift.transport.TraceContextFactory;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts the rows of a run that has no histogram, so the pager knows how many pages exist.
 *
 * <p>The count is a separate {@code size = 0} query with {@code track_total_hits}, sent over
 * whichever transport the run uses.
 */
public class PageCountService {
  private static final Logger LOG = LoggerFactory.getLogger(PageCountService.class);

  public static final String COUNT_ERROR_PREFIX = "Error while retrieving total events: ";

  private final TraceContextFactory traceContextFactory;
  private final Duration requestTimeout;

  public PageCountService(TraceContextFactory traceContextFactory, Duration requestTimeout) {
    this.traceContextFactory = traceContextFactory;
    this.requestTimeout = requestTimeout;
  }

  public void getPageCount(
      SearchSession session, QueryRequest searchRequest, SearchTransport transport) {
    QueryResults results = session.getQueryResults();
    Integer from = searchRequest.getFrom();
    if (results.getTotal() > (from == null ? 0 : from) + searchRequest.getSize()) {
      LOG.debug("Total {} already spans past the current page", results.getTotal());
      return;
    }

    QueryRequest request = toCountRequest(searchRequest, results.getTimeOffset());
    SearchTrace trace = traceContextFactory.newTrace();
    session.trackTrace(trace.traceId());
    try {
      SearchResponse response =
          SearchFutures.await(
              transport.search(
                  new SearchCall(
                      request,
                      SearchType.PAGE_COUNT,
                      false,
                      trace,
                      session.getOrgId(),
                      session.getStreamType())),
              requestTimeout,
              trace.traceId());
      applyCount(session, request.getStartTime(), response);
    } catch (SearchCancelledException e) {
      LOG.info("Page count cancelled, trace {}", trace.traceId());
    } catch (SearchException e) {
      LOG.warn("Page count failed, trace {}", trace.traceId(), e);
      session.setCountErrorMsg(countErrorMessage(e, trace.traceId()));
    } finally {
      session.untrackTrace(trace.traceId());
    }
  }

  static QueryRequest toCountRequest(QueryRequest searchRequest, TimeOffset timeOffset) {
    QueryRequest request = searchRequest.copy();
    request.setSize(0);
    request.setFrom(null);
    request.setQuickMode(null);
    request.setActionId(null);
    request.setStreamingOutput(false);
    request.setStreamingId(null);
    request.setTrackTotalHits(true);
    if (timeOffset != null) {
      request.setStartTime(timeOffset.startTime());
      request.setEndTime(timeOffset.endTime());
    }
    return request;
  }

  private void applyCount(SearchSession session, long startTime, SearchResponse response) {
    QueryResults results = session.getQueryResults();
    results.addCounters(response.getTook(), response.getScanSize());

    PartitionDetail detail = results.getPartitionDetail();
    List<PartitionRange> partitions = detail.getPartitions();
    for (int i = 0; i < partitions.size(); i++) {
      long total = detail.getTotal(i);
      if ((total == PartitionDetail.UNKNOWN_TOTAL || total < response.getTotal())
          && partitions.get(i).startTime() == startTime) {
        detail.setTotal(i, response.getTotal());
      }
    }

    SearchParameters parameters = session.getParameters();
    long total =
        PartitionPaginator.refresh(
            detail,
            parameters.rowsPerPage,
            parameters.currentPage,
            results.getHits().size() != parameters.rowsPerPage);
    results.setTotal(Math.max(total, response.getTotal()));
    session.setHistogram(session.getHistogram().withTitle(session.histogramTitle()));
  }

  static String countErrorMessage(SearchException e, String traceId) {
    String message = COUNT_ERROR_PREFIX;
    if ((e.getStatus() == 400 || e.getStatus() >= 429) && e.getServerMessage() != null) {
      message += e.getServerMessage();
    }
    message += " TraceID:" + (e.getTraceId() == null ? traceId : e.getTraceId());
    return message;
  }
}
