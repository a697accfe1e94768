package com.slack.sift.search;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import com.slack.sift.histogram.HistogramAggregator;
import com.slack.sift.histogram.HistogramData;
import com.slack.sift.histogram.HistogramEligibility;
import com.slack.sift.partition.PageSlice;
import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.partition.PartitionPaginator;
import com.slack.sift.partition.PartitionPlan;
import com.slack.sift.partition.PartitionPlanner;
import com.slack.sift.partition.PartitionRange;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.QueryBuildException;
import com.slack.sift.query.QueryBuilder;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.transport.CommunicationMethod;
import com.slack.sift.transport.SearchApi;
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
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a search for a session: builds the query, plans the partitions, reads the current page
 * slice by slice and then fills in the histogram or the page count.
 *
 * <p>Every remote call blocks the calling thread until its response arrives. The fetch loops check
 * the session's cancellation flag before each call, so a cancel raised from another thread stops
 * the run at the next call boundary.
 */
public class SearchOrchestrator {
  private static final Logger LOG = LoggerFactory.getLogger(SearchOrchestrator.class);

  public static final String SEARCH_REQUESTS = "sift_search_requests";
  public static final String SEARCH_FAILURES = "sift_search_failures";
  public static final String SEARCH_DURATION = "sift_search_duration";

  static final String ORDER_ASC = "asc";

  private final QueryBuilder queryBuilder;
  private final PartitionPlanner partitionPlanner;
  private final Map<CommunicationMethod, SearchTransport> transports;
  private final HistogramAggregator histogramAggregator;
  private final PageCountService pageCountService;
  private final SearchApi searchApi;
  private final TraceContextFactory traceContextFactory;
  private final SearchNotifier notifier;
  private final ErrorMessageResolver errorMessageResolver;
  private final boolean websocketEnabled;
  private final boolean histogramEnabled;
  private final Duration requestTimeout;

  private final MeterRegistry meterRegistry;
  private final Counter searchRequests;
  private final Counter searchFailures;
  private final Timer searchDuration;

  public SearchOrchestrator(
      QueryBuilder queryBuilder,
      PartitionPlanner partitionPlanner,
      Map<CommunicationMethod, SearchTransport> transports,
      HistogramAggregator histogramAggregator,
      PageCountService pageCountService,
      SearchApi searchApi,
      TraceContextFactory traceContextFactory,
      SearchNotifier notifier,
      ErrorMessageResolver errorMessageResolver,
      boolean websocketEnabled,
      boolean histogramEnabled,
      Duration requestTimeout,
      MeterRegistry meterRegistry) {
    this.queryBuilder = queryBuilder;
    this.partitionPlanner = partitionPlanner;
    this.transports = transports;
    this.histogramAggregator = histogramAggregator;
    this.pageCountService = pageCountService;
    this.searchApi = searchApi;
    this.traceContextFactory = traceContextFactory;
    this.notifier = notifier;
    this.errorMessageResolver = errorMessageResolver;
    this.websocketEnabled = websocketEnabled;
    this.histogramEnabled = histogramEnabled;
    this.requestTimeout = requestTimeout;
    this.meterRegistry = meterRegistry;
    this.searchRequests = meterRegistry.counter(SEARCH_REQUESTS);
    this.searchFailures = meterRegistry.counter(SEARCH_FAILURES);
    this.searchDuration = meterRegistry.timer(SEARCH_DURATION);
  }

  /**
   * Runs {@code parameters} on {@code session}. A new search resets the session and plans the
   * partitions again; paging reuses the partitions of the previous run and only reads the
   * requested page.
   */
  public void getQueryData(
      SearchSession session, SearchParameters parameters, boolean isPagination) {
    session.clearCancel();
    if (parameters.streams.isEmpty()) {
      LOG.debug("No stream selected, skipping search");
      return;
    }

    Timer.Sample sample = Timer.start(meterRegistry);
    session.setLoading(true);
    try {
      runQuery(session, parameters, isPagination);
    } finally {
      session.setLoading(false);
      sample.stop(searchDuration);
    }
  }

  private void runQuery(SearchSession session, SearchParameters parameters, boolean isPagination) {
    BuiltQuery builtQuery;
    try {
      builtQuery = queryBuilder.buildSearch(parameters);
    } catch (QueryBuildException e) {
      LOG.warn("Unable to build search for {}", parameters.streamNames(), e);
      session.setError(e.getMessage(), 0, "");
      return;
    }

    boolean pagination = isPagination && session.getHistogramQuery() != null;
    if (!pagination) {
      session.resetQueryData();
    } else {
      session.setError("", 0, "");
    }
    session.setBuiltQuery(builtQuery);
    session.setParameters(parameters);
    session.setCommunicationMethod(
        CommunicationMethod.choose(
            websocketEnabled, parameters.isMultiStream(), parameters.sqlMode));
    SearchTransport transport = transports.get(session.getCommunicationMethod());
    QueryResults results = session.getQueryResults();

    if (!pagination) {
      if (!planPartitions(session, builtQuery)) {
        return;
      }
      session.setHistogramQuery(toHistogramQuery(builtQuery.request));
    }

    PartitionDetail detail = session.getPartitionDetail();
    QueryRequest request = builtQuery.request;
    boolean loaded;
    if (builtQuery.isAggregation() || detail.isStreamingOutput()) {
      QueryRequest pageRequest = request.copy();
      loaded = fetchAllPartitions(session, builtQuery, transport);
      if (loaded && !pagination) {
        runHistogram(session, builtQuery, pageRequest, transport);
      }
    } else {
      if (!builtQuery.isLimitQuery()) {
        PartitionPaginator.refresh(
            detail, parameters.rowsPerPage, parameters.currentPage, false);
      }
      List<PageSlice> page = detail.getPage(parameters.currentPage);
      if (page.isEmpty()) {
        LOG.info("Nothing to read for page {}", parameters.currentPage);
        results.setHits(List.of());
        loaded = true;
      } else {
        applySlice(request, page.get(0));
        session.setSubpage(1);
        QueryRequest pageRequest = request.copy();
        loaded = getPaginatedData(session, request, transport, false);
        if (loaded && !pagination) {
          runHistogram(session, builtQuery, pageRequest, transport);
        }
      }
    }

    if (loaded) {
      long total =
          PartitionPaginator.refresh(
              detail, parameters.rowsPerPage, parameters.currentPage, true);
      if (!request.isMultiSql() && !builtQuery.isAggregation()) {
        results.setTotal(total);
      }
    }
    session.setHistogram(session.getHistogram().withTitle(session.histogramTitle()));
  }

  private boolean planPartitions(SearchSession session, BuiltQuery builtQuery) {
    SearchTrace trace = traceContextFactory.newTrace();
    try {
      PartitionPlan plan =
          partitionPlanner.getQueryPartitions(
              builtQuery, session.getOrgId(), session.getStreamType(), trace);
      QueryResults results = session.getQueryResults();
      results.setPartitionDetail(plan.detail());
      results.setHistogramEligible(plan.histogramEligible());
      results.setHistogramInterval(plan.histogramInterval());
      results.setTotal(plan.records());
      return true;
    } catch (SearchException e) {
      searchFailures.increment();
      session.setError(
          SearchErrors.message(
              e, errorMessageResolver, SearchErrors.DEFAULT_SEARCH_ERROR, trace.traceId()),
          e.getCode(),
          e.getErrorDetail());
      return false;
    }
  }

  @VisibleForTesting
  static QueryRequest toHistogramQuery(QueryRequest request) {
    QueryRequest histogramQuery = request.copy();
    histogramQuery.setQuickMode(null);
    histogramQuery.setFrom(null);
    histogramQuery.setActionId(null);
    histogramQuery.setSize(QueryRequest.ALL_ROWS);
    return histogramQuery;
  }

  /**
   * Reads the slices of the current page in order, appending each to the results, until the page
   * is full or its slices run out.
   *
   * @return false when the run stopped on an error or a cancel
   */
  @VisibleForTesting
  boolean getPaginatedData(
      SearchSession session, QueryRequest request, SearchTransport transport, boolean append) {
    boolean appendResults = append;
    StepResult step;
    do {
      if (session.consumeCancel()) {
        session.notifyCancelOnce(notifier, SearchErrors.OPERATION_CANCELLED_MESSAGE);
        return false;
      }
      SearchResponse response = fetch(session, request, transport);
      if (response == null) {
        return false;
      }
      acceptPage(session, request, response, appendResults);
      step = nextSlice(session, request);
      appendResults = true;
    } while (step == StepResult.CONTINUE);
    return true;
  }

  private void acceptPage(
      SearchSession session, QueryRequest request, SearchResponse response, boolean append) {
    SearchParameters parameters = session.getParameters();
    QueryResults results = session.getQueryResults();
    PartitionDetail detail = session.getPartitionDetail();

    applyFunctionError(session, request, response);
    detail.recordTotal(request.getStartTime(), response.getTotal());
    if (append) {
      results.append(response);
    } else {
      results.replace(response);
    }
    sortHits(results);

    long total =
        PartitionPaginator.refresh(
            detail,
            parameters.rowsPerPage,
            parameters.currentPage,
            response.getHits().size() != parameters.rowsPerPage);
    if (!request.isMultiSql()) {
      results.setTotal(total);
    }
  }

  /** Moves {@code request} to the next unread slice of the current page if more rows are due. */
  private StepResult nextSlice(SearchSession session, QueryRequest request) {
    SearchParameters parameters = session.getParameters();
    List<PageSlice> page = session.getPartitionDetail().getPage(parameters.currentPage);
    int streamCount = request.isMultiSql() ? request.getSql().size() : 1;

    int subpage = session.getSubpage();
    while (subpage < page.size() && page.get(subpage).size() == 0) {
      subpage++;
    }
    session.setSubpage(subpage);
    if (page.size() > subpage
        && session.getQueryResults().getHits().size() < parameters.rowsPerPage * streamCount) {
      applySlice(request, page.get(subpage));
      session.setSubpage(subpage + 1);
      return StepResult.CONTINUE;
    }
    return StepResult.DONE;
  }

  /**
   * Aggregations and streamed results are read whole, one partition after the other.
   *
   * @return false when the run stopped on an error or a cancel
   */
  private boolean fetchAllPartitions(
      SearchSession session, BuiltQuery builtQuery, SearchTransport transport) {
    PartitionDetail detail = session.getPartitionDetail();
    QueryResults results = session.getQueryResults();
    QueryRequest request = builtQuery.request;
    if (!builtQuery.isLimitQuery()) {
      request.setFrom(0);
      request.setSize(QueryRequest.ALL_ROWS);
    }

    for (int i = 0; i < detail.size(); i++) {
      if (session.consumeCancel()) {
        session.notifyCancelOnce(notifier, SearchErrors.OPERATION_CANCELLED_MESSAGE);
        return false;
      }
      PartitionRange partition = detail.getPartition(i);
      request.setStartTime(partition.startTime());
      request.setEndTime(partition.endTime());
      request.setStreamingOutput(detail.isStreamingOutput());
      request.setStreamingId(detail.getStreamingId());
      session.setSubpage(i + 1);

      SearchResponse response = fetch(session, request, transport);
      if (response == null) {
        return false;
      }
      applyFunctionError(session, request, response);
      if (i == 0) {
        results.replace(response);
      } else {
        results.append(response);
      }
      sortHits(results);
    }
    results.setTotal(results.getHits().size());
    return true;
  }

  /**
   * Sends one search and waits for it. Failures are recorded on the session.
   *
   * @return null when the call failed or was cancelled
   */
  private SearchResponse fetch(
      SearchSession session, QueryRequest request, SearchTransport transport) {
    SearchTrace trace = traceContextFactory.newTrace();
    session.trackTrace(trace.traceId());
    searchRequests.increment();
    try {
      return SearchFutures.await(
          transport.search(
              new SearchCall(
                  request.copy(),
                  SearchType.SEARCH,
                  session.getBuiltQuery().paginationEnabled,
                  trace,
                  session.getOrgId(),
                  session.getStreamType())),
          requestTimeout,
          trace.traceId());
    } catch (SearchCancelledException e) {
      LOG.info("Search cancelled, trace {}", trace.traceId());
      session.consumeCancel();
      session.setError(SearchErrors.CANCELLED_MESSAGE, 0, "");
      session.notifyCancelOnce(notifier, SearchErrors.CANCELLED_MESSAGE);
      return null;
    } catch (SearchException e) {
      if (session.consumeCancel()) {
        LOG.info("Ignoring failure of cancelled trace {}", trace.traceId());
        session.notifyCancelOnce(notifier, SearchErrors.OPERATION_CANCELLED_MESSAGE);
        return null;
      }
      searchFailures.increment();
      LOG.error("Search failed, trace {}", trace.traceId(), e);
      session.setError(
          SearchErrors.message(
              e, errorMessageResolver, SearchErrors.DEFAULT_SEARCH_ERROR, trace.traceId()),
          e.getCode(),
          e.getErrorDetail());
      return null;
    } finally {
      session.untrackTrace(trace.traceId());
    }
  }

  /** The server narrowed the window, e.g. a function limited how far back it can read. */
  private static void applyFunctionError(
      SearchSession session, QueryRequest request, SearchResponse response) {
    if (Strings.isNullOrEmpty(response.getFunctionError())
        || response.getNewStartTime() == null
        || response.getNewEndTime() == null) {
      return;
    }
    LOG.info(
        "Search window narrowed to [{}, {}]: {}",
        response.getNewStartTime(),
        response.getNewEndTime(),
        response.getFunctionError());
    request.setStartTime(response.getNewStartTime());
    request.setEndTime(response.getNewEndTime());
    QueryRequest histogramQuery = session.getHistogramQuery();
    if (histogramQuery != null) {
      histogramQuery.setStartTime(response.getNewStartTime());
      histogramQuery.setEndTime(response.getNewEndTime());
    }
    session.getPartitionDetail().adjustSinglePartitionStart(response.getNewStartTime());
  }

  private void runHistogram(
      SearchSession session,
      BuiltQuery builtQuery,
      QueryRequest pageRequest,
      SearchTransport transport) {
    QueryResults results = session.getQueryResults();
    HistogramEligibility eligibility =
        HistogramEligibility.evaluate(builtQuery, results.getHistogramEligible(), histogramEnabled);
    if (eligibility == HistogramEligibility.ELIGIBLE) {
      histogramAggregator.run(session, transport);
      return;
    }

    LOG.debug("Histogram skipped: {}", eligibility);
    session.setHistogram(
        eligibility.hasError()
            ? HistogramData.error(
                eligibility.errorMsg, eligibility.errorCode, session.histogramTitle())
            : HistogramData.EMPTY.withTitle(session.histogramTitle()));

    int from = pageRequest.getFrom() == null ? 0 : pageRequest.getFrom();
    int hitCount = results.getHits().size();
    if (eligibility.needsPageCount(
        builtQuery.isAggregation(), session.getParameters().currentPage, from, hitCount)) {
      pageCountService.getPageCount(session, pageRequest, transport);
    }
  }

  /** Orders the hits as the server reported in {@code order_by_metadata}. */
  @VisibleForTesting
  static void sortHits(QueryResults results) {
    List<List<String>> orderBy = results.getOrderByMetadata();
    if (orderBy == null || orderBy.isEmpty()) {
      return;
    }
    Comparator<JsonNode> comparator = null;
    for (List<String> column : orderBy) {
      if (column.isEmpty()) {
        continue;
      }
      String field = column.get(0);
      boolean ascending = column.size() < 2 || ORDER_ASC.equalsIgnoreCase(column.get(1));
      Comparator<JsonNode> byField =
          (left, right) -> compareValues(left.get(field), right.get(field), ascending);
      comparator = comparator == null ? byField : comparator.thenComparing(byField);
    }
    if (comparator == null) {
      return;
    }
    List<JsonNode> hits = new ArrayList<>(results.getHits());
    hits.sort(comparator);
    results.setHits(hits);
  }

  // Missing values sort last in either direction.
  private static int compareValues(JsonNode left, JsonNode right, boolean ascending) {
    boolean leftMissing = left == null || left.isNull();
    boolean rightMissing = right == null || right.isNull();
    if (leftMissing || rightMissing) {
      return Boolean.compare(leftMissing, rightMissing);
    }
    int result =
        left.isNumber() && right.isNumber()
            ? Double.compare(left.asDouble(), right.asDouble())
            : left.asText().compareTo(right.asText());
    return ascending ? result : -result;
  }

  /** Rows around {@code key} in {@code stream}, read in one call for a point in time view. */
  public SearchResponse searchAround(
      SearchSession session, String stream, String key, int size, String sql) {
    SearchTrace trace = traceContextFactory.newTrace();
    searchRequests.increment();
    try {
      return SearchFutures.await(
          searchApi.searchAround(
              session.getOrgId(), session.getStreamType(), stream, key, size, sql),
          requestTimeout,
          trace.traceId());
    } catch (SearchException e) {
      searchFailures.increment();
      LOG.error("Search around {} in {} failed", key, stream, e);
      session.setError(
          SearchErrors.message(
              e, errorMessageResolver, SearchErrors.DEFAULT_SEARCH_ERROR, trace.traceId()),
          e.getCode(),
          e.getErrorDetail());
      throw e;
    }
  }

  private static void applySlice(QueryRequest request, PageSlice slice) {
    request.setStartTime(slice.startTime());
    request.setEndTime(slice.endTime());
    request.setFrom(slice.from());
    request.setSize(slice.size());
    request.setStreamingOutput(slice.streamingOutput());
    request.setStreamingId(slice.streamingId());
  }
}
