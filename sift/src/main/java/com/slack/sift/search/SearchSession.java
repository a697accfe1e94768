package com.slack.sift.search;

import com.slack.sift.histogram.HistogramData;
import com.slack.sift.histogram.HistogramTitle;
import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.transport.CommunicationMethod;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * State of one user's search: the last run's query, results, histogram and errors, plus the
 * cancellation flag that another thread may raise while a run is in progress. A session runs one
 * search at a time.
 */
public class SearchSession {
  private final String orgId;
  private final String streamType;

  private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
  private final AtomicBoolean cancelNotified = new AtomicBoolean(false);
  private final Set<String> inFlightTraceIds = ConcurrentHashMap.newKeySet();

  private volatile CommunicationMethod communicationMethod = CommunicationMethod.HTTP;
  private volatile boolean loading = false;
  private volatile boolean loadingHistogram = false;

  private final QueryResults queryResults = new QueryResults();
  private HistogramData histogram = HistogramData.EMPTY;
  private BuiltQuery builtQuery;
  private SearchParameters parameters;
  private QueryRequest histogramQuery;
  private int subpage = 1;

  private String errorMsg = "";
  private String errorDetail = "";
  private int errorCode = 0;
  private String countErrorMsg = "";

  public SearchSession(String orgId, String streamType) {
    this.orgId = orgId;
    this.streamType = streamType;
  }

  /** Clears everything a previous run left behind. */
  public synchronized void resetQueryData() {
    queryResults.reset();
    histogram = HistogramData.EMPTY;
    histogramQuery = null;
    subpage = 1;
    errorMsg = "";
    errorDetail = "";
    errorCode = 0;
    countErrorMsg = "";
    cancelNotified.set(false);
  }

  public String getOrgId() {
    return orgId;
  }

  public String getStreamType() {
    return streamType;
  }

  public void requestCancel() {
    cancelRequested.set(true);
  }

  public boolean isCancelRequested() {
    return cancelRequested.get();
  }

  /** Clears the cancellation flag, returning whether it was set. */
  public boolean consumeCancel() {
    return cancelRequested.compareAndSet(true, false);
  }

  /** Lowers the flag and lets the next cancellation notify again. */
  public void clearCancel() {
    cancelRequested.set(false);
    cancelNotified.set(false);
  }

  /** Raises {@code message} unless this run already notified about its cancellation. */
  public boolean notifyCancelOnce(SearchNotifier notifier, String message) {
    if (cancelNotified.compareAndSet(false, true)) {
      notifier.notify(message);
      return true;
    }
    return false;
  }

  public void trackTrace(String traceId) {
    inFlightTraceIds.add(traceId);
  }

  public void untrackTrace(String traceId) {
    inFlightTraceIds.remove(traceId);
  }

  public List<String> getInFlightTraceIds() {
    return new ArrayList<>(inFlightTraceIds);
  }

  public CommunicationMethod getCommunicationMethod() {
    return communicationMethod;
  }

  public void setCommunicationMethod(CommunicationMethod communicationMethod) {
    this.communicationMethod = communicationMethod;
  }

  public boolean isLoading() {
    return loading;
  }

  public void setLoading(boolean loading) {
    this.loading = loading;
  }

  public boolean isLoadingHistogram() {
    return loadingHistogram;
  }

  public void setLoadingHistogram(boolean loadingHistogram) {
    this.loadingHistogram = loadingHistogram;
  }

  public QueryResults getQueryResults() {
    return queryResults;
  }

  public PartitionDetail getPartitionDetail() {
    return queryResults.getPartitionDetail();
  }

  public synchronized HistogramData getHistogram() {
    return histogram;
  }

  public synchronized void setHistogram(HistogramData histogram) {
    this.histogram = histogram;
  }

  public BuiltQuery getBuiltQuery() {
    return builtQuery;
  }

  public void setBuiltQuery(BuiltQuery builtQuery) {
    this.builtQuery = builtQuery;
  }

  public SearchParameters getParameters() {
    return parameters;
  }

  public void setParameters(SearchParameters parameters) {
    this.parameters = parameters;
  }

  public QueryRequest getHistogramQuery() {
    return histogramQuery;
  }

  public void setHistogramQuery(QueryRequest histogramQuery) {
    this.histogramQuery = histogramQuery;
  }

  public int getSubpage() {
    return subpage;
  }

  public void setSubpage(int subpage) {
    this.subpage = subpage;
  }

  public synchronized String getErrorMsg() {
    return errorMsg;
  }

  public synchronized String getErrorDetail() {
    return errorDetail;
  }

  public synchronized int getErrorCode() {
    return errorCode;
  }

  public synchronized void setError(String errorMsg, int errorCode, String errorDetail) {
    this.errorMsg = errorMsg;
    this.errorCode = errorCode;
    this.errorDetail = errorDetail == null ? "" : errorDetail;
  }

  public synchronized String getCountErrorMsg() {
    return countErrorMsg;
  }

  public synchronized void setCountErrorMsg(String countErrorMsg) {
    this.countErrorMsg = countErrorMsg;
  }

  /** Title line for the current page, empty before the first run. */
  public String histogramTitle() {
    if (builtQuery == null || parameters == null) {
      return "";
    }
    PartitionDetail detail = queryResults.getPartitionDetail();
    int hitCount = queryResults.getHits().size();
    long total = queryResults.getTotal();
    if (builtQuery.isSqlMode() && builtQuery.isAggregation()) {
      total = hitCount;
    }
    return HistogramTitle.format(
        parameters.currentPage,
        parameters.rowsPerPage,
        detail.getPaginations().size(),
        builtQuery.paginationEnabled,
        hitCount,
        total,
        detail.hasUnknownTotal(),
        queryResults.getTook(),
        queryResults.getScanSize(),
        queryResults.getResultCacheRatio() > 0);
  }

  @Override
  public String toString() {
    return "SearchSession{"
        + "orgId='"
        + orgId
        + '\''
        + ", streamType='"
        + streamType
        + '\''
        + ", communicationMethod="
        + communicationMethod
        + ", loading="
        + loading
        + ", queryResults="
        + queryResults
        + ", errorMsg='"
        + errorMsg
        + '\''
        + '}';
  }
}
