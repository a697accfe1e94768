package com.slack.sift.transport;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** One http request per search call. */
public class HttpSearchTransport implements SearchTransport {
  private static final Logger LOG = LoggerFactory.getLogger(HttpSearchTransport.class);

  public static final String HTTP_SEARCH_REQUESTS = "sift_http_search_requests";
  public static final String HTTP_CANCEL_REQUESTS = "sift_http_cancel_requests";

  private final SearchApi searchApi;
  private final boolean sqlBase64Enabled;
  private final Counter searchRequests;
  private final Counter cancelRequests;

  public HttpSearchTransport(
      SearchApi searchApi, boolean sqlBase64Enabled, MeterRegistry meterRegistry) {
    this.searchApi = searchApi;
    this.sqlBase64Enabled = sqlBase64Enabled;
    this.searchRequests = meterRegistry.counter(HTTP_SEARCH_REQUESTS);
    this.cancelRequests = meterRegistry.counter(HTTP_CANCEL_REQUESTS);
  }

  @Override
  public CommunicationMethod method() {
    return CommunicationMethod.HTTP;
  }

  @Override
  public CompletableFuture<SearchResponse> search(SearchCall call) {
    searchRequests.increment();
    return searchApi.search(
        call.orgId(),
        call.streamType(),
        SearchRequests.searchBody(call.request(), sqlBase64Enabled),
        call.trace().traceparent());
  }

  @Override
  public CompletableFuture<Boolean> cancel(String orgId, Collection<String> traceIds) {
    if (traceIds.isEmpty()) {
      return CompletableFuture.completedFuture(false);
    }
    cancelRequests.increment();
    LOG.info("Cancelling running queries {}", traceIds);
    return searchApi
        .deleteRunningQueries(orgId, traceIds)
        .thenApply(results -> results.stream().anyMatch(CancelResult::success));
  }
}
