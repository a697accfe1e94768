package com.slack.sift.transport;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;

/**
 * Issues searches. Implementations differ only in how the call travels; given the same server data
 * they complete with the same {@link SearchResponse}.
 *
 * <p>The returned future fails with {@link SearchCancelledException} when the call was cancelled
 * and with {@link SearchException} for any other failure.
 */
public interface SearchTransport {

  CommunicationMethod method();

  CompletableFuture<SearchResponse> search(SearchCall call);

  /**
   * Asks the server to stop the given traces.
   *
   * @return true when the server confirmed at least one cancellation right away
   */
  CompletableFuture<Boolean> cancel(String orgId, Collection<String> traceIds);
}
