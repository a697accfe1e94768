package com.slack.sift.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** The search service endpoints. Futures fail with {@link SearchException} on error responses. */
public interface SearchApi {

  CompletableFuture<SearchResponse> search(
      String orgId, String streamType, ObjectNode body, String traceparent);

  CompletableFuture<PartitionResponse> partition(
      String orgId, String streamType, ObjectNode body, String traceparent);

  CompletableFuture<List<CancelResult>> deleteRunningQueries(
      String orgId, Collection<String> traceIds);

  /** Rows surrounding {@code key} in {@code stream}, for a point in time view. */
  CompletableFuture<SearchResponse> searchAround(
      String orgId, String streamType, String stream, String key, int size, String sql);
}
