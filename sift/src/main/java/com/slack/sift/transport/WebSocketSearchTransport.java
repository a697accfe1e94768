package com.slack.sift.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.util.JsonUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Collection;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Search calls over the shared {@link WebSocketConnection}. A call registers handlers under its
 * trace id, sends a search frame once the socket is open and completes when the server ends the
 * trace. The server may stream a result in several frames; hits are appended and the counters are
 * summed so the completed response matches what the http endpoint returns for the same query.
 */
public class WebSocketSearchTransport implements SearchTransport {
  private static final Logger LOG = LoggerFactory.getLogger(WebSocketSearchTransport.class);

  public static final String WS_SEARCH_REQUESTS = "sift_ws_search_requests";
  public static final String WS_CANCEL_REQUESTS = "sift_ws_cancel_requests";

  static final String TYPE_SEARCH_RESPONSE = "search_response";
  static final String TYPE_SEARCH_RESPONSE_HITS = "search_response_hits";
  static final String TYPE_SEARCH_RESPONSE_METADATA = "search_response_metadata";

  private final WebSocketConnection connection;
  private final boolean sqlBase64Enabled;
  private final boolean useCache;
  private final Counter searchRequests;
  private final Counter cancelRequests;

  public WebSocketSearchTransport(
      WebSocketConnection connection,
      boolean sqlBase64Enabled,
      boolean useCache,
      MeterRegistry meterRegistry) {
    this.connection = connection;
    this.sqlBase64Enabled = sqlBase64Enabled;
    this.useCache = useCache;
    this.searchRequests = meterRegistry.counter(WS_SEARCH_REQUESTS);
    this.cancelRequests = meterRegistry.counter(WS_CANCEL_REQUESTS);
  }

  @Override
  public CommunicationMethod method() {
    return CommunicationMethod.WEBSOCKET;
  }

  @Override
  public CompletableFuture<SearchResponse> search(SearchCall call) {
    searchRequests.increment();
    String traceId = call.traceId();
    CompletableFuture<SearchResponse> future = new CompletableFuture<>();
    StreamedResult result = new StreamedResult();
    TraceRegistry traceRegistry = connection.getTraceRegistry();

    TraceHandlers handlers =
        new TraceHandlers()
            .onMessage(
                frame -> {
                  try {
                    result.accept(frame);
                  } catch (JsonProcessingException e) {
                    if (traceRegistry.remove(traceId) != null) {
                      future.completeExceptionally(
                          new SearchException("Unable to parse search response", traceId, e));
                    }
                  }
                })
            .onClose(
                event -> {
                  switch (event.kind()) {
                    case END -> {
                      result.response.setTraceId(traceId);
                      future.complete(result.response);
                    }
                    case CANCELLED -> future.completeExceptionally(
                        new SearchCancelledException(traceId));
                    case DISCONNECTED -> future.completeExceptionally(
                        new SearchException(0, event.code(), event.message(), null, null, traceId));
                  }
                })
            .onError(content -> future.completeExceptionally(toException(content, traceId)));
    traceRegistry.register(traceId, handlers);
    // A caller that gives up on the future, e.g. on timeout, also stops the query on the server.
    future.whenComplete(
        (response, error) -> {
          if (error instanceof CancellationException && traceRegistry.remove(traceId) != null) {
            LOG.info("Search abandoned by caller, cancelling trace {}", traceId);
            sendCancel(call.orgId(), traceId);
          }
        });

    String frame;
    try {
      frame = JsonUtil.writeAsString(searchFrame(call));
    } catch (JsonProcessingException e) {
      traceRegistry.remove(traceId);
      return CompletableFuture.failedFuture(e);
    }

    connection.whenOpen(
        () -> {
          if (!connection.send(frame) && traceRegistry.remove(traceId) != null) {
            future.completeExceptionally(
                new SearchException(
                    WebSocketCloseEvent.UNEXPECTED_TERMINATION_MESSAGE, traceId, null));
          }
        });
    return future;
  }

  @Override
  public CompletableFuture<Boolean> cancel(String orgId, Collection<String> traceIds) {
    for (String traceId : traceIds) {
      sendCancel(orgId, traceId);
    }
    // Confirmation arrives per trace as a cancel_response frame.
    return CompletableFuture.completedFuture(false);
  }

  private void sendCancel(String orgId, String traceId) {
    cancelRequests.increment();
    ObjectNode content = JsonUtil.objectNode().put("trace_id", traceId).put("org_id", orgId);
    ObjectNode frame = JsonUtil.objectNode().put("type", "cancel");
    frame.set("content", content);
    try {
      String text = JsonUtil.writeAsString(frame);
      connection.whenOpen(() -> connection.send(text));
    } catch (JsonProcessingException e) {
      LOG.error("Unable to send cancel for trace {}", traceId, e);
    }
  }

  /**
   * {@code {type: search, content: {trace_id, payload, stream_type, search_type, use_cache,
   * org_id}}}
   */
  @VisibleForTesting
  ObjectNode searchFrame(SearchCall call) {
    ObjectNode content = JsonUtil.objectNode();
    content.put("trace_id", call.traceId());
    content.set("payload", SearchRequests.searchBody(call.request(), sqlBase64Enabled));
    content.put("stream_type", call.streamType());
    content.put("search_type", "ui");
    content.put("use_cache", useCache);
    content.put("org_id", call.orgId());

    ObjectNode frame = JsonUtil.objectNode();
    frame.put("type", "search");
    frame.set("content", content);
    return frame;
  }

  static RuntimeException toException(JsonNode content, String traceId) {
    int code = content.path("code").asInt(0);
    if (code == SearchCancelledException.CANCELLED_CODE) {
      return new SearchCancelledException(traceId);
    }
    return new SearchException(
        0,
        code,
        ArmeriaSearchApi.textOrNull(content, "message"),
        ArmeriaSearchApi.textOrNull(content, "error"),
        ArmeriaSearchApi.textOrNull(content, "error_detail"),
        traceId);
  }

  /** Folds the streamed frames of one trace into a single response. */
  private static class StreamedResult {
    private final SearchResponse response = new SearchResponse();
    private boolean sawMetadata = false;

    void accept(JsonNode frame) throws JsonProcessingException {
      String type = frame.path("type").asText("");
      JsonNode content = frame.path("content");
      JsonNode results = content.path("results");

      switch (type) {
        case TYPE_SEARCH_RESPONSE_HITS -> {
          SearchResponse chunk = JsonUtil.convert(results, SearchResponse.class);
          response.getHits().addAll(chunk.getHits());
        }
        case TYPE_SEARCH_RESPONSE_METADATA -> {
          acceptCounters(JsonUtil.convert(results, SearchResponse.class));
          readStreamFlags(content);
        }
        case TYPE_SEARCH_RESPONSE -> {
          SearchResponse chunk = JsonUtil.convert(results, SearchResponse.class);
          response.getHits().addAll(chunk.getHits());
          acceptCounters(chunk);
          readStreamFlags(content);
        }
        default -> LOG.debug("Ignoring websocket frame of type {}", type);
      }
    }

    private void acceptCounters(SearchResponse chunk) {
      if (!sawMetadata) {
        response.setFrom(chunk.getFrom());
        sawMetadata = true;
      }
      response.setTotal(response.getTotal() + chunk.getTotal());
      response.setTook(response.getTook() + chunk.getTook());
      response.setScanSize(response.getScanSize() + chunk.getScanSize());
      response.mergeMetadata(chunk);
    }

    private void readStreamFlags(JsonNode content) throws JsonProcessingException {
      if (content.path("streaming_aggs").asBoolean(false)) {
        response.setStreamingAggs(true);
      }
      JsonNode timeOffset = content.get("time_offset");
      if (timeOffset != null && timeOffset.isObject()) {
        response.setTimeOffset(JsonUtil.convert(timeOffset, TimeOffset.class));
      }
    }
  }
}
