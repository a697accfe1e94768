package com.slack.sift.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-flight websocket traces in registration order. A trace is removed by the first terminal event
 * (end, cancel, error or socket close) so its close or error handlers run exactly once.
 */
public class TraceRegistry {
  private static final Logger LOG = LoggerFactory.getLogger(TraceRegistry.class);

  private final Map<String, TraceHandlers> traces = new LinkedHashMap<>();

  public synchronized void register(String traceId, TraceHandlers handlers) {
    if (traces.putIfAbsent(traceId, handlers) != null) {
      throw new IllegalStateException("Trace " + traceId + " is already registered");
    }
  }

  public synchronized TraceHandlers remove(String traceId) {
    return traces.remove(traceId);
  }

  public synchronized boolean contains(String traceId) {
    return traces.containsKey(traceId);
  }

  public synchronized List<String> traceIds() {
    return new ArrayList<>(traces.keySet());
  }

  public synchronized int size() {
    return traces.size();
  }

  /** Routes a non terminal frame to the trace's message handlers. */
  public void dispatch(String traceId, JsonNode frame) {
    TraceHandlers handlers;
    synchronized (this) {
      handlers = traces.get(traceId);
    }
    if (handlers == null) {
      LOG.debug("Dropping frame for unknown trace {}", traceId);
      return;
    }
    handlers.fireMessage(frame);
  }

  /** Ends a trace: removes it and runs its close handlers. No-op if it already ended. */
  public boolean close(String traceId, WebSocketCloseEvent event) {
    TraceHandlers handlers = remove(traceId);
    if (handlers == null) {
      return false;
    }
    handlers.fireClose(event);
    return true;
  }

  /** Ends a trace with an error frame: removes it and runs its error handlers. */
  public boolean fail(String traceId, JsonNode content) {
    TraceHandlers handlers = remove(traceId);
    if (handlers == null) {
      return false;
    }
    handlers.fireError(content);
    return true;
  }

  /** Ends every registered trace, used when the socket goes away. */
  public void closeAll(WebSocketCloseEvent event) {
    for (String traceId : traceIds()) {
      close(traceId, event);
    }
  }
}
