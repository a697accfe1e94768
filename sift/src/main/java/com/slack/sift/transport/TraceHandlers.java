package com.slack.sift.transport;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** The message, close and error callbacks registered for one trace. */
public class TraceHandlers {
  private static final Logger LOG = LoggerFactory.getLogger(TraceHandlers.class);

  private final List<Consumer<JsonNode>> message = new CopyOnWriteArrayList<>();
  private final List<Consumer<WebSocketCloseEvent>> close = new CopyOnWriteArrayList<>();
  private final List<Consumer<JsonNode>> error = new CopyOnWriteArrayList<>();

  public TraceHandlers onMessage(Consumer<JsonNode> handler) {
    message.add(handler);
    return this;
  }

  public TraceHandlers onClose(Consumer<WebSocketCloseEvent> handler) {
    close.add(handler);
    return this;
  }

  public TraceHandlers onError(Consumer<JsonNode> handler) {
    error.add(handler);
    return this;
  }

  void fireMessage(JsonNode frame) {
    fire(message, frame);
  }

  void fireClose(WebSocketCloseEvent event) {
    fire(close, event);
  }

  void fireError(JsonNode content) {
    fire(error, content);
  }

  private static <T> void fire(List<Consumer<T>> handlers, T value) {
    for (Consumer<T> handler : handlers) {
      try {
        handler.accept(value);
      } catch (RuntimeException e) {
        LOG.error("Trace handler failed", e);
      }
    }
  }
}
