package com.slack.sift.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.util.JsonUtil;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The shared websocket of a process. Every search, histogram and page count call multiplexes over
 * it with its own trace id. Inbound frames are routed to the {@link TraceRegistry} by {@code
 * content.trace_id}.
 *
 * <p>The socket connects lazily on the first {@link #whenOpen(Runnable)}. Callbacks submitted while
 * it is connecting are queued and run in submission order once it opens. When the socket closes
 * every running trace is ended and the next call reconnects.
 */
public class WebSocketConnection implements WebSocketChannel.Listener, Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(WebSocketConnection.class);

  public static final String TYPE_END = "end";
  public static final String TYPE_CANCEL_RESPONSE = "cancel_response";
  public static final String TYPE_ERROR = "error";

  enum State {
    CLOSED,
    CONNECTING,
    OPEN
  }

  private final WebSocketChannel channel;
  private final TraceRegistry traceRegistry;
  private final Deque<Runnable> openCallbacks = new ArrayDeque<>();
  private State state = State.CLOSED;

  public WebSocketConnection(WebSocketChannel channel, TraceRegistry traceRegistry) {
    this.channel = channel;
    this.traceRegistry = traceRegistry;
  }

  public TraceRegistry getTraceRegistry() {
    return traceRegistry;
  }

  /** Runs {@code callback} now if the socket is open, otherwise once it opens. */
  public void whenOpen(Runnable callback) {
    boolean runNow = false;
    boolean connect = false;
    synchronized (this) {
      switch (state) {
        case OPEN -> runNow = true;
        case CONNECTING -> openCallbacks.add(callback);
        case CLOSED -> {
          openCallbacks.add(callback);
          state = State.CONNECTING;
          connect = true;
        }
      }
    }
    if (runNow) {
      callback.run();
    }
    if (connect) {
      LOG.info("Opening websocket connection");
      channel.connect(this);
    }
  }

  public boolean send(String text) {
    return channel.send(text);
  }

  /**
   * Drains the queued callbacks before marking the socket open, so a callback submitted while the
   * queue drains is queued behind the earlier ones instead of running ahead of them.
   */
  @Override
  public void onOpen() {
    LOG.info("Websocket connection open");
    while (true) {
      List<Runnable> callbacks;
      synchronized (this) {
        if (state == State.CLOSED) {
          return;
        }
        if (openCallbacks.isEmpty()) {
          state = State.OPEN;
          return;
        }
        callbacks = new ArrayList<>(openCallbacks);
        openCallbacks.clear();
      }
      LOG.debug("Running {} queued requests", callbacks.size());
      callbacks.forEach(Runnable::run);
    }
  }

  @Override
  public void onMessage(String text) {
    JsonNode frame;
    try {
      frame = JsonUtil.readTree(text);
    } catch (IOException e) {
      LOG.warn("Dropping malformed websocket frame", e);
      return;
    }

    String type = frame.path("type").asText("");
    JsonNode content = frame.path("content");
    String traceId = ArmeriaSearchApi.textOrNull(content, "trace_id");
    if (traceId == null) {
      LOG.warn("Dropping websocket frame of type {} without trace id", type);
      return;
    }

    switch (type) {
      case TYPE_END -> traceRegistry.close(traceId, WebSocketCloseEvent.end());
      case TYPE_CANCEL_RESPONSE -> traceRegistry.close(traceId, WebSocketCloseEvent.cancelled());
      case TYPE_ERROR -> traceRegistry.fail(traceId, content);
      default -> traceRegistry.dispatch(traceId, frame);
    }
  }

  @Override
  public void onClose(int code, String reason) {
    int dropped;
    synchronized (this) {
      state = State.CLOSED;
      dropped = openCallbacks.size();
      openCallbacks.clear();
    }
    if (WebSocketCloseEvent.isAbnormal(code)) {
      LOG.warn("Websocket closed abnormally, code={} reason={}", code, reason);
    } else {
      LOG.info("Websocket closed, code={} reason={}", code, reason);
    }
    if (dropped > 0) {
      LOG.warn("Dropped {} requests queued before the websocket opened", dropped);
    }
    traceRegistry.closeAll(WebSocketCloseEvent.disconnected(code, reason));
  }

  @Override
  public void onError(Throwable cause) {
    LOG.error("Websocket error", cause);
  }

  @VisibleForTesting
  synchronized State getState() {
    return state;
  }

  @Override
  public void close() {
    channel.close();
  }
}
