package com.slack.sift.transport;

import com.linecorp.armeria.client.websocket.WebSocketClient;
import com.linecorp.armeria.client.websocket.WebSocketSession;
import com.linecorp.armeria.common.websocket.CloseWebSocketFrame;
import com.linecorp.armeria.common.websocket.WebSocket;
import com.linecorp.armeria.common.websocket.WebSocketCloseStatus;
import com.linecorp.armeria.common.websocket.WebSocketFrame;
import com.linecorp.armeria.common.websocket.WebSocketWriter;
import java.util.concurrent.atomic.AtomicBoolean;
import org.reactivestreams.Subscriber;
import org.reactivestreams.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** {@link WebSocketChannel} backed by Armeria's websocket client. */
public class ArmeriaWebSocketChannel implements WebSocketChannel {
  private static final Logger LOG = LoggerFactory.getLogger(ArmeriaWebSocketChannel.class);

  static final int ABNORMAL_CLOSURE = 1006;

  private final WebSocketClient client;
  private final String path;
  private volatile WebSocketWriter writer;

  public ArmeriaWebSocketChannel(String baseUri, String path) {
    this(WebSocketClient.of(toWebSocketUri(baseUri)), path);
  }

  ArmeriaWebSocketChannel(WebSocketClient client, String path) {
    this.client = client;
    this.path = path;
  }

  static String toWebSocketUri(String baseUri) {
    if (baseUri.startsWith("https://")) {
      return "wss://" + baseUri.substring("https://".length());
    }
    if (baseUri.startsWith("http://")) {
      return "ws://" + baseUri.substring("http://".length());
    }
    return baseUri;
  }

  @Override
  public void connect(Listener listener) {
    client
        .connect(path)
        .whenComplete(
            (session, throwable) -> {
              if (throwable != null) {
                listener.onError(throwable);
                listener.onClose(ABNORMAL_CLOSURE, throwable.getMessage());
                return;
              }
              open(session, listener);
            });
  }

  private void open(WebSocketSession session, Listener listener) {
    WebSocketWriter outbound = WebSocket.streaming();
    session.setOutbound(outbound);
    writer = outbound;
    session.inbound().subscribe(new InboundSubscriber(listener));
    listener.onOpen();
  }

  @Override
  public boolean send(String text) {
    WebSocketWriter current = writer;
    return current != null && current.tryWrite(text);
  }

  @Override
  public void close() {
    WebSocketWriter current = writer;
    if (current != null) {
      current.close(WebSocketCloseStatus.NORMAL_CLOSURE, "client closed");
      writer = null;
    }
  }

  private class InboundSubscriber implements Subscriber<WebSocketFrame> {
    private final Listener listener;
    private final AtomicBoolean closed = new AtomicBoolean();

    InboundSubscriber(Listener listener) {
      this.listener = listener;
    }

    @Override
    public void onSubscribe(Subscription subscription) {
      subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(WebSocketFrame frame) {
      switch (frame.type()) {
        case TEXT -> listener.onMessage(frame.text());
        case CLOSE -> {
          CloseWebSocketFrame close = (CloseWebSocketFrame) frame;
          closed(close.status().code(), close.reasonPhrase());
        }
        default -> LOG.trace("Ignoring websocket frame {}", frame.type());
      }
    }

    @Override
    public void onError(Throwable cause) {
      listener.onError(cause);
      closed(ABNORMAL_CLOSURE, cause.getMessage());
    }

    @Override
    public void onComplete() {
      closed(WebSocketCloseStatus.NORMAL_CLOSURE.code(), "");
    }

    private void closed(int code, String reason) {
      if (closed.compareAndSet(false, true)) {
        writer = null;
        listener.onClose(code, reason);
      }
    }
  }
}
