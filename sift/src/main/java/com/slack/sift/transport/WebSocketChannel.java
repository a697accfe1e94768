package com.slack.sift.transport;

/** A single text websocket. Events are delivered to the listener passed to {@link #connect}. */
public interface WebSocketChannel {

  interface Listener {
    void onOpen();

    void onMessage(String text);

    void onClose(int code, String reason);

    void onError(Throwable cause);
  }

  /** Starts connecting; {@link Listener#onOpen()} or {@link Listener#onClose} follows. */
  void connect(Listener listener);

  /**
   * @return false when the frame could not be written, e.g. the socket is closed
   */
  boolean send(String text);

  void close();
}
