package com.slack.sift.transport;

import java.util.Set;

/** Why a trace stopped receiving frames. */
public record WebSocketCloseEvent(int code, String reason, Kind kind) {
  public static final int NORMAL_CLOSURE = 1000;
  public static final String UNEXPECTED_TERMINATION_MESSAGE =
      "WebSocket connection terminated unexpectedly. Please check your network and try again";

  // Going away, abnormal closure, and the server side failures 1010-1013.
  private static final Set<Integer> ABNORMAL_CODES = Set.of(1001, 1006, 1010, 1011, 1012, 1013);

  public enum Kind {
    // The server sent the last frame of the trace.
    END,
    // The server confirmed a cancel request for the trace.
    CANCELLED,
    // The socket closed while the trace was running.
    DISCONNECTED
  }

  public static WebSocketCloseEvent end() {
    return new WebSocketCloseEvent(NORMAL_CLOSURE, "end", Kind.END);
  }

  public static WebSocketCloseEvent cancelled() {
    return new WebSocketCloseEvent(NORMAL_CLOSURE, "cancel_response", Kind.CANCELLED);
  }

  public static WebSocketCloseEvent disconnected(int code, String reason) {
    return new WebSocketCloseEvent(code, reason, Kind.DISCONNECTED);
  }

  public static boolean isAbnormal(int code) {
    return ABNORMAL_CODES.contains(code);
  }

  /** Message to show for a trace that was cut off by a socket close. */
  public String message() {
    if (isAbnormal(code)) {
      return UNEXPECTED_TERMINATION_MESSAGE;
    }
    return reason == null || reason.isEmpty() ? "WebSocket connection closed" : reason;
  }
}
