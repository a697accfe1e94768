package com.slack.sift.transport;

public enum CommunicationMethod {
  HTTP,
  WEBSOCKET;

  /**
   * The websocket is preferred. Multi-stream quick mode searches fan out one statement per stream
   * and go over http.
   */
  public static CommunicationMethod choose(
      boolean websocketEnabled, boolean multiStream, boolean sqlMode) {
    if (websocketEnabled && !(multiStream && !sqlMode)) {
      return WEBSOCKET;
    }
    return HTTP;
  }
}
