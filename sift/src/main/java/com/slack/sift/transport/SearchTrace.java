package com.slack.sift.transport;

/** Correlation ids of one remote call. The trace id routes websocket responses and cancels. */
public record SearchTrace(String traceId, String spanId) {

  /** W3C trace context header value. */
  public String traceparent() {
    return "00-" + traceId + "-" + spanId + "-01";
  }
}
