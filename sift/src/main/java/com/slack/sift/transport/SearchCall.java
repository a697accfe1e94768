package com.slack.sift.transport;

import com.slack.sift.query.QueryRequest;

/** One search issued to a transport. */
public record SearchCall(
    QueryRequest request,
    SearchType type,
    boolean pagination,
    SearchTrace trace,
    String orgId,
    String streamType) {

  public String traceId() {
    return trace.traceId();
  }
}
