package com.slack.sift.transport;

/** The call ended because it was cancelled. Not a failure. */
public class SearchCancelledException extends RuntimeException {
  // Server code for a query cancelled on request.
  public static final int CANCELLED_CODE = 20009;

  private final String traceId;

  public SearchCancelledException(String traceId) {
    super("Search query was cancelled, trace " + traceId);
    this.traceId = traceId;
  }

  public String getTraceId() {
    return traceId;
  }
}
