package com.slack.sift.transport;

/**
 * A failed remote call. Carries what the server said about the failure so the caller can build a
 * user facing message: the http status (0 over the websocket), the server error code, message,
 * detail and the trace id of the failed call.
 */
public class SearchException extends RuntimeException {
  public static final String RATE_LIMIT_EXCEEDED = "rate_limit_exceeded";

  private final int status;
  private final int code;
  private final String serverMessage;
  private final String error;
  private final String errorDetail;
  private final String traceId;

  public SearchException(
      int status,
      int code,
      String serverMessage,
      String error,
      String errorDetail,
      String traceId) {
    super(describe(status, code, serverMessage, error));
    this.status = status;
    this.code = code;
    this.serverMessage = serverMessage;
    this.error = error;
    this.errorDetail = errorDetail;
    this.traceId = traceId;
  }

  public SearchException(String message, String traceId, Throwable cause) {
    super(message, cause);
    this.status = 0;
    this.code = 0;
    this.serverMessage = message;
    this.error = null;
    this.errorDetail = null;
    this.traceId = traceId;
  }

  private static String describe(int status, int code, String message, String error) {
    String text = error != null && !error.isEmpty() ? error : message;
    return "status=" + status + ", code=" + code + ", message=" + text;
  }

  public int getStatus() {
    return status;
  }

  public int getCode() {
    return code;
  }

  public String getServerMessage() {
    return serverMessage;
  }

  public String getError() {
    return error;
  }

  public String getErrorDetail() {
    return errorDetail;
  }

  public String getTraceId() {
    return traceId;
  }

  /** True only for a 429 or a websocket {@code rate_limit_exceeded} error. */
  public boolean isRateLimited() {
    return status == 429 || RATE_LIMIT_EXCEEDED.equals(error);
  }
}
