package com.slack.sift.search;

import com.google.common.base.Strings;
import com.slack.sift.transport.SearchException;
import java.util.Optional;

/** Builds the message shown for a failed call. */
public class SearchErrors {
  public static final String DEFAULT_SEARCH_ERROR = "Error while processing search request";
  public static final String CANCELLED_MESSAGE = "Search query was cancelled";
  public static final String OPERATION_CANCELLED_MESSAGE = "Search operation is cancelled.";

  private SearchErrors() {}

  /**
   * The server's error, else its message, else {@code defaultMessage}. Bad request and rate limit
   * responses show the server message as is. A custom message for the error code wins over both,
   * and the trace id of the call is appended.
   *
   * @param traceId used when the server didn't report the trace id of the failed call
   */
  public static String message(
      SearchException e, ErrorMessageResolver resolver, String defaultMessage, String traceId) {
    String message = firstNonEmpty(e.getError(), e.getServerMessage(), defaultMessage);

    boolean useServerMessage =
        e.getStatus() == 400
            || e.getStatus() >= 429
            || SearchException.RATE_LIMIT_EXCEEDED.equals(e.getError());
    if (useServerMessage && !Strings.isNullOrEmpty(e.getServerMessage())) {
      message = e.getServerMessage();
    }

    Optional<String> custom = resolver.customMessage(e.getCode());
    if (custom.isPresent()) {
      message = custom.get();
    }

    String failedTraceId = Strings.isNullOrEmpty(e.getTraceId()) ? traceId : e.getTraceId();
    if (!Strings.isNullOrEmpty(failedTraceId)) {
      message += " TraceID:" + failedTraceId;
    }
    return message;
  }

  private static String firstNonEmpty(String... values) {
    for (String value : values) {
      if (!Strings.isNullOrEmpty(value)) {
        return value;
      }
    }
    return "";
  }
}
