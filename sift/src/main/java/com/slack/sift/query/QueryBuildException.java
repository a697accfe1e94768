package com.slack.sift.query;

/** A query that can't be sent: bad time range or bad SQL. Raised before any remote call. */
public class QueryBuildException extends Exception {
  public static final String INVALID_DATE = "invalid date";
  public static final String INVALID_SQL = "invalid SQL";
  public static final String START_AFTER_END = "start>end";

  public QueryBuildException(String message) {
    super(message);
  }

  public QueryBuildException(String message, Throwable cause) {
    super(message, cause);
  }
}
