package com.slack.sift.histogram;

import com.slack.sift.query.BuiltQuery;

/**
 * Whether a run gets a histogram, decided once the first page has landed. Runs that don't get one
 * may still need a separate count query to know how many pages there are.
 */
public enum HistogramEligibility {
  ELIGIBLE(null, 0),
  MULTI_STREAM_SQL("Histogram is not available for multi-stream SQL mode search.", 0),
  LIMIT_QUERY(HistogramEligibility.UNSUPPORTED_QUERY_MESSAGE, -1),
  UNSUPPORTED_QUERY(HistogramEligibility.UNSUPPORTED_QUERY_MESSAGE, 0),
  DISABLED(null, 0);

  static final String UNSUPPORTED_QUERY_MESSAGE =
      "Histogram unavailable for CTEs, DISTINCT, JOIN and LIMIT queries.";

  public final String errorMsg;
  public final int errorCode;

  HistogramEligibility(String errorMsg, int errorCode) {
    this.errorMsg = errorMsg;
    this.errorCode = errorCode;
  }

  /**
   * @param serverEligible the partition or search response's {@code is_histogram_eligible}, null
   *     when the server didn't say
   */
  public static HistogramEligibility evaluate(
      BuiltQuery builtQuery, Boolean serverEligible, boolean histogramEnabled) {
    if (builtQuery.isSqlMode() && builtQuery.parameters.isMultiStream()) {
      return MULTI_STREAM_SQL;
    }
    if (builtQuery.isLimitQuery()) {
      return LIMIT_QUERY;
    }
    if (builtQuery.isDistinctOrWith() || Boolean.FALSE.equals(serverEligible)) {
      return UNSUPPORTED_QUERY;
    }
    if (!histogramEnabled || !builtQuery.parameters.showHistogram) {
      return DISABLED;
    }
    return ELIGIBLE;
  }

  public boolean hasError() {
    return errorMsg != null;
  }

  /** Whether the page count has to be fetched separately for this outcome. */
  public boolean needsPageCount(boolean aggregation, int currentPage, int from, int hits) {
    return switch (this) {
      case MULTI_STREAM_SQL -> currentPage == 1 && !aggregation;
      case UNSUPPORTED_QUERY, DISABLED -> from == 0 && hits > 0 && !aggregation;
      case ELIGIBLE, LIMIT_QUERY -> false;
    };
  }
}
