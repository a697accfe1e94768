package com.slack.sift.query;

/** Output of {@link QueryBuilder}: the request to send plus what was learned about the query. */
public class BuiltQuery {
  public final QueryRequest request;
  // Null outside of SQL mode.
  public final QueryIR queryIR;
  public final ChartInterval chartInterval;
  // Histogram SQL with an [INTERVAL] token. Null for multi-stream quick mode, which uses a union.
  public final String histogramSql;
  public final boolean paginationEnabled;
  public final boolean histogramDirty;
  public final SearchParameters parameters;

  public BuiltQuery(
      QueryRequest request,
      QueryIR queryIR,
      ChartInterval chartInterval,
      String histogramSql,
      boolean paginationEnabled,
      boolean histogramDirty,
      SearchParameters parameters) {
    this.request = request;
    this.queryIR = queryIR;
    this.chartInterval = chartInterval;
    this.histogramSql = histogramSql;
    this.paginationEnabled = paginationEnabled;
    this.histogramDirty = histogramDirty;
    this.parameters = parameters;
  }

  public boolean isSqlMode() {
    return parameters.sqlMode;
  }

  public boolean isLimitQuery() {
    return queryIR != null && queryIR.isLimitQuery();
  }

  public boolean isDistinctOrWith() {
    return queryIR != null && (queryIR.distinct || queryIR.hasWith || queryIR.hasJoin);
  }

  public boolean isAggregation() {
    return queryIR != null && queryIR.isAggregation();
  }

  /** Several streams searched with generated per-stream SQL, i.e. quick mode across streams. */
  public boolean isMultiStreamQuickMode() {
    return parameters.isMultiStream() && !parameters.sqlMode;
  }

  public boolean isOrderedAscending() {
    return queryIR != null && queryIR.isOrderedAscendingBy(parameters.timestampColumn);
  }
}
