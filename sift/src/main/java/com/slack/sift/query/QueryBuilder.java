package com.slack.sift.query;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns {@link SearchParameters} into the {@link QueryRequest} of a run.
 *
 * <p>In SQL mode the user statement is sent as is; parsing only decides the request shape (limit,
 * aggregation) and derives the histogram statement. In quick mode the statement is generated from
 * the selected streams, one statement per stream when several are selected.
 */
public class QueryBuilder {
  private static final Logger LOG = LoggerFactory.getLogger(QueryBuilder.class);

  public static final String INTERVAL_TOKEN = "[INTERVAL]";
  public static final String HISTOGRAM_KEY = "zo_sql_key";
  public static final String HISTOGRAM_COUNT = "zo_sql_num";
  public static final String STREAM_NAME_COLUMN = "_stream_name";

  private final SqlParser sqlParser;
  private final SqlRenderer sqlRenderer;
  private final QuerySyncListener querySyncListener;

  public QueryBuilder(
      SqlParser sqlParser, SqlRenderer sqlRenderer, QuerySyncListener querySyncListener) {
    this.sqlParser = sqlParser;
    this.sqlRenderer = sqlRenderer;
    this.querySyncListener = querySyncListener;
  }

  public BuiltQuery buildSearch(SearchParameters parameters) throws QueryBuildException {
    if (parameters.startTime <= 0 || parameters.endTime <= 0) {
      throw new QueryBuildException(QueryBuildException.INVALID_DATE);
    }
    if (parameters.startTime > parameters.endTime) {
      throw new QueryBuildException(QueryBuildException.START_AFTER_END);
    }

    ChartInterval chartInterval =
        ChartInterval.forRange(parameters.startTime, parameters.endTime);
    BuiltQuery builtQuery =
        parameters.sqlMode
            ? buildSqlSearch(parameters, chartInterval)
            : buildQuickSearch(parameters, chartInterval);

    builtQuery.request.setQuickMode(parameters.quickMode);
    builtQuery.request.setRegions(parameters.regions);
    builtQuery.request.setClusters(parameters.clusters);
    querySyncListener.onQueryBuilt(parameters, builtQuery.request);
    LOG.debug("Built search request {} with interval {}", builtQuery.request, chartInterval.label);
    return builtQuery;
  }

  private BuiltQuery buildSqlSearch(SearchParameters parameters, ChartInterval chartInterval)
      throws QueryBuildException {
    if (Strings.isNullOrEmpty(parameters.query.trim())) {
      throw new QueryBuildException(QueryBuildException.INVALID_SQL);
    }

    QueryIR queryIR;
    try {
      queryIR = sqlParser.parse(parameters.query);
    } catch (IllegalArgumentException e) {
      throw new QueryBuildException(QueryBuildException.INVALID_SQL, e);
    }

    QueryRequest request =
        new QueryRequest(
            List.of(parameters.query),
            parameters.startTime,
            parameters.endTime,
            parameters.rowsPerPage);
    boolean paginationEnabled = true;
    if (queryIR.isLimitQuery()) {
      request.setSize(queryIR.limit.intValue());
      request.setFrom(queryIR.offset == null ? 0 : queryIR.offset.intValue());
      request.setTrackTotalHits(null);
      paginationEnabled = false;
    } else if (queryIR.isAggregation()) {
      request.setSize(QueryRequest.ALL_ROWS);
    }
    if (queryIR.distinct || queryIR.hasWith) {
      request.setTrackTotalHits(null);
    }

    return new BuiltQuery(
        request,
        queryIR,
        chartInterval,
        sqlRenderer.render(toHistogramQuery(queryIR, parameters.timestampColumn)),
        paginationEnabled,
        isHistogramDirty(parameters),
        parameters);
  }

  private BuiltQuery buildQuickSearch(SearchParameters parameters, ChartInterval chartInterval) {
    List<String> sql = new ArrayList<>();
    String histogramSql = null;
    if (parameters.isMultiStream()) {
      for (StreamSchema stream : parameters.streams) {
        List<String> columns = new ArrayList<>();
        if (parameters.quickMode) {
          for (String field : parameters.interestingFields) {
            if (stream.hasField(field)) {
              columns.add(field);
            }
          }
        }
        String projection =
            columns.isEmpty() ? "*" : withTimestamp(columns, parameters.timestampColumn);
        sql.add(
            selectFrom(
                projection + ", '" + stream.name() + "' AS " + STREAM_NAME_COLUMN,
                stream.name(),
                parameters.query));
      }
    } else {
      String stream = parameters.streams.get(0).name();
      String projection =
          parameters.quickMode && !parameters.interestingFields.isEmpty()
              ? withTimestamp(parameters.interestingFields, parameters.timestampColumn)
              : "*";
      sql.add(selectFrom(projection, stream, parameters.query));
      histogramSql =
          "SELECT histogram("
              + parameters.timestampColumn
              + ", '"
              + INTERVAL_TOKEN
              + "') AS "
              + HISTOGRAM_KEY
              + ", COUNT(*) AS "
              + HISTOGRAM_COUNT
              + " FROM \""
              + stream
              + "\""
              + whereClause(parameters.query)
              + " GROUP BY "
              + HISTOGRAM_KEY
              + " ORDER BY "
              + HISTOGRAM_KEY;
    }

    QueryRequest request =
        new QueryRequest(sql, parameters.startTime, parameters.endTime, parameters.rowsPerPage);
    return new BuiltQuery(
        request,
        null,
        chartInterval,
        histogramSql,
        true,
        isHistogramDirty(parameters),
        parameters);
  }

  /**
   * Rewrites a parsed statement into its histogram form: same source and filter, projection
   * replaced by the bucket key and count, grouped and ordered by bucket, without limit or offset.
   */
  @VisibleForTesting
  static QueryIR toHistogramQuery(QueryIR queryIR, String timestampColumn) {
    return queryIR.toBuilder()
        .columns(
            List.of(
                "histogram(" + timestampColumn + ", '" + INTERVAL_TOKEN + "') AS " + HISTOGRAM_KEY,
                "count(*) AS " + HISTOGRAM_COUNT))
        .groupBy(List.of(HISTOGRAM_KEY))
        .orderBy(List.of(new QueryIR.OrderBy(HISTOGRAM_KEY, true)))
        .limit(null)
        .offset(null)
        .distinct(false)
        .hasAggregation(true)
        .build();
  }

  private static boolean isHistogramDirty(SearchParameters parameters) {
    return !parameters.showHistogram || parameters.currentPage > 1;
  }

  private static String withTimestamp(List<String> fields, String timestampColumn) {
    List<String> columns = new ArrayList<>();
    columns.add(timestampColumn);
    for (String field : fields) {
      if (!field.equals(timestampColumn)) {
        columns.add(field);
      }
    }
    return String.join(", ", columns);
  }

  private static String selectFrom(String projection, String stream, String filter) {
    return "SELECT " + projection + " FROM \"" + stream + "\"" + whereClause(filter);
  }

  static String whereClause(String filter) {
    return Strings.isNullOrEmpty(filter.trim()) ? "" : " WHERE " + filter.trim();
  }
}
