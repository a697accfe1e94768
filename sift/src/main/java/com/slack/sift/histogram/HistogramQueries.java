package com.slack.sift.histogram;

import com.google.common.base.Strings;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.ChartInterval;
import com.slack.sift.query.QueryBuilder;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.query.StreamSchema;
import java.util.ArrayList;
import java.util.List;

public class HistogramQueries {
  private HistogramQueries() {}

  /**
   * Histogram SQL for the run with the interval filled in. Quick mode over several streams counts
   * every stream in one union query.
   */
  public static String forRun(BuiltQuery builtQuery) {
    if (builtQuery.isMultiStreamQuickMode()) {
      return multiStream(builtQuery.parameters, builtQuery.chartInterval);
    }
    return builtQuery.histogramSql.replace(
        QueryBuilder.INTERVAL_TOKEN, builtQuery.chartInterval.label);
  }

  /**
   * One count per stream joined with {@code UNION ALL}. Streams that lack a field used by the
   * filter are left out.
   */
  public static String multiStream(SearchParameters parameters, ChartInterval chartInterval) {
    String where = Strings.isNullOrEmpty(parameters.query) ? "" : " WHERE " + parameters.query;
    List<String> perStream = new ArrayList<>();
    for (StreamSchema stream : parameters.streams) {
      if (parameters.missingFilterStreams.contains(stream.name())) {
        continue;
      }
      perStream.add(
          String.format(
              "select histogram(%s, '%s') AS %s, count(*) AS %s from \"%s\"%s GROUP BY %s",
              parameters.timestampColumn,
              chartInterval.label,
              QueryBuilder.HISTOGRAM_KEY,
              QueryBuilder.HISTOGRAM_COUNT,
              stream.name(),
              where,
              QueryBuilder.HISTOGRAM_KEY));
    }
    return String.join(" UNION ALL ", perStream);
  }
}
