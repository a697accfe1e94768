package com.slack.sift.histogram;

import static com.slack.sift.testlib.SearchTestUtils.quickSearch;
import static org.assertj.core.api.Assertions.assertThat;

import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.ChartInterval;
import com.slack.sift.query.QueryIR;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.query.StreamSchema;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

public class HistogramEligibilityTest {

  private static BuiltQuery built(SearchParameters parameters, QueryIR queryIR) {
    return new BuiltQuery(
        new QueryRequest(List.of("SELECT 1"), parameters.startTime, parameters.endTime, 250),
        queryIR,
        ChartInterval.MINUTE_1,
        "SELECT 1",
        true,
        false,
        parameters);
  }

  private static BuiltQuery sql(QueryIR queryIR) {
    return built(quickSearch("a", Duration.ofHours(1)).sqlMode(true).build(), queryIR);
  }

  private static QueryIR.Builder select() {
    return QueryIR.builder().columns(List.of("*")).streams(List.of("a"));
  }

  @Test
  public void testPlainQueryIsEligible() {
    BuiltQuery builtQuery = built(quickSearch("a", Duration.ofHours(1)).build(), null);
    assertThat(HistogramEligibility.evaluate(builtQuery, null, true))
        .isEqualTo(HistogramEligibility.ELIGIBLE);
    assertThat(HistogramEligibility.evaluate(builtQuery, true, true))
        .isEqualTo(HistogramEligibility.ELIGIBLE);
  }

  @Test
  public void testMultiStreamSql() {
    SearchParameters parameters =
        quickSearch("a", Duration.ofHours(1))
            .sqlMode(true)
            .streams(
                List.of(
                    new StreamSchema("a", Set.of("_timestamp")),
                    new StreamSchema("b", Set.of("_timestamp"))))
            .build();
    HistogramEligibility eligibility =
        HistogramEligibility.evaluate(built(parameters, select().build()), true, true);
    assertThat(eligibility).isEqualTo(HistogramEligibility.MULTI_STREAM_SQL);
    assertThat(eligibility.errorMsg)
        .isEqualTo("Histogram is not available for multi-stream SQL mode search.");
  }

  @Test
  public void testLimitQuery() {
    HistogramEligibility eligibility =
        HistogramEligibility.evaluate(sql(select().limit(10L).build()), true, true);
    assertThat(eligibility).isEqualTo(HistogramEligibility.LIMIT_QUERY);
    assertThat(eligibility.errorCode).isEqualTo(-1);
    assertThat(eligibility.hasError()).isTrue();
  }

  @Test
  public void testUnsupportedQueries() {
    assertThat(HistogramEligibility.evaluate(sql(select().distinct(true).build()), null, true))
        .isEqualTo(HistogramEligibility.UNSUPPORTED_QUERY);
    assertThat(HistogramEligibility.evaluate(sql(select().hasJoin(true).build()), null, true))
        .isEqualTo(HistogramEligibility.UNSUPPORTED_QUERY);
    assertThat(HistogramEligibility.evaluate(sql(select().build()), false, true))
        .isEqualTo(HistogramEligibility.UNSUPPORTED_QUERY);
    assertThat(HistogramEligibility.UNSUPPORTED_QUERY.errorMsg)
        .isEqualTo("Histogram unavailable for CTEs, DISTINCT, JOIN and LIMIT queries.");
  }

  @Test
  public void testDisabled() {
    assertThat(HistogramEligibility.evaluate(sql(select().build()), true, false))
        .isEqualTo(HistogramEligibility.DISABLED);
    BuiltQuery hidden =
        built(quickSearch("a", Duration.ofHours(1)).showHistogram(false).build(), null);
    HistogramEligibility eligibility = HistogramEligibility.evaluate(hidden, true, true);
    assertThat(eligibility).isEqualTo(HistogramEligibility.DISABLED);
    assertThat(eligibility.hasError()).isFalse();
  }

  @Test
  public void testNeedsPageCount() {
    assertThat(HistogramEligibility.MULTI_STREAM_SQL.needsPageCount(false, 1, 0, 0)).isTrue();
    assertThat(HistogramEligibility.MULTI_STREAM_SQL.needsPageCount(false, 2, 0, 10)).isFalse();
    assertThat(HistogramEligibility.MULTI_STREAM_SQL.needsPageCount(true, 1, 0, 10)).isFalse();

    assertThat(HistogramEligibility.DISABLED.needsPageCount(false, 1, 0, 10)).isTrue();
    assertThat(HistogramEligibility.UNSUPPORTED_QUERY.needsPageCount(false, 1, 0, 0)).isFalse();
    assertThat(HistogramEligibility.UNSUPPORTED_QUERY.needsPageCount(false, 2, 250, 10))
        .isFalse();

    assertThat(HistogramEligibility.ELIGIBLE.needsPageCount(false, 1, 0, 10)).isFalse();
    assertThat(HistogramEligibility.LIMIT_QUERY.needsPageCount(false, 1, 0, 10)).isFalse();
  }
}
