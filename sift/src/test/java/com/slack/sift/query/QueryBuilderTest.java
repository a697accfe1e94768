package com.slack.sift.query;

import static com.slack.sift.testlib.SearchTestUtils.START;
import static com.slack.sift.testlib.SearchTestUtils.micros;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class QueryBuilderTest {
  private SqlParser sqlParser;
  private QuerySyncListener querySyncListener;
  private QueryBuilder queryBuilder;

  @BeforeEach
  public void setUp() {
    sqlParser = mock(SqlParser.class);
    querySyncListener = mock(QuerySyncListener.class);
    // Renders just enough of the statement to assert on its shape.
    SqlRenderer sqlRenderer =
        queryIR ->
            "SELECT "
                + String.join(", ", queryIR.columns)
                + " FROM \""
                + queryIR.streams.get(0)
                + "\" GROUP BY "
                + String.join(", ", queryIR.groupBy)
                + (queryIR.limit == null ? "" : " LIMIT " + queryIR.limit);
    queryBuilder = new QueryBuilder(sqlParser, sqlRenderer, querySyncListener);
  }

  private static SearchParameters.Builder search(Duration window) {
    return SearchParameters.builder()
        .streams(List.of(new StreamSchema("k8s", Set.of("_timestamp", "level", "message"))))
        .timeRange(micros(START), micros(START.plus(window)))
        .rowsPerPage(50);
  }

  private static QueryIR.Builder select() {
    return QueryIR.builder().columns(List.of("*")).streams(List.of("k8s"));
  }

  @Test
  public void testInvalidDates() {
    SearchParameters parameters = search(Duration.ofHours(1)).timeRange(-1, 10).build();
    assertThatExceptionOfType(QueryBuildException.class)
        .isThrownBy(() -> queryBuilder.buildSearch(parameters))
        .withMessage(QueryBuildException.INVALID_DATE);
  }

  @Test
  public void testStartAfterEnd() {
    SearchParameters parameters =
        search(Duration.ofHours(1)).timeRange(micros(START) + 10, micros(START)).build();
    assertThatExceptionOfType(QueryBuildException.class)
        .isThrownBy(() -> queryBuilder.buildSearch(parameters))
        .withMessage(QueryBuildException.START_AFTER_END);
  }

  @Test
  public void testEmptySqlIsInvalid() {
    SearchParameters parameters = search(Duration.ofHours(1)).sqlMode(true).query("  ").build();
    assertThatExceptionOfType(QueryBuildException.class)
        .isThrownBy(() -> queryBuilder.buildSearch(parameters))
        .withMessage(QueryBuildException.INVALID_SQL);
    verify(sqlParser, never()).parse(anyString());
  }

  @Test
  public void testUnparsableSqlIsInvalid() {
    when(sqlParser.parse(anyString())).thenThrow(new IllegalArgumentException("syntax error"));
    SearchParameters parameters =
        search(Duration.ofHours(1)).sqlMode(true).query("SELEC * FORM k8s").build();
    assertThatExceptionOfType(QueryBuildException.class)
        .isThrownBy(() -> queryBuilder.buildSearch(parameters))
        .withMessage(QueryBuildException.INVALID_SQL);
  }

  @Test
  public void testQuickModeSingleStreamProjectsInterestingFields() throws QueryBuildException {
    SearchParameters parameters =
        search(Duration.ofMinutes(15))
            .quickMode(true)
            .interestingFields(List.of("level", "message"))
            .query("level = 'error'")
            .build();

    BuiltQuery builtQuery = queryBuilder.buildSearch(parameters);

    assertThat(builtQuery.request.getSql())
        .containsExactly("SELECT _timestamp, level, message FROM \"k8s\" WHERE level = 'error'");
    assertThat(builtQuery.request.getSize()).isEqualTo(50);
    assertThat(builtQuery.request.getQuickMode()).isTrue();
    assertThat(builtQuery.paginationEnabled).isTrue();
    assertThat(builtQuery.chartInterval).isEqualTo(ChartInterval.SECONDS_10);
    assertThat(builtQuery.histogramSql)
        .isEqualTo(
            "SELECT histogram(_timestamp, '[INTERVAL]') AS zo_sql_key, COUNT(*) AS zo_sql_num"
                + " FROM \"k8s\" WHERE level = 'error' GROUP BY zo_sql_key ORDER BY zo_sql_key");
    verify(querySyncListener).onQueryBuilt(parameters, builtQuery.request);
  }

  @Test
  public void testNonQuickModeSelectsEverything() throws QueryBuildException {
    BuiltQuery builtQuery =
        queryBuilder.buildSearch(
            search(Duration.ofMinutes(15)).interestingFields(List.of("level")).build());
    assertThat(builtQuery.request.getSql()).containsExactly("SELECT * FROM \"k8s\"");
  }

  @Test
  public void testMultiStreamProjectsFieldsPresentInEachStream() throws QueryBuildException {
    SearchParameters parameters =
        search(Duration.ofMinutes(15))
            .streams(
                List.of(
                    new StreamSchema("k8s", Set.of("_timestamp", "level")),
                    new StreamSchema("nginx", Set.of("_timestamp", "status"))))
            .quickMode(true)
            .interestingFields(List.of("level"))
            .build();

    BuiltQuery builtQuery = queryBuilder.buildSearch(parameters);

    assertThat(builtQuery.request.getSql())
        .containsExactly(
            "SELECT _timestamp, level, 'k8s' AS _stream_name FROM \"k8s\"",
            "SELECT *, 'nginx' AS _stream_name FROM \"nginx\"");
    assertThat(builtQuery.request.isMultiSql()).isTrue();
    assertThat(builtQuery.isMultiStreamQuickMode()).isTrue();
    assertThat(builtQuery.histogramSql).isNull();
  }

  @Test
  public void testLimitQueryDisablesPagination() throws QueryBuildException {
    when(sqlParser.parse(anyString())).thenReturn(select().limit(10L).offset(5L).build());
    BuiltQuery builtQuery =
        queryBuilder.buildSearch(
            search(Duration.ofHours(1))
                .sqlMode(true)
                .query("SELECT * FROM k8s LIMIT 10 OFFSET 5")
                .build());

    assertThat(builtQuery.request.getSize()).isEqualTo(10);
    assertThat(builtQuery.request.getFrom()).isEqualTo(5);
    assertThat(builtQuery.request.getTrackTotalHits()).isNull();
    assertThat(builtQuery.paginationEnabled).isFalse();
    assertThat(builtQuery.isLimitQuery()).isTrue();
    // limit and offset are stripped from the histogram statement
    assertThat(builtQuery.histogramSql).doesNotContain("LIMIT");
  }

  @Test
  public void testAggregationReadsAllRows() throws QueryBuildException {
    when(sqlParser.parse(anyString()))
        .thenReturn(
            select().columns(List.of("level", "count(*)")).groupBy(List.of("level")).build());
    BuiltQuery builtQuery =
        queryBuilder.buildSearch(
            search(Duration.ofHours(1))
                .sqlMode(true)
                .query("SELECT level, count(*) FROM k8s GROUP BY level")
                .build());

    assertThat(builtQuery.request.getSize()).isEqualTo(QueryRequest.ALL_ROWS);
    assertThat(builtQuery.isAggregation()).isTrue();
    assertThat(builtQuery.paginationEnabled).isTrue();
  }

  @Test
  public void testDistinctDropsTrackTotalHits() throws QueryBuildException {
    when(sqlParser.parse(anyString())).thenReturn(select().distinct(true).build());
    BuiltQuery builtQuery =
        queryBuilder.buildSearch(
            search(Duration.ofHours(1))
                .sqlMode(true)
                .query("SELECT DISTINCT level FROM k8s")
                .build());

    assertThat(builtQuery.request.getTrackTotalHits()).isNull();
    assertThat(builtQuery.isDistinctOrWith()).isTrue();
  }

  @Test
  public void testHistogramQueryIsDerivedFromParsedStatement() {
    QueryIR queryIR =
        select()
            .where("level = 'error'")
            .orderBy(List.of(new QueryIR.OrderBy("_timestamp", false)))
            .limit(100L)
            .build();

    QueryIR histogram = QueryBuilder.toHistogramQuery(queryIR, "_timestamp");

    assertThat(histogram.columns)
        .containsExactly(
            "histogram(_timestamp, '[INTERVAL]') AS zo_sql_key", "count(*) AS zo_sql_num");
    assertThat(histogram.where).isEqualTo("level = 'error'");
    assertThat(histogram.groupBy).containsExactly("zo_sql_key");
    assertThat(histogram.orderBy).containsExactly(new QueryIR.OrderBy("zo_sql_key", true));
    assertThat(histogram.limit).isNull();
    assertThat(histogram.offset).isNull();
  }

  @Test
  public void testHistogramIsDirtyPastFirstPage() throws QueryBuildException {
    assertThat(queryBuilder.buildSearch(search(Duration.ofHours(1)).build()).histogramDirty)
        .isFalse();
    assertThat(
            queryBuilder.buildSearch(search(Duration.ofHours(1)).currentPage(2).build())
                .histogramDirty)
        .isTrue();
    assertThat(
            queryBuilder.buildSearch(search(Duration.ofHours(1)).showHistogram(false).build())
                .histogramDirty)
        .isTrue();
  }

  @Test
  public void testRegionsAndClustersArePassedThrough() throws QueryBuildException {
    BuiltQuery builtQuery =
        queryBuilder.buildSearch(
            search(Duration.ofHours(1))
                .regions(List.of("us-east-1"))
                .clusters(List.of("c1", "c2"))
                .build());
    assertThat(builtQuery.request.getRegions()).containsExactly("us-east-1");
    assertThat(builtQuery.request.getClusters()).containsExactly("c1", "c2");
    verify(querySyncListener).onQueryBuilt(any(), any());
  }
}
