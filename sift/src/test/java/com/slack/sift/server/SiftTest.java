package com.slack.sift.server;

import static com.slack.sift.testlib.SearchTestUtils.START;
import static com.slack.sift.testlib.SearchTestUtils.bucket;
import static com.slack.sift.testlib.SearchTestUtils.hits;
import static com.slack.sift.testlib.SearchTestUtils.micros;
import static com.slack.sift.testlib.SearchTestUtils.response;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.slack.sift.config.SiftConfig;
import com.slack.sift.config.SiftConfigs;
import com.slack.sift.query.ChartInterval;
import com.slack.sift.query.QuerySyncListener;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.query.SqlParser;
import com.slack.sift.query.StreamSchema;
import com.slack.sift.search.CancellationCoordinator;
import com.slack.sift.search.ErrorMessageResolver;
import com.slack.sift.search.SearchSession;
import com.slack.sift.testlib.FakeWebSocketChannel;
import com.slack.sift.transport.CancelResult;
import com.slack.sift.transport.CommunicationMethod;
import com.slack.sift.transport.PartitionResponse;
import com.slack.sift.transport.SearchApi;
import com.slack.sift.transport.SearchResponse;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class SiftTest {
  private static final long T1 = micros(START);
  private static final long T2 = micros(START.plus(Duration.ofHours(1)));

  private static final String CONFIG =
      String.join(
          "\n",
          "searchConfig:",
          "  rowsPerPage: 20",
          "  minAutoRefreshInterval: 15",
          "  streamType: logs",
          "transportConfig:",
          "  orgId: acme",
          "  websocketEnabled: false",
          "  requestTimeoutMs: 5000");

  private SearchApi searchApi;
  private FakeWebSocketChannel webSocketChannel;
  private List<String> notifications;
  private Runnable onDataSearch;
  private Sift sift;

  @BeforeEach
  public void setUp() throws Exception {
    SiftConfigs.SiftConfig config = SiftConfig.fromYamlConfig(CONFIG);
    searchApi = mock(SearchApi.class);
    webSocketChannel = new FakeWebSocketChannel(true);
    notifications = new CopyOnWriteArrayList<>();
    onDataSearch = () -> {};

    when(searchApi.partition(eq("acme"), eq("logs"), any(ObjectNode.class), any()))
        .thenReturn(
            CompletableFuture.completedFuture(new PartitionResponse(List.of(List.of(T1, T2)), 0)));
    when(searchApi.search(eq("acme"), eq("logs"), any(ObjectNode.class), any()))
        .thenAnswer(
            invocation -> {
              ObjectNode body = invocation.getArgument(2);
              return CompletableFuture.completedFuture(answer(body));
            });

    sift =
        new Sift(
            config,
            mock(SqlParser.class),
            queryIR -> "",
            QuerySyncListener.NOOP,
            notifications::add,
            ErrorMessageResolver.NONE,
            searchApi,
            webSocketChannel,
            new SimpleMeterRegistry());
  }

  @AfterEach
  public void tearDown() {
    sift.close();
  }

  private SearchResponse answer(ObjectNode body) {
    if (body.path("query").path("sql").asText().startsWith("SELECT histogram(")) {
      return response(List.of(bucket(ChartInterval.formatKey(START), 5)), 1);
    }
    onDataSearch.run();
    return response(hits(0, 5), 5);
  }

  private SearchParameters search() {
    return sift.newSearch()
        .streams(List.of(new StreamSchema("k8s", Set.of("_timestamp", "message"))))
        .query("")
        .timeRange(T1, T2)
        .build();
  }

  @Test
  public void testSessionAndSearchDefaults() {
    SearchSession session = sift.newSession();
    assertThat(session.getOrgId()).isEqualTo("acme");
    assertThat(session.getStreamType()).isEqualTo("logs");

    SearchParameters parameters = search();
    assertThat(parameters.rowsPerPage).isEqualTo(20);
    assertThat(parameters.timestampColumn).isEqualTo("_timestamp");
    assertThat(parameters.showHistogram).isTrue();
    assertThat(sift.autoRefresh(session, parameters, 1).getIntervalSeconds()).isEqualTo(15);
  }

  @Test
  public void testSearchOverHttp() {
    SearchSession session = sift.newSession();

    sift.search(session, search());

    assertThat(session.getErrorMsg()).isEmpty();
    assertThat(session.getCommunicationMethod()).isEqualTo(CommunicationMethod.HTTP);
    assertThat(session.getQueryResults().getHits()).hasSize(5);
    assertThat(session.getQueryResults().getTotal()).isEqualTo(5);
    assertThat(session.getHistogram().yData).contains(5L);
    assertThat(session.getHistogram().title).startsWith("Showing 1 to 5 out of 5 events");
    // the websocket is only opened when a search goes over it
    assertThat(webSocketChannel.getConnects()).isZero();

    sift.page(session, search());
    verify(searchApi, times(1)).partition(any(), any(), any(), any());
    assertThat(session.getQueryResults().getHits()).hasSize(5);
  }

  @Test
  public void testCancelRunningSearch() {
    SearchSession session = sift.newSession();
    when(searchApi.deleteRunningQueries(eq("acme"), anyCollection()))
        .thenReturn(CompletableFuture.completedFuture(List.of(new CancelResult("t1", true))));
    onDataSearch = () -> sift.cancel(session);

    sift.search(session, search());

    verify(searchApi).deleteRunningQueries(eq("acme"), anyCollection());
    assertThat(notifications).containsExactly(CancellationCoordinator.CANCEL_SUCCESS_MESSAGE);
    assertThat(session.isCancelRequested()).isFalse();
  }

  @Test
  public void testCancelWithNothingRunning() {
    SearchSession session = sift.newSession();

    sift.cancel(session);

    verify(searchApi, never()).deleteRunningQueries(any(), any());
    assertThat(session.isCancelRequested()).isFalse();
    assertThat(notifications).isEmpty();
  }
}
