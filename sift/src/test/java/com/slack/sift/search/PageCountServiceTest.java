package com.slack.sift.search;

import static com.slack.sift.testlib.SearchTestUtils.START;
import static com.slack.sift.testlib.SearchTestUtils.hits;
import static com.slack.sift.testlib.SearchTestUtils.micros;
import static com.slack.sift.testlib.SearchTestUtils.quickSearch;
import static com.slack.sift.testlib.SearchTestUtils.response;
import static org.assertj.core.api.Assertions.assertThat;

import com.slack.sift.partition.PartitionDetail;
import com.slack.sift.partition.PartitionRange;
import com.slack.sift.query.BuiltQuery;
import com.slack.sift.query.ChartInterval;
import com.slack.sift.query.QueryRequest;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.testlib.FakeSearchTransport;
import com.slack.sift.transport.SearchCall;
import com.slack.sift.transport.SearchException;
import com.slack.sift.transport.SearchType;
import com.slack.sift.transport.TimeOffset;
import com.slack.sift.transport.TraceContextFactory;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class PageCountServiceTest {
  private static final long T0 = micros(START);
  private static final long T1 = micros(START.plus(Duration.ofHours(1)));

  private PageCountService pageCountService;
  private SearchSession session;
  private QueryRequest searchRequest;

  @BeforeEach
  public void setUp() {
    pageCountService = new PageCountService(TraceContextFactory.create(), Duration.ofSeconds(5));
    session = new SearchSession("org", "logs");
    SearchParameters parameters = quickSearch("k8s", Duration.ofHours(1)).rowsPerPage(100).build();
    searchRequest = new QueryRequest(List.of("SELECT * FROM \"k8s\""), T0, T1, 100);
    searchRequest.setFrom(0);
    searchRequest.setQuickMode(true);
    searchRequest.setTrackTotalHits(false);
    session.setParameters(parameters);
    session.setBuiltQuery(
        new BuiltQuery(
            searchRequest, null, ChartInterval.SECONDS_30, null, true, false, parameters));
    PartitionDetail detail =
        PartitionDetail.seeded(List.of(new PartitionRange(T0, T1)), 100, false, null);
    detail.setTotal(0, 100);
    session.getQueryResults().setPartitionDetail(detail);
    session.getQueryResults().setHits(hits(0, 100));
    session.getQueryResults().setTotal(100);
  }

  @Test
  public void testCountRequest() {
    QueryRequest request =
        PageCountService.toCountRequest(searchRequest, new TimeOffset(T0 + 10, T1 - 10));

    assertThat(request.getSize()).isZero();
    assertThat(request.getFrom()).isNull();
    assertThat(request.getQuickMode()).isNull();
    assertThat(request.getTrackTotalHits()).isTrue();
    assertThat(request.getStartTime()).isEqualTo(T0 + 10);
    assertThat(request.getEndTime()).isEqualTo(T1 - 10);
    assertThat(request.isStreamingOutput()).isFalse();
    // the search request is left as it was
    assertThat(searchRequest.getSize()).isEqualTo(100);
    assertThat(searchRequest.getTrackTotalHits()).isFalse();
  }

  @Test
  public void testCountUpdatesTotalsAndPages() {
    FakeSearchTransport transport = new FakeSearchTransport(call -> response(List.of(), 1234));

    pageCountService.getPageCount(session, searchRequest, transport);

    List<SearchCall> calls = transport.getCalls(SearchType.PAGE_COUNT);
    assertThat(calls).hasSize(1);
    assertThat(calls.get(0).request().getSize()).isZero();
    assertThat(session.getQueryResults().getTotal()).isEqualTo(1234);
    assertThat(session.getPartitionDetail().getPartitionTotal()).containsExactly(1234L);
    assertThat(session.getPartitionDetail().getPaginations()).hasSize(12);
    assertThat(session.getQueryResults().getTook()).isEqualTo(5);
    assertThat(session.getHistogram().title).contains("out of 1,234 events");
    assertThat(session.getInFlightTraceIds()).isEmpty();
  }

  @Test
  public void testSkippedWhenTotalAlreadyKnown() {
    session.getQueryResults().setTotal(500);
    FakeSearchTransport transport = new FakeSearchTransport(call -> response(List.of(), 1234));

    pageCountService.getPageCount(session, searchRequest, transport);

    assertThat(transport.getCalls()).isEmpty();
  }

  @Test
  public void testFailureSetsCountError() {
    FakeSearchTransport transport =
        new FakeSearchTransport(
            call -> {
              throw new SearchException(429, 0, "Too many requests", null, null, null);
            });

    pageCountService.getPageCount(session, searchRequest, transport);

    String traceId = transport.getCalls().get(0).traceId();
    assertThat(session.getCountErrorMsg())
        .isEqualTo("Error while retrieving total events: Too many requests TraceID:" + traceId);
    assertThat(session.getQueryResults().getTotal()).isEqualTo(100);
    assertThat(session.getErrorMsg()).isEmpty();
  }

  @Test
  public void testCountErrorHidesInternalMessages() {
    SearchException e = new SearchException(404, 0, "stack trace here", null, null, "t1");
    assertThat(PageCountService.countErrorMessage(e, "t2"))
        .isEqualTo("Error while retrieving total events:  TraceID:t1");
  }
}
