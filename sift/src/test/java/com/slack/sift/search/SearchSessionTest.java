package com.slack.sift.search;

import static org.assertj.core.api.Assertions.assertThat;

import com.slack.sift.histogram.HistogramData;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

public class SearchSessionTest {

  @Test
  public void testCancelIsConsumedOnce() {
    SearchSession session = new SearchSession("org", "logs");
    assertThat(session.consumeCancel()).isFalse();

    session.requestCancel();
    assertThat(session.isCancelRequested()).isTrue();
    assertThat(session.consumeCancel()).isTrue();
    assertThat(session.consumeCancel()).isFalse();
    assertThat(session.isCancelRequested()).isFalse();
  }

  @Test
  public void testCancelNotificationOncePerRun() {
    SearchSession session = new SearchSession("org", "logs");
    List<String> notifications = new CopyOnWriteArrayList<>();

    assertThat(session.notifyCancelOnce(notifications::add, "first")).isTrue();
    assertThat(session.notifyCancelOnce(notifications::add, "second")).isFalse();
    session.resetQueryData();
    assertThat(session.notifyCancelOnce(notifications::add, "third")).isTrue();

    assertThat(notifications).containsExactly("first", "third");
  }

  @Test
  public void testTraceTracking() {
    SearchSession session = new SearchSession("org", "logs");
    session.trackTrace("t1");
    session.trackTrace("t2");
    session.untrackTrace("t1");
    assertThat(session.getInFlightTraceIds()).containsExactly("t2");
  }

  @Test
  public void testResetClearsPreviousRun() {
    SearchSession session = new SearchSession("org", "logs");
    session.setError("boom", 500, "detail");
    session.setCountErrorMsg("count failed");
    session.setHistogram(HistogramData.error("no histogram", 0, "title"));
    session.getQueryResults().setTotal(42);
    session.setSubpage(3);

    session.resetQueryData();

    assertThat(session.getErrorMsg()).isEmpty();
    assertThat(session.getErrorCode()).isZero();
    assertThat(session.getErrorDetail()).isEmpty();
    assertThat(session.getCountErrorMsg()).isEmpty();
    assertThat(session.getHistogram()).isSameAs(HistogramData.EMPTY);
    assertThat(session.getQueryResults().getTotal()).isZero();
    assertThat(session.getSubpage()).isEqualTo(1);
    assertThat(session.getHistogramQuery()).isNull();
  }

  @Test
  public void testTitleIsEmptyBeforeFirstRun() {
    assertThat(new SearchSession("org", "logs").histogramTitle()).isEmpty();
  }
}
