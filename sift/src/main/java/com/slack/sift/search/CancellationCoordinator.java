package com.slack.sift.search;

import com.google.common.base.Strings;
import com.slack.sift.transport.CommunicationMethod;
import com.slack.sift.transport.SearchException;
import com.slack.sift.transport.SearchFutures;
import com.slack.sift.transport.SearchTransport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stops a running search from another thread. Raising the session's flag stops the fetch loops at
 * their next iteration; calls already sent are cancelled on the server, never abandoned locally.
 *
 * <p>Over the websocket the server confirms each cancelled trace with a {@code cancel_response},
 * which ends the waiting call. Over http the running queries are deleted and the outcome is
 * reported right away.
 */
public class CancellationCoordinator {
  private static final Logger LOG = LoggerFactory.getLogger(CancellationCoordinator.class);

  public static final String CANCELLED_RUNS = "sift_cancelled_runs";

  public static final String CANCEL_SUCCESS_MESSAGE = "Running query cancelled successfully";
  public static final String CANCEL_FAILED_MESSAGE = "Failed to cancel running query";

  private final Map<CommunicationMethod, SearchTransport> transports;
  private final SearchNotifier notifier;
  private final Duration requestTimeout;
  private final Counter cancelledRuns;

  public CancellationCoordinator(
      Map<CommunicationMethod, SearchTransport> transports,
      SearchNotifier notifier,
      Duration requestTimeout,
      MeterRegistry meterRegistry) {
    this.transports = transports;
    this.notifier = notifier;
    this.requestTimeout = requestTimeout;
    this.cancelledRuns = meterRegistry.counter(CANCELLED_RUNS);
  }

  public void cancelQuery(SearchSession session) {
    List<String> traceIds = session.getInFlightTraceIds();
    session.requestCancel();
    cancelledRuns.increment();

    if (traceIds.isEmpty()) {
      if (!session.isLoading() && !session.isLoadingHistogram()) {
        LOG.info("Nothing to cancel for org {}", session.getOrgId());
        session.clearCancel();
      }
      return;
    }

    CommunicationMethod method = session.getCommunicationMethod();
    SearchTransport transport = transports.get(method);
    LOG.info("Cancelling {} traces over {}: {}", traceIds.size(), method, traceIds);
    if (method == CommunicationMethod.WEBSOCKET) {
      transport.cancel(session.getOrgId(), traceIds);
      return;
    }

    try {
      boolean cancelled =
          SearchFutures.await(
              transport.cancel(session.getOrgId(), traceIds), requestTimeout, null);
      if (cancelled) {
        session.notifyCancelOnce(notifier, CANCEL_SUCCESS_MESSAGE);
      } else {
        notifier.notify(CANCEL_FAILED_MESSAGE);
      }
    } catch (SearchException e) {
      LOG.error("Failed to cancel traces {}", traceIds, e);
      notifier.notify(
          Strings.isNullOrEmpty(e.getServerMessage())
              ? CANCEL_FAILED_MESSAGE
              : e.getServerMessage());
    } finally {
      traceIds.forEach(session::untrackTrace);
    }
  }
}
