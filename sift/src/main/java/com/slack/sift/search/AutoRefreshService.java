package com.slack.sift.search;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;
import com.slack.sift.query.SearchParameters;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Re-runs a session's search on a fixed delay, sliding its time window so that it ends now. The
 * delay is never shorter than the configured minimum refresh interval.
 */
public class AutoRefreshService extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(AutoRefreshService.class);

  private final SearchOrchestrator orchestrator;
  private final SearchSession session;
  private final SearchParameters parameters;
  private final long intervalSeconds;
  private final Clock clock;

  public AutoRefreshService(
      SearchOrchestrator orchestrator,
      SearchSession session,
      SearchParameters parameters,
      int requestedIntervalSeconds,
      int minAutoRefreshInterval,
      Clock clock) {
    this.orchestrator = orchestrator;
    this.session = session;
    this.parameters = parameters;
    this.intervalSeconds = effectiveInterval(requestedIntervalSeconds, minAutoRefreshInterval);
    this.clock = clock;
  }

  @VisibleForTesting
  static long effectiveInterval(int requestedIntervalSeconds, int minAutoRefreshInterval) {
    return Math.max(requestedIntervalSeconds, minAutoRefreshInterval);
  }

  public long getIntervalSeconds() {
    return intervalSeconds;
  }

  @Override
  protected void runOneIteration() {
    if (session.isLoading() || session.isLoadingHistogram()) {
      LOG.debug("Previous refresh still running, skipping");
      return;
    }
    orchestrator.getQueryData(session, slideToNow(parameters, clock), false);
  }

  /** Moves the window to end now while keeping its width. */
  @VisibleForTesting
  static SearchParameters slideToNow(SearchParameters parameters, Clock clock) {
    long width = parameters.endTime - parameters.startTime;
    long now = ChronoUnit.MICROS.between(Instant.EPOCH, clock.instant());
    return parameters.toBuilder().timeRange(now - width, now).currentPage(1).build();
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
  }

  @Override
  protected void shutDown() {
    LOG.info("Stopped auto refresh of {}", parameters.streamNames());
  }
}
