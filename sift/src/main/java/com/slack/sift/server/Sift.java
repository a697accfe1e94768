package com.slack.sift.server;

import com.google.common.annotations.VisibleForTesting;
import com.slack.sift.config.SiftConfig;
import com.slack.sift.config.SiftConfigs;
import com.slack.sift.histogram.HistogramAggregator;
import com.slack.sift.partition.PartitionPlanner;
import com.slack.sift.query.QueryBuilder;
import com.slack.sift.query.QuerySyncListener;
import com.slack.sift.query.SearchParameters;
import com.slack.sift.query.SqlParser;
import com.slack.sift.query.SqlRenderer;
import com.slack.sift.query.StreamSchema;
import com.slack.sift.search.AutoRefreshService;
import com.slack.sift.search.CancellationCoordinator;
import com.slack.sift.search.ErrorMessageResolver;
import com.slack.sift.search.PageCountService;
import com.slack.sift.search.SearchNotifier;
import com.slack.sift.search.SearchOrchestrator;
import com.slack.sift.search.SearchSession;
import com.slack.sift.transport.ArmeriaSearchApi;
import com.slack.sift.transport.ArmeriaWebSocketChannel;
import com.slack.sift.transport.CommunicationMethod;
import com.slack.sift.transport.HttpSearchTransport;
import com.slack.sift.transport.SearchApi;
import com.slack.sift.transport.SearchTransport;
import com.slack.sift.transport.TraceContextFactory;
import com.slack.sift.transport.TraceRegistry;
import com.slack.sift.transport.WebSocketChannel;
import com.slack.sift.transport.WebSocketConnection;
import com.slack.sift.transport.WebSocketSearchTransport;
import com.slack.sift.util.MetricsFactory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import java.io.Closeable;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main class of sift. Wires the query builder, partition planner, transports and orchestrator from
 * the config and hands out search sessions that share one websocket connection.
 */
public class Sift implements Closeable {
  private static final Logger LOG = LoggerFactory.getLogger(Sift.class);

  private final SiftConfigs.SiftConfig siftConfig;
  private final WebSocketConnection webSocketConnection;
  private final SearchOrchestrator orchestrator;
  private final CancellationCoordinator cancellationCoordinator;

  @VisibleForTesting
  Sift(
      SiftConfigs.SiftConfig siftConfig,
      SqlParser sqlParser,
      SqlRenderer sqlRenderer,
      QuerySyncListener querySyncListener,
      SearchNotifier notifier,
      ErrorMessageResolver errorMessageResolver,
      SearchApi searchApi,
      WebSocketChannel webSocketChannel,
      MeterRegistry meterRegistry) {
    this.siftConfig = siftConfig;
    SiftConfigs.SearchConfig searchConfig = siftConfig.getSearchConfig();
    SiftConfigs.TransportConfig transportConfig = siftConfig.getTransportConfig();
    Duration requestTimeout = Duration.ofMillis(transportConfig.getRequestTimeoutMs());
    TraceContextFactory traceContextFactory = TraceContextFactory.create();

    this.webSocketConnection = new WebSocketConnection(webSocketChannel, new TraceRegistry());
    Map<CommunicationMethod, SearchTransport> transports = new EnumMap<>(CommunicationMethod.class);
    transports.put(
        CommunicationMethod.HTTP,
        new HttpSearchTransport(searchApi, searchConfig.getSqlBase64Enabled(), meterRegistry));
    transports.put(
        CommunicationMethod.WEBSOCKET,
        new WebSocketSearchTransport(
            webSocketConnection,
            searchConfig.getSqlBase64Enabled(),
            transportConfig.getUseCache(),
            meterRegistry));

    this.orchestrator =
        new SearchOrchestrator(
            new QueryBuilder(sqlParser, sqlRenderer, querySyncListener),
            new PartitionPlanner(
                searchApi, searchConfig.getSqlBase64Enabled(), requestTimeout, meterRegistry),
            transports,
            new HistogramAggregator(traceContextFactory, notifier, requestTimeout, meterRegistry),
            new PageCountService(traceContextFactory, requestTimeout),
            searchApi,
            traceContextFactory,
            notifier,
            errorMessageResolver,
            transportConfig.getWebsocketEnabled(),
            searchConfig.getHistogramEnabled(),
            requestTimeout,
            meterRegistry);
    this.cancellationCoordinator =
        new CancellationCoordinator(transports, notifier, requestTimeout, meterRegistry);
    LOG.info("Started sift with config: {}", siftConfig);
  }

  public static Sift fromConfig(
      SiftConfigs.SiftConfig siftConfig,
      SqlParser sqlParser,
      SqlRenderer sqlRenderer,
      MeterRegistry meterRegistry) {
    SiftConfigs.TransportConfig transportConfig = siftConfig.getTransportConfig();
    String websocketPath =
        transportConfig.getWebsocketPath().replace("{org}", transportConfig.getOrgId());
    return new Sift(
        siftConfig,
        sqlParser,
        sqlRenderer,
        QuerySyncListener.NOOP,
        SearchNotifier.LOGGING,
        ErrorMessageResolver.NONE,
        new ArmeriaSearchApi(
            transportConfig.getBaseUri(),
            Duration.ofMillis(transportConfig.getRequestTimeoutMs())),
        new ArmeriaWebSocketChannel(transportConfig.getBaseUri(), websocketPath),
        meterRegistry);
  }

  public SearchSession newSession() {
    return new SearchSession(
        siftConfig.getTransportConfig().getOrgId(), siftConfig.getSearchConfig().getStreamType());
  }

  /** Search parameters with the page size and timestamp column taken from the config. */
  public SearchParameters.Builder newSearch() {
    SiftConfigs.SearchConfig searchConfig = siftConfig.getSearchConfig();
    return SearchParameters.builder()
        .rowsPerPage(searchConfig.getRowsPerPage())
        .timestampColumn(searchConfig.getTimestampColumn())
        .showHistogram(searchConfig.getHistogramEnabled());
  }

  public void search(SearchSession session, SearchParameters parameters) {
    orchestrator.getQueryData(session, parameters, false);
  }

  public void page(SearchSession session, SearchParameters parameters) {
    orchestrator.getQueryData(session, parameters, true);
  }

  public void cancel(SearchSession session) {
    cancellationCoordinator.cancelQuery(session);
  }

  public AutoRefreshService autoRefresh(
      SearchSession session, SearchParameters parameters, int intervalSeconds) {
    return new AutoRefreshService(
        orchestrator,
        session,
        parameters,
        intervalSeconds,
        siftConfig.getSearchConfig().getMinAutoRefreshInterval(),
        Clock.systemUTC());
  }

  public SearchOrchestrator getOrchestrator() {
    return orchestrator;
  }

  @Override
  public void close() {
    LOG.info("Shutting down sift");
    webSocketConnection.close();
  }

  /** Runs one quick mode search: {@code Sift <config> <stream> [filter] [minutes]}. */
  public static void main(String[] args) throws Exception {
    if (args.length < 2) {
      LOG.info("Usage: Sift <config file> <stream> [filter] [minutes]");
      return;
    }
    SiftConfig.initFromFile(Path.of(args[0]));
    SiftConfigs.SiftConfig config = SiftConfig.get();
    MetricsFactory.init(config);
    Metrics.addRegistry(MetricsFactory.getRegistry());

    String filter = args.length > 2 ? args[2] : "";
    long minutes = args.length > 3 ? Long.parseLong(args[3]) : 15;
    SqlParser noSqlMode =
        sql -> {
          throw new IllegalArgumentException("SQL mode is not available from the command line");
        };
    try (Sift sift =
        fromConfig(config, noSqlMode, queryIR -> "", MetricsFactory.getRegistry())) {
      Instant now = Instant.now();
      SearchParameters parameters =
          sift.newSearch()
              .streams(List.of(new StreamSchema(args[1], Set.of())))
              .query(filter)
              .quickMode(true)
              .timeRange(
                  ChronoUnit.MICROS.between(Instant.EPOCH, now.minus(Duration.ofMinutes(minutes))),
                  ChronoUnit.MICROS.between(Instant.EPOCH, now))
              .build();
      SearchSession session = sift.newSession();
      sift.search(session, parameters);
      if (!session.getErrorMsg().isEmpty()) {
        LOG.error("Search failed: {}", session.getErrorMsg());
        return;
      }
      LOG.info(session.getHistogram().title);
      session.getQueryResults().getHits().forEach(hit -> LOG.info("{}", hit));
    }
  }
}
