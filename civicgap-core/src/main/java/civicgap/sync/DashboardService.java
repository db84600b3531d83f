package civicgap.sync;

import civicgap.error.SqlErrors;
import civicgap.metrics.GapMetricsCalculator;
import civicgap.metrics.GapReport;
import civicgap.model.DailyCount;
import civicgap.spi.CivicStore;
import civicgap.spi.ConnectionProvider;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Dashboard read model served through a {@link SyncCache}.
 *
 * <p>Values may be up to one TTL stale. Storage failures propagate as
 * {@link civicgap.error.StorageException} and do not evict the previous value.
 */
public final class DashboardService {
  private static final Logger logger = Logger.getLogger(DashboardService.class.getName());

  static final String SUMMARY_KEY = "summary";
  static final String GAPS_KEY = "gaps";
  static final String TREND_KEY_PREFIX = "trend:";
  static final String POPULAR_KEY_PREFIX = "popular:";

  private static final Duration WEEK = Duration.ofDays(7);

  private final ConnectionProvider connectionProvider;
  private final CivicStore store;
  private final GapMetricsCalculator calculator;
  private final SyncCache cache;
  private final Clock clock;

  public DashboardService(ConnectionProvider connectionProvider, CivicStore store,
      GapMetricsCalculator calculator, SyncCache cache) {
    this(connectionProvider, store, calculator, cache, Clock.systemUTC());
  }

  public DashboardService(ConnectionProvider connectionProvider, CivicStore store,
      GapMetricsCalculator calculator, SyncCache cache, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.store = Objects.requireNonNull(store, "store");
    this.calculator = Objects.requireNonNull(calculator, "calculator");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public SyncCache cache() {
    return cache;
  }

  public DashboardSummary getDashboardSummary() {
    return cache.get(SUMMARY_KEY, this::loadSummary);
  }

  /**
   * Interactions per day over the last {@code days} days, oldest first. Days without
   * interactions are omitted.
   *
   * @param days window length, 1 to 90
   */
  public List<DailyCount> getInteractionTrend(int days) {
    if (days < 1 || days > 90) {
      throw new IllegalArgumentException("days must be in [1, 90], got: " + days);
    }
    return cache.get(TREND_KEY_PREFIX + days, () -> query("load interaction trend", conn ->
        List.copyOf(store.dailyInteractionCounts(conn, clock.instant().minus(Duration.ofDays(days))))));
  }

  /**
   * The most recently submitted proposals, newest first.
   *
   * @param limit number of proposals, 1 to 100
   */
  public List<ProposalSummary> getPopularProposals(int limit) {
    if (limit < 1 || limit > 100) {
      throw new IllegalArgumentException("limit must be in [1, 100], got: " + limit);
    }
    return cache.get(POPULAR_KEY_PREFIX + limit, () -> query("load recent proposals", conn ->
        store.recentProposals(conn, limit).stream().map(ProposalSummary::of).toList()));
  }

  public GapReport getGapMetrics() {
    return cache.get(GAPS_KEY, calculator::calculateAll);
  }

  private DashboardSummary loadSummary() {
    return query("load dashboard summary", conn -> {
      Instant now = clock.instant();
      long citizens = store.countCitizens(conn);
      long interactions = store.countInteractions(conn);
      long proposals = store.countProposals(conn);
      long lastWeek = store.countInteractionsSince(conn, now.minus(WEEK));
      double engagement = citizens > 0 ? (proposals + interactions) * 100.0 / citizens : 0.0;
      logger.log(Level.INFO, "Dashboard summary computed: citizens={0}, interactions={1}, proposals={2}",
          new Object[]{citizens, interactions, proposals});
      return new DashboardSummary(citizens, interactions, proposals, engagement, lastWeek, now);
    });
  }

  private <T> T query(String action, ConnectionCallback<T> callback) {
    try (Connection conn = connectionProvider.getConnection()) {
      return callback.apply(conn);
    } catch (SQLException e) {
      throw SqlErrors.translate(action, e);
    }
  }

  @FunctionalInterface
  private interface ConnectionCallback<T> {
    T apply(Connection conn) throws SQLException;
  }
}
