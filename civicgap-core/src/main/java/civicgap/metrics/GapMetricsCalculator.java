package civicgap.metrics;

import civicgap.error.SqlErrors;
import civicgap.model.GapAxis;
import civicgap.model.GapMetric;
import civicgap.model.GapTier;
import civicgap.spi.CivicStore;
import civicgap.spi.ConnectionProvider;
import civicgap.spi.TransactionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Compares citizen demand (proposals) against in-progress bills per theme, inclusion group
 * and city.
 *
 * <p>Bills carry no inclusion group, so every observed group reports zero bills and a
 * 100% gap. Theme and city metrics are ordered by gap descending, group metrics by demand
 * descending; ties are ordered by key.
 *
 * <p>Storage failures propagate as {@link civicgap.error.StorageException}.
 */
public final class GapMetricsCalculator {
  private static final Logger logger = Logger.getLogger(GapMetricsCalculator.class.getName());

  private static final Comparator<GapMetric> BY_GAP = Comparator
      .comparingDouble(GapMetric::gapPercent).reversed()
      .thenComparing(GapMetric::key);
  private static final Comparator<GapMetric> BY_DEMAND = Comparator
      .comparingLong(GapMetric::demand).reversed()
      .thenComparing(GapMetric::key);

  private final ConnectionProvider connectionProvider;
  private final TransactionManager txManager;
  private final CivicStore store;
  private final Clock clock;

  public GapMetricsCalculator(ConnectionProvider connectionProvider, TransactionManager txManager,
      CivicStore store) {
    this(connectionProvider, txManager, store, Clock.systemUTC());
  }

  public GapMetricsCalculator(ConnectionProvider connectionProvider, TransactionManager txManager,
      CivicStore store, Clock clock) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.store = Objects.requireNonNull(store, "store");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public List<GapMetric> calculate(GapAxis axis) {
    Objects.requireNonNull(axis, "axis");
    try (Connection conn = connectionProvider.getConnection()) {
      return calculate(conn, axis, clock.instant());
    } catch (SQLException e) {
      throw SqlErrors.translate("calculate " + axis.code() + " gap", e);
    }
  }

  /**
   * Computes all three axes on one connection with a shared timestamp.
   */
  public GapReport calculateAll() {
    try (Connection conn = connectionProvider.getConnection()) {
      return calculateAll(conn);
    } catch (SQLException e) {
      throw SqlErrors.translate("calculate gap metrics", e);
    }
  }

  /**
   * Recomputes every axis and replaces the whole metric cache in one transaction.
   * On failure the previous cache contents stay visible.
   *
   * @return the metrics that were written
   */
  public GapReport snapshot() {
    try (TransactionManager.Transaction tx = txManager.begin()) {
      GapReport report = calculateAll(tx.connection());
      store.replaceGapMetrics(tx.connection(), report.all());
      tx.commit();
      logger.log(Level.INFO, "Gap metric snapshot saved: themes={0}, groups={1}, cities={2}",
          new Object[]{report.byTheme().size(), report.byGroup().size(), report.byCity().size()});
      return report;
    } catch (SQLException e) {
      throw SqlErrors.translate("snapshot gap metrics", e);
    }
  }

  /**
   * Metrics from the last {@link #snapshot()}, grouped by axis.
   */
  public GapReport cachedMetrics() {
    try (Connection conn = connectionProvider.getConnection()) {
      List<GapMetric> rows = store.findGapMetrics(conn);
      List<GapMetric> themes = new ArrayList<>();
      List<GapMetric> groups = new ArrayList<>();
      List<GapMetric> cities = new ArrayList<>();
      for (GapMetric row : rows) {
        switch (row.axis()) {
          case THEME -> themes.add(row);
          case GROUP -> groups.add(row);
          case CITY -> cities.add(row);
        }
      }
      themes.sort(BY_GAP);
      groups.sort(BY_DEMAND);
      cities.sort(BY_GAP);
      return new GapReport(themes, groups, cities);
    } catch (SQLException e) {
      throw SqlErrors.translate("read cached gap metrics", e);
    }
  }

  private GapReport calculateAll(Connection conn) {
    Instant now = clock.instant();
    return new GapReport(
        calculate(conn, GapAxis.THEME, now),
        calculate(conn, GapAxis.GROUP, now),
        calculate(conn, GapAxis.CITY, now));
  }

  private List<GapMetric> calculate(Connection conn, GapAxis axis, Instant computedAt) {
    Map<String, Long> demand = store.countDemand(conn, axis);
    Map<String, Long> bills = axis == GapAxis.GROUP ? Map.of() : store.countActiveBills(conn, axis);

    List<GapMetric> metrics = new ArrayList<>(demand.size());
    for (Map.Entry<String, Long> entry : demand.entrySet()) {
      long demandCount = entry.getValue();
      long billCount = bills.getOrDefault(entry.getKey(), 0L);
      double gap = GapMath.gapPercent(demandCount, billCount);
      metrics.add(new GapMetric(axis, entry.getKey(), demandCount, billCount, gap, GapTier.of(gap), computedAt));
    }
    metrics.sort(axis == GapAxis.GROUP ? BY_DEMAND : BY_GAP);
    logger.log(Level.FINE, "Calculated {0} gap: {1} segments", new Object[]{axis.code(), metrics.size()});
    return List.copyOf(metrics);
  }
}
