package civicgap.jdbc.store;

import civicgap.jdbc.JdbcTemplate;
import civicgap.model.DailyCount;

import java.sql.Connection;
import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * PostgreSQL civic store.
 *
 * <p>Buckets daily counts with {@code date_trunc} so the {@code occurred_at} index is used
 * for the range scan.
 */
public final class PostgresCivicStore extends AbstractJdbcCivicStore {

  public PostgresCivicStore() {
    super();
  }

  public PostgresCivicStore(Clock clock) {
    super(clock);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public List<DailyCount> dailyInteractionCounts(Connection conn, Instant since) {
    return JdbcTemplate.query(conn,
        "SELECT date_trunc('day', occurred_at)::date AS bucket_day, COUNT(*) AS total FROM interaction "
            + "WHERE occurred_at >= ? GROUP BY 1 ORDER BY 1",
        rs -> new DailyCount(rs.getDate("bucket_day").toLocalDate(), rs.getLong("total")),
        since);
  }
}
