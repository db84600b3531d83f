package civicgap.jdbc.store;

import civicgap.error.StorageException;
import civicgap.jdbc.JdbcSchema;
import civicgap.jdbc.JdbcTemplate;
import civicgap.model.BillStatus;
import civicgap.model.Citizen;
import civicgap.model.ContentKind;
import civicgap.model.DailyCount;
import civicgap.model.GapAxis;
import civicgap.model.GapMetric;
import civicgap.model.GapTier;
import civicgap.model.Interaction;
import civicgap.model.InteractionKind;
import civicgap.model.Opinion;
import civicgap.model.Proposal;
import civicgap.model.ProposalStatus;
import civicgap.spi.CivicStore;
import civicgap.util.Json;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Base JDBC civic store with standard SQL implementations.
 *
 * <p>Subclasses name the dialect and its DDL script. Register custom implementations via
 * {@code META-INF/services/civicgap.jdbc.store.AbstractJdbcCivicStore}.
 *
 * <p>Inserts re-read the row they wrote, so returned records reflect the stored precision.
 *
 * @see JdbcCivicStores
 */
public abstract class AbstractJdbcCivicStore implements CivicStore {

  private static final String CITIZEN_COLUMNS =
      "id, identity_token, city, inclusion_group, interest_themes, created_at";
  private static final String INTERACTION_COLUMNS =
      "id, citizen_id, bill_id, kind, opinion, content, metadata, occurred_at, created_at";
  private static final String PROPOSAL_COLUMNS =
      "id, citizen_id, content, content_kind, audio_url, primary_theme, secondary_themes, confidence, "
          + "city, inclusion_group, status, duplicate_group_id, occurred_at, created_at";
  private static final String GAP_COLUMNS =
      "axis, segment_key, demand, bills, gap_percent, tier, computed_at";

  protected static final JdbcTemplate.RowMapper<Citizen> CITIZEN_ROW_MAPPER = rs -> new Citizen(
      rs.getLong("id"),
      rs.getString("identity_token"),
      rs.getString("city"),
      rs.getString("inclusion_group"),
      new LinkedHashSet<>(readStrings(rs, "interest_themes")),
      JdbcTemplate.instant(rs, "created_at"));

  protected static final JdbcTemplate.RowMapper<Interaction> INTERACTION_ROW_MAPPER = rs -> new Interaction(
      rs.getLong("id"),
      rs.getLong("citizen_id"),
      JdbcTemplate.nullableLong(rs, "bill_id"),
      code(InteractionKind.fromCode(rs.getString("kind")), "kind", rs),
      rs.getString("opinion") == null ? null : code(Opinion.fromCode(rs.getString("opinion")), "opinion", rs),
      rs.getString("content"),
      readMap(rs, "metadata"),
      JdbcTemplate.instant(rs, "occurred_at"),
      JdbcTemplate.instant(rs, "created_at"));

  protected static final JdbcTemplate.RowMapper<Proposal> PROPOSAL_ROW_MAPPER = rs -> new Proposal(
      rs.getLong("id"),
      rs.getLong("citizen_id"),
      rs.getString("content"),
      code(ContentKind.fromCode(rs.getString("content_kind")), "content_kind", rs),
      rs.getString("audio_url"),
      rs.getString("primary_theme"),
      readStrings(rs, "secondary_themes"),
      JdbcTemplate.nullableDouble(rs, "confidence"),
      rs.getString("city"),
      rs.getString("inclusion_group"),
      code(ProposalStatus.fromCode(rs.getString("status")), "status", rs),
      JdbcTemplate.nullableLong(rs, "duplicate_group_id"),
      JdbcTemplate.instant(rs, "occurred_at"),
      JdbcTemplate.instant(rs, "created_at"));

  protected static final JdbcTemplate.RowMapper<GapMetric> GAP_ROW_MAPPER = rs -> new GapMetric(
      code(GapAxis.fromCode(rs.getString("axis")), "axis", rs),
      rs.getString("segment_key"),
      rs.getLong("demand"),
      rs.getLong("bills"),
      rs.getDouble("gap_percent"),
      GapTier.valueOf(rs.getString("tier")),
      JdbcTemplate.instant(rs, "computed_at"));

  private final Clock clock;

  protected AbstractJdbcCivicStore() {
    this(Clock.systemUTC());
  }

  protected AbstractJdbcCivicStore(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Unique identifier for this store (e.g., "postgresql", "h2").
   */
  public abstract String name();

  /**
   * JDBC URL prefixes this store handles (e.g., "jdbc:postgresql:").
   */
  public abstract List<String> jdbcUrlPrefixes();

  /**
   * Classpath location of the DDL script for this dialect.
   */
  public String schemaResource() {
    return "civicgap/jdbc/schema-" + name() + ".sql";
  }

  /**
   * Creates the tables and indexes if they do not exist.
   */
  public void createSchema(Connection conn) {
    JdbcSchema.apply(conn, schemaResource());
  }

  /** Creation timestamp, truncated to what every supported dialect stores. */
  protected Instant now() {
    return clock.instant().truncatedTo(ChronoUnit.MICROS);
  }

  // ── Citizens ────────────────────────────────────────────────────

  @Override
  public Optional<Citizen> findCitizenById(Connection conn, long id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + CITIZEN_COLUMNS + " FROM citizen WHERE id=?", CITIZEN_ROW_MAPPER, id);
  }

  @Override
  public Optional<Citizen> findCitizenByToken(Connection conn, String identityToken) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + CITIZEN_COLUMNS + " FROM citizen WHERE identity_token=?", CITIZEN_ROW_MAPPER, identityToken);
  }

  @Override
  public Citizen insertCitizen(Connection conn, String identityToken, String city,
      String inclusionGroup, Set<String> interestThemes) {
    Instant now = now();
    long id = JdbcTemplate.insert(conn,
        "INSERT INTO citizen (identity_token, city, inclusion_group, interest_themes, created_at, updated_at) "
            + "VALUES (?,?,?,?,?,?)",
        identityToken, city, inclusionGroup, Json.writeStrings(interestThemes), now, now);
    return findCitizenById(conn, id).orElseThrow(() -> missingAfterInsert("citizen", id));
  }

  @Override
  public long countCitizens(Connection conn) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM citizen");
  }

  // ── Interactions ────────────────────────────────────────────────

  @Override
  public Interaction insertInteraction(Connection conn, Interaction row) {
    long id = JdbcTemplate.insert(conn,
        "INSERT INTO interaction (citizen_id, bill_id, kind, opinion, content, metadata, occurred_at, created_at) "
            + "VALUES (?,?,?,?,?,?,?,?)",
        row.citizenId(),
        row.billId(),
        row.kind().code(),
        row.opinion() == null ? null : row.opinion().code(),
        row.content(),
        Json.writeMap(row.metadata()),
        row.occurredAt(),
        now());
    return findInteraction(conn, id).orElseThrow(() -> missingAfterInsert("interaction", id));
  }

  @Override
  public Optional<Interaction> findInteraction(Connection conn, long id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + INTERACTION_COLUMNS + " FROM interaction WHERE id=?", INTERACTION_ROW_MAPPER, id);
  }

  @Override
  public long countInteractions(Connection conn) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM interaction");
  }

  @Override
  public long countInteractionsSince(Connection conn, Instant since) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM interaction WHERE occurred_at >= ?", since);
  }

  @Override
  public List<DailyCount> dailyInteractionCounts(Connection conn, Instant since) {
    return JdbcTemplate.query(conn,
        "SELECT CAST(occurred_at AS DATE) AS bucket_day, COUNT(*) AS total FROM interaction "
            + "WHERE occurred_at >= ? GROUP BY CAST(occurred_at AS DATE) ORDER BY bucket_day",
        rs -> new DailyCount(rs.getDate("bucket_day").toLocalDate(), rs.getLong("total")),
        since);
  }

  // ── Proposals ───────────────────────────────────────────────────

  @Override
  public Proposal insertProposal(Connection conn, Proposal row) {
    long id = JdbcTemplate.insert(conn,
        "INSERT INTO proposal (citizen_id, content, content_kind, audio_url, primary_theme, secondary_themes, "
            + "confidence, city, inclusion_group, status, duplicate_group_id, occurred_at, created_at) "
            + "VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?)",
        row.citizenId(),
        row.content(),
        row.contentKind().code(),
        row.audioUrl(),
        row.primaryTheme(),
        Json.writeStrings(row.secondaryThemes()),
        row.confidence(),
        row.city(),
        row.inclusionGroup(),
        row.status().code(),
        row.duplicateGroupId(),
        row.occurredAt(),
        now());
    return findProposal(conn, id).orElseThrow(() -> missingAfterInsert("proposal", id));
  }

  @Override
  public Optional<Proposal> findProposal(Connection conn, long id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + PROPOSAL_COLUMNS + " FROM proposal WHERE id=?", PROPOSAL_ROW_MAPPER, id);
  }

  @Override
  public long countProposals(Connection conn) {
    return JdbcTemplate.count(conn, "SELECT COUNT(*) FROM proposal");
  }

  @Override
  public List<Proposal> recentProposals(Connection conn, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    return JdbcTemplate.query(conn,
        "SELECT " + PROPOSAL_COLUMNS + " FROM proposal ORDER BY id DESC LIMIT ?", PROPOSAL_ROW_MAPPER, limit);
  }

  // ── Gap metrics ─────────────────────────────────────────────────

  @Override
  public Map<String, Long> countDemand(Connection conn, GapAxis axis) {
    String column = switch (Objects.requireNonNull(axis, "axis")) {
      case THEME -> "primary_theme";
      case GROUP -> "inclusion_group";
      case CITY -> "city";
    };
    return groupCounts(conn,
        "SELECT " + column + " AS seg_key, COUNT(*) AS total FROM proposal WHERE " + column
            + " IS NOT NULL GROUP BY " + column + " ORDER BY " + column);
  }

  @Override
  public Map<String, Long> countActiveBills(Connection conn, GapAxis axis) {
    String column = switch (Objects.requireNonNull(axis, "axis")) {
      case THEME -> "primary_theme";
      case CITY -> "city";
      case GROUP -> throw new IllegalArgumentException("Bills are not segmented by inclusion group");
    };
    return groupCounts(conn,
        "SELECT " + column + " AS seg_key, COUNT(*) AS total FROM legislative_bill WHERE status=? AND "
            + column + " IS NOT NULL GROUP BY " + column + " ORDER BY " + column,
        BillStatus.IN_PROGRESS.code());
  }

  @Override
  public void replaceGapMetrics(Connection conn, List<GapMetric> metrics) {
    JdbcTemplate.update(conn, "DELETE FROM gap_metric_cache");
    for (GapMetric metric : metrics) {
      JdbcTemplate.update(conn,
          "INSERT INTO gap_metric_cache (" + GAP_COLUMNS + ") VALUES (?,?,?,?,?,?,?)",
          metric.axis().code(),
          metric.key(),
          metric.demand(),
          metric.bills(),
          metric.gapPercent(),
          metric.tier().name(),
          metric.computedAt());
    }
  }

  @Override
  public List<GapMetric> findGapMetrics(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + GAP_COLUMNS + " FROM gap_metric_cache ORDER BY axis, gap_percent DESC, segment_key",
        GAP_ROW_MAPPER);
  }

  private static Map<String, Long> groupCounts(Connection conn, String sql, Object... params) {
    Map<String, Long> counts = new LinkedHashMap<>();
    JdbcTemplate.query(conn, sql, rs -> counts.put(rs.getString("seg_key"), rs.getLong("total")), params);
    return counts;
  }

  private static StorageException missingAfterInsert(String table, long id) {
    return new StorageException("Inserted " + table + " row " + id + " is not visible", null, null);
  }

  private static <E> E code(Optional<E> value, String column, ResultSet rs) throws SQLException {
    return value.orElseThrow(() -> new SQLException("Unknown " + column + " code in row " + idOf(rs)));
  }

  private static String idOf(ResultSet rs) {
    try {
      return String.valueOf(rs.getLong("id"));
    } catch (SQLException e) {
      return "?";
    }
  }

  private static List<String> readStrings(ResultSet rs, String column) throws SQLException {
    try {
      return Json.readStrings(rs.getString(column));
    } catch (IllegalArgumentException e) {
      throw new SQLException("Invalid JSON in column " + column, e);
    }
  }

  private static Map<String, Object> readMap(ResultSet rs, String column) throws SQLException {
    try {
      return Json.readMap(rs.getString(column));
    } catch (IllegalArgumentException e) {
      throw new SQLException("Invalid JSON in column " + column, e);
    }
  }
}
