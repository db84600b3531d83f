package civicgap.spi;

import civicgap.model.Citizen;
import civicgap.model.DailyCount;
import civicgap.model.GapAxis;
import civicgap.model.GapMetric;
import civicgap.model.Interaction;
import civicgap.model.Proposal;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence SPI for citizens, interactions, proposals, bills and the gap metric cache.
 *
 * <p>Every method operates on a caller-supplied connection so it can join the caller's
 * transaction. Failures surface as {@link civicgap.error.StorageException} subtypes:
 * {@link civicgap.error.StorageIntegrityException} for constraint violations and
 * {@link civicgap.error.TransientStorageException} for connection-class failures.
 *
 * @see civicgap.jdbc.store.AbstractJdbcCivicStore
 */
public interface CivicStore {

  // ── Citizens ────────────────────────────────────────────────────

  Optional<Citizen> findCitizenById(Connection conn, long id);

  Optional<Citizen> findCitizenByToken(Connection conn, String identityToken);

  /**
   * Inserts a citizen. Raises a unique violation if the token already exists.
   *
   * @return the persisted row with its generated id
   */
  Citizen insertCitizen(Connection conn, String identityToken, String city,
      String inclusionGroup, Set<String> interestThemes);

  long countCitizens(Connection conn);

  // ── Interactions ────────────────────────────────────────────────

  /**
   * Inserts an interaction. The {@code id} and {@code createdAt} of {@code row} are ignored.
   *
   * @return the persisted row with generated id and creation time
   */
  Interaction insertInteraction(Connection conn, Interaction row);

  Optional<Interaction> findInteraction(Connection conn, long id);

  long countInteractions(Connection conn);

  long countInteractionsSince(Connection conn, Instant since);

  /**
   * Interactions per calendar day since {@code since}, oldest day first.
   * Days without interactions are absent.
   */
  List<DailyCount> dailyInteractionCounts(Connection conn, Instant since);

  // ── Proposals ───────────────────────────────────────────────────

  /**
   * Inserts a proposal. The {@code id} and {@code createdAt} of {@code row} are ignored.
   */
  Proposal insertProposal(Connection conn, Proposal row);

  Optional<Proposal> findProposal(Connection conn, long id);

  long countProposals(Connection conn);

  /**
   * Most recently inserted proposals, newest first.
   */
  List<Proposal> recentProposals(Connection conn, int limit);

  // ── Gap metrics ─────────────────────────────────────────────────

  /**
   * Proposals per non-null segment value of {@code axis}.
   */
  Map<String, Long> countDemand(Connection conn, GapAxis axis);

  /**
   * In-progress bills per non-null segment value. Bills carry no inclusion group,
   * so {@link GapAxis#GROUP} is rejected.
   *
   * @throws IllegalArgumentException for {@link GapAxis#GROUP}
   */
  Map<String, Long> countActiveBills(Connection conn, GapAxis axis);

  /**
   * Deletes every cached gap metric row and inserts {@code metrics}. Callers run this
   * inside a transaction so readers never observe a partial set.
   */
  void replaceGapMetrics(Connection conn, List<GapMetric> metrics);

  List<GapMetric> findGapMetrics(Connection conn);
}
