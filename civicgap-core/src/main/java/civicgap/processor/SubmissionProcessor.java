package civicgap.processor;

import civicgap.error.SqlErrors;
import civicgap.error.StorageIntegrityException;
import civicgap.error.ValidationException;
import civicgap.model.Citizen;
import civicgap.model.CitizenRef;
import civicgap.model.Classification;
import civicgap.model.ContentKind;
import civicgap.model.Interaction;
import civicgap.model.InteractionKind;
import civicgap.model.Opinion;
import civicgap.model.Proposal;
import civicgap.model.ProposalStatus;
import civicgap.spi.CivicStore;
import civicgap.spi.TransactionManager;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Validates submissions and writes them in a single transaction.
 *
 * <p>Each call runs validate, resolve citizen, insert, commit. Any failure rolls the
 * whole transaction back, including a citizen created for an unknown token. Storage
 * failures surface as {@link civicgap.error.StorageException} subtypes; this class does
 * not retry.
 */
public final class SubmissionProcessor {
  private static final Logger logger = Logger.getLogger(SubmissionProcessor.class.getName());

  /** City assigned to citizens first seen through an interaction. */
  public static final String UNKNOWN_CITY = "Unknown";

  private final TransactionManager txManager;
  private final CivicStore store;

  public SubmissionProcessor(TransactionManager txManager, CivicStore store) {
    this.txManager = Objects.requireNonNull(txManager, "txManager");
    this.store = Objects.requireNonNull(store, "store");
  }

  /**
   * Validates and persists an interaction.
   *
   * @return the stored row, equal to the request in every supplied field
   * @throws ValidationException                           if a field is missing or invalid,
   *                                                       or a referenced citizen id does not exist
   * @throws civicgap.error.StorageIntegrityException      if a foreign key does not resolve
   * @throws civicgap.error.TransientStorageException      if storage is temporarily unavailable
   */
  public Interaction persistInteraction(InteractionRequest request) {
    SubmissionValidator.validateInteraction(request);
    InteractionKind kind = InteractionKind.fromCode(request.kind()).orElseThrow();
    Opinion opinion = request.opinion() == null ? null : Opinion.fromCode(request.opinion()).orElseThrow();

    try (TransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      Citizen citizen = resolveCitizen(conn, request.citizen(), UNKNOWN_CITY, null);
      Interaction saved = store.insertInteraction(conn, new Interaction(
          0L, citizen.id(), request.billId(), kind, opinion, request.content(),
          request.metadata(), request.occurredAt(), null));
      tx.commit();
      logger.log(Level.INFO, "Persisted interaction: id={0}, kind={1}, citizenId={2}",
          new Object[]{saved.id(), kind.code(), citizen.id()});
      return saved;
    } catch (SQLException e) {
      throw SqlErrors.translate("persist interaction", e);
    }
  }

  /**
   * Validates and persists a proposal. A citizen created here takes the proposal's city
   * and inclusion group.
   *
   * @return the stored row, equal to the request in every supplied field
   */
  public Proposal persistProposal(ProposalRequest request) {
    SubmissionValidator.validateProposal(request);
    ContentKind contentKind = ContentKind.fromCode(request.contentKind()).orElseThrow();
    ProposalStatus status = request.status() == null
        ? ProposalStatus.PENDING : ProposalStatus.fromCode(request.status()).orElseThrow();
    Classification classification = request.classification();

    try (TransactionManager.Transaction tx = txManager.begin()) {
      Connection conn = tx.connection();
      Citizen citizen = resolveCitizen(conn, request.citizen(), request.city(), request.inclusionGroup());
      Proposal saved = store.insertProposal(conn, new Proposal(
          0L,
          citizen.id(),
          request.content(),
          contentKind,
          request.audioUrl(),
          classification == null ? null : classification.primaryTheme(),
          classification == null ? List.of() : classification.secondaryThemes(),
          classification == null ? null : classification.confidence(),
          request.city(),
          request.inclusionGroup(),
          status,
          request.duplicateGroupId(),
          request.occurredAt(),
          null));
      tx.commit();
      logger.log(Level.INFO, "Persisted proposal: id={0}, city={1}, citizenId={2}",
          new Object[]{saved.id(), saved.city(), citizen.id()});
      return saved;
    } catch (SQLException e) {
      throw SqlErrors.translate("persist proposal", e);
    }
  }

  /**
   * Resolves a citizen reference on {@code conn}.
   *
   * <p>An id must already exist. A token is looked up and, if unknown, inserted under a
   * savepoint; losing a concurrent insert race to the unique constraint rolls back to the
   * savepoint and re-reads the winner's row.
   *
   * @throws ValidationException if an id does not exist
   */
  Citizen resolveCitizen(Connection conn, CitizenRef ref, String city, String inclusionGroup)
      throws SQLException {
    if (ref instanceof CitizenRef.ById byId) {
      return store.findCitizenById(conn, byId.id())
          .orElseThrow(() -> new ValidationException("citizen", "Citizen with id " + byId.id() + " not found"));
    }
    String token = ((CitizenRef.ByToken) ref).token();
    var existing = store.findCitizenByToken(conn, token);
    if (existing.isPresent()) {
      return existing.get();
    }

    Savepoint savepoint = conn.setSavepoint();
    try {
      Citizen created = store.insertCitizen(conn, token, city, inclusionGroup, Set.of());
      conn.releaseSavepoint(savepoint);
      logger.log(Level.INFO, "Created citizen {0}", created.id());
      return created;
    } catch (StorageIntegrityException e) {
      if (!e.isUniqueViolation()) {
        throw e;
      }
      conn.rollback(savepoint);
      logger.log(Level.FINE, "Citizen {0} created concurrently, re-reading", ref);
      return store.findCitizenByToken(conn, token).orElseThrow(() -> e);
    }
  }
}
