package civicgap.jdbc.store;

import civicgap.error.StorageException;
import civicgap.error.StorageIntegrityException;
import civicgap.jdbc.H2Databases;
import civicgap.jdbc.JdbcTemplate;
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
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class H2CivicStoreTest {

  private static final Instant NOW = Instant.parse("2025-03-10T15:00:00.123456789Z");

  private H2CivicStore store;
  private Connection conn;

  @BeforeEach
  void setUp() throws SQLException {
    JdbcDataSource dataSource = H2Databases.create("store");
    store = new H2CivicStore(Clock.fixed(NOW, ZoneOffset.UTC));
    conn = dataSource.getConnection();
  }

  @AfterEach
  void tearDown() throws SQLException {
    conn.close();
  }

  @Test
  void citizenRoundTrip() {
    Set<String> themes = new LinkedHashSet<>(List.of("Saúde", "Educação"));
    Citizen created = store.insertCitizen(conn, "hash-abc", "João Pessoa", "Juventude", themes);

    assertTrue(created.id() > 0);
    assertEquals("hash-abc", created.identityToken());
    assertEquals("João Pessoa", created.city());
    assertEquals("Juventude", created.inclusionGroup());
    assertEquals(themes, created.interestThemes());
    assertEquals(Instant.parse("2025-03-10T15:00:00.123456Z"), created.createdAt());

    assertEquals(created, store.findCitizenByToken(conn, "hash-abc").orElseThrow());
    assertEquals(created, store.findCitizenById(conn, created.id()).orElseThrow());
    assertTrue(store.findCitizenByToken(conn, "hash-unknown").isEmpty());
    assertEquals(1, store.countCitizens(conn));
  }

  @Test
  void duplicateTokenIsUniqueViolation() {
    store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());

    StorageIntegrityException e = assertThrows(StorageIntegrityException.class,
        () -> store.insertCitizen(conn, "hash-abc", "Natal", null, Set.of()));
    assertTrue(e.isUniqueViolation());
  }

  @Test
  void interactionRoundTrip() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());
    long billId = H2Databases.insertBill(conn, "PL-1", "Saúde", "Recife", "in_progress");
    Instant occurredAt = Instant.parse("2025-03-09T10:15:30Z");

    Interaction saved = store.insertInteraction(conn, new Interaction(
        0L, citizen.id(), billId, InteractionKind.OPINION, Opinion.AGAINST, "Sou contra",
        Map.of("channel", "whatsapp", "step", 3), occurredAt, null));

    assertTrue(saved.id() > 0);
    assertEquals(citizen.id(), saved.citizenId());
    assertEquals(billId, saved.billId());
    assertEquals(InteractionKind.OPINION, saved.kind());
    assertEquals(Opinion.AGAINST, saved.opinion());
    assertEquals("Sou contra", saved.content());
    assertEquals("whatsapp", saved.metadata().get("channel"));
    assertEquals(3, ((Number) saved.metadata().get("step")).intValue());
    assertEquals(occurredAt, saved.occurredAt());
    assertNotNull(saved.createdAt());
    assertEquals(saved, store.findInteraction(conn, saved.id()).orElseThrow());
  }

  @Test
  void interactionWithUnknownCitizenViolatesForeignKey() {
    assertThrows(StorageIntegrityException.class, () -> store.insertInteraction(conn, new Interaction(
        0L, 999L, null, InteractionKind.VIEW, null, null, Map.of(), NOW, null)));
    assertEquals(0, store.countInteractions(conn));
  }

  @Test
  void proposalRoundTrip() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());

    Proposal saved = store.insertProposal(conn, new Proposal(
        0L, citizen.id(), "Mais creches no bairro", ContentKind.TRANSCRIBED_AUDIO,
        "https://media.example/a.ogg", "Educação", List.of("Infância"), 0.42,
        "Recife", "Mulheres", ProposalStatus.NEEDS_REVIEW, 7L,
        Instant.parse("2025-03-09T10:15:30Z"), null));

    assertEquals("Mais creches no bairro", saved.content());
    assertEquals(ContentKind.TRANSCRIBED_AUDIO, saved.contentKind());
    assertEquals("https://media.example/a.ogg", saved.audioUrl());
    assertEquals("Educação", saved.primaryTheme());
    assertEquals(List.of("Infância"), saved.secondaryThemes());
    assertEquals(0.42, saved.confidence());
    assertEquals("Mulheres", saved.inclusionGroup());
    assertEquals(ProposalStatus.NEEDS_REVIEW, saved.status());
    assertEquals(7L, saved.duplicateGroupId());
    assertEquals(saved, store.findProposal(conn, saved.id()).orElseThrow());
  }

  @Test
  void recentProposalsAreNewestFirst() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());
    for (int i = 1; i <= 4; i++) {
      store.insertProposal(conn, proposal(citizen.id(), "Proposta " + i, "Saúde", "Recife", null));
    }

    List<Proposal> recent = store.recentProposals(conn, 3);

    assertEquals(List.of("Proposta 4", "Proposta 3", "Proposta 2"),
        recent.stream().map(Proposal::content).toList());
    assertEquals(4, store.countProposals(conn));
    assertThrows(IllegalArgumentException.class, () -> store.recentProposals(conn, 0));
  }

  @Test
  void demandAndBillsAreGroupedPerAxis() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());
    store.insertProposal(conn, proposal(citizen.id(), "a", "Saúde", "Recife", "Juventude"));
    store.insertProposal(conn, proposal(citizen.id(), "b", "Saúde", "Natal", null));
    store.insertProposal(conn, proposal(citizen.id(), "c", "Educação", "Recife", "Juventude"));
    store.insertProposal(conn, proposal(citizen.id(), "d", null, "Recife", "Idosos"));
    H2Databases.insertBill(conn, "PL-1", "Saúde", "Recife", "in_progress");
    H2Databases.insertBill(conn, "PL-2", "Saúde", "Recife", "approved");
    H2Databases.insertBill(conn, "PL-3", "Transporte", null, "in_progress");

    assertEquals(Map.of("Educação", 1L, "Saúde", 2L), store.countDemand(conn, GapAxis.THEME));
    assertEquals(Map.of("Idosos", 1L, "Juventude", 2L), store.countDemand(conn, GapAxis.GROUP));
    assertEquals(Map.of("Natal", 1L, "Recife", 3L), store.countDemand(conn, GapAxis.CITY));

    assertEquals(Map.of("Saúde", 1L, "Transporte", 1L), store.countActiveBills(conn, GapAxis.THEME));
    assertEquals(Map.of("Recife", 1L), store.countActiveBills(conn, GapAxis.CITY));
    assertThrows(IllegalArgumentException.class, () -> store.countActiveBills(conn, GapAxis.GROUP));
  }

  @Test
  void replaceGapMetricsSwapsTheWholeSnapshot() {
    Instant computedAt = Instant.parse("2025-03-10T00:00:00Z");
    store.replaceGapMetrics(conn, List.of(
        new GapMetric(GapAxis.THEME, "Saúde", 150, 5, 96.67, GapTier.HIGH, computedAt),
        new GapMetric(GapAxis.THEME, "Educação", 10, 5, 50.0, GapTier.MEDIUM, computedAt)));
    store.replaceGapMetrics(conn, List.of(
        new GapMetric(GapAxis.CITY, "Recife", 10, 8, 20.0, GapTier.LOW, computedAt),
        new GapMetric(GapAxis.THEME, "Saúde", 150, 5, 96.67, GapTier.HIGH, computedAt)));

    List<GapMetric> stored = store.findGapMetrics(conn);

    assertEquals(2, stored.size());
    assertEquals(GapAxis.CITY, stored.get(0).axis());
    assertEquals(new GapMetric(GapAxis.THEME, "Saúde", 150, 5, 96.67, GapTier.HIGH, computedAt), stored.get(1));
  }

  @Test
  void dailyCountsBucketByDayAndOmitEmptyDays() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());
    Instant dayOne = Instant.parse("2025-03-06T12:00:00Z");
    Instant dayTwo = Instant.parse("2025-03-09T12:00:00Z");
    for (Instant at : List.of(dayOne, dayTwo, dayTwo, Instant.parse("2025-03-01T12:00:00Z"))) {
      store.insertInteraction(conn, new Interaction(
          0L, citizen.id(), null, InteractionKind.VIEW, null, null, Map.of(), at, null));
    }

    List<DailyCount> counts = store.dailyInteractionCounts(conn, Instant.parse("2025-03-05T00:00:00Z"));

    assertEquals(List.of(
        new DailyCount(LocalDate.ofInstant(dayOne, ZoneId.systemDefault()), 1),
        new DailyCount(LocalDate.ofInstant(dayTwo, ZoneId.systemDefault()), 2)), counts);
    assertEquals(3, store.countInteractionsSince(conn, Instant.parse("2025-03-05T00:00:00Z")));
  }

  @Test
  void unknownCodeInRowFailsMapping() {
    Citizen citizen = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of());
    long id = JdbcTemplate.insert(conn,
        "INSERT INTO interaction (citizen_id, kind, occurred_at, created_at) VALUES (?,?,?,?)",
        citizen.id(), "shrug", NOW, NOW);

    assertThrows(StorageException.class, () -> store.findInteraction(conn, id));
  }

  private static Proposal proposal(long citizenId, String content, String theme, String city, String group) {
    return new Proposal(0L, citizenId, content, ContentKind.TEXT, null, theme, List.of(),
        theme == null ? null : 0.9, city, group, ProposalStatus.PENDING, null, NOW, null);
  }
}
