package civicgap.jdbc;

import civicgap.error.ErrorKind;
import civicgap.jdbc.store.H2CivicStore;
import civicgap.jdbc.tx.JdbcTransactionManager;
import civicgap.model.CitizenRef;
import civicgap.model.Classification;
import civicgap.model.Interaction;
import civicgap.model.Proposal;
import civicgap.processor.InteractionRequest;
import civicgap.processor.ProposalRequest;
import civicgap.processor.SubmissionProcessor;
import civicgap.processor.SubmissionResult;
import civicgap.processor.SubmissionService;
import civicgap.queue.DrainResult;
import civicgap.queue.FallbackQueue;
import civicgap.queue.QueueEntry;
import civicgap.retry.RetryExecutor;
import com.fasterxml.jackson.databind.JsonNode;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SubmissionPersistenceTest {

  private static final Instant OCCURRED_AT = Instant.parse("2025-03-09T10:15:30Z");

  private JdbcDataSource dataSource;
  private H2CivicStore store;
  private SubmissionProcessor processor;

  @BeforeEach
  void setUp() throws Exception {
    dataSource = H2Databases.create("submission");
    store = new H2CivicStore();
    processor = new SubmissionProcessor(new JdbcTransactionManager(dataSource), store);
  }

  @Test
  void unknownTokenCreatesCitizenWithProposalCity() throws Exception {
    Proposal saved = processor.persistProposal(new ProposalRequest(
        CitizenRef.token("hash-new"), "Mais ônibus à noite", "text", "Campina Grande", "Trabalhadores",
        null, new Classification("Transporte", List.of(), 0.8), null, null, OCCURRED_AT));

    try (Connection conn = dataSource.getConnection()) {
      var citizen = store.findCitizenByToken(conn, "hash-new").orElseThrow();
      assertEquals(citizen.id(), saved.citizenId());
      assertEquals("Campina Grande", citizen.city());
      assertEquals("Trabalhadores", citizen.inclusionGroup());
    }
    assertEquals("pending", saved.status().code());
  }

  @Test
  void storedInteractionEqualsTheRequest() throws Exception {
    Map<String, Object> where = new LinkedHashMap<>();
    where.put("bairro", "Torre");
    where.put("lat", -7.115);
    InteractionRequest request = new InteractionRequest(CitizenRef.token("hash-meta"), "reaction", null, null,
        "curtiu", Map.of("count", 5L, "big", 5_000_000_000L, "score", 0.75, "where", where),
        Instant.parse("2025-03-09T10:15:30.123456789Z"));

    Interaction saved = processor.persistInteraction(request);

    assertEquals(request.metadata(), saved.metadata());
    assertEquals(request.occurredAt(), saved.occurredAt());
    try (Connection conn = dataSource.getConnection()) {
      Interaction reread = store.findInteraction(conn, saved.id()).orElseThrow();
      assertEquals(saved, reread);
      assertEquals(request.metadata(), reread.metadata());
    }
  }

  @Test
  void longProposalContentIsStored() throws Exception {
    String content = "Proposta longa ".repeat(700);
    SubmissionService service = SubmissionService.builder()
        .processor(processor)
        .retryExecutor(RetryExecutor.builder().sleeper(d -> { }).build())
        .build();

    SubmissionResult<Proposal> result = service.submitProposal(new ProposalRequest(
        CitizenRef.token("hash-long"), content, "text", "Recife", null, null, null, null, null, OCCURRED_AT));

    SubmissionResult.Accepted<Proposal> accepted = assertInstanceOf(SubmissionResult.Accepted.class, result);
    assertEquals(content, accepted.record().content());
  }

  @Test
  void valueTooLongForColumnIsRejectedNotQueued() throws Exception {
    List<JsonNode> queued = new ArrayList<>();
    SubmissionService service = SubmissionService.builder()
        .processor(processor)
        .retryExecutor(RetryExecutor.builder().sleeper(d -> { }).build())
        .queue(new FallbackQueue() {
          @Override
          public void enqueue(JsonNode payload) {
            queued.add(payload);
          }

          @Override
          public DrainResult drain(EntryProcessor entryProcessor, int maxAttempts) {
            return DrainResult.EMPTY;
          }

          @Override
          public int size() {
            return queued.size();
          }

          @Override
          public List<QueueEntry> peek(int limit) {
            return List.of();
          }

          @Override
          public void clear() {
            queued.clear();
          }
        })
        .build();

    SubmissionResult<Proposal> result = service.submitProposal(new ProposalRequest(
        CitizenRef.token("hash-city"), "Mais praças", "text", "R".repeat(121), null, null, null, null, null,
        OCCURRED_AT));

    SubmissionResult.Rejected<Proposal> rejected = assertInstanceOf(SubmissionResult.Rejected.class, result);
    assertEquals(ErrorKind.STORAGE_INTEGRITY, rejected.report().kind());
    assertTrue(queued.isEmpty());
  }

  @Test
  void concurrentSubmissionsWithSameTokenCreateOneCitizen() throws Exception {
    int threads = 8;
    ExecutorService pool = Executors.newFixedThreadPool(threads);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<Interaction>> futures = new ArrayList<>();
    try {
      for (int i = 0; i < threads; i++) {
        futures.add(pool.submit(() -> {
          start.await();
          return processor.persistInteraction(new InteractionRequest(
              CitizenRef.token("hash-shared"), "view", null, null, null, Map.of(), OCCURRED_AT));
        }));
      }
      start.countDown();

      long citizenId = -1;
      for (Future<Interaction> future : futures) {
        Interaction saved = future.get(30, TimeUnit.SECONDS);
        if (citizenId < 0) {
          citizenId = saved.citizenId();
        }
        assertEquals(citizenId, saved.citizenId());
      }
    } finally {
      pool.shutdownNow();
    }

    try (Connection conn = dataSource.getConnection()) {
      assertEquals(1, store.countCitizens(conn));
      assertEquals(threads, store.countInteractions(conn));
    }
  }

  @Test
  void danglingBillReferenceIsRejectedAndNothingIsWritten() throws Exception {
    long citizenId;
    try (Connection conn = dataSource.getConnection()) {
      citizenId = store.insertCitizen(conn, "hash-abc", "Recife", null, Set.of()).id();
    }
    SubmissionService service = SubmissionService.builder()
        .processor(processor)
        .retryExecutor(RetryExecutor.builder().sleeper(d -> { }).build())
        .build();

    SubmissionResult<Interaction> result = service.submitInteraction(new InteractionRequest(
        CitizenRef.id(citizenId), "opinion", "favor", 424242L, null, Map.of(), OCCURRED_AT));

    SubmissionResult.Rejected<Interaction> rejected = assertInstanceOf(SubmissionResult.Rejected.class, result);
    assertEquals(ErrorKind.STORAGE_INTEGRITY, rejected.report().kind());
    try (Connection conn = dataSource.getConnection()) {
      assertEquals(0, store.countInteractions(conn));
    }
  }

  @Test
  void failedInteractionRollsBackNewCitizen() throws Exception {
    assertThrows(RuntimeException.class, () -> processor.persistInteraction(new InteractionRequest(
        CitizenRef.token("hash-rollback"), "view", null, 424242L, null, Map.of(), OCCURRED_AT)));

    try (Connection conn = dataSource.getConnection()) {
      assertTrue(store.findCitizenByToken(conn, "hash-rollback").isEmpty());
    }
  }
}
