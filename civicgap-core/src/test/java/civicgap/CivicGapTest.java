package civicgap;

import civicgap.error.StorageException;
import civicgap.error.TransientStorageException;
import civicgap.model.CitizenRef;
import civicgap.processor.InteractionRequest;
import civicgap.processor.SubmissionResult;
import civicgap.queue.DrainResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CivicGapTest {

  @TempDir
  Path dir;

  private final StubCivicStore store = new StubCivicStore();
  private final StubTransactionManager tx = new StubTransactionManager();

  private CivicGap.Builder builder() {
    return CivicGap.builder()
        .connectionProvider(tx)
        .transactionManager(tx)
        .store(store)
        .sleeper(d -> { })
        .config(new CivicGapConfig().setQueuePath(dir.resolve("temp_queue.jsonl")));
  }

  @Test
  void failedWriteIsQueuedAndReplayedByDrain() {
    long citizenId = store.addCitizen("hash-1", "Recife").id();
    for (int i = 0; i < 3; i++) {
      store.failNextInsert(new TransientStorageException("database is down", "08001", null));
    }

    try (CivicGap civicGap = builder().build()) {
      SubmissionResult<?> result = civicGap.submitInteraction(new InteractionRequest(
          CitizenRef.id(citizenId), "view", null, null, null, Map.of(), Instant.parse("2025-03-01T12:00:00Z")));
      assertEquals(SubmissionResult.Kind.QUEUED, result.kind());
      assertTrue(Files.exists(dir.resolve("temp_queue.jsonl")));

      DrainResult drained = civicGap.drainQueue();

      assertEquals(1, drained.processed());
      assertEquals(1, store.interactions.size());
      assertEquals(0, civicGap.queue().orElseThrow().size());
    }
  }

  @Test
  void disabledQueueMeansFailedResults() {
    long citizenId = store.addCitizen("hash-1", "Recife").id();
    store.failNextInsert(new StorageException("disk quota exceeded", "53100", null));

    try (CivicGap civicGap = builder()
        .config(new CivicGapConfig().setQueueEnabled(false))
        .build()) {
      SubmissionResult<?> result = civicGap.submitInteraction(new InteractionRequest(
          CitizenRef.id(citizenId), "view", null, null, null, Map.of(), Instant.now()));

      assertEquals(SubmissionResult.Kind.FAILED, result.kind());
      assertTrue(civicGap.queue().isEmpty());
      assertEquals(DrainResult.EMPTY, civicGap.drainQueue());
    }
  }

  @Test
  void invalidConfigIsRejectedAtBuild() {
    assertThrows(IllegalArgumentException.class,
        () -> builder().config(new CivicGapConfig().setRetryMaxAttempts(0)).build());
    assertThrows(IllegalArgumentException.class,
        () -> builder().config(new CivicGapConfig().setReviewThreshold(1.5)).build());
    assertThrows(NullPointerException.class, () -> CivicGap.builder().build());
  }

  @Test
  void builderCanOnlyBuildOnce() {
    CivicGap.Builder builder = builder();
    builder.build().close();

    assertThrows(IllegalStateException.class, builder::build);
  }
}
