package civicgap.retry;

import civicgap.RecordingQueue;
import civicgap.error.ErrorKind;
import civicgap.error.ErrorReport;
import civicgap.error.TransientStorageException;
import civicgap.error.ValidationException;
import civicgap.queue.FallbackQueueException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHandlerTest {

  private final ErrorHandler handler = new ErrorHandler();

  @Test
  void validationErrorReportCarriesField() {
    ErrorReport report = handler.handleValidationError(
        new ValidationException("kind", "Invalid kind: vote"), Map.of("type", "interaction"));

    assertEquals(ErrorKind.VALIDATION, report.kind());
    assertEquals("kind", report.field());
    assertEquals("interaction", report.context().get("type"));
  }

  @Test
  void storageErrorIsQueued() {
    RecordingQueue queue = new RecordingQueue();

    StorageOutcome outcome = handler.handleStorageError(
        new TransientStorageException("connection lost", "08006", null), payload(), queue);

    assertTrue(outcome.queued());
    assertEquals(ErrorKind.TRANSIENT_STORAGE, outcome.report().kind());
    assertEquals(true, outcome.report().context().get("queued"));
    assertEquals(1, queue.entries.size());
  }

  @Test
  void withoutQueueTheOutcomeIsError() {
    StorageOutcome outcome = handler.handleStorageError(new RuntimeException("boom"), payload(), null);

    assertEquals(StorageOutcome.Status.ERROR, outcome.status());
    assertEquals(ErrorKind.STORAGE, outcome.report().kind());
    assertEquals(false, outcome.report().context().get("queued"));
  }

  @Test
  void queueFailureIsReportedNotThrown() {
    RecordingQueue queue = new RecordingQueue();
    queue.failure = new FallbackQueueException("disk full");

    StorageOutcome outcome = handler.handleStorageError(new RuntimeException("boom"), payload(), queue);

    assertEquals(StorageOutcome.Status.ERROR, outcome.status());
    assertEquals("disk full", outcome.report().context().get("queueError"));
  }

  private static JsonNode payload() {
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("type", "proposal");
    node.putObject("data").put("content", "mais creches");
    return node;
  }
}
