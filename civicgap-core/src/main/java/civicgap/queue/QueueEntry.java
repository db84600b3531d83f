package civicgap.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One line of the fallback queue.
 *
 * @param payload   opaque operation payload
 * @param queuedAt  time the payload was first enqueued
 * @param attempts  failed replay attempts so far
 * @param lastError message of the most recent replay failure, or {@code null}
 */
public record QueueEntry(JsonNode payload, Instant queuedAt, int attempts, String lastError) {

  public QueueEntry {
    Objects.requireNonNull(payload, "payload");
    Objects.requireNonNull(queuedAt, "queuedAt");
    if (attempts < 0) {
      throw new IllegalArgumentException("attempts must be >= 0, got: " + attempts);
    }
  }

  static QueueEntry fresh(JsonNode payload, Instant queuedAt) {
    return new QueueEntry(payload, queuedAt, 0, null);
  }

  QueueEntry failed(Throwable error) {
    String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    return new QueueEntry(payload, queuedAt, attempts + 1, message);
  }

  /**
   * Value of the payload's {@code type} field, or {@code "unknown"}.
   */
  public String type() {
    JsonNode type = payload.get("type");
    return type != null && type.isTextual() ? type.asText() : "unknown";
  }
}
