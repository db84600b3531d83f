package civicgap.queue;

import civicgap.util.Json;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Line format shared by the queue and the dead-letter file:
 * {@code {"payload":{...},"queued_at":"<ISO-8601>","attempts":N,"last_error":"..."}}.
 */
final class QueueLines {
  static final String PAYLOAD = "payload";
  static final String QUEUED_AT = "queued_at";
  static final String ATTEMPTS = "attempts";
  static final String LAST_ERROR = "last_error";

  private static final ObjectMapper mapper = Json.mapper();

  private QueueLines() {}

  static String format(QueueEntry entry) {
    ObjectNode node = mapper.createObjectNode();
    node.set(PAYLOAD, entry.payload());
    node.put(QUEUED_AT, entry.queuedAt().toString());
    node.put(ATTEMPTS, entry.attempts());
    if (entry.lastError() != null) {
      node.put(LAST_ERROR, entry.lastError());
    }
    try {
      return mapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new FallbackQueueException("Failed to encode queue entry", e);
    }
  }

  /**
   * @throws IllegalArgumentException if the line is not a queue entry
   */
  static QueueEntry parse(String line) {
    JsonNode node;
    try {
      node = mapper.readTree(line);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (node == null || !node.isObject()) {
      throw new IllegalArgumentException("not a JSON object");
    }
    JsonNode payload = node.get(PAYLOAD);
    if (payload == null || payload.isNull()) {
      throw new IllegalArgumentException("missing payload");
    }
    Instant queuedAt;
    try {
      JsonNode queued = node.get(QUEUED_AT);
      queuedAt = queued == null || queued.isNull() ? Instant.EPOCH : Instant.parse(queued.asText());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("invalid queued_at: " + e.getParsedString(), e);
    }
    int attempts = Math.max(0, node.path(ATTEMPTS).asInt(0));
    JsonNode lastError = node.get(LAST_ERROR);
    return new QueueEntry(payload, queuedAt, attempts,
        lastError == null || lastError.isNull() ? null : lastError.asText());
  }
}
