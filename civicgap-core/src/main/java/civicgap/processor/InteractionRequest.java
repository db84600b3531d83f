package civicgap.processor;

import civicgap.model.CitizenRef;
import civicgap.util.Json;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Inbound interaction as received from the request layer. Enum fields carry their wire
 * codes so unknown values can be rejected by {@link SubmissionValidator}.
 *
 * @param citizen    existing citizen id or identity token
 * @param kind       {@code opinion}, {@code view} or {@code reaction}
 * @param opinion    {@code favor}, {@code against} or {@code skip}; required for opinions
 * @param billId     referenced bill, or {@code null}
 * @param content    free text, or {@code null}
 * @param metadata   arbitrary JSON-compatible attributes
 * @param occurredAt when the interaction happened, kept to microseconds
 */
public record InteractionRequest(
    CitizenRef citizen,
    String kind,
    String opinion,
    Long billId,
    String content,
    Map<String, Object> metadata,
    Instant occurredAt
) {
  public InteractionRequest {
    metadata = metadata == null ? Map.of() : normalize(metadata);
    occurredAt = occurredAt == null ? null : occurredAt.truncatedTo(ChronoUnit.MICROS);
  }

  // Holds the same value types a stored row reads back with.
  private static Map<String, Object> normalize(Map<String, Object> metadata) {
    try {
      return Collections.unmodifiableMap(Json.normalizeMap(metadata));
    } catch (IllegalArgumentException e) {
      // kept as given; SubmissionValidator rejects it
      return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
  }
}
