package civicgap.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persisted interaction row.
 *
 * @param id         generated row id
 * @param citizenId  owning citizen
 * @param billId     referenced bill, or {@code null}
 * @param kind       interaction kind
 * @param opinion    set iff {@code kind == OPINION}
 * @param content    optional free text
 * @param metadata   arbitrary metadata (never {@code null})
 * @param occurredAt when the citizen acted
 * @param createdAt  when the row was written
 */
public record Interaction(
    long id,
    long citizenId,
    Long billId,
    InteractionKind kind,
    Opinion opinion,
    String content,
    Map<String, Object> metadata,
    Instant occurredAt,
    Instant createdAt
) {
  public Interaction {
    metadata = metadata == null
        ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }
}
