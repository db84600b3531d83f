package civicgap.model;

import java.time.Instant;
import java.util.Set;

/**
 * Persisted citizen row. The identity token is a one-way hash; raw identifiers are never stored.
 */
public record Citizen(
    long id,
    String identityToken,
    String city,
    String inclusionGroup,
    Set<String> interestThemes,
    Instant createdAt
) {
  public Citizen {
    interestThemes = interestThemes == null ? Set.of() : Set.copyOf(interestThemes);
  }
}
