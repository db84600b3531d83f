package civicgap.model;

import java.time.Instant;
import java.util.List;

/**
 * Persisted proposal row. Theme fields come from the classifier collaborator.
 */
public record Proposal(
    long id,
    long citizenId,
    String content,
    ContentKind contentKind,
    String audioUrl,
    String primaryTheme,
    List<String> secondaryThemes,
    Double confidence,
    String city,
    String inclusionGroup,
    ProposalStatus status,
    Long duplicateGroupId,
    Instant occurredAt,
    Instant createdAt
) {
  public Proposal {
    secondaryThemes = secondaryThemes == null ? List.of() : List.copyOf(secondaryThemes);
  }
}
