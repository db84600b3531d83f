package civicgap.processor;

import civicgap.model.CitizenRef;
import civicgap.model.Classification;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Inbound proposal, optionally with a classification already attached.
 *
 * @param citizen          existing citizen id or identity token
 * @param content          proposal text, must not be blank
 * @param contentKind      {@code text} or {@code transcribed_audio}
 * @param city             city the proposal concerns
 * @param inclusionGroup   inclusion group of the author, or {@code null}
 * @param audioUrl         original recording for transcribed audio, or {@code null}
 * @param classification   themes and confidence, or {@code null} if not classified
 * @param status           status code; {@code null} means derived from the classification
 * @param duplicateGroupId duplicate cluster, or {@code null}
 * @param occurredAt       when the proposal was made, kept to microseconds
 */
public record ProposalRequest(
    CitizenRef citizen,
    String content,
    String contentKind,
    String city,
    String inclusionGroup,
    String audioUrl,
    Classification classification,
    String status,
    Long duplicateGroupId,
    Instant occurredAt
) {

  public ProposalRequest {
    occurredAt = occurredAt == null ? null : occurredAt.truncatedTo(ChronoUnit.MICROS);
  }

  ProposalRequest withStatus(String status) {
    return new ProposalRequest(citizen, content, contentKind, city, inclusionGroup, audioUrl,
        classification, status, duplicateGroupId, occurredAt);
  }
}
