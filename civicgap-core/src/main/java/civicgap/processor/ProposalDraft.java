package civicgap.processor;

import civicgap.model.CitizenRef;
import civicgap.model.Classification;

import java.time.Instant;

/**
 * Proposal that still has to be classified; see {@link SubmissionService#classifyAndSubmit}.
 */
public record ProposalDraft(
    CitizenRef citizen,
    String content,
    String contentKind,
    String city,
    String inclusionGroup,
    String audioUrl,
    Instant occurredAt
) {

  ProposalRequest toRequest(Classification classification, String status) {
    return new ProposalRequest(citizen, content, contentKind, city, inclusionGroup, audioUrl,
        classification, status, null, occurredAt);
  }
}
