package civicgap.sync;

import civicgap.model.Proposal;
import civicgap.model.ProposalStatus;

import java.time.Instant;

/**
 * Proposal as listed on the dashboard, with content cut to {@value #MAX_CONTENT} code points.
 */
public record ProposalSummary(
    long id,
    String content,
    String primaryTheme,
    String city,
    String inclusionGroup,
    ProposalStatus status,
    Instant occurredAt
) {
  public static final int MAX_CONTENT = 100;

  static ProposalSummary of(Proposal proposal) {
    String content = proposal.content();
    if (content != null && content.codePointCount(0, content.length()) > MAX_CONTENT) {
      content = content.substring(0, content.offsetByCodePoints(0, MAX_CONTENT));
    }
    return new ProposalSummary(proposal.id(), content, proposal.primaryTheme(), proposal.city(),
        proposal.inclusionGroup(), proposal.status(), proposal.occurredAt());
  }
}
