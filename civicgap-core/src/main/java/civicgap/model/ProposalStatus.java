package civicgap.model;

import java.util.Optional;

/**
 * Review state of a proposal.
 */
public enum ProposalStatus {
  PENDING("pending"),
  NEEDS_REVIEW("needs_review"),
  APPROVED("approved");

  private final String code;

  ProposalStatus(String code) {
    this.code = code;
  }

  /**
   * Wire code stored in the database and the fallback queue.
   */
  public String code() {
    return code;
  }

  /**
   * Resolves a wire code; empty for {@code null} or unknown codes.
   */
  public static Optional<ProposalStatus> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (ProposalStatus value : values()) {
      if (value.code.equals(code)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
