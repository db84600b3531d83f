package civicgap.model;

import java.util.Optional;

/**
 * What a citizen did with (or without) a bill.
 */
public enum InteractionKind {
  OPINION("opinion"),
  VIEW("view"),
  REACTION("reaction");

  private final String code;

  InteractionKind(String code) {
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
  public static Optional<InteractionKind> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (InteractionKind value : values()) {
      if (value.code.equals(code)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
