package civicgap.model;

import java.util.Optional;

/**
 * Stance recorded by an {@link InteractionKind#OPINION} interaction.
 */
public enum Opinion {
  FAVOR("favor"),
  AGAINST("against"),
  SKIP("skip");

  private final String code;

  Opinion(String code) {
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
  public static Optional<Opinion> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (Opinion value : values()) {
      if (value.code.equals(code)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
