package civicgap.model;

import java.util.Optional;

/**
 * How a proposal's content was captured.
 */
public enum ContentKind {
  TEXT("text"),
  TRANSCRIBED_AUDIO("transcribed_audio");

  private final String code;

  ContentKind(String code) {
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
  public static Optional<ContentKind> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (ContentKind value : values()) {
      if (value.code.equals(code)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
