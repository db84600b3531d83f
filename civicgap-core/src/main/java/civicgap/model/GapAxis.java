package civicgap.model;

import java.util.Optional;

/**
 * Segmentation axis for gap metrics.
 */
public enum GapAxis {
  THEME("theme"),
  GROUP("group"),
  CITY("city");

  private final String code;

  GapAxis(String code) {
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
  public static Optional<GapAxis> fromCode(String code) {
    if (code == null) {
      return Optional.empty();
    }
    for (GapAxis value : values()) {
      if (value.code.equals(code)) {
        return Optional.of(value);
      }
    }
    return Optional.empty();
  }
}
