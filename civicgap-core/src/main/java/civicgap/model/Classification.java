package civicgap.model;

import java.util.List;
import java.util.Objects;

/**
 * Theme classification of a proposal.
 *
 * @param primaryTheme    main theme
 * @param secondaryThemes up to two further themes
 * @param confidence      classifier confidence in [0, 1]
 */
public record Classification(String primaryTheme, List<String> secondaryThemes, double confidence) {
  /** Theme assigned when the classifier is unavailable. */
  public static final String DEFAULT_THEME = "Outros";
  /** Confidence below this value sends a proposal to manual review. */
  public static final double REVIEW_THRESHOLD = 0.6;

  public Classification {
    Objects.requireNonNull(primaryTheme, "primaryTheme");
    secondaryThemes = secondaryThemes == null ? List.of() : List.copyOf(secondaryThemes);
    if (secondaryThemes.size() > 2) {
      throw new IllegalArgumentException("at most 2 secondary themes, got: " + secondaryThemes.size());
    }
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new IllegalArgumentException("confidence must be in [0, 1], got: " + confidence);
    }
  }

  /**
   * Fallback used when classification fails: default theme, zero confidence.
   */
  public static Classification fallback() {
    return new Classification(DEFAULT_THEME, List.of(), 0.0);
  }

  public boolean needsReview(double threshold) {
    return confidence < threshold;
  }
}
