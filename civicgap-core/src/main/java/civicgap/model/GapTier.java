package civicgap.model;

/**
 * Classification of a gap percentage: High (&ge; 70), Medium (&ge; 40), Low (&lt; 40).
 */
public enum GapTier {
  HIGH,
  MEDIUM,
  LOW;

  public static GapTier of(double gapPercent) {
    if (gapPercent >= 70) {
      return HIGH;
    }
    if (gapPercent >= 40) {
      return MEDIUM;
    }
    return LOW;
  }
}
