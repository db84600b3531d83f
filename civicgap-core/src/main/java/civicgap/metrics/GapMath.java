package civicgap.metrics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Gap percentage arithmetic.
 */
public final class GapMath {

  private GapMath() {}

  /**
   * {@code max(0, (demand - bills) / demand * 100)} rounded half-up to two decimals;
   * 0 when there is no demand.
   */
  public static double gapPercent(long demand, long bills) {
    if (demand < 0 || bills < 0) {
      throw new IllegalArgumentException("counts must be >= 0, got demand=" + demand + ", bills=" + bills);
    }
    if (demand == 0 || bills >= demand) {
      return 0.0;
    }
    return BigDecimal.valueOf(demand - bills)
        .multiply(BigDecimal.valueOf(100))
        .divide(BigDecimal.valueOf(demand), 2, RoundingMode.HALF_UP)
        .doubleValue();
  }
}
