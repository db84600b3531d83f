package civicgap.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy using deterministic exponential backoff.
 *
 * <p>Delay formula: {@code base * multiplier^attempt} for the 0-based failed attempt,
 * capped at {@code maxDelay}. With the defaults (1s, x2) the waits are 1s, 2s, 4s.
 */
public final class ExponentialBackoffRetryPolicy implements RetryPolicy {
  private final int maxAttempts;
  private final Duration base;
  private final double multiplier;
  private final Duration maxDelay;

  public ExponentialBackoffRetryPolicy(int maxAttempts, Duration base, double multiplier) {
    this(maxAttempts, base, multiplier, Duration.ofHours(1));
  }

  /**
   * @param maxAttempts total attempts, must be &gt; 0
   * @param base        delay after the first failure, must be &ge; 0
   * @param multiplier  growth factor per attempt, must be &ge; 1
   * @param maxDelay    upper bound for any single delay
   */
  public ExponentialBackoffRetryPolicy(int maxAttempts, Duration base, double multiplier, Duration maxDelay) {
    Objects.requireNonNull(base, "base");
    Objects.requireNonNull(maxDelay, "maxDelay");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0, got: " + maxAttempts);
    }
    if (base.isNegative()) {
      throw new IllegalArgumentException("base must be >= 0, got: " + base);
    }
    if (Double.isNaN(multiplier) || multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
    }
    if (maxDelay.isNegative()) {
      throw new IllegalArgumentException("maxDelay must be >= 0, got: " + maxDelay);
    }
    this.maxAttempts = maxAttempts;
    this.base = base;
    this.multiplier = multiplier;
    this.maxDelay = maxDelay;
  }

  /**
   * Policy with the default settings: 3 attempts, 1 second base, multiplier 2.
   */
  public static ExponentialBackoffRetryPolicy defaults() {
    return new ExponentialBackoffRetryPolicy(3, Duration.ofSeconds(1), 2.0);
  }

  @Override
  public int maxAttempts() {
    return maxAttempts;
  }

  public Duration base() {
    return base;
  }

  public double multiplier() {
    return multiplier;
  }

  @Override
  public Duration delayFor(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0, got: " + attempt);
    }
    double millis = base.toMillis() * Math.pow(multiplier, attempt);
    // pow overflows to infinity long before the cast would wrap
    if (Double.isInfinite(millis) || millis >= maxDelay.toMillis()) {
      return maxDelay;
    }
    return Duration.ofMillis(Math.round(millis));
  }

  @Override
  public String toString() {
    return "ExponentialBackoffRetryPolicy[maxAttempts=" + maxAttempts + ", base=" + base
        + ", multiplier=" + multiplier + ", maxDelay=" + maxDelay + "]";
  }
}
