package civicgap.retry;

import java.time.Duration;

/**
 * Strategy for bounding retries and computing the wait between attempts.
 *
 * @see ExponentialBackoffRetryPolicy
 */
public interface RetryPolicy {

  /**
   * Total attempts including the first one. Always &gt; 0.
   */
  int maxAttempts();

  /**
   * Wait after the failed attempt {@code attempt}.
   *
   * @param attempt 0-based index of the attempt that just failed
   * @return non-negative delay
   */
  Duration delayFor(int attempt);
}
