package civicgap.retry;

import java.time.Duration;

/**
 * Blocking wait used by {@link RetryExecutor#execute}; replaced in tests.
 */
@FunctionalInterface
public interface Sleeper {

  Sleeper SYSTEM = duration -> Thread.sleep(duration.toMillis());

  void sleep(Duration duration) throws InterruptedException;
}
