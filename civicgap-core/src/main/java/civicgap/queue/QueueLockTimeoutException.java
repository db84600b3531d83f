package civicgap.queue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Thrown when the queue lock is not acquired within the configured timeout.
 */
public final class QueueLockTimeoutException extends FallbackQueueException {
  private final Path lockFile;
  private final Duration timeout;

  public QueueLockTimeoutException(Path lockFile, Duration timeout) {
    super("Timed out after " + timeout.toMillis() + "ms waiting for queue lock " + lockFile);
    this.lockFile = lockFile;
    this.timeout = timeout;
  }

  public Path lockFile() {
    return lockFile;
  }

  public Duration timeout() {
    return timeout;
  }
}
