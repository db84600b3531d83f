package civicgap.queue;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Whole-file lock guarding a queue file.
 *
 * <p>Combines a JVM-level {@link ReentrantLock} with an OS lock on a sibling {@code .lock}
 * file so that other processes sharing the queue are excluded as well. Both waits are
 * bounded by the same timeout. Re-entry from the owning thread skips the file lock.
 */
final class QueueLock {
  private static final long FILE_LOCK_POLL_MS = 10L;

  private final ReentrantLock lock = new ReentrantLock();
  private final Path lockFile;
  private final Duration timeout;

  QueueLock(Path lockFile, Duration timeout) {
    this.lockFile = Objects.requireNonNull(lockFile, "lockFile");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  Path lockFile() {
    return lockFile;
  }

  /**
   * Acquires both locks.
   *
   * @throws QueueLockTimeoutException if either lock is not acquired within the timeout
   * @throws FallbackQueueException    if the lock file cannot be opened or the thread is interrupted
   */
  Held acquire() {
    long deadline = System.nanoTime() + timeout.toNanos();
    try {
      if (!lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS)) {
        throw new QueueLockTimeoutException(lockFile, timeout);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FallbackQueueException("Interrupted waiting for queue lock " + lockFile, e);
    }
    if (lock.getHoldCount() > 1) {
      return new Held(null, null);
    }
    try {
      FileChannel channel = FileChannel.open(lockFile,
          StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      try {
        FileLock fileLock = awaitFileLock(channel, deadline);
        return new Held(channel, fileLock);
      } catch (RuntimeException e) {
        channel.close();
        throw e;
      }
    } catch (IOException e) {
      lock.unlock();
      throw new FallbackQueueException("Failed to lock " + lockFile, e);
    } catch (RuntimeException e) {
      lock.unlock();
      throw e;
    }
  }

  private FileLock awaitFileLock(FileChannel channel, long deadline) throws IOException {
    while (true) {
      FileLock fileLock;
      try {
        fileLock = channel.tryLock();
      } catch (OverlappingFileLockException e) {
        // another QueueLock instance in this JVM holds the same file
        fileLock = null;
      }
      if (fileLock != null) {
        return fileLock;
      }
      if (System.nanoTime() >= deadline) {
        throw new QueueLockTimeoutException(lockFile, timeout);
      }
      try {
        Thread.sleep(FILE_LOCK_POLL_MS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FallbackQueueException("Interrupted waiting for queue lock " + lockFile, e);
      }
    }
  }

  /**
   * Releases the locks on close.
   */
  final class Held implements AutoCloseable {
    private final FileChannel channel;
    private final FileLock fileLock;

    private Held(FileChannel channel, FileLock fileLock) {
      this.channel = channel;
      this.fileLock = fileLock;
    }

    @Override
    public void close() {
      try {
        if (fileLock != null) {
          fileLock.release();
        }
        if (channel != null) {
          channel.close();
        }
      } catch (IOException e) {
        throw new FallbackQueueException("Failed to release " + lockFile, e);
      } finally {
        lock.unlock();
      }
    }
  }
}
