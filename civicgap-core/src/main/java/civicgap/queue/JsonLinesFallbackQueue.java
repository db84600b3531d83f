package civicgap.queue;

import civicgap.spi.MetricsExporter;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FallbackQueue} backed by a newline-delimited JSON file.
 *
 * <p>Each line is one {@link QueueEntry}. Appends and drains are serialised by a
 * {@link QueueLock} on {@code <file>.lock}. A drain rewrites the file through a temporary
 * sibling and an atomic move, so a crash mid-drain leaves either the old or the new
 * contents.
 *
 * <p>Lines that are not valid JSON, or carry no {@code payload}, are logged once and
 * dropped on the next rewrite; they never abort a drain.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class JsonLinesFallbackQueue implements FallbackQueue {
  private static final Logger logger = Logger.getLogger(JsonLinesFallbackQueue.class.getName());

  private final Path file;
  private final QueueLock lock;
  private final DeadLetterSink deadLetterSink;
  private final MetricsExporter metrics;
  private final Clock clock;

  private JsonLinesFallbackQueue(Builder builder) {
    this.file = Objects.requireNonNull(builder.file, "file").toAbsolutePath();
    Duration lockTimeout = builder.lockTimeout;
    if (lockTimeout.isNegative() || lockTimeout.isZero()) {
      throw new IllegalArgumentException("lockTimeout must be > 0");
    }
    this.lock = new QueueLock(Path.of(file + ".lock"), lockTimeout);
    this.deadLetterSink = builder.deadLetterSink != null ? builder.deadLetterSink : DeadLetterSink.LOGGING;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    try {
      Files.createDirectories(file.getParent());
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to create queue directory " + file.getParent(), e);
    }
    logger.log(Level.INFO, "Fallback queue at {0}", file);
  }

  public static Builder builder() {
    return new Builder();
  }

  public Path file() {
    return file;
  }

  @Override
  public void enqueue(JsonNode payload) {
    Objects.requireNonNull(payload, "payload");
    QueueEntry entry = QueueEntry.fresh(payload, clock.instant());
    String line = QueueLines.format(entry) + "\n";
    try (QueueLock.Held ignored = lock.acquire()) {
      Files.writeString(file, line, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to append to " + file, e);
    }
    metrics.incrementEnqueued();
    logger.log(Level.INFO, "Queued {0} payload", entry.type());
  }

  @Override
  public DrainResult drain(EntryProcessor processor, int maxAttempts) {
    Objects.requireNonNull(processor, "processor");
    if (maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    DrainResult result;
    int depth;
    try (QueueLock.Held ignored = lock.acquire()) {
      if (!Files.exists(file)) {
        return DrainResult.EMPTY;
      }
      List<String> lines = readLines();
      List<QueueEntry> retained = new ArrayList<>();
      int processed = 0;
      int deadLettered = 0;
      int corrupt = 0;

      for (int i = 0; i < lines.size(); i++) {
        String line = lines.get(i);
        if (line.isBlank()) {
          continue;
        }
        QueueEntry entry;
        try {
          entry = QueueLines.parse(line);
        } catch (IllegalArgumentException e) {
          corrupt++;
          logger.log(Level.WARNING, "Skipping corrupt queue line {0} in {1}: {2}",
              new Object[]{i + 1, file, e.getMessage()});
          continue;
        }

        try {
          processor.process(entry.payload());
          processed++;
          logger.log(Level.FINE, "Replayed queued {0} payload", entry.type());
        } catch (Exception e) {
          QueueEntry failed = entry.failed(e);
          if (failed.attempts() < maxAttempts) {
            retained.add(failed);
            logger.log(Level.WARNING, "Replay of queued {0} payload failed (attempt {1}): {2}",
                new Object[]{failed.type(), failed.attempts(), failed.lastError()});
          } else if (deadLetter(failed, e)) {
            deadLettered++;
          } else {
            retained.add(failed);
          }
        }
      }

      rewrite(retained);
      depth = retained.size();
      result = new DrainResult(processed, retained.size(), deadLettered, corrupt);
    }

    metrics.recordDrain(result.processed(), result.retained(), result.deadLettered(), result.corrupt());
    metrics.recordQueueDepth(depth);
    if (result.total() > 0) {
      logger.log(Level.INFO, "Drained {0}: processed={1}, retained={2}, deadLettered={3}, corrupt={4}",
          new Object[]{file, result.processed(), result.retained(), result.deadLettered(), result.corrupt()});
    }
    return result;
  }

  private boolean deadLetter(QueueEntry entry, Exception cause) {
    logger.log(Level.SEVERE, "Permanently failed to replay queued " + entry.type()
        + " payload after " + entry.attempts() + " attempts", cause);
    try {
      deadLetterSink.accept(entry);
      return true;
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Dead-letter sink rejected entry; keeping it queued", e);
      return false;
    }
  }

  @Override
  public int size() {
    try (QueueLock.Held ignored = lock.acquire()) {
      if (!Files.exists(file)) {
        return 0;
      }
      int count = 0;
      for (String line : readLines()) {
        if (!line.isBlank()) {
          count++;
        }
      }
      return count;
    }
  }

  @Override
  public List<QueueEntry> peek(int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be > 0");
    }
    try (QueueLock.Held ignored = lock.acquire()) {
      if (!Files.exists(file)) {
        return List.of();
      }
      List<QueueEntry> entries = new ArrayList<>();
      for (String line : readLines()) {
        if (entries.size() >= limit) {
          break;
        }
        if (line.isBlank()) {
          continue;
        }
        try {
          entries.add(QueueLines.parse(line));
        } catch (IllegalArgumentException e) {
          logger.log(Level.FINE, "peek skipped corrupt line: {0}", e.getMessage());
        }
      }
      return List.copyOf(entries);
    }
  }

  @Override
  public void clear() {
    try (QueueLock.Held ignored = lock.acquire()) {
      if (Files.deleteIfExists(file)) {
        logger.log(Level.INFO, "Cleared fallback queue {0}", file);
      }
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to delete " + file, e);
    }
    metrics.recordQueueDepth(0);
  }

  private List<String> readLines() {
    try {
      return Files.readAllLines(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to read " + file, e);
    }
  }

  private void rewrite(List<QueueEntry> entries) {
    StringBuilder sb = new StringBuilder();
    for (QueueEntry entry : entries) {
      sb.append(QueueLines.format(entry)).append('\n');
    }
    Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
    try {
      Files.writeString(tmp, sb, StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
          StandardOpenOption.WRITE, StandardOpenOption.SYNC);
      try {
        Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
      }
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to rewrite " + file, e);
    }
  }

  /**
   * Builder for {@link JsonLinesFallbackQueue}.
   */
  public static final class Builder {
    private Path file;
    private Duration lockTimeout = Duration.ofSeconds(10);
    private DeadLetterSink deadLetterSink;
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * Sets the queue file. The parent directory is created if missing.
     *
     * <p><b>Required.</b>
     */
    public Builder file(Path file) {
      this.file = file;
      return this;
    }

    /**
     * Maximum wait for the queue lock. Optional. Defaults to 10 seconds.
     */
    public Builder lockTimeout(Duration lockTimeout) {
      this.lockTimeout = Objects.requireNonNull(lockTimeout, "lockTimeout");
      return this;
    }

    /**
     * Receives entries removed after their last allowed attempt.
     * Optional. Defaults to {@link DeadLetterSink#LOGGING}.
     */
    public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
      this.deadLetterSink = deadLetterSink;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Clock used to stamp {@code queued_at}. Optional. Defaults to the UTC system clock.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public JsonLinesFallbackQueue build() {
      return new JsonLinesFallbackQueue(this);
    }
  }
}
