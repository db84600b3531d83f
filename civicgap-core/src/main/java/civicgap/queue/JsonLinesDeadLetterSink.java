package civicgap.queue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Appends dead-lettered entries to a separate JSON-lines file in the queue's line format,
 * so they can be inspected or re-enqueued by hand.
 */
public final class JsonLinesDeadLetterSink implements DeadLetterSink {
  private final Path file;

  public JsonLinesDeadLetterSink(Path file) {
    this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
    try {
      Files.createDirectories(this.file.getParent());
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to create dead-letter directory " + this.file.getParent(), e);
    }
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void accept(QueueEntry entry) {
    try {
      Files.writeString(file, QueueLines.format(entry) + "\n", StandardCharsets.UTF_8,
          StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.SYNC);
    } catch (IOException e) {
      throw new FallbackQueueException("Failed to append to dead-letter file " + file, e);
    }
  }
}
