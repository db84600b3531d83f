package civicgap.queue;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Receives queue entries removed after exhausting their replay attempts.
 *
 * <p>Called while the queue lock is held. A sink that throws keeps the entry in the queue.
 *
 * @see JsonLinesDeadLetterSink
 */
@FunctionalInterface
public interface DeadLetterSink {

  /**
   * Logs the entry and discards it.
   */
  DeadLetterSink LOGGING = new DeadLetterSink() {
    private final Logger logger = Logger.getLogger(DeadLetterSink.class.getName());

    @Override
    public void accept(QueueEntry entry) {
      logger.log(Level.SEVERE, "Discarding queued {0} payload queued at {1}: {2}",
          new Object[]{entry.type(), entry.queuedAt(), entry.lastError()});
    }
  };

  void accept(QueueEntry entry);
}
