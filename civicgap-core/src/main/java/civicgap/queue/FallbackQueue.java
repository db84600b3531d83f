package civicgap.queue;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Durable local buffer for operations that could not be persisted.
 *
 * <p>Delivery is at-least-once within a single process: an entry is removed only after
 * its processor returns normally or after it reaches the attempt cap.
 *
 * @see JsonLinesFallbackQueue
 */
public interface FallbackQueue {

  /**
   * Appends a payload with zero attempts.
   *
   * @throws QueueLockTimeoutException if the queue lock is not acquired in time
   * @throws FallbackQueueException    if the entry cannot be written
   */
  void enqueue(JsonNode payload);

  /**
   * Replays every queued entry in order and rewrites the queue with the entries
   * that should be retried.
   *
   * @param processor   replays one payload; returning normally means success
   * @param maxAttempts attempts after which an entry is dead-lettered, must be &gt; 0
   */
  DrainResult drain(EntryProcessor processor, int maxAttempts);

  /**
   * Number of queued lines, corrupt ones included.
   */
  int size();

  /**
   * First {@code limit} readable entries without removing them.
   */
  List<QueueEntry> peek(int limit);

  /**
   * Discards every queued entry.
   */
  void clear();

  /**
   * Replays a single queued payload.
   */
  @FunctionalInterface
  interface EntryProcessor {
    void process(JsonNode payload) throws Exception;
  }
}
