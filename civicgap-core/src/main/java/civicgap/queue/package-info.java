/**
 * Local durable fallback queue.
 *
 * <p>Operations that could not be persisted are appended to a JSON-lines file by
 * {@link civicgap.queue.JsonLinesFallbackQueue} and replayed later, either on demand or
 * by a {@link civicgap.queue.QueueDrainScheduler}. Entries that keep failing are handed
 * to a {@link civicgap.queue.DeadLetterSink}.
 *
 * <p>Delivery is at-least-once and single-process; there is no cross-node coordination.
 */
package civicgap.queue;
