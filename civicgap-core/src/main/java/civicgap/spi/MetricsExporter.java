package civicgap.spi;

/**
 * Observability hook for exporting pipeline counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  void incrementAccepted();

  void incrementRejected();

  void incrementQueued();

  void incrementFailed();

  /**
   * Increments the count of retry attempts scheduled after a retryable failure.
   */
  void incrementRetryAttempt();

  /**
   * Increments the count of operations that failed on their final attempt.
   */
  void incrementRetryExhausted();

  void incrementEnqueued();

  /**
   * Records the outcome of one fallback queue drain.
   *
   * @param processed    entries replayed successfully and removed
   * @param retained     entries kept for a later drain
   * @param deadLettered entries removed after reaching the attempt cap
   * @param corrupt      unparsable lines skipped
   */
  void recordDrain(int processed, int retained, int deadLettered, int corrupt);

  /**
   * Records the number of entries left in the fallback queue.
   */
  default void recordQueueDepth(int depth) {
  }

  default void incrementCacheHit() {
  }

  default void incrementCacheMiss() {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementAccepted() {
    }

    @Override
    public void incrementRejected() {
    }

    @Override
    public void incrementQueued() {
    }

    @Override
    public void incrementFailed() {
    }

    @Override
    public void incrementRetryAttempt() {
    }

    @Override
    public void incrementRetryExhausted() {
    }

    @Override
    public void incrementEnqueued() {
    }

    @Override
    public void recordDrain(int processed, int retained, int deadLettered, int corrupt) {
    }
  }
}
