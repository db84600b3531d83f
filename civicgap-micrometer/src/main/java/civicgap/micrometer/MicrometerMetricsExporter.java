package civicgap.micrometer;

import civicgap.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code civicgap.submission.accepted} / {@code .rejected} / {@code .queued} / {@code .failed}</li>
 *   <li>{@code civicgap.retry.attempt}: retries scheduled after a retryable failure</li>
 *   <li>{@code civicgap.retry.exhausted}: operations that failed on their final attempt</li>
 *   <li>{@code civicgap.queue.enqueued}: payloads written to the fallback queue</li>
 *   <li>{@code civicgap.queue.drain.processed} / {@code .dead_lettered} / {@code .corrupt}</li>
 *   <li>{@code civicgap.cache.hit} / {@code civicgap.cache.miss}</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code civicgap.queue.depth}: entries left after the last drain</li>
 * </ul>
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter accepted;
  private final Counter rejected;
  private final Counter queued;
  private final Counter failed;
  private final Counter retryAttempt;
  private final Counter retryExhausted;
  private final Counter enqueued;
  private final Counter drainProcessed;
  private final Counter drainDeadLettered;
  private final Counter drainCorrupt;
  private final Counter cacheHit;
  private final Counter cacheMiss;
  private final Gauge queueDepthGauge;

  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "civicgap"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "civicgap");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "recife.civicgap"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.accepted = counter(namePrefix + ".submission.accepted", "Submissions persisted");
    this.rejected = counter(namePrefix + ".submission.rejected", "Submissions rejected by validation or constraints");
    this.queued = counter(namePrefix + ".submission.queued", "Submissions diverted to the fallback queue");
    this.failed = counter(namePrefix + ".submission.failed", "Submissions neither stored nor queued");
    this.retryAttempt = counter(namePrefix + ".retry.attempt", "Retries scheduled");
    this.retryExhausted = counter(namePrefix + ".retry.exhausted", "Operations failed after the last attempt");
    this.enqueued = counter(namePrefix + ".queue.enqueued", "Payloads appended to the fallback queue");
    this.drainProcessed = counter(namePrefix + ".queue.drain.processed", "Queued payloads replayed");
    this.drainDeadLettered = counter(namePrefix + ".queue.drain.dead_lettered",
        "Queued payloads removed after the attempt cap");
    this.drainCorrupt = counter(namePrefix + ".queue.drain.corrupt", "Unparsable queue lines dropped");
    this.cacheHit = counter(namePrefix + ".cache.hit", "Dashboard cache hits");
    this.cacheMiss = counter(namePrefix + ".cache.miss", "Dashboard cache misses");

    this.queueDepthGauge = Gauge.builder(namePrefix + ".queue.depth", queueDepth, AtomicInteger::get)
        .description("Entries in the fallback queue")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementAccepted() {
    if (closed) return;
    accepted.increment();
  }

  @Override
  public void incrementRejected() {
    if (closed) return;
    rejected.increment();
  }

  @Override
  public void incrementQueued() {
    if (closed) return;
    queued.increment();
  }

  @Override
  public void incrementFailed() {
    if (closed) return;
    failed.increment();
  }

  @Override
  public void incrementRetryAttempt() {
    if (closed) return;
    retryAttempt.increment();
  }

  @Override
  public void incrementRetryExhausted() {
    if (closed) return;
    retryExhausted.increment();
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void recordDrain(int processed, int retained, int deadLettered, int corrupt) {
    if (closed) return;
    drainProcessed.increment(processed);
    drainDeadLettered.increment(deadLettered);
    drainCorrupt.increment(corrupt);
  }

  @Override
  public void recordQueueDepth(int depth) {
    if (closed) return;
    queueDepth.set(depth);
  }

  @Override
  public void incrementCacheHit() {
    if (closed) return;
    cacheHit.increment();
  }

  @Override
  public void incrementCacheMiss() {
    if (closed) return;
    cacheMiss.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(accepted, rejected, queued, failed, retryAttempt, retryExhausted,
        enqueued, drainProcessed, drainDeadLettered, drainCorrupt, cacheHit, cacheMiss, queueDepthGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
