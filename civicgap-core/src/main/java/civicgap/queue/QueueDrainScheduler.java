package civicgap.queue;

import civicgap.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically drains a {@link FallbackQueue}, replaying each entry through a processor.
 *
 * <p>Builder pattern, {@link AutoCloseable}, a single daemon thread named
 * {@code civicgap-drain-N} and synchronized lifecycle. Drain failures are logged and
 * never escape the scheduler thread.
 *
 * @see QueueDrainScheduler.Builder
 */
public final class QueueDrainScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueueDrainScheduler.class.getName());

  private final FallbackQueue queue;
  private final FallbackQueue.EntryProcessor processor;
  private final int maxAttempts;
  private final Duration interval;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> drainTask;
  private volatile boolean closed;

  private QueueDrainScheduler(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.processor = Objects.requireNonNull(builder.processor, "processor");
    if (builder.maxAttempts <= 0) {
      throw new IllegalArgumentException("maxAttempts must be > 0");
    }
    if (builder.interval.isNegative() || builder.interval.isZero()) {
      throw new IllegalArgumentException("interval must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.interval = builder.interval;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the drain loop. Subsequent calls are no-ops if already started.
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueueDrainScheduler has been closed");
    }
    if (drainTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("civicgap-drain-"));
    long millis = interval.toMillis();
    drainTask = scheduler.scheduleWithFixedDelay(this::runOnce, millis, millis, TimeUnit.MILLISECONDS);
  }

  /**
   * Executes a single drain pass. Called by the scheduler; may be invoked directly.
   */
  public void runOnce() {
    if (closed) {
      return;
    }
    try {
      queue.drain(processor, maxAttempts);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Queue drain failed", t);
    }
  }

  public boolean isRunning() {
    return drainTask != null && !closed;
  }

  /** Cancels the drain schedule and shuts down the scheduler thread. */
  @Override
  public synchronized void close() {
    closed = true;
    if (drainTask != null) {
      drainTask.cancel(false);
      drainTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link QueueDrainScheduler}. */
  public static final class Builder {
    private FallbackQueue queue;
    private FallbackQueue.EntryProcessor processor;
    private int maxAttempts = 3;
    private Duration interval = Duration.ofSeconds(30);

    private Builder() {}

    /** <b>Required.</b> */
    public Builder queue(FallbackQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Replays one payload. <b>Required.</b> Typically {@code submissionService::replay}.
     */
    public Builder processor(FallbackQueue.EntryProcessor processor) {
      this.processor = processor;
      return this;
    }

    /** Optional. Defaults to 3. Must be &gt; 0. */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Delay between drain passes. Optional. Defaults to 30 seconds. */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    public QueueDrainScheduler build() {
      return new QueueDrainScheduler(this);
    }
  }
}
