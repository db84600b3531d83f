package civicgap.retry;

import civicgap.spi.MetricsExporter;
import civicgap.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs operations with exponential-backoff retry for a caller-chosen set of exception types.
 *
 * <p>Attempt {@code i} (0-based) failing with a listed type waits
 * {@link RetryPolicy#delayFor(int) delayFor(i)} before the next attempt. Unlisted exceptions
 * propagate immediately. The last failure is logged at SEVERE with its stack trace and
 * rethrown unchanged.
 *
 * <p>{@link #executeAsync} schedules backoff waits on a timer thread instead of blocking.
 * Cancelling the returned future stops further attempts.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 */
public final class RetryExecutor implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(RetryExecutor.class.getName());

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final MetricsExporter metrics;
  private final boolean ownsScheduler;
  private ScheduledExecutorService scheduler;
  private volatile boolean closed;

  private RetryExecutor(Builder builder) {
    this.policy = builder.policy != null ? builder.policy : ExponentialBackoffRetryPolicy.defaults();
    this.sleeper = builder.sleeper != null ? builder.sleeper : Sleeper.SYSTEM;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.scheduler = builder.scheduler;
    this.ownsScheduler = builder.scheduler == null;
  }

  public static Builder builder() {
    return new Builder();
  }

  public RetryPolicy policy() {
    return policy;
  }

  /**
   * Runs {@code operation} with this executor's policy.
   *
   * @param retryOn exception types that trigger a retry
   * @param name    operation name used in log messages
   */
  public <T, E extends Exception> T execute(RetryableOperation<T, E> operation,
      Set<Class<? extends Throwable>> retryOn, String name) throws E {
    return execute(operation, policy, retryOn, name);
  }

  /**
   * Runs {@code operation} with an explicit policy.
   *
   * <p>If the thread is interrupted during a backoff wait, the loop stops, the interrupt
   * flag is restored and the last failure is rethrown with the
   * {@link InterruptedException} attached as suppressed.
   */
  public <T, E extends Exception> T execute(RetryableOperation<T, E> operation, RetryPolicy policy,
      Set<Class<? extends Throwable>> retryOn, String name) throws E {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(policy, "policy");
    Objects.requireNonNull(retryOn, "retryOn");
    for (int attempt = 0; ; attempt++) {
      try {
        return operation.run();
      } catch (Exception e) {
        if (!isRetryable(e, retryOn)) {
          throw e;
        }
        if (attempt + 1 >= policy.maxAttempts()) {
          logPermanentFailure(name, attempt + 1, e);
          throw e;
        }
        Duration delay = policy.delayFor(attempt);
        logRetry(name, attempt + 1, delay, e);
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          e.addSuppressed(ie);
          logger.log(Level.WARNING, "Retry of {0} interrupted after {1} attempts",
              new Object[]{name, attempt + 1});
          throw e;
        }
      }
    }
  }

  /**
   * Non-blocking variant of {@link #execute}. Each attempt calls {@code operation} for a
   * new stage; backoff waits are scheduled on a daemon timer thread.
   *
   * <p>The returned future completes with the first successful value, or exceptionally
   * with the unwrapped last failure. Cancelling it prevents any further attempt.
   */
  public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
      Set<Class<? extends Throwable>> retryOn, String name) {
    Objects.requireNonNull(operation, "operation");
    Objects.requireNonNull(retryOn, "retryOn");
    CompletableFuture<T> result = new CompletableFuture<>();
    attemptAsync(operation, retryOn, name, 0, result);
    return result;
  }

  private <T> void attemptAsync(Supplier<? extends CompletionStage<T>> operation,
      Set<Class<? extends Throwable>> retryOn, String name, int attempt, CompletableFuture<T> result) {
    if (result.isDone()) {
      return;
    }
    CompletionStage<T> stage;
    try {
      stage = operation.get();
    } catch (Throwable t) {
      stage = CompletableFuture.failedFuture(t);
    }
    stage.whenComplete((value, error) -> {
      if (result.isDone()) {
        return;
      }
      if (error == null) {
        result.complete(value);
        return;
      }
      Throwable cause = unwrap(error);
      if (!isRetryable(cause, retryOn)) {
        result.completeExceptionally(cause);
        return;
      }
      if (attempt + 1 >= policy.maxAttempts()) {
        logPermanentFailure(name, attempt + 1, cause);
        result.completeExceptionally(cause);
        return;
      }
      Duration delay = policy.delayFor(attempt);
      logRetry(name, attempt + 1, delay, cause);
      try {
        scheduler().schedule(() -> attemptAsync(operation, retryOn, name, attempt + 1, result),
            delay.toMillis(), TimeUnit.MILLISECONDS);
      } catch (RejectedExecutionException | IllegalStateException e) {
        cause.addSuppressed(e);
        result.completeExceptionally(cause);
      }
    });
  }

  private synchronized ScheduledExecutorService scheduler() {
    if (closed) {
      throw new IllegalStateException("RetryExecutor has been closed");
    }
    if (scheduler == null) {
      scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("civicgap-retry-"));
    }
    return scheduler;
  }

  private static boolean isRetryable(Throwable error, Set<Class<? extends Throwable>> retryOn) {
    for (Class<? extends Throwable> type : retryOn) {
      if (type.isInstance(error)) {
        return true;
      }
    }
    return false;
  }

  private static Throwable unwrap(Throwable error) {
    Throwable current = error;
    while (current instanceof CompletionException && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private void logRetry(String name, int attempts, Duration delay, Throwable error) {
    metrics.incrementRetryAttempt();
    logger.log(Level.WARNING, "Attempt {0} of {1} failed, retrying in {2}ms: {3}: {4}",
        new Object[]{attempts, name, delay.toMillis(), error.getClass().getSimpleName(), error.getMessage()});
  }

  private void logPermanentFailure(String name, int attempts, Throwable error) {
    metrics.incrementRetryExhausted();
    logger.log(Level.SEVERE, "Permanent failure after " + attempts + " attempts: operation=" + name
        + ", error=" + error.getClass().getSimpleName() + ", message=" + error.getMessage(), error);
  }

  /**
   * Shuts down the internally created timer thread. Pending async retries are abandoned.
   */
  @Override
  public synchronized void close() {
    closed = true;
    if (scheduler != null && ownsScheduler) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /**
   * Builder for {@link RetryExecutor}.
   */
  public static final class Builder {
    private RetryPolicy policy;
    private Sleeper sleeper;
    private MetricsExporter metrics;
    private ScheduledExecutorService scheduler;

    private Builder() {}

    /** Optional. Defaults to {@link ExponentialBackoffRetryPolicy#defaults()}. */
    public Builder policy(RetryPolicy policy) {
      this.policy = policy;
      return this;
    }

    /** Optional. Defaults to {@link Sleeper#SYSTEM}. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Timer used by {@link RetryExecutor#executeAsync}. Optional; when absent a daemon
     * thread is created on first use and shut down by {@link RetryExecutor#close()}.
     * A supplied scheduler is never shut down by the executor.
     */
    public Builder scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    public RetryExecutor build() {
      return new RetryExecutor(this);
    }
  }
}
