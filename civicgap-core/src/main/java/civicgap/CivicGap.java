package civicgap;

import civicgap.metrics.GapMetricsCalculator;
import civicgap.metrics.GapReport;
import civicgap.model.DailyCount;
import civicgap.model.Interaction;
import civicgap.model.Proposal;
import civicgap.processor.InteractionRequest;
import civicgap.processor.ProposalDraft;
import civicgap.processor.ProposalRequest;
import civicgap.processor.SubmissionProcessor;
import civicgap.processor.SubmissionResult;
import civicgap.processor.SubmissionService;
import civicgap.queue.DeadLetterSink;
import civicgap.queue.DrainResult;
import civicgap.queue.FallbackQueue;
import civicgap.queue.JsonLinesDeadLetterSink;
import civicgap.queue.JsonLinesFallbackQueue;
import civicgap.queue.QueueDrainScheduler;
import civicgap.retry.ExponentialBackoffRetryPolicy;
import civicgap.retry.RetryExecutor;
import civicgap.retry.Sleeper;
import civicgap.spi.CivicStore;
import civicgap.spi.ConnectionProvider;
import civicgap.spi.MetricsExporter;
import civicgap.spi.ThemeClassifier;
import civicgap.spi.TransactionManager;
import civicgap.sync.DashboardService;
import civicgap.sync.DashboardSummary;
import civicgap.sync.ProposalSummary;
import civicgap.sync.SyncCache;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composition root that owns every component: fallback queue, retry executor, processor,
 * submission service, gap calculator, dashboard cache and the optional drain scheduler.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * DataSource ds = ...;
 * try (CivicGap civicGap = CivicGap.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(ds))
 *     .transactionManager(new JdbcTransactionManager(ds))
 *     .store(JdbcCivicStores.detect(ds))
 *     .config(CivicGapConfig.fromProperties(props))
 *     .build()) {
 *   SubmissionResult<Interaction> result = civicGap.submitInteraction(request);
 * }
 * }</pre>
 */
public final class CivicGap implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(CivicGap.class.getName());

  private final FallbackQueue queue;
  private final RetryExecutor retryExecutor;
  private final SubmissionService submissions;
  private final GapMetricsCalculator calculator;
  private final DashboardService dashboard;
  private final QueueDrainScheduler drainScheduler;
  private final MetricsExporter metrics;
  private final int drainMaxAttempts;

  private CivicGap(Builder builder, FallbackQueue queue, RetryExecutor retryExecutor,
      SubmissionService submissions, GapMetricsCalculator calculator, DashboardService dashboard,
      QueueDrainScheduler drainScheduler) {
    this.queue = queue;
    this.retryExecutor = retryExecutor;
    this.submissions = submissions;
    this.calculator = calculator;
    this.dashboard = dashboard;
    this.drainScheduler = drainScheduler;
    this.metrics = builder.metrics;
    this.drainMaxAttempts = builder.config.getDrainMaxAttempts();
  }

  public static Builder builder() {
    return new Builder();
  }

  // ── Submissions ─────────────────────────────────────────────────

  public SubmissionResult<Interaction> submitInteraction(InteractionRequest request) {
    return submissions.submitInteraction(request);
  }

  public SubmissionResult<Proposal> submitProposal(ProposalRequest request) {
    return submissions.submitProposal(request);
  }

  public SubmissionResult<Proposal> classifyAndSubmit(ProposalDraft draft) {
    return submissions.classifyAndSubmit(draft);
  }

  // ── Dashboard ───────────────────────────────────────────────────

  public DashboardSummary getDashboardSummary() {
    return dashboard.getDashboardSummary();
  }

  public List<DailyCount> getInteractionTrend(int days) {
    return dashboard.getInteractionTrend(days);
  }

  public List<ProposalSummary> getPopularProposals(int limit) {
    return dashboard.getPopularProposals(limit);
  }

  public GapReport getGapMetrics() {
    return dashboard.getGapMetrics();
  }

  // ── Maintenance ─────────────────────────────────────────────────

  /**
   * Recomputes all gap metrics and atomically replaces the stored snapshot.
   */
  public GapReport snapshotGapMetrics() {
    return calculator.snapshot();
  }

  /**
   * Replays the fallback queue once on the calling thread.
   *
   * @return {@link DrainResult#EMPTY} when no queue is configured
   */
  public DrainResult drainQueue() {
    if (queue == null) {
      return DrainResult.EMPTY;
    }
    return queue.drain(submissions::replay, drainMaxAttempts);
  }

  public Optional<FallbackQueue> queue() {
    return Optional.ofNullable(queue);
  }

  public SubmissionService submissions() {
    return submissions;
  }

  public GapMetricsCalculator calculator() {
    return calculator;
  }

  public DashboardService dashboard() {
    return dashboard;
  }

  public RetryExecutor retryExecutor() {
    return retryExecutor;
  }

  /**
   * Stops the drain scheduler and the retry timer, then closes the metrics exporter if it
   * is {@link AutoCloseable}.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (drainScheduler != null) {
      try {
        drainScheduler.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    try {
      retryExecutor.close();
    } catch (RuntimeException e) {
      if (first == null) first = e; else first.addSuppressed(e);
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /**
   * Builder for {@link CivicGap}.
   */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private TransactionManager transactionManager;
    private CivicStore store;
    private ThemeClassifier classifier;
    private MetricsExporter metrics;
    private CivicGapConfig config;
    private Clock clock;
    private Sleeper sleeper;
    private FallbackQueue queue;
    private DeadLetterSink deadLetterSink;
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /** Connection source for read paths. <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** Transaction source for writes and snapshots. <b>Required.</b> */
    public Builder transactionManager(TransactionManager transactionManager) {
      this.transactionManager = transactionManager;
      return this;
    }

    /** Persistence backend. <b>Required.</b> */
    public Builder store(CivicStore store) {
      this.store = store;
      return this;
    }

    public Builder classifier(ThemeClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to {@code new CivicGapConfig()}. */
    public Builder config(CivicGapConfig config) {
      this.config = config;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /** Backoff sleeper for the retry executor. Mostly useful in tests. */
    public Builder sleeper(Sleeper sleeper) {
      this.sleeper = sleeper;
      return this;
    }

    /**
     * Uses {@code queue} instead of the JSON-lines file queue described by the config.
     */
    public Builder queue(FallbackQueue queue) {
      this.queue = queue;
      return this;
    }

    /**
     * Overrides the dead-letter sink derived from {@link CivicGapConfig#getDeadLetterPath()}.
     */
    public Builder deadLetterSink(DeadLetterSink deadLetterSink) {
      this.deadLetterSink = deadLetterSink;
      return this;
    }

    /**
     * Wires the components and starts the drain scheduler if enabled.
     *
     * @throws IllegalStateException if called twice
     */
    public CivicGap build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(transactionManager, "transactionManager");
      Objects.requireNonNull(store, "store");
      if (config == null) {
        config = new CivicGapConfig();
      }
      if (metrics == null) {
        metrics = MetricsExporter.NOOP;
      }
      if (clock == null) {
        clock = Clock.systemUTC();
      }
      validate(config);

      FallbackQueue fallbackQueue = queue;
      if (fallbackQueue == null && config.isQueueEnabled()) {
        DeadLetterSink sink = deadLetterSink;
        if (sink == null) {
          sink = config.getDeadLetterPath() != null
              ? new JsonLinesDeadLetterSink(config.getDeadLetterPath()) : DeadLetterSink.LOGGING;
        }
        fallbackQueue = JsonLinesFallbackQueue.builder()
            .file(config.getQueuePath())
            .lockTimeout(Duration.ofMillis(config.getQueueLockTimeoutMs()))
            .deadLetterSink(sink)
            .metrics(metrics)
            .clock(clock)
            .build();
      }

      RetryExecutor retryExecutor = RetryExecutor.builder()
          .policy(new ExponentialBackoffRetryPolicy(config.getRetryMaxAttempts(),
              Duration.ofMillis(config.getRetryBackoffBaseMs()), config.getRetryBackoffMultiplier()))
          .sleeper(sleeper)
          .metrics(metrics)
          .build();

      SubmissionService submissions = SubmissionService.builder()
          .processor(new SubmissionProcessor(transactionManager, store))
          .retryExecutor(retryExecutor)
          .queue(fallbackQueue)
          .classifier(classifier)
          .reviewThreshold(config.getReviewThreshold())
          .metrics(metrics)
          .build();

      GapMetricsCalculator calculator = new GapMetricsCalculator(connectionProvider, transactionManager, store, clock);
      SyncCache cache = new SyncCache(Duration.ofMillis(config.getCacheTtlMs()), clock, metrics);
      DashboardService dashboard = new DashboardService(connectionProvider, store, calculator, cache, clock);

      QueueDrainScheduler drainScheduler = null;
      if (fallbackQueue != null && config.isDrainEnabled()) {
        drainScheduler = QueueDrainScheduler.builder()
            .queue(fallbackQueue)
            .processor(submissions::replay)
            .maxAttempts(config.getDrainMaxAttempts())
            .interval(Duration.ofMillis(config.getDrainIntervalMs()))
            .build();
        drainScheduler.start();
      }

      logger.log(Level.INFO, "CivicGap started: queue={0}, drain={1}",
          new Object[]{fallbackQueue != null, drainScheduler != null});
      return new CivicGap(this, fallbackQueue, retryExecutor, submissions, calculator, dashboard, drainScheduler);
    }

    private static void validate(CivicGapConfig config) {
      if (config.isQueueEnabled() && config.getQueuePath() == null) {
        throw new IllegalArgumentException("queuePath is required when the queue is enabled");
      }
      if (config.getQueueLockTimeoutMs() <= 0) {
        throw new IllegalArgumentException("queueLockTimeoutMs must be > 0");
      }
      if (config.getDrainMaxAttempts() <= 0) {
        throw new IllegalArgumentException("drainMaxAttempts must be > 0");
      }
      if (config.getDrainIntervalMs() <= 0) {
        throw new IllegalArgumentException("drainIntervalMs must be > 0");
      }
      if (config.getRetryMaxAttempts() <= 0) {
        throw new IllegalArgumentException("retryMaxAttempts must be > 0");
      }
      if (config.getRetryBackoffBaseMs() < 0) {
        throw new IllegalArgumentException("retryBackoffBaseMs must be >= 0");
      }
      if (config.getRetryBackoffMultiplier() < 1.0) {
        throw new IllegalArgumentException("retryBackoffMultiplier must be >= 1");
      }
      if (config.getCacheTtlMs() < 0) {
        throw new IllegalArgumentException("cacheTtlMs must be >= 0");
      }
      if (config.getReviewThreshold() < 0.0 || config.getReviewThreshold() > 1.0) {
        throw new IllegalArgumentException("reviewThreshold must be in [0, 1]");
      }
    }
  }
}
