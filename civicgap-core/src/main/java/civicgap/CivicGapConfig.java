package civicgap;

import java.nio.file.Path;
import java.util.Properties;

/**
 * Tunables for {@link CivicGap}. Mutable, with fluent setters.
 *
 * <p>{@link #fromProperties(Properties)} reads the same values from {@code civicgap.*} keys:
 * <pre>
 * civicgap.queue.enabled=true
 * civicgap.queue.path=data/temp_queue.jsonl
 * civicgap.queue.lock-timeout-ms=10000
 * civicgap.queue.dead-letter-path=data/dead_letter.jsonl
 * civicgap.drain.enabled=false
 * civicgap.drain.max-attempts=3
 * civicgap.drain.interval-ms=30000
 * civicgap.retry.max-attempts=3
 * civicgap.retry.backoff-base-ms=1000
 * civicgap.retry.backoff-multiplier=2.0
 * civicgap.cache.ttl-ms=5000
 * civicgap.classifier.review-threshold=0.6
 * </pre>
 */
public final class CivicGapConfig {
  static final String PREFIX = "civicgap.";

  private boolean queueEnabled = true;
  private Path queuePath = Path.of("data", "temp_queue.jsonl");
  private long queueLockTimeoutMs = 10_000L;
  private Path deadLetterPath;

  private boolean drainEnabled = false;
  private int drainMaxAttempts = 3;
  private long drainIntervalMs = 30_000L;

  private int retryMaxAttempts = 3;
  private long retryBackoffBaseMs = 1_000L;
  private double retryBackoffMultiplier = 2.0;

  private long cacheTtlMs = 5_000L;

  private double reviewThreshold = 0.6;

  /**
   * Reads a config from {@code civicgap.*} properties. Missing keys keep their defaults.
   *
   * @throws IllegalArgumentException if a value cannot be parsed
   */
  public static CivicGapConfig fromProperties(Properties props) {
    CivicGapConfig config = new CivicGapConfig();
    String value;
    if ((value = get(props, "queue.enabled")) != null) {
      config.setQueueEnabled(parseBoolean("queue.enabled", value));
    }
    if ((value = get(props, "queue.path")) != null) {
      config.setQueuePath(Path.of(value));
    }
    if ((value = get(props, "queue.lock-timeout-ms")) != null) {
      config.setQueueLockTimeoutMs(parseLong("queue.lock-timeout-ms", value));
    }
    if ((value = get(props, "queue.dead-letter-path")) != null) {
      config.setDeadLetterPath(Path.of(value));
    }
    if ((value = get(props, "drain.enabled")) != null) {
      config.setDrainEnabled(parseBoolean("drain.enabled", value));
    }
    if ((value = get(props, "drain.max-attempts")) != null) {
      config.setDrainMaxAttempts((int) parseLong("drain.max-attempts", value));
    }
    if ((value = get(props, "drain.interval-ms")) != null) {
      config.setDrainIntervalMs(parseLong("drain.interval-ms", value));
    }
    if ((value = get(props, "retry.max-attempts")) != null) {
      config.setRetryMaxAttempts((int) parseLong("retry.max-attempts", value));
    }
    if ((value = get(props, "retry.backoff-base-ms")) != null) {
      config.setRetryBackoffBaseMs(parseLong("retry.backoff-base-ms", value));
    }
    if ((value = get(props, "retry.backoff-multiplier")) != null) {
      config.setRetryBackoffMultiplier(parseDouble("retry.backoff-multiplier", value));
    }
    if ((value = get(props, "cache.ttl-ms")) != null) {
      config.setCacheTtlMs(parseLong("cache.ttl-ms", value));
    }
    if ((value = get(props, "classifier.review-threshold")) != null) {
      config.setReviewThreshold(parseDouble("classifier.review-threshold", value));
    }
    return config;
  }

  private static String get(Properties props, String key) {
    String value = props.getProperty(PREFIX + key);
    return value == null || value.isBlank() ? null : value.trim();
  }

  private static long parseLong(String key, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PREFIX + key + " must be an integer, got: " + value, e);
    }
  }

  private static double parseDouble(String key, String value) {
    try {
      return Double.parseDouble(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(PREFIX + key + " must be a number, got: " + value, e);
    }
  }

  private static boolean parseBoolean(String key, String value) {
    if ("true".equalsIgnoreCase(value)) {
      return true;
    }
    if ("false".equalsIgnoreCase(value)) {
      return false;
    }
    throw new IllegalArgumentException(PREFIX + key + " must be true or false, got: " + value);
  }

  public boolean isQueueEnabled() {
    return queueEnabled;
  }

  public CivicGapConfig setQueueEnabled(boolean queueEnabled) {
    this.queueEnabled = queueEnabled;
    return this;
  }

  public Path getQueuePath() {
    return queuePath;
  }

  public CivicGapConfig setQueuePath(Path queuePath) {
    this.queuePath = queuePath;
    return this;
  }

  public long getQueueLockTimeoutMs() {
    return queueLockTimeoutMs;
  }

  public CivicGapConfig setQueueLockTimeoutMs(long queueLockTimeoutMs) {
    this.queueLockTimeoutMs = queueLockTimeoutMs;
    return this;
  }

  public Path getDeadLetterPath() {
    return deadLetterPath;
  }

  /**
   * File that receives entries dropped after {@link #getDrainMaxAttempts()} failures.
   * {@code null} (the default) only logs them.
   */
  public CivicGapConfig setDeadLetterPath(Path deadLetterPath) {
    this.deadLetterPath = deadLetterPath;
    return this;
  }

  public boolean isDrainEnabled() {
    return drainEnabled;
  }

  public CivicGapConfig setDrainEnabled(boolean drainEnabled) {
    this.drainEnabled = drainEnabled;
    return this;
  }

  public int getDrainMaxAttempts() {
    return drainMaxAttempts;
  }

  public CivicGapConfig setDrainMaxAttempts(int drainMaxAttempts) {
    this.drainMaxAttempts = drainMaxAttempts;
    return this;
  }

  public long getDrainIntervalMs() {
    return drainIntervalMs;
  }

  public CivicGapConfig setDrainIntervalMs(long drainIntervalMs) {
    this.drainIntervalMs = drainIntervalMs;
    return this;
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public CivicGapConfig setRetryMaxAttempts(int retryMaxAttempts) {
    this.retryMaxAttempts = retryMaxAttempts;
    return this;
  }

  public long getRetryBackoffBaseMs() {
    return retryBackoffBaseMs;
  }

  public CivicGapConfig setRetryBackoffBaseMs(long retryBackoffBaseMs) {
    this.retryBackoffBaseMs = retryBackoffBaseMs;
    return this;
  }

  public double getRetryBackoffMultiplier() {
    return retryBackoffMultiplier;
  }

  public CivicGapConfig setRetryBackoffMultiplier(double retryBackoffMultiplier) {
    this.retryBackoffMultiplier = retryBackoffMultiplier;
    return this;
  }

  public long getCacheTtlMs() {
    return cacheTtlMs;
  }

  public CivicGapConfig setCacheTtlMs(long cacheTtlMs) {
    this.cacheTtlMs = cacheTtlMs;
    return this;
  }

  public double getReviewThreshold() {
    return reviewThreshold;
  }

  public CivicGapConfig setReviewThreshold(double reviewThreshold) {
    this.reviewThreshold = reviewThreshold;
    return this;
  }
}
