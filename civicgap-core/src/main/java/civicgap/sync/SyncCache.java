package civicgap.sync;

import civicgap.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-through cache whose entries are served while younger than a fixed TTL.
 *
 * <p>Expired entries are recomputed synchronously by the caller's loader; there is no
 * background refresh. Concurrent misses on the same key may both run the loader and the
 * last write wins. A loader that throws leaves the previous entry in place.
 */
public final class SyncCache {
  private static final Logger logger = Logger.getLogger(SyncCache.class.getName());

  private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
  private final Duration ttl;
  private final Clock clock;
  private final MetricsExporter metrics;

  public SyncCache(Duration ttl) {
    this(ttl, Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public SyncCache(Duration ttl, Clock clock, MetricsExporter metrics) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative()) {
      throw new IllegalArgumentException("ttl must be >= 0");
    }
    this.ttl = ttl;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  public Duration ttl() {
    return ttl;
  }

  /**
   * Returns the cached value for {@code key} if it is younger than the TTL, otherwise runs
   * {@code loader}, caches its result and returns it.
   */
  @SuppressWarnings("unchecked")
  public <T> T get(String key, Supplier<T> loader) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(loader, "loader");
    Entry entry = entries.get(key);
    Instant now = clock.instant();
    if (entry != null && isValid(entry, now)) {
      metrics.incrementCacheHit();
      logger.log(Level.FINE, "Cache hit for {0}", key);
      return (T) entry.value();
    }
    metrics.incrementCacheMiss();
    T value = loader.get();
    entries.put(key, new Entry(value, clock.instant()));
    logger.log(Level.FINE, "Cache refreshed for {0}", key);
    return value;
  }

  /**
   * Forces the next {@link #get} for {@code key} to recompute.
   */
  public void clear(String key) {
    if (entries.remove(key) != null) {
      logger.log(Level.INFO, "Cache entry {0} cleared", key);
    }
  }

  public void clearAll() {
    entries.clear();
    logger.log(Level.INFO, "Cache cleared");
  }

  /**
   * Validity and age of every entry, ordered by key.
   */
  public Map<String, CacheStatus> status() {
    Instant now = clock.instant();
    Map<String, CacheStatus> status = new TreeMap<>();
    entries.forEach((key, entry) -> status.put(key, new CacheStatus(
        key, isValid(entry, now), Duration.between(entry.cachedAt(), now), entry.cachedAt())));
    return status;
  }

  private boolean isValid(Entry entry, Instant now) {
    return Duration.between(entry.cachedAt(), now).compareTo(ttl) < 0;
  }

  private record Entry(Object value, Instant cachedAt) {}
}
