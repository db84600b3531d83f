package civicgap.sync;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of one {@link SyncCache} entry.
 *
 * @param key      cache key
 * @param valid    whether the entry is younger than the TTL
 * @param age      time since the value was computed
 * @param cachedAt when the value was computed
 */
public record CacheStatus(String key, boolean valid, Duration age, Instant cachedAt) {}
