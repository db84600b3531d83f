package civicgap.sync;

import civicgap.MutableClock;
import civicgap.spi.MetricsExporter;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SyncCacheTest {

  private final MutableClock clock = new MutableClock(Instant.parse("2025-03-01T12:00:00Z"));
  private final SyncCache cache = new SyncCache(Duration.ofSeconds(5), clock, MetricsExporter.NOOP);
  private final AtomicInteger loads = new AtomicInteger();

  private Integer load() {
    return loads.incrementAndGet();
  }

  @Test
  void servesCachedValueWithinTtl() {
    assertEquals(1, cache.get("summary", this::load));
    clock.advance(Duration.ofMillis(4999));

    assertEquals(1, cache.get("summary", this::load));
    assertEquals(1, loads.get());
  }

  @Test
  void recomputesOnceTtlElapsed() {
    cache.get("summary", this::load);
    clock.advance(Duration.ofSeconds(5));

    assertEquals(2, cache.get("summary", this::load));
  }

  @Test
  void keysAreIndependent() {
    cache.get("trend:7", this::load);
    cache.get("trend:30", this::load);

    assertEquals(2, loads.get());
  }

  @Test
  void clearForcesReload() {
    cache.get("gaps", this::load);
    cache.clear("gaps");

    assertEquals(2, cache.get("gaps", this::load));
  }

  @Test
  void clearAllEmptiesStatus() {
    cache.get("a", this::load);
    cache.get("b", this::load);
    cache.clearAll();

    assertTrue(cache.status().isEmpty());
  }

  @Test
  void failingLoaderKeepsPreviousEntry() {
    cache.get("summary", this::load);
    clock.advance(Duration.ofSeconds(6));

    assertThrows(IllegalStateException.class, () -> cache.get("summary", () -> {
      throw new IllegalStateException("db down");
    }));

    CacheStatus status = cache.status().get("summary");
    assertNotNull(status);
    assertFalse(status.valid());
    assertEquals(2, cache.get("summary", this::load));
  }

  @Test
  void statusReportsAgeAndValidity() {
    cache.get("b", this::load);
    clock.advance(Duration.ofSeconds(3));
    cache.get("a", this::load);
    clock.advance(Duration.ofSeconds(3));

    Map<String, CacheStatus> status = cache.status();

    assertEquals(List.of("a", "b"), List.copyOf(status.keySet()));
    assertTrue(status.get("a").valid());
    assertEquals(Duration.ofSeconds(3), status.get("a").age());
    assertFalse(status.get("b").valid());
    assertEquals(Duration.ofSeconds(6), status.get("b").age());
  }

  @Test
  void rejectsNegativeTtl() {
    assertThrows(IllegalArgumentException.class, () -> new SyncCache(Duration.ofSeconds(-1)));
  }
}
