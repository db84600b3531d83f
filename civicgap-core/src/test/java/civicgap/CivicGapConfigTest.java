package civicgap;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CivicGapConfigTest {

  @Test
  void defaults() {
    CivicGapConfig config = new CivicGapConfig();

    assertTrue(config.isQueueEnabled());
    assertEquals(Path.of("data", "temp_queue.jsonl"), config.getQueuePath());
    assertEquals(10_000L, config.getQueueLockTimeoutMs());
    assertNull(config.getDeadLetterPath());
    assertFalse(config.isDrainEnabled());
    assertEquals(3, config.getDrainMaxAttempts());
    assertEquals(3, config.getRetryMaxAttempts());
    assertEquals(1_000L, config.getRetryBackoffBaseMs());
    assertEquals(2.0, config.getRetryBackoffMultiplier());
    assertEquals(5_000L, config.getCacheTtlMs());
    assertEquals(0.6, config.getReviewThreshold());
  }

  @Test
  void readsProperties() {
    Properties props = new Properties();
    props.setProperty("civicgap.queue.path", "/var/lib/civicgap/queue.jsonl");
    props.setProperty("civicgap.queue.dead-letter-path", "/var/lib/civicgap/dead.jsonl");
    props.setProperty("civicgap.drain.enabled", "TRUE");
    props.setProperty("civicgap.drain.interval-ms", " 60000 ");
    props.setProperty("civicgap.retry.max-attempts", "5");
    props.setProperty("civicgap.retry.backoff-multiplier", "1.5");
    props.setProperty("civicgap.cache.ttl-ms", "0");
    props.setProperty("civicgap.classifier.review-threshold", "0.75");
    props.setProperty("civicgap.queue.lock-timeout-ms", "");

    CivicGapConfig config = CivicGapConfig.fromProperties(props);

    assertEquals(Path.of("/var/lib/civicgap/queue.jsonl"), config.getQueuePath());
    assertEquals(Path.of("/var/lib/civicgap/dead.jsonl"), config.getDeadLetterPath());
    assertTrue(config.isDrainEnabled());
    assertEquals(60_000L, config.getDrainIntervalMs());
    assertEquals(5, config.getRetryMaxAttempts());
    assertEquals(1.5, config.getRetryBackoffMultiplier());
    assertEquals(0L, config.getCacheTtlMs());
    assertEquals(0.75, config.getReviewThreshold());
    assertEquals(10_000L, config.getQueueLockTimeoutMs());
  }

  @Test
  void invalidValuesNameTheKey() {
    Properties props = new Properties();
    props.setProperty("civicgap.retry.max-attempts", "three");

    IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
        () -> CivicGapConfig.fromProperties(props));
    assertTrue(e.getMessage().contains("civicgap.retry.max-attempts"));

    Properties flags = new Properties();
    flags.setProperty("civicgap.queue.enabled", "yes");
    assertThrows(IllegalArgumentException.class, () -> CivicGapConfig.fromProperties(flags));
  }
}
