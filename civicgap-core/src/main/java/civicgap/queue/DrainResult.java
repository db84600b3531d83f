package civicgap.queue;

/**
 * Outcome counts of one {@link FallbackQueue#drain} pass.
 *
 * @param processed    entries replayed successfully and removed
 * @param retained     entries that failed but stay queued for a later pass
 * @param deadLettered entries removed after reaching the attempt cap
 * @param corrupt      unparsable lines skipped and dropped
 */
public record DrainResult(int processed, int retained, int deadLettered, int corrupt) {

  public static final DrainResult EMPTY = new DrainResult(0, 0, 0, 0);

  public int total() {
    return processed + retained + deadLettered + corrupt;
  }
}
