package civicgap.model;

import java.time.Instant;

/**
 * One segment of the legislative gap report, also the shape of a cache row.
 *
 * @param axis        segmentation axis
 * @param key         segment value, e.g. a theme name
 * @param demand      proposals in the segment
 * @param bills       in-progress bills in the segment
 * @param gapPercent  {@code max(0, (demand - bills) / demand * 100)}, two decimals
 * @param tier        classification of {@code gapPercent}
 * @param computedAt  when the value was computed
 */
public record GapMetric(
    GapAxis axis,
    String key,
    long demand,
    long bills,
    double gapPercent,
    GapTier tier,
    Instant computedAt
) {}
