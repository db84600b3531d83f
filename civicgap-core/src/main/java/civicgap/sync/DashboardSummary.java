package civicgap.sync;

import java.time.Instant;

/**
 * Headline dashboard figures.
 *
 * @param citizens             registered citizens
 * @param interactions         recorded interactions
 * @param proposals            recorded proposals
 * @param engagementRate       (proposals + interactions) / citizens * 100, or 0 without citizens
 * @param interactionsLastWeek interactions that occurred in the last 7 days
 * @param computedAt           when the figures were computed
 */
public record DashboardSummary(
    long citizens,
    long interactions,
    long proposals,
    double engagementRate,
    long interactionsLastWeek,
    Instant computedAt
) {}
