package civicgap.model;

import java.time.LocalDate;

/**
 * Number of interactions recorded on one calendar day.
 */
public record DailyCount(LocalDate day, long count) {}
