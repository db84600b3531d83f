/**
 * civicgap: ingestion, resilience and legislative gap metrics for citizen participation data.
 *
 * <p>{@link civicgap.CivicGap} is the entry point. Storage is plugged in through
 * {@link civicgap.spi}; the {@code civicgap-jdbc} module supplies H2 and PostgreSQL
 * implementations.
 */
package civicgap;
