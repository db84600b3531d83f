/**
 * Domain model: citizens, interactions, proposals, bills and gap metrics.
 *
 * <p>Enums expose the lowercase wire {@code code()} used by the database and the
 * fallback queue file.
 */
package civicgap.model;
