/**
 * Dialect-specific {@link civicgap.spi.CivicStore} implementations and their registry.
 */
package civicgap.jdbc.store;
