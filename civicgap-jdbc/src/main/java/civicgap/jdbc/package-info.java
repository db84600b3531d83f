/**
 * JDBC implementation of the civicgap storage SPI.
 *
 * <p>{@link civicgap.jdbc.store.JdbcCivicStores} picks the H2 or PostgreSQL store from the
 * JDBC URL; {@link civicgap.jdbc.tx.JdbcTransactionManager} provides explicit transactions;
 * {@link civicgap.jdbc.JdbcSchema} creates the tables from the bundled scripts.
 */
package civicgap.jdbc;
