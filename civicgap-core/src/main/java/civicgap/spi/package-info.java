/**
 * Service provider interfaces: storage, transactions, connections, classification and metrics.
 *
 * <p>{@code civicgap-jdbc} implements {@link civicgap.spi.CivicStore},
 * {@link civicgap.spi.TransactionManager} and {@link civicgap.spi.ConnectionProvider};
 * {@code civicgap-micrometer} implements {@link civicgap.spi.MetricsExporter}.
 * {@link civicgap.spi.ThemeClassifier} is supplied by the embedding application.
 */
package civicgap.spi;
