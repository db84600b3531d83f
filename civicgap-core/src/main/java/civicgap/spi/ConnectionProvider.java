package civicgap.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections for read paths that run outside an explicit transaction
 * (dashboard queries, gap calculation).
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see civicgap.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

  /**
   * Obtains a new JDBC connection.
   *
   * @return an open connection; the caller must close it
   * @throws SQLException if a connection cannot be obtained
   */
  Connection getConnection() throws SQLException;
}
