package civicgap.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Opens explicit transaction boundaries for the processor and the gap snapshot.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     store.insertInteraction(tx.connection(), row);
 *     tx.commit();
 * }
 * }</pre>
 *
 * @see civicgap.jdbc.tx.JdbcTransactionManager
 */
public interface TransactionManager {

  /**
   * Begins a transaction on a fresh connection with auto-commit disabled.
   *
   * @throws SQLException if a connection cannot be obtained or configured
   */
  Transaction begin() throws SQLException;

  /**
   * Active transaction handle. If neither {@link #commit()} nor {@link #rollback()}
   * is called, {@link #close()} rolls back.
   */
  interface Transaction extends AutoCloseable {

    Connection connection();

    void commit() throws SQLException;

    void rollback() throws SQLException;

    @Override
    void close() throws SQLException;
  }
}
