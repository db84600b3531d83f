package civicgap.jdbc.tx;

import civicgap.jdbc.DataSourceConnectionProvider;
import civicgap.spi.ConnectionProvider;
import civicgap.spi.TransactionManager;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Transaction manager for plain JDBC. Each {@link #begin()} takes a fresh connection,
 * disables auto-commit and raises the isolation to at least READ COMMITTED.
 *
 * <pre>{@code
 * try (var tx = txManager.begin()) {
 *     store.insertProposal(tx.connection(), row);
 *     tx.commit();
 * }
 * }</pre>
 */
public final class JdbcTransactionManager implements TransactionManager {
  private static final Logger logger = Logger.getLogger(JdbcTransactionManager.class.getName());

  private final ConnectionProvider connectionProvider;

  public JdbcTransactionManager(ConnectionProvider connectionProvider) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
  }

  public JdbcTransactionManager(DataSource dataSource) {
    this(new DataSourceConnectionProvider(dataSource));
  }

  /**
   * @throws SQLException if a connection cannot be obtained or configured
   */
  @Override
  public Transaction begin() throws SQLException {
    Connection connection = connectionProvider.getConnection();
    try {
      connection.setAutoCommit(false);
      if (connection.getTransactionIsolation() == Connection.TRANSACTION_READ_UNCOMMITTED
          || connection.getTransactionIsolation() == Connection.TRANSACTION_NONE) {
        connection.setTransactionIsolation(Connection.TRANSACTION_READ_COMMITTED);
      }
    } catch (SQLException e) {
      try {
        connection.close();
      } catch (SQLException closeError) {
        e.addSuppressed(closeError);
      }
      throw e;
    }
    return new JdbcTransaction(connection);
  }

  /**
   * Active transaction. If neither {@link #commit()} nor {@link #rollback()} is called,
   * {@link #close()} rolls back. The connection is returned on completion.
   */
  static final class JdbcTransaction implements Transaction {
    private final Connection connection;
    private boolean completed;

    private JdbcTransaction(Connection connection) {
      this.connection = connection;
    }

    @Override
    public Connection connection() {
      if (completed) {
        throw new IllegalStateException("Transaction already completed");
      }
      return connection;
    }

    @Override
    public void commit() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.commit();
      } catch (SQLException e) {
        try {
          connection.rollback();
        } catch (SQLException rollbackError) {
          e.addSuppressed(rollbackError);
        }
        finish(e);
        throw e;
      }
      finish(null);
    }

    @Override
    public void rollback() throws SQLException {
      if (completed) {
        return;
      }
      try {
        connection.rollback();
      } catch (SQLException e) {
        finish(e);
        throw e;
      }
      finish(null);
    }

    @Override
    public void close() throws SQLException {
      if (!completed) {
        rollback();
      }
    }

    private void finish(SQLException pending) throws SQLException {
      completed = true;
      try {
        connection.setAutoCommit(true);
      } catch (SQLException e) {
        if (pending != null) {
          pending.addSuppressed(e);
        } else {
          logger.log(Level.FINE, "Failed to restore auto-commit", e);
        }
      } finally {
        connection.close();
      }
    }
  }
}
