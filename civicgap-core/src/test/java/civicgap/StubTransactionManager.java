package civicgap;

import civicgap.spi.ConnectionProvider;
import civicgap.spi.TransactionManager;

import java.sql.Connection;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Transaction manager without a database. Connections are {@code null}; the counters record
 * how each transaction ended.
 */
public class StubTransactionManager implements TransactionManager, ConnectionProvider {
  public final AtomicInteger begun = new AtomicInteger();
  public final AtomicInteger committed = new AtomicInteger();
  public final AtomicInteger rolledBack = new AtomicInteger();

  @Override
  public Connection getConnection() {
    return null;
  }

  @Override
  public Transaction begin() {
    begun.incrementAndGet();
    return new Transaction() {
      private boolean done;

      @Override
      public Connection connection() {
        return null;
      }

      @Override
      public void commit() {
        done = true;
        committed.incrementAndGet();
      }

      @Override
      public void rollback() {
        done = true;
        rolledBack.incrementAndGet();
      }

      @Override
      public void close() {
        if (!done) {
          rollback();
        }
      }
    };
  }
}
