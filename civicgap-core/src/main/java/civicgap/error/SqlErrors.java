package civicgap.error;

import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Translates {@link SQLException}s into the {@link StorageException} hierarchy.
 *
 * <p>Classification walks the {@link SQLException#getNextException() chain} and uses
 * the SQLState class plus the JDBC 4 exception subtypes:
 * <ul>
 *   <li>classes {@code 22} (data exception) and {@code 23} (constraint violation)
 *       → {@link StorageIntegrityException}</li>
 *   <li>classes {@code 08}, {@code 40}, {@code 53}, {@code 57}, {@code HYT}, H2's
 *       concurrent-update state, and {@link SQLTransientException} /
 *       {@link SQLRecoverableException} → {@link TransientStorageException}</li>
 *   <li>anything else → {@link StorageException}</li>
 * </ul>
 */
public final class SqlErrors {
  public static final String UNIQUE_VIOLATION = "23505";

  private static final Set<String> TRANSIENT_CLASSES = Set.of("08", "40", "53", "57");
  // H2: concurrent update in another transaction, lock timeout
  private static final Set<String> TRANSIENT_STATES = Set.of("90131", "HYT00", "HY008");

  private SqlErrors() {}

  /**
   * Returns the unchecked exception matching the failure class of {@code e}.
   *
   * @param action short description used as the exception message prefix
   * @param e      the driver exception
   */
  public static StorageException translate(String action, SQLException e) {
    String state = effectiveState(e);
    String message = "Failed to " + action + ": " + e.getMessage();
    if (state != null && (state.startsWith("22") || state.startsWith("23"))) {
      return new StorageIntegrityException(message, state, e);
    }
    if (isTransient(e, state)) {
      return new TransientStorageException(message, state, e);
    }
    return new StorageException(message, state, e);
  }

  private static boolean isTransient(SQLException e, String state) {
    if (e instanceof SQLTransientException
        || e instanceof SQLRecoverableException
        || e instanceof SQLTimeoutException) {
      return true;
    }
    if (state == null) {
      return false;
    }
    if (TRANSIENT_STATES.contains(state)) {
      return true;
    }
    return state.length() >= 2 && TRANSIENT_CLASSES.contains(state.substring(0, 2));
  }

  private static String effectiveState(SQLException e) {
    SQLException current = e;
    while (current != null) {
      String state = current.getSQLState();
      if (state != null && !state.isEmpty()) {
        return state;
      }
      current = current.getNextException();
    }
    return null;
  }
}
