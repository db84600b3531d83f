package civicgap.error;

/**
 * Unchecked exception wrapping a JDBC failure that {@link SqlErrors} could not
 * classify as integrity or transient.
 */
public class StorageException extends CivicGapException {
  private final String sqlState;

  public StorageException(String message, String sqlState, Throwable cause) {
    this(ErrorKind.STORAGE, message, sqlState, cause);
  }

  protected StorageException(ErrorKind kind, String message, String sqlState, Throwable cause) {
    super(kind, message, cause);
    this.sqlState = sqlState;
  }

  /**
   * SQLState reported by the driver, or {@code null} if none was available.
   */
  public String sqlState() {
    return sqlState;
  }
}
