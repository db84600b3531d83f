package civicgap.error;

/**
 * The database rejected the written values: a constraint was violated or a value does
 * not fit its column. Replaying the same write cannot succeed.
 * The enclosing transaction has been (or must be) rolled back.
 */
public final class StorageIntegrityException extends StorageException {

  public StorageIntegrityException(String message, String sqlState, Throwable cause) {
    super(ErrorKind.STORAGE_INTEGRITY, message, sqlState, cause);
  }

  /**
   * {@code true} if the violated constraint was a unique key (SQLState 23505).
   */
  public boolean isUniqueViolation() {
    return SqlErrors.UNIQUE_VIOLATION.equals(sqlState());
  }
}
