package civicgap.error;

/**
 * The store was unreachable, timed out, or lost a lock race. Safe to retry.
 */
public final class TransientStorageException extends StorageException {

  public TransientStorageException(String message, String sqlState, Throwable cause) {
    super(ErrorKind.TRANSIENT_STORAGE, message, sqlState, cause);
  }
}
