package civicgap.queue;

/**
 * Unchecked exception thrown when the fallback queue cannot be read or written.
 */
public class FallbackQueueException extends RuntimeException {

  public FallbackQueueException(String message) {
    super(message);
  }

  public FallbackQueueException(String message, Throwable cause) {
    super(message, cause);
  }
}
