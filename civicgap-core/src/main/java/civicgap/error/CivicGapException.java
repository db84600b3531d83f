package civicgap.error;

import java.util.Objects;

/**
 * Root of the unchecked exception hierarchy. Every subtype carries its {@link ErrorKind}.
 */
public abstract class CivicGapException extends RuntimeException {
  private final ErrorKind kind;

  protected CivicGapException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  protected CivicGapException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }
}
