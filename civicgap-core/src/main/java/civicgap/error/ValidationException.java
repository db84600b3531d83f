package civicgap.error;

/**
 * Raised when a submission is missing a required field or carries an invalid value.
 */
public final class ValidationException extends CivicGapException {
  private final String field;

  public ValidationException(String field, String message) {
    super(ErrorKind.VALIDATION, message);
    this.field = field;
  }

  /**
   * Name of the offending field as it appears on the wire, e.g. {@code "opinion"}.
   */
  public String field() {
    return field;
  }
}
