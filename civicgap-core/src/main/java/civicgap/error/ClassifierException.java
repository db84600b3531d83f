package civicgap.error;

/**
 * Failure reported by a {@link civicgap.spi.ThemeClassifier}.
 */
public final class ClassifierException extends CivicGapException {

  public ClassifierException(String message) {
    super(ErrorKind.CLASSIFIER, message);
  }

  public ClassifierException(String message, Throwable cause) {
    super(ErrorKind.CLASSIFIER, message, cause);
  }
}
