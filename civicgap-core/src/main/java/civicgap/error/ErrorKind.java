package civicgap.error;

/**
 * Failure classification shared by every submission path.
 *
 * <p>Callers switch on the kind instead of catching exception subtypes.
 */
public enum ErrorKind {
  /** Caller-fixable input problem. Never retried. */
  VALIDATION,
  /** Referential breach or unique violation that is not an identity race. Never retried. */
  STORAGE_INTEGRITY,
  /** Connection, timeout or lock failure. Retried, then queued. */
  TRANSIENT_STORAGE,
  /** Storage failure that could not be classified further. */
  STORAGE,
  /** The external theme classifier failed. Degrades, never aborts a submission. */
  CLASSIFIER
}
