/**
 * Validation and transactional persistence of citizen interactions and proposals.
 *
 * <p>{@link civicgap.processor.SubmissionProcessor} owns the write path;
 * {@link civicgap.processor.SubmissionService} adds retry, fallback queueing and the
 * {@link civicgap.processor.SubmissionResult} union returned to callers.
 */
package civicgap.processor;
