/**
 * Retry with exponential backoff and structured failure handling.
 *
 * <p>{@link civicgap.retry.RetryExecutor} retries only the exception types the caller lists;
 * {@link civicgap.retry.ErrorHandler} turns failures into
 * {@link civicgap.error.ErrorReport}s and hands unpersisted payloads to the fallback queue.
 */
package civicgap.retry;
