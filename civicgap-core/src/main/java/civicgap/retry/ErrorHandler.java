package civicgap.retry;

import civicgap.error.CivicGapException;
import civicgap.error.ErrorKind;
import civicgap.error.ErrorReport;
import civicgap.queue.FallbackQueue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Structured handling for validation and storage failures.
 *
 * <p>Every method logs the failure and returns a report; none of them throw.
 */
public final class ErrorHandler {
  private static final Logger logger = Logger.getLogger(ErrorHandler.class.getName());

  /**
   * Builds a report for a rejected input. Validation errors are never retried.
   */
  public ErrorReport handleValidationError(Throwable error, Map<String, Object> context) {
    Objects.requireNonNull(error, "error");
    logger.log(Level.WARNING, "Validation error: error={0}, message={1}, context={2}",
        new Object[]{error.getClass().getSimpleName(), error.getMessage(), context});
    return ErrorReport.of(ErrorKind.VALIDATION, error, context);
  }

  /**
   * Logs a storage failure and, when {@code queue} is given, appends {@code payload} to it.
   *
   * @param queue fallback queue, or {@code null} when none is configured
   * @return {@link StorageOutcome.Status#QUEUED} if the payload was appended,
   *     otherwise {@link StorageOutcome.Status#ERROR}
   */
  public StorageOutcome handleStorageError(Throwable error, JsonNode payload, FallbackQueue queue) {
    Objects.requireNonNull(error, "error");
    ErrorKind kind = error instanceof CivicGapException c ? c.kind() : ErrorKind.STORAGE;
    logger.log(Level.SEVERE, "Storage error: error=" + error.getClass().getSimpleName()
        + ", message=" + error.getMessage(), error);

    Map<String, Object> context = new LinkedHashMap<>();
    context.put("type", payloadType(payload));
    if (queue != null && payload != null) {
      try {
        queue.enqueue(payload);
        logger.log(Level.INFO, "Queued {0} operation for later processing", payloadType(payload));
        context.put("queued", true);
        return new StorageOutcome(StorageOutcome.Status.QUEUED, ErrorReport.of(kind, error, context));
      } catch (RuntimeException queueError) {
        logger.log(Level.SEVERE, "Failed to queue operation: error="
            + queueError.getClass().getSimpleName() + ", message=" + queueError.getMessage(), queueError);
        context.put("queueError", queueError.getMessage());
      }
    }
    context.put("queued", false);
    return new StorageOutcome(StorageOutcome.Status.ERROR, ErrorReport.of(kind, error, context));
  }

  /**
   * Logs {@code error} at SEVERE with where it happened and the full stack trace.
   */
  public void logError(Throwable error, String component, String operation, Map<String, Object> context) {
    Objects.requireNonNull(error, "error");
    logger.log(Level.SEVERE, "Pipeline error: component=" + component + ", operation=" + operation
        + ", error=" + error.getClass().getSimpleName() + ", message=" + error.getMessage()
        + ", context=" + (context == null ? Map.of() : context), error);
  }

  private static String payloadType(JsonNode payload) {
    if (payload == null) {
      return "unknown";
    }
    JsonNode type = payload.get("type");
    return type != null && type.isTextual() ? type.asText() : "unknown";
  }
}
