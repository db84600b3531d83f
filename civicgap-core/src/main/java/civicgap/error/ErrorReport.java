package civicgap.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured description of a failed submission, suitable for a response body.
 *
 * @param kind    failure classification
 * @param type    simple class name of the underlying exception
 * @param message human-readable message
 * @param field   offending field for validation failures, otherwise {@code null}
 * @param context caller-supplied context (never {@code null})
 */
public record ErrorReport(
    ErrorKind kind,
    String type,
    String message,
    String field,
    Map<String, Object> context
) {
  public ErrorReport {
    Objects.requireNonNull(kind, "kind");
    context = context == null
        ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
  }

  public static ErrorReport of(ErrorKind kind, Throwable error, Map<String, Object> context) {
    String field = error instanceof ValidationException v ? v.field() : null;
    return new ErrorReport(kind, error.getClass().getSimpleName(), error.getMessage(), field, context);
  }
}
