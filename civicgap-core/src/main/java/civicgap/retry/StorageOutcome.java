package civicgap.retry;

import civicgap.error.ErrorReport;

import java.util.Objects;

/**
 * Result of {@link ErrorHandler#handleStorageError}.
 *
 * @param status whether the payload was queued
 * @param report details of the storage failure
 */
public record StorageOutcome(Status status, ErrorReport report) {

  public StorageOutcome {
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(report, "report");
  }

  public boolean queued() {
    return status == Status.QUEUED;
  }

  public enum Status {
    /** Payload was appended to the fallback queue. */
    QUEUED,
    /** No queue was available, or appending failed. */
    ERROR
  }
}
