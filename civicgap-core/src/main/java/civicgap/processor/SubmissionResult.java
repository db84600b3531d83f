package civicgap.processor;

import civicgap.error.ErrorReport;

import java.util.Objects;

/**
 * Outcome of a submission. Every submission ends in exactly one of these.
 *
 * <ul>
 *   <li>{@link Accepted}: the record was committed.</li>
 *   <li>{@link Rejected}: the input was invalid or violated an integrity constraint;
 *       nothing was stored and nothing was queued.</li>
 *   <li>{@link Queued}: storage failed and the payload was written to the fallback queue.</li>
 *   <li>{@link Failed}: storage failed and the payload could not be queued.</li>
 * </ul>
 *
 * @param <T> type of the stored record
 */
public sealed interface SubmissionResult<T>
    permits SubmissionResult.Accepted, SubmissionResult.Rejected,
    SubmissionResult.Queued, SubmissionResult.Failed {

  Kind kind();

  enum Kind {
    ACCEPTED,
    REJECTED,
    QUEUED,
    FAILED
  }

  record Accepted<T>(T record) implements SubmissionResult<T> {
    public Accepted {
      Objects.requireNonNull(record, "record");
    }

    @Override
    public Kind kind() {
      return Kind.ACCEPTED;
    }
  }

  record Rejected<T>(ErrorReport report) implements SubmissionResult<T> {
    public Rejected {
      Objects.requireNonNull(report, "report");
    }

    @Override
    public Kind kind() {
      return Kind.REJECTED;
    }
  }

  record Queued<T>(ErrorReport report) implements SubmissionResult<T> {
    public Queued {
      Objects.requireNonNull(report, "report");
    }

    @Override
    public Kind kind() {
      return Kind.QUEUED;
    }
  }

  record Failed<T>(ErrorReport report) implements SubmissionResult<T> {
    public Failed {
      Objects.requireNonNull(report, "report");
    }

    @Override
    public Kind kind() {
      return Kind.FAILED;
    }
  }
}
