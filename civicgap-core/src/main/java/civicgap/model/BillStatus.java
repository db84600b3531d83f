package civicgap.model;

/**
 * Legislative stage of a bill. Only {@link #IN_PROGRESS} bills count against demand.
 *
 * <p>Bills are written by the ingestion tooling; this module only reads them.
 */
public enum BillStatus {
  IN_PROGRESS("in_progress"),
  APPROVED("approved"),
  REJECTED("rejected");

  private final String code;

  BillStatus(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
