package dev.ito.domain.audit;

/**
 * Record is not valid JSON, is truncated, or lacks a required field.
 *
 * @since 0.1.0
 */
public final class MalformedRecordException extends AuditRecordException {
  private static final long serialVersionUID = 1L;

  public MalformedRecordException(String message) {
    super(message);
  }

  public MalformedRecordException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public LineIssue.Kind kind() {
    return LineIssue.Kind.MALFORMED;
  }
}
