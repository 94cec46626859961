package dev.ito.domain.audit;

/**
 * A single log record could not be turned into an {@link AuditEvent}.
 *
 * @since 0.1.0
 */
public abstract class AuditRecordException extends Exception {
  private static final long serialVersionUID = 1L;

  protected AuditRecordException(String message) {
    super(message);
  }

  protected AuditRecordException(String message, Throwable cause) {
    super(message, cause);
  }

  /**
   * Classification recorded when the line is skipped.
   *
   * @return issue kind
   */
  public abstract LineIssue.Kind kind();
}
