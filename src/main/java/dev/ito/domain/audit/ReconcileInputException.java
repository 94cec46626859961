package dev.ito.domain.audit;

/**
 * File-state derivation failed, so no trustworthy reconciliation report can be produced.
 *
 * @since 0.1.0
 */
public class ReconcileInputException extends Exception {
  private static final long serialVersionUID = 1L;

  public ReconcileInputException(String message) {
    super(message);
  }

  public ReconcileInputException(String message, Throwable cause) {
    super(message, cause);
  }
}
