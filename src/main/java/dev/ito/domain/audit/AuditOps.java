package dev.ito.domain.audit;

/**
 * Well-known values of {@link AuditEvent#op()}.
 *
 * <p>Operations are free strings on the record so that logs written by newer tools stay readable.</p>
 */
public final class AuditOps {
  public static final String CREATE = "create";
  public static final String STATUS_CHANGE = "status_change";
  public static final String STATUS = "status";
  public static final String ADD = "add";
  public static final String ARCHIVE = "archive";
  public static final String CHANGE_ADDED = "change_added";
  public static final String CHANGE_COMPLETED = "change_completed";
  public static final String UNLOCK = "unlock";
  public static final String DECISION = "decision";
  public static final String BLOCKER = "blocker";
  public static final String QUESTION = "question";
  public static final String NOTE = "note";
  public static final String FOCUS_CHANGE = "focus_change";
  public static final String SET = "set";
  public static final String UNSET = "unset";
  public static final String RECONCILED = "reconciled";

  /** Value implied for an entity whose most recent event is an {@link #ARCHIVE} without {@code to}. */
  public static final String ARCHIVED_STATE = "archived";

  private AuditOps() {
    // Constants
  }

  /**
   * Returns whether the op records a status transition whose {@code from} should match the prior state.
   *
   * @param op operation name
   * @return {@code true} for {@code status_change} and {@code status}
   */
  public static boolean isStatusTransition(String op) {
    return STATUS_CHANGE.equals(op) || STATUS.equals(op);
  }

  /**
   * Returns whether the op introduces a new entity.
   *
   * @param op operation name
   * @return {@code true} for {@code create} and {@code add}
   */
  public static boolean isCreation(String op) {
    return CREATE.equals(op) || ADD.equals(op);
  }
}
