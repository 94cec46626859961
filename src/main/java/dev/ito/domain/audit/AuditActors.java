package dev.ito.domain.audit;

/**
 * Well-known values of {@link AuditEvent#actor()}.
 */
public final class AuditActors {
  /** Interactive command invoked by a person. */
  public static final String CLI = "cli";
  /** Compensating events written by reconciliation. */
  public static final String RECONCILE = "reconcile";
  /** Iterative assistant retry loop. */
  public static final String RALPH = "ralph";
  /** Any other automated assistant. */
  public static final String AGENT = "agent";

  /** Identity recorded in {@code by} for reconciliation writes. */
  public static final String RECONCILE_IDENTITY = "@reconcile";

  private AuditActors() {
    // Constants
  }
}
