package dev.ito.domain.audit;

/**
 * Well-known values of {@link AuditEvent#entity()}.
 */
public final class EntityTypes {
  public static final String TASK = "task";
  public static final String CHANGE = "change";
  public static final String MODULE = "module";
  public static final String WAVE = "wave";
  public static final String PLANNING = "planning";
  public static final String CONFIG = "config";

  private EntityTypes() {
    // Constants
  }
}
