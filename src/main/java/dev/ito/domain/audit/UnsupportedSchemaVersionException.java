package dev.ito.domain.audit;

/**
 * Record declares a schema version this build does not understand.
 *
 * @since 0.1.0
 */
public final class UnsupportedSchemaVersionException extends AuditRecordException {
  private static final long serialVersionUID = 1L;

  private final long version;

  public UnsupportedSchemaVersionException(long version) {
    super("unsupported audit schema version " + version + " (supported: " + AuditEvent.SCHEMA_VERSION + ")");
    this.version = version;
  }

  public long version() {
    return version;
  }

  @Override
  public LineIssue.Kind kind() {
    return LineIssue.Kind.UNSUPPORTED_SCHEMA_VERSION;
  }
}
