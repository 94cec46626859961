package dev.ito.api;

/**
 * Process exit statuses of the audit CLI.
 *
 * <p>{@link #DRIFT_DETECTED} signals a completed run whose result needs attention (unfixed drift or an invalid
 * log), so scripts can tell it apart from argument and I/O failures.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed and found nothing to report. */
  SUCCESS(0),
  /** Drift remains after reconcile, or validate found errors. */
  DRIFT_DETECTED(1),
  /** Arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** Log, tasks file or config file could not be read or written. */
  IO_ERROR(3),
  /** Configuration or project state could not be used. */
  CONFIG_ERROR(4),
  /** Unexpected failure. */
  RUNTIME_FAILURE(5),
  /** Interrupted, for example by SIGINT while streaming. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
