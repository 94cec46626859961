package dev.ito.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for the audit subsystem.
 * <ul>
 *   <li>Counter increments for appends, skipped lines, resyncs and drift entries.</li>
 *   <li>Numeric observations such as events returned per read.</li>
 * </ul>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code audit.append.success}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
