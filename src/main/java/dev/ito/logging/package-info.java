/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity and keep echoed log lines short.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.</p>
 *
 * @since 0.1.0
 */
package dev.ito.logging;
