/**
 * <strong>Purpose:</strong> Audit use cases: recording transitions through an explicit
 * {@link dev.ito.application.audit.AuditContext}, reconciliation with optional compensation, semantic
 * validation and statistics.
 * <p><strong>Dependencies:</strong> Ports from {@code dev.ito.application.port} only.</p>
 *
 * @since 0.1.0
 */
package dev.ito.application.audit;
