/**
 * <strong>Purpose:</strong> Audit event model and the pure functions built on it.
 * <p><strong>Contents:</strong> the {@link dev.ito.domain.audit.AuditEvent} record and its builder, filters,
 * state materialization, the reconciliation engine, stream cursors and read-side result types.</p>
 * <p><strong>Concurrency:</strong> All types are immutable or confined to one thread (builders).</p>
 * <p><strong>I/O:</strong> None. File access lives in {@code dev.ito.infrastructure}.</p>
 *
 * @since 0.1.0
 */
package dev.ito.domain.audit;
