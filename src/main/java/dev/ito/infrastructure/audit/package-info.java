/**
 * <strong>Purpose:</strong> File-backed audit log adapters: the JSON line codec, durable and discarding
 * writers, the line-oriented reader and the cursor-based stream watcher.
 * <p><strong>Concurrency:</strong> Only {@link dev.ito.infrastructure.audit.FsAuditWriter} mutates the log,
 * and only by appending. Readers re-derive their view from disk on every call.</p>
 * <p><strong>Observability:</strong> Counters under {@code audit.append.*}, {@code audit.read.*} and
 * {@code audit.stream.*}; skipped lines logged at DEBUG with truncated content.</p>
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.audit;
