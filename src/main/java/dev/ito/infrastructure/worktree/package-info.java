/**
 * <strong>Purpose:</strong> Multi-worktree views of the audit log: discovery through
 * {@code git worktree list}, a deterministic merged timeline and a multi-log tailing session.
 * <p><strong>Failures:</strong> Per-worktree problems are reported and excluded; they never fail the
 * aggregate.</p>
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.worktree;
