/**
 * Correlation context for new audit events: session, harness session, branch, worktree, commit and actor
 * identity.
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.context;
