/**
 * Process-backed git access used by worktree discovery and event context resolution.
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.git;
