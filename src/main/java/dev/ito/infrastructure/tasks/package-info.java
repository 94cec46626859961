/**
 * Minimal tasks.md scanner feeding reconciliation with observed task statuses.
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.tasks;
