/**
 * Command-line entry points of the audit event log: the {@link dev.ito.api.Main} dispatcher and one class per
 * command. Results go to stdout through {@link dev.ito.api.CliPrinter}; diagnostics go to the log.
 *
 * @since 0.1.0
 */
package dev.ito.api;
