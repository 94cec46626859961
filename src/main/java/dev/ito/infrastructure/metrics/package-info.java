/**
 * OpenTelemetry-backed implementation of {@link dev.ito.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package dev.ito.infrastructure.metrics;
