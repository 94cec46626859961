/**
 * Wall-clock adapter for {@link dev.ito.application.port.ClockPort}.
 */
package dev.ito.infrastructure.time;
