/**
 * <strong>Purpose:</strong> Ports between the audit use cases and their adapters.
 * <p>Each port ships a constant or lambda-friendly shape so tests can substitute fakes without a mocking
 * library.</p>
 *
 * @since 0.1.0
 */
package dev.ito.application.port;
