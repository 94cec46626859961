/**
 * Configuration loading (defaults, YAML, CLI) and the composition root that wires audit adapters.
 *
 * @since 0.1.0
 */
package dev.ito.config;
