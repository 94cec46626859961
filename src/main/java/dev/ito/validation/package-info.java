/**
 * Input validation helpers shared by the CLI and configuration layers.
 *
 * @since 0.1.0
 */
package dev.ito.validation;
