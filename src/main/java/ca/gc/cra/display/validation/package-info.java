/**
 * <strong>Purpose:</strong> Argument validation helpers used by settings, configuration loading and the CLI.
 * <p><strong>Concurrency:</strong> Stateless and thread-safe.
 *
 * @since 0.1.0
 */
package ca.gc.cra.display.validation;
