/**
 * Metrics adapters implementing {@link ca.gc.cra.display.application.port.MetricsPort}.
 * <p><strong>Concurrency:</strong> Safe for concurrent updates.</p>
 */
package ca.gc.cra.display.infrastructure.metrics;
