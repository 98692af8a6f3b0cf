/**
 * <strong>Purpose:</strong> The display core: settings store, stream registry, header rendering, the advisory
 * lock, bounded formatting, and the print engine tying them together.
 * <p><strong>Concurrency:</strong> All mutation and all output happen under {@link
 * ca.gc.cra.display.application.AdvisoryLock}; settings are readable without blocking.
 * <p><strong>Observability:</strong> SLF4J diagnostics plus counters reported through
 * {@link ca.gc.cra.display.application.port.MetricsPort}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.display.application;
