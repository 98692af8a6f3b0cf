/**
 * Ports consumed by the display core: output destinations, clock, terminal probing, and metrics.
 * <p><strong>Role:</strong> Domain-facing contracts implemented by {@code infrastructure} adapters.</p>
 * <p><strong>Concurrency:</strong> Implementations document their own guarantees; the print engine calls
 * destinations only while holding the display lock.</p>
 */
package ca.gc.cra.display.application.port;
