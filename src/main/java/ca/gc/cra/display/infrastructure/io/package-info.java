/**
 * Destination adapters: process streams, files, and arbitrary writers.
 * <p><strong>Concurrency:</strong> Written only under the display lock.</p>
 */
package ca.gc.cra.display.infrastructure.io;
