/**
 * Configuration loading for display settings.
 * <p><strong>Concurrency:</strong> Loaders are stateless; applying settings goes through the display lock.</p>
 */
package ca.gc.cra.display.config;
