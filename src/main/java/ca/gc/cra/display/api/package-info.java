/**
 * Public entry points: the {@link ca.gc.cra.display.api.Display} facade, process argument parsing and the demo
 * command.
 * <p><strong>Concurrency:</strong> A {@code Display} is safe to share across threads; see its class docs for the
 * locking contract.</p>
 */
package ca.gc.cra.display.api;
