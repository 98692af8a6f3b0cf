/**
 * <strong>Purpose:</strong> Controls the library's internal SLF4J/Logback diagnostics.
 * <p>Diagnostics never go to traced destinations; they go wherever {@code logback.xml} sends them.
 *
 * @since 0.1.0
 */
package ca.gc.cra.display.logging;
