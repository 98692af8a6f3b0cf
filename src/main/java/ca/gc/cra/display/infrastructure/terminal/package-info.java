/**
 * Terminal detection adapters used once at display initialization.
 */
package ca.gc.cra.display.infrastructure.terminal;
