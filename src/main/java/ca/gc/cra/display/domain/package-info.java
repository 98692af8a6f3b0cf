/**
 * <strong>Purpose:</strong> Value types for traced printing: categories, toggles, style tokens, redirect state,
 * and the failure taxonomy.
 * <p><strong>Concurrency:</strong> All types are immutable.
 * <p><strong>Observability:</strong> No logging; failures surface as {@link ca.gc.cra.display.domain.DisplayException}s.
 *
 * @since 0.1.0
 */
package ca.gc.cra.display.domain;
