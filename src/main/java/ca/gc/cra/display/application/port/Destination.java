package ca.gc.cra.display.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Output sink a traced line is written to.
 * <p><strong>Why:</strong> Decouples the print engine from consoles, files, and in-memory buffers.</p>
 * <p><strong>Role:</strong> Port implemented by adapters in {@code infrastructure.io}.</p>
 * <p><strong>Thread-safety:</strong> The print engine only calls a destination while holding the display lock;
 * implementations shared with other writers must do their own synchronization.</p>
 * <p><strong>Observability:</strong> Failures surface as {@link IOException}s so closed or invalid handles reach
 * the caller instead of being swallowed.</p>
 *
 * @since 0.1.0
 */
public interface Destination {
  /**
   * Writes text without adding a terminator.
   *
   * @param text fully rendered text; never {@code null}
   * @throws IOException if the underlying handle is closed or the write fails
   */
  void write(String text) throws IOException;

  /**
   * Pushes buffered text to the underlying handle.
   *
   * @throws IOException if the flush fails
   */
  void flush() throws IOException;

  /**
   * @return short label used in diagnostics (for example {@code stdout} or a file path)
   */
  String name();
}
