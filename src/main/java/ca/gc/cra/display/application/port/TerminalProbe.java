package ca.gc.cra.display.application.port;

/**
 * Port that tells whether an inherited standard stream is attached to an interactive terminal.
 *
 * <p>Consulted once per initialization; the result is cached in a
 * {@link ca.gc.cra.display.domain.RedirectState}.</p>
 *
 * @since 0.1.0
 */
public interface TerminalProbe {
  /** Inherited process streams that can be probed. */
  enum StandardStream {
    OUT(1),
    ERR(2);

    private final int descriptor;

    StandardStream(int descriptor) {
      this.descriptor = descriptor;
    }

    /**
     * @return POSIX file descriptor number of the stream
     */
    public int descriptor() {
      return descriptor;
    }
  }

  /**
   * @param stream stream to probe
   * @return {@code true} when the stream writes to an interactive terminal
   */
  boolean isInteractive(StandardStream stream);
}
