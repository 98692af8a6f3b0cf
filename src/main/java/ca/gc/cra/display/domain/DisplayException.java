package ca.gc.cra.display.domain;

/**
 * Root of the recoverable failures raised by the display library.
 *
 * <p>None of these terminate the process; callers decide whether a failure is fatal.</p>
 *
 * @since 0.1.0
 */
public class DisplayException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  public DisplayException(String message) {
    super(message);
  }

  public DisplayException(String message, Throwable cause) {
    super(message, cause);
  }
}
