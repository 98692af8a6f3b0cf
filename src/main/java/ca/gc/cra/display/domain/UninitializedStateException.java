package ca.gc.cra.display.domain;

/**
 * Raised when a print or stream operation runs before initialization or after teardown.
 *
 * @since 0.1.0
 */
public final class UninitializedStateException extends DisplayException {
  private static final long serialVersionUID = 1L;

  public UninitializedStateException(String message) {
    super(message);
  }
}
