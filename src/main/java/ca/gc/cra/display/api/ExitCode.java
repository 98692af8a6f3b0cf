package ca.gc.cra.display.api;

/**
 * Process exit codes of the {@code display} demo command.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** IO failure while reading configuration or writing output. */
  IO_ERROR(3),
  /** Configuration file was malformed or held an invalid value. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
