package ca.gc.cra.display.domain;

/**
 * Raised when a setting is given a value outside its domain. The previous value is kept.
 *
 * @since 0.1.0
 */
public final class InvalidConfigValueException extends DisplayException {
  private static final long serialVersionUID = 1L;

  private final String setting;
  private final String rejectedValue;

  public InvalidConfigValueException(String setting, String rejectedValue) {
    super("Invalid " + setting + " value: " + (rejectedValue == null ? "<null>" : "'" + rejectedValue + "'"));
    this.setting = setting;
    this.rejectedValue = rejectedValue;
  }

  /**
   * @return name of the setting that rejected the value
   */
  public String setting() {
    return setting;
  }

  /**
   * @return the rejected value, possibly {@code null}
   */
  public String rejectedValue() {
    return rejectedValue;
  }
}
