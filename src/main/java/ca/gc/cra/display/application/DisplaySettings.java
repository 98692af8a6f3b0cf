package ca.gc.cra.display.application;

import ca.gc.cra.display.domain.InvalidConfigValueException;
import ca.gc.cra.display.domain.Toggle;
import ca.gc.cra.display.validation.Strings;
import java.util.Locale;

/**
 * <strong>What:</strong> Mutable store for the display's global settings.
 * <p><strong>Why:</strong> Prints consult verbosity, colorfulness, auto-newline, trace inclusion and the caller
 * filename on every call; setters must validate rather than coerce.</p>
 * <p><strong>Role:</strong> Config Store owned by a {@code Display}; the facade serializes writes through the
 * display lock.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject out-of-domain values with {@link InvalidConfigValueException}, keeping the prior value.</li>
 *   <li>Bound the stored filename to {@value #MAX_FILENAME_LENGTH} characters.</li>
 *   <li>Hand the print engine a consistent {@link Snapshot}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Fields are volatile so getters never block; writers are expected to hold the
 * display lock.</p>
 *
 * @since 0.1.0
 */
public final class DisplaySettings {
  /** Longest filename kept for trace headers. */
  public static final int MAX_FILENAME_LENGTH = 31;
  /** Filename shown until a display is initialized. */
  public static final String UNKNOWN_FILENAME = "?";

  static final String VERBOSITY = "verbosity";
  static final String COLORFULNESS = "colorfulness";
  static final String AUTO_NEWLINE = "autoNewline";
  static final String SHOW_TRACE = "showTrace";
  static final String FILENAME = "filename";

  private volatile Toggle verbosity = Toggle.ENABLE;
  private volatile Toggle colorfulness = Toggle.ENABLE;
  private volatile Toggle autoNewline = Toggle.ENABLE;
  private volatile Toggle showTrace = Toggle.ENABLE;
  private volatile String filename = UNKNOWN_FILENAME;

  /**
   * Immutable view of the settings captured at the start of a print.
   *
   * @param verbosity standard prints are emitted
   * @param colorfulness escape sequences may be emitted
   * @param autoNewline a line terminator follows each message
   * @param showTrace the {@code [time][file][function]} header is emitted
   * @param filename caller filename stamped into the header
   */
  public record Snapshot(
      boolean verbosity,
      boolean colorfulness,
      boolean autoNewline,
      boolean showTrace,
      String filename) {}

  /**
   * Restores verbosity, colorfulness, auto-newline and trace inclusion to {@link Toggle#ENABLE}.
   * The filename is left alone.
   */
  public void resetToggles() {
    verbosity = Toggle.ENABLE;
    colorfulness = Toggle.ENABLE;
    autoNewline = Toggle.ENABLE;
    showTrace = Toggle.ENABLE;
  }

  public Snapshot snapshot() {
    return new Snapshot(
        verbosity.enabled(), colorfulness.enabled(), autoNewline.enabled(), showTrace.enabled(), filename);
  }

  public Toggle verbosity() {
    return verbosity;
  }

  public void setVerbosity(Toggle value) {
    verbosity = require(VERBOSITY, value);
  }

  public Toggle colorfulness() {
    return colorfulness;
  }

  public void setColorfulness(Toggle value) {
    colorfulness = require(COLORFULNESS, value);
  }

  public Toggle autoNewline() {
    return autoNewline;
  }

  public void setAutoNewline(Toggle value) {
    autoNewline = require(AUTO_NEWLINE, value);
  }

  public Toggle showTrace() {
    return showTrace;
  }

  public void setShowTrace(Toggle value) {
    showTrace = require(SHOW_TRACE, value);
  }

  public String filename() {
    return filename;
  }

  /**
   * Overrides the filename stamped into trace headers.
   *
   * @param value new filename; must be non-blank and free of control characters
   * @throws InvalidConfigValueException if {@code value} is unusable
   */
  public void setFilename(String value) {
    if (!Strings.isPrintableLabel(value)) {
      throw new InvalidConfigValueException(FILENAME, value);
    }
    filename = Strings.truncate(value.trim(), MAX_FILENAME_LENGTH);
  }

  /**
   * Applies a textual setting, as read from a configuration file.
   *
   * @param key one of {@code verbosity}, {@code colorfulness}, {@code autoNewline}, {@code showTrace},
   *     {@code filename} (case-insensitive)
   * @param value textual value; toggles accept the spellings of {@link Toggle#parse(String, String)}
   * @throws InvalidConfigValueException if the key is unknown or the value is out of domain
   */
  public void apply(String key, String value) {
    String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    switch (normalized) {
      case "verbosity", "verbose" -> setVerbosity(Toggle.parse(VERBOSITY, value));
      case "colorfulness", "color" -> setColorfulness(Toggle.parse(COLORFULNESS, value));
      case "autonewline" -> setAutoNewline(Toggle.parse(AUTO_NEWLINE, value));
      case "showtrace" -> setShowTrace(Toggle.parse(SHOW_TRACE, value));
      case "filename" -> setFilename(value);
      default -> throw new InvalidConfigValueException("setting name", key);
    }
  }

  private static Toggle require(String setting, Toggle value) {
    if (value == null) {
      throw new InvalidConfigValueException(setting, null);
    }
    return value;
  }
}
