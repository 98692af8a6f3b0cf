package ca.gc.cra.display.domain;

import java.util.Locale;

/**
 * The two legal values accepted by every boolean display setting.
 *
 * @since 0.1.0
 */
public enum Toggle {
  DISABLE,
  ENABLE;

  /**
   * Maps a primitive flag to its toggle.
   *
   * @param enabled flag value
   * @return {@link #ENABLE} when {@code enabled} is {@code true}
   */
  public static Toggle of(boolean enabled) {
    return enabled ? ENABLE : DISABLE;
  }

  /**
   * @return {@code true} for {@link #ENABLE}
   */
  public boolean enabled() {
    return this == ENABLE;
  }

  /**
   * Parses textual toggle values from configuration files.
   *
   * <p>Accepts {@code enable/disable}, {@code true/false}, {@code on/off} and {@code 1/0}, ignoring case and
   * surrounding whitespace.</p>
   *
   * @param setting setting name used in the failure message
   * @param raw candidate text
   * @return parsed toggle
   * @throws InvalidConfigValueException if {@code raw} is not one of the accepted spellings
   */
  public static Toggle parse(String setting, String raw) {
    if (raw == null) {
      throw new InvalidConfigValueException(setting, null);
    }
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "enable", "enabled", "true", "on", "1" -> ENABLE;
      case "disable", "disabled", "false", "off", "0" -> DISABLE;
      default -> throw new InvalidConfigValueException(setting, raw);
    };
  }
}
