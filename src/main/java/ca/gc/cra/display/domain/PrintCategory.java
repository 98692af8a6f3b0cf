package ca.gc.cra.display.domain;

import java.util.Locale;

/**
 * <strong>What:</strong> Severity class of a traced print.
 * <p><strong>Why:</strong> Drives routing (which stream a line lands on), verbosity gating, and the tag that
 * follows the trace header.</p>
 * <p><strong>Role:</strong> Domain value shared by the print engine and the stream registry.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum PrintCategory {
  /** Ordinary output; obeys verbosity. */
  STANDARD(""),
  /** Warning output; printed regardless of verbosity. */
  WARNING("[WARNING] "),
  /** Error output; printed regardless of verbosity. */
  ERROR("[ERROR] "),
  /**
   * Output written to a caller-supplied destination.
   * <p>Not a valid target for stream rebinding.</p>
   */
  CUSTOM("");

  private final String tag;

  PrintCategory(String tag) {
    this.tag = tag;
  }

  /**
   * Returns the tag printed between the header and the body, including its trailing space.
   *
   * @return tag text, or an empty string for untagged categories
   */
  public String tag() {
    return tag;
  }

  /**
   * Indicates whether disabling verbosity suppresses this category.
   *
   * @return {@code true} only for {@link #STANDARD}
   */
  public boolean gatedByVerbosity() {
    return this == STANDARD;
  }

  /**
   * Indicates whether the stream registry holds a destination for this category.
   *
   * @return {@code false} for {@link #CUSTOM}
   */
  public boolean registryBound() {
    return this != CUSTOM;
  }

  /**
   * Resolves a category from its case-insensitive name.
   *
   * @param raw category name such as {@code "warning"}
   * @return matching category
   * @throws InvalidCategoryException if {@code raw} names no category
   */
  public static PrintCategory parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new InvalidCategoryException(String.valueOf(raw));
    }
    try {
      return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new InvalidCategoryException(raw);
    }
  }
}
