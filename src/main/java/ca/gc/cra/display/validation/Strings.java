package ca.gc.cra.display.validation;

import java.util.Objects;

/**
 * <strong>What:</strong> String validation helpers shared by configuration, argument parsing, and settings.
 * <p><strong>Why:</strong> Keeps control characters and blank names out of trace headers, where they would corrupt
 * the line layout.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities; safe for concurrent access.</p>
 * <p><strong>Performance:</strong> O(n) character scans.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Tests whether a value can be stamped into a trace header.
   *
   * @param value candidate text; may be {@code null}
   * @return {@code true} when {@code value} is non-null, not blank, and free of control characters
   */
  public static boolean isPrintableLabel(String value) {
    return value != null && !value.isBlank() && !containsControl(value);
  }

  /**
   * Cuts a value down to at most {@code maxChars} UTF-16 units without splitting a surrogate pair.
   *
   * @param value text to bound; must not be {@code null}
   * @param maxChars maximum length; must not be negative
   * @return {@code value} itself when short enough, otherwise its bounded prefix
   */
  public static String truncate(String value, int maxChars) {
    Objects.requireNonNull(value, "value");
    if (maxChars < 0) {
      throw new IllegalArgumentException("maxChars must not be negative");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (end > 0 && Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end);
  }

  /**
   * @param value text to scan
   * @return {@code true} if any character is an ISO control character
   */
  public static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
