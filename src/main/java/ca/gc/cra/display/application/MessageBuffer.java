package ca.gc.cra.display.application;

import ca.gc.cra.display.validation.Strings;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> Formats a message template into a fixed-capacity buffer.
 * <p><strong>Why:</strong> A single print never renders more than {@value #CAPACITY} - 1 characters of body text,
 * however long its template or arguments are.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @implNote Templates use {@link java.util.Formatter} syntax ({@code %d}, {@code %s}, ...) with
 * {@link Locale#ROOT}. One slot of the capacity is reserved, as in a C string buffer, so the longest body is
 * {@code CAPACITY - 1}; a surrogate pair straddling the limit is dropped whole.
 * @since 0.1.0
 */
public final class MessageBuffer {
  /** Capacity of the message buffer, in UTF-16 units. */
  public static final int CAPACITY = 256;
  /** Longest body a print can render. */
  public static final int MAX_RENDERED = CAPACITY - 1;

  private MessageBuffer() {
    // Utility
  }

  /**
   * Rendered body and whether it was cut short.
   *
   * @param text body text, at most {@link #MAX_RENDERED} characters
   * @param truncated {@code true} if the full rendering did not fit
   */
  public record Rendered(String text, boolean truncated) {}

  /**
   * Formats {@code template} against {@code args} and bounds the result.
   *
   * @param template format template; must not be {@code null}
   * @param args template arguments; {@code null} is treated as none
   * @return bounded rendering
   * @throws java.util.IllegalFormatException if the template does not match its arguments
   */
  public static Rendered format(String template, Object... args) {
    Objects.requireNonNull(template, "template");
    String full = String.format(Locale.ROOT, template, args == null ? new Object[0] : args);
    String bounded = Strings.truncate(full, MAX_RENDERED);
    return new Rendered(bounded, bounded.length() != full.length());
  }
}
