package ca.gc.cra.display.domain;

import java.util.Objects;

/**
 * <strong>What:</strong> ANSI escape-sequence style token applied to a trace header.
 * <p><strong>Why:</strong> Lets callers color or emphasize the header of a print; tokens compose by
 * concatenation so a modifier can be paired with a color ({@code BOLD.with(RED)}).</p>
 * <p><strong>Thread-safety:</strong> Immutable value object.</p>
 *
 * @since 0.1.0
 */
public final class AnsiStyle {
  private static final String ESC = "\u001b[";

  public static final AnsiStyle BLACK = code("black", 30);
  public static final AnsiStyle RED = code("red", 31);
  public static final AnsiStyle GREEN = code("green", 32);
  public static final AnsiStyle YELLOW = code("yellow", 33);
  public static final AnsiStyle BLUE = code("blue", 34);
  public static final AnsiStyle MAGENTA = code("magenta", 35);
  public static final AnsiStyle CYAN = code("cyan", 36);
  public static final AnsiStyle WHITE = code("white", 37);
  /** Resets all attributes; also the style of plain standard prints. */
  public static final AnsiStyle RESET = code("reset", 0);

  public static final AnsiStyle BOLD = code("bold", 1);
  public static final AnsiStyle FAINT = code("faint", 2);
  public static final AnsiStyle ITALIC = code("italic", 3);
  public static final AnsiStyle UNDERLINE = code("underline", 4);

  /** Style forced onto warning prints. */
  public static final AnsiStyle WARNING = BOLD.with(YELLOW);
  /** Style forced onto error prints. */
  public static final AnsiStyle ERROR = BOLD.with(RED);

  private final String name;
  private final String sequence;

  private AnsiStyle(String name, String sequence) {
    this.name = name;
    this.sequence = sequence;
  }

  private static AnsiStyle code(String name, int code) {
    return new AnsiStyle(name, ESC + code + "m");
  }

  /**
   * Concatenates several tokens into one, in order.
   *
   * @param styles tokens to join; must not be empty
   * @return composed token
   */
  public static AnsiStyle compose(AnsiStyle... styles) {
    Objects.requireNonNull(styles, "styles");
    if (styles.length == 0) {
      throw new IllegalArgumentException("at least one style is required");
    }
    AnsiStyle result = Objects.requireNonNull(styles[0], "styles[0]");
    for (int i = 1; i < styles.length; i++) {
      result = result.with(styles[i]);
    }
    return result;
  }

  /**
   * Appends another token to this one.
   *
   * @param next token emitted after this one
   * @return composed token
   */
  public AnsiStyle with(AnsiStyle next) {
    Objects.requireNonNull(next, "next");
    return new AnsiStyle(name + "+" + next.name, sequence + next.sequence);
  }

  /**
   * @return raw escape sequence written to the destination
   */
  public String sequence() {
    return sequence;
  }

  /**
   * @return readable name such as {@code bold+red}
   */
  public String name() {
    return name;
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof AnsiStyle style && sequence.equals(style.sequence);
  }

  @Override
  public int hashCode() {
    return sequence.hashCode();
  }

  @Override
  public String toString() {
    return "AnsiStyle[" + name + "]";
  }
}
