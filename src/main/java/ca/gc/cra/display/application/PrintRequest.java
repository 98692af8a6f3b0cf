package ca.gc.cra.display.application;

import ca.gc.cra.display.application.port.Destination;
import ca.gc.cra.display.domain.AnsiStyle;
import ca.gc.cra.display.domain.PrintCategory;
import java.util.Objects;

/**
 * One print call, as handed to the {@link PrintEngine}. Never stored.
 *
 * @param category severity class
 * @param destination explicit destination; required for {@link PrintCategory#CUSTOM}, {@code null} otherwise
 * @param style style token applied to the header
 * @param function calling function's name, supplied by the call site
 * @param template message format template
 * @param args template arguments
 * @since 0.1.0
 */
public record PrintRequest(
    PrintCategory category,
    Destination destination,
    AnsiStyle style,
    String function,
    String template,
    Object[] args) {

  public PrintRequest {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(style, "style");
    Objects.requireNonNull(template, "template");
    if (category == PrintCategory.CUSTOM) {
      Objects.requireNonNull(destination, "destination");
    } else if (destination != null) {
      throw new IllegalArgumentException("only CUSTOM prints take an explicit destination");
    }
    args = args == null ? new Object[0] : args;
  }

  public static PrintRequest standard(String function, String template, Object... args) {
    return new PrintRequest(PrintCategory.STANDARD, null, AnsiStyle.RESET, function, template, args);
  }

  public static PrintRequest styled(String function, AnsiStyle style, String template, Object... args) {
    return new PrintRequest(PrintCategory.STANDARD, null, style, function, template, args);
  }

  public static PrintRequest warning(String function, String template, Object... args) {
    return new PrintRequest(PrintCategory.WARNING, null, AnsiStyle.WARNING, function, template, args);
  }

  public static PrintRequest error(String function, String template, Object... args) {
    return new PrintRequest(PrintCategory.ERROR, null, AnsiStyle.ERROR, function, template, args);
  }

  public static PrintRequest custom(
      Destination destination, String function, String template, Object... args) {
    return new PrintRequest(PrintCategory.CUSTOM, destination, AnsiStyle.RESET, function, template, args);
  }
}
