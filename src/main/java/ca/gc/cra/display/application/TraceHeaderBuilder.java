package ca.gc.cra.display.application;

import ca.gc.cra.display.application.port.ClockPort;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Renders the {@code [HH:mm:ss][file][function]} prefix of a traced line.
 *
 * <p>Time has second resolution and is rendered in the clock's local zone. The function name always comes from
 * the call site; nothing is inferred from the stack.</p>
 *
 * @since 0.1.0
 */
public final class TraceHeaderBuilder {
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
  private static final String UNKNOWN_FUNCTION = "?";

  private final ClockPort clock;

  public TraceHeaderBuilder(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * @param filename caller filename from the settings
   * @param function function name passed by the call site; blank renders as {@code ?}
   * @return header text without a trailing space
   */
  public String render(String filename, String function) {
    String time = TIME.format(Instant.ofEpochMilli(clock.nowMillis()).atZone(clock.zone()));
    String fn = function == null || function.isBlank() ? UNKNOWN_FUNCTION : function;
    return new StringBuilder(time.length() + filename.length() + fn.length() + 6)
        .append('[').append(time).append(']')
        .append('[').append(filename).append(']')
        .append('[').append(fn).append(']')
        .toString();
  }
}
