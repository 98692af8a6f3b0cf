package ca.gc.cra.display.application.port;

import java.time.ZoneId;

/**
 * <strong>What:</strong> Port supplying the wall-clock time stamped into trace headers.
 * <p><strong>Why:</strong> Lets tests pin the header timestamp.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote The production adapter delegates to {@link System#currentTimeMillis()} and the JVM default zone.
 * @since 0.1.0
 * @see ca.gc.cra.display.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();

  /**
   * Returns the zone used to render local time.
   *
   * @return local zone for header timestamps
   */
  ZoneId zone();
}
