package ca.gc.cra.display.infrastructure.time;

import ca.gc.cra.display.application.port.ClockPort;
import java.time.ZoneId;

/**
 * {@link ClockPort} implementation backed by {@link System#currentTimeMillis()} and the JVM default zone.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  /**
   * @implNote Read on every call so a changed default zone applies to the next header.
   */
  @Override
  public ZoneId zone() {
    return ZoneId.systemDefault();
  }
}
