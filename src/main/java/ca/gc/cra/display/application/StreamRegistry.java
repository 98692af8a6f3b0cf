package ca.gc.cra.display.application;

import ca.gc.cra.display.application.port.Destination;
import ca.gc.cra.display.domain.InvalidCategoryException;
import ca.gc.cra.display.domain.PrintCategory;
import ca.gc.cra.display.domain.RedirectState;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps each registry-bound {@link PrintCategory} to its output destination.
 * <p><strong>Why:</strong> Lets a process send standard output to a log file while warnings and errors keep going
 * to the terminal, or any other arrangement, without touching call sites.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Hold a non-null destination for STANDARD, WARNING and ERROR from construction onward.</li>
 *   <li>Reject {@link PrintCategory#CUSTOM} and {@code null} categories with {@link InvalidCategoryException}.</li>
 *   <li>Carry the {@link RedirectState} detected at initialization.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutations are expected under the display lock; reads happen inside the
 * print critical section. The backing map is guarded by its own monitor so out-of-band reads stay safe.</p>
 *
 * @since 0.1.0
 */
public final class StreamRegistry {
  private static final Logger log = LoggerFactory.getLogger(StreamRegistry.class);

  private final Map<PrintCategory, Destination> streams = new EnumMap<>(PrintCategory.class);
  private final RedirectState redirectState;

  /**
   * Creates a registry with the conventional defaults: standard prints on {@code standardOut}, warnings and
   * errors on {@code standardErr}.
   *
   * @param standardOut process standard output
   * @param standardErr process standard error
   * @param redirectState redirect flags detected for the two inherited streams
   */
  public StreamRegistry(Destination standardOut, Destination standardErr, RedirectState redirectState) {
    this.redirectState = Objects.requireNonNull(redirectState, "redirectState");
    streams.put(PrintCategory.STANDARD, Objects.requireNonNull(standardOut, "standardOut"));
    streams.put(PrintCategory.WARNING, Objects.requireNonNull(standardErr, "standardErr"));
    streams.put(PrintCategory.ERROR, standardErr);
  }

  /**
   * Rebinds a category's destination.
   *
   * @param category STANDARD, WARNING or ERROR
   * @param destination new destination; must not be {@code null}
   * @return destination previously bound to the category
   * @throws InvalidCategoryException if {@code category} is {@code null} or {@link PrintCategory#CUSTOM}
   */
  public Destination bind(PrintCategory category, Destination destination) {
    requireBound(category);
    Objects.requireNonNull(destination, "destination");
    Destination previous;
    synchronized (streams) {
      previous = streams.put(category, destination);
    }
    log.debug("Rebound {} stream from {} to {}", category, previous.name(), destination.name());
    return previous;
  }

  /**
   * Returns the destination bound to a category.
   *
   * @param category STANDARD, WARNING or ERROR
   * @return bound destination, never {@code null}
   * @throws InvalidCategoryException if {@code category} is {@code null} or {@link PrintCategory#CUSTOM}
   */
  public Destination resolve(PrintCategory category) {
    requireBound(category);
    synchronized (streams) {
      return streams.get(category);
    }
  }

  public RedirectState redirectState() {
    return redirectState;
  }

  private static void requireBound(PrintCategory category) {
    if (category == null || !category.registryBound()) {
      throw new InvalidCategoryException(String.valueOf(category));
    }
  }
}
