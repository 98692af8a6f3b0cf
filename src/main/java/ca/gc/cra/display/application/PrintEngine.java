package ca.gc.cra.display.application;

import ca.gc.cra.display.application.port.Destination;
import ca.gc.cra.display.application.port.MetricsPort;
import ca.gc.cra.display.domain.AnsiStyle;
import ca.gc.cra.display.domain.PrintCategory;
import ca.gc.cra.display.domain.UninitializedStateException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Renders and writes traced lines.
 * <p><strong>Why:</strong> Every public print funnels through one place so locking, routing, colorization and
 * bounded formatting behave identically for all categories.</p>
 * <p><strong>Role:</strong> Application service behind the {@code Display} facade.</p>
 * <p><strong>Line layout:</strong> {@code [style][HH:mm:ss][file][function]} (when trace is shown), then the
 * category tag or a single space, the bounded body, {@code RESET} (when colorful), and {@code \n} (when
 * auto-newline is on). A category whose inherited stream was detected as redirected is rendered without any escape
 * sequence, whatever the colorfulness setting.</p>
 * <p><strong>Thread-safety:</strong> At most one thread renders and writes at a time; see {@link AdvisoryLock}.</p>
 * <p><strong>Observability:</strong> Counts {@value #EMITTED}, {@value #SUPPRESSED}, {@value #TRUNCATED},
 * {@value #FAILED}; observes {@value #LOCK_WAIT}.</p>
 *
 * @since 0.1.0
 */
public final class PrintEngine {
  private static final Logger log = LoggerFactory.getLogger(PrintEngine.class);

  static final String EMITTED = "display.print.emitted";
  static final String SUPPRESSED = "display.print.suppressed";
  static final String TRUNCATED = "display.print.truncated";
  static final String FAILED = "display.print.failed";
  static final String LOCK_WAIT = "display.lock.waitNanos";

  private static final String LINE_TERMINATOR = "\n";

  private final DisplaySettings settings;
  private final StreamRegistry streams;
  private final TraceHeaderBuilder headers;
  private final AdvisoryLock lock;
  private final MetricsPort metrics;
  private volatile boolean closed;

  public PrintEngine(
      DisplaySettings settings,
      StreamRegistry streams,
      TraceHeaderBuilder headers,
      AdvisoryLock lock,
      MetricsPort metrics) {
    this.settings = Objects.requireNonNull(settings, "settings");
    this.streams = Objects.requireNonNull(streams, "streams");
    this.headers = Objects.requireNonNull(headers, "headers");
    this.lock = Objects.requireNonNull(lock, "lock");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Prints one request.
   *
   * @param request print to perform
   * @return {@code true} if a line was written, {@code false} if verbosity suppressed it
   * @throws java.util.IllegalFormatException if the template does not match its arguments; nothing is written
   * @throws UncheckedIOException if the destination rejects the write
   * @throws UninitializedStateException if the engine was closed, including while this call waited for the lock
   */
  public boolean emit(PrintRequest request) {
    Objects.requireNonNull(request, "request");
    try (AdvisoryLock.Hold hold = lock.enter()) {
      if (hold.acquired()) {
        metrics.observe(LOCK_WAIT, hold.waitNanos());
      }
      if (closed) {
        throw new UninitializedStateException("Display has been torn down");
      }
      DisplaySettings.Snapshot current = settings.snapshot();
      PrintCategory category = request.category();
      if (category.gatedByVerbosity() && !current.verbosity()) {
        metrics.increment(SUPPRESSED);
        return false;
      }

      boolean colorful = current.colorfulness() && !streams.redirectState().redirects(category);
      Destination destination =
          category == PrintCategory.CUSTOM ? request.destination() : streams.resolve(category);

      MessageBuffer.Rendered body = MessageBuffer.format(request.template(), request.args());
      if (body.truncated()) {
        metrics.increment(TRUNCATED);
      }

      write(destination, render(request, current, colorful, body.text()));
      metrics.increment(EMITTED);
      return true;
    }
  }

  /**
   * Rejects every later print. Prints already blocked on the lock fail once they acquire it.
   */
  public void close() {
    try (AdvisoryLock.Hold hold = lock.enter()) {
      closed = true;
    }
  }

  public boolean isClosed() {
    return closed;
  }

  private String render(
      PrintRequest request, DisplaySettings.Snapshot current, boolean colorful, String body) {
    StringBuilder line = new StringBuilder(body.length() + 64);
    if (current.showTrace()) {
      if (colorful) {
        line.append(request.style().sequence());
      }
      line.append(headers.render(current.filename(), request.function()));
    }
    String tag = request.category().tag();
    if (!tag.isEmpty()) {
      line.append(tag);
    } else if (current.showTrace()) {
      line.append(' ');
    }
    line.append(body);
    if (colorful) {
      line.append(AnsiStyle.RESET.sequence());
    }
    if (current.autoNewline()) {
      line.append(LINE_TERMINATOR);
    }
    return line.toString();
  }

  private void write(Destination destination, String text) {
    try {
      destination.write(text);
      destination.flush();
    } catch (IOException ex) {
      metrics.increment(FAILED);
      log.warn("Display write to {} failed", destination.name(), ex);
      throw new UncheckedIOException("Failed to write to " + destination.name(), ex);
    }
  }
}
