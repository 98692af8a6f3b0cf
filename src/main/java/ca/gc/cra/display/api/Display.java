package ca.gc.cra.display.api;

import ca.gc.cra.display.application.AdvisoryLock;
import ca.gc.cra.display.application.DisplaySettings;
import ca.gc.cra.display.application.PrintEngine;
import ca.gc.cra.display.application.PrintRequest;
import ca.gc.cra.display.application.StreamRegistry;
import ca.gc.cra.display.application.TraceHeaderBuilder;
import ca.gc.cra.display.application.port.ClockPort;
import ca.gc.cra.display.application.port.Destination;
import ca.gc.cra.display.application.port.MetricsPort;
import ca.gc.cra.display.application.port.TerminalProbe;
import ca.gc.cra.display.application.port.TerminalProbe.StandardStream;
import ca.gc.cra.display.domain.AnsiStyle;
import ca.gc.cra.display.domain.PrintCategory;
import ca.gc.cra.display.domain.RedirectState;
import ca.gc.cra.display.domain.Toggle;
import ca.gc.cra.display.domain.UninitializedStateException;
import ca.gc.cra.display.infrastructure.io.Destinations;
import ca.gc.cra.display.infrastructure.terminal.ProcFdTerminalProbe;
import ca.gc.cra.display.infrastructure.time.SystemClockAdapter;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Traceable, thread-safe printing to consoles and files.
 * <p><strong>Why:</strong> Gives every line a {@code [HH:mm:ss][file][function]} prefix, optional ANSI styling,
 * and per-category routing, without lines from different threads interleaving.</p>
 * <p><strong>Role:</strong> Public facade and composition root; owns the settings, the stream registry, the
 * advisory lock and the print engine of one independent display context.</p>
 * <p><strong>Lifecycle:</strong> {@link #create()} returns an uninitialized display;
 * {@link #initialize(String, String...)} probes the terminals, binds stdout/stderr and applies process flags;
 * {@link #teardown()} closes it. Printing outside that window raises {@link UninitializedStateException}.</p>
 * <p><strong>Usage:</strong></p>
 * <pre>{@code
 * Display display = Display.create().initialize("Worker.java", args);
 * display.print("run", "Hello, %s!", "World");
 * display.error("run", "Lost %d frames", 3);
 * display.printStyled("run", AnsiStyle.ITALIC.with(AnsiStyle.CYAN), "x = %d", 76);
 * display.lock();
 * try {
 *   display.print("run", "line one");
 *   display.print("run", "line two");
 * } finally {
 *   display.unlock();
 * }
 * display.teardown();
 * }</pre>
 * <p><strong>Thread-safety:</strong> Every print and every setter runs under the display's {@link AdvisoryLock}.
 * A thread that calls {@link #lock()} must call {@link #unlock()}; until it does, all other threads' prints and
 * setters block.</p>
 *
 * @since 0.1.0
 */
public final class Display {
  private static final Logger log = LoggerFactory.getLogger(Display.class);

  private enum Lifecycle {
    UNINITIALIZED,
    READY,
    CLOSED
  }

  private final DisplaySettings settings = new DisplaySettings();
  private final AdvisoryLock lock = new AdvisoryLock();
  private final ClockPort clock;
  private final TerminalProbe terminalProbe;
  private final MetricsPort metrics;
  private final Destination standardOut;
  private final Destination standardErr;

  private volatile Lifecycle lifecycle = Lifecycle.UNINITIALIZED;
  private volatile StreamRegistry streams;
  private volatile PrintEngine engine;

  private Display(Builder builder) {
    this.clock = builder.clock;
    this.terminalProbe = builder.terminalProbe;
    this.metrics = builder.metrics;
    this.standardOut = builder.standardOut;
    this.standardErr = builder.standardErr;
  }

  /**
   * Creates an uninitialized display bound to the process streams, the system clock and no metrics.
   *
   * @return new display; call {@link #initialize(String, String...)} before printing
   */
  public static Display create() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Prepares the display for printing.
   *
   * <p>Detects whether stdout and stderr are terminals (once; the result is cached), binds STANDARD to stdout and
   * WARNING/ERROR to stderr, enables all toggles, then applies {@code --silent}/{@code -s} and
   * {@code --no-color}/{@code -n}. The caller filename is the base name of {@code callerSource}.</p>
   *
   * @param callerSource identity of the initializing source, such as {@code "src/app/Main.java"}
   * @param processArgs process arguments; unknown entries are ignored
   * @return this display
   * @throws ca.gc.cra.display.domain.InvalidConfigValueException if {@code callerSource} is blank
   */
  public Display initialize(String callerSource, String... processArgs) {
    DisplayArgs args = DisplayArgs.parse(processArgs);
    try (AdvisoryLock.Hold hold = lock.enter()) {
      RedirectState redirects = new RedirectState(
          !terminalProbe.isInteractive(StandardStream.OUT),
          !terminalProbe.isInteractive(StandardStream.ERR));
      StreamRegistry registry = new StreamRegistry(standardOut, standardErr, redirects);
      settings.setFilename(baseName(callerSource));
      settings.resetToggles();
      if (args.silent()) {
        settings.setVerbosity(Toggle.DISABLE);
      }
      if (args.noColor()) {
        settings.setColorfulness(Toggle.DISABLE);
      }
      streams = registry;
      engine = new PrintEngine(settings, registry, new TraceHeaderBuilder(clock), lock, metrics);
      lifecycle = Lifecycle.READY;
      log.info("Display initialized for {} (stdoutRedirected={}, stderrRedirected={}, verbose={}, colorful={})",
          settings.filename(), redirects.standardRedirected(), redirects.errorRedirected(),
          settings.verbosity().enabled(), settings.colorfulness().enabled());
    }
    return this;
  }

  /**
   * Initializes with the simple name of {@code caller} as the trace filename.
   *
   * @param caller class performing the initialization
   * @param processArgs process arguments
   * @return this display
   */
  public Display initialize(Class<?> caller, String... processArgs) {
    Objects.requireNonNull(caller, "caller");
    return initialize(caller.getSimpleName(), processArgs);
  }

  /**
   * Closes the display. A bracket held by the calling thread is released; later prints fail with
   * {@link UninitializedStateException}.
   */
  public void teardown() {
    try (AdvisoryLock.Hold hold = lock.enter()) {
      if (lifecycle == Lifecycle.CLOSED) {
        return;
      }
      lifecycle = Lifecycle.CLOSED;
      if (engine != null) {
        engine.close();
      }
      engine = null;
      streams = null;
    } finally {
      lock.unlock();
    }
    log.info("Display for {} torn down", settings.filename());
  }

  /** Standard print; suppressed while verbosity is disabled. */
  public boolean print(String function, String template, Object... args) {
    return engine().emit(PrintRequest.standard(function, template, args));
  }

  /** Standard print with a caller-chosen header style; suppressed while verbosity is disabled. */
  public boolean printStyled(String function, AnsiStyle style, String template, Object... args) {
    return engine().emit(PrintRequest.styled(function, style, template, args));
  }

  /** Warning print; always emitted, tagged {@code [WARNING]}, bold yellow header. */
  public boolean warning(String function, String template, Object... args) {
    return engine().emit(PrintRequest.warning(function, template, args));
  }

  /** Error print; always emitted, tagged {@code [ERROR]}, bold red header. */
  public boolean error(String function, String template, Object... args) {
    return engine().emit(PrintRequest.error(function, template, args));
  }

  /**
   * Prints straight to {@code destination}, bypassing the stream registry and verbosity.
   * Trace, color and newline settings still apply.
   */
  public boolean printTo(Destination destination, String function, String template, Object... args) {
    return engine().emit(PrintRequest.custom(destination, function, template, args));
  }

  /**
   * Returns a print helper bound to one function name, for call sites that print repeatedly.
   *
   * @param function calling function's name
   * @return caller-bound helper
   */
  public Caller caller(String function) {
    return new Caller(this, function);
  }

  /**
   * Acquires the display lock so several prints form one uninterrupted block. Idempotent for the holder.
   *
   * @return {@code true} if this call acquired the lock
   */
  public boolean lock() {
    return lock.lock();
  }

  /**
   * Releases the display lock if the calling thread holds it.
   *
   * @return {@code true} if the lock was released
   */
  public boolean unlock() {
    return lock.unlock();
  }

  public boolean isLocked() {
    return lock.isLocked();
  }

  /**
   * Runs {@code block} under the display lock. A bracket already held by the caller is left held.
   *
   * @param block prints to group
   */
  public void atomically(Runnable block) {
    Objects.requireNonNull(block, "block");
    boolean acquired = lock.lock();
    try {
      block.run();
    } finally {
      if (acquired) {
        lock.unlock();
      }
    }
  }

  public Toggle getVerbosity() {
    return settings.verbosity();
  }

  public void setVerbosity(Toggle value) {
    mutate(() -> settings.setVerbosity(value));
  }

  public void setVerbosity(boolean enabled) {
    setVerbosity(Toggle.of(enabled));
  }

  public Toggle getColorfulness() {
    return settings.colorfulness();
  }

  public void setColorfulness(Toggle value) {
    mutate(() -> settings.setColorfulness(value));
  }

  public void setColorfulness(boolean enabled) {
    setColorfulness(Toggle.of(enabled));
  }

  public Toggle getAutoNewline() {
    return settings.autoNewline();
  }

  public void setAutoNewline(Toggle value) {
    mutate(() -> settings.setAutoNewline(value));
  }

  public void setAutoNewline(boolean enabled) {
    setAutoNewline(Toggle.of(enabled));
  }

  public Toggle getShowTrace() {
    return settings.showTrace();
  }

  /**
   * Enables or disables the trace header. Without a header no style prefix is written either.
   */
  public void setShowTrace(Toggle value) {
    mutate(() -> settings.setShowTrace(value));
  }

  public void setShowTrace(boolean enabled) {
    setShowTrace(Toggle.of(enabled));
  }

  public String getFilename() {
    return settings.filename();
  }

  public void setFilename(String filename) {
    mutate(() -> settings.setFilename(filename));
  }

  /**
   * Applies one textual setting, as read from a configuration file.
   *
   * @see DisplaySettings#apply(String, String)
   */
  public void applySetting(String key, String value) {
    mutate(() -> settings.apply(key, value));
  }

  /**
   * Rebinds the destination of STANDARD, WARNING or ERROR prints.
   *
   * @return previously bound destination
   * @throws ca.gc.cra.display.domain.InvalidCategoryException for {@code null} or {@link PrintCategory#CUSTOM}
   * @throws UninitializedStateException if the display is not initialized
   */
  public Destination setStream(PrintCategory category, Destination destination) {
    try (AdvisoryLock.Hold hold = lock.enter()) {
      return registry().bind(category, destination);
    }
  }

  /**
   * @throws ca.gc.cra.display.domain.InvalidCategoryException for {@code null} or {@link PrintCategory#CUSTOM}
   * @throws UninitializedStateException if the display is not initialized
   */
  public Destination getStream(PrintCategory category) {
    return registry().resolve(category);
  }

  /**
   * @return redirect flags detected at initialization
   */
  public RedirectState redirectState() {
    return registry().redirectState();
  }

  public boolean isInitialized() {
    return lifecycle == Lifecycle.READY;
  }

  private void mutate(Runnable change) {
    try (AdvisoryLock.Hold hold = lock.enter()) {
      change.run();
    }
  }

  private PrintEngine engine() {
    PrintEngine current = engine;
    if (current == null) {
      throw notReady();
    }
    return current;
  }

  private StreamRegistry registry() {
    StreamRegistry current = streams;
    if (current == null) {
      throw notReady();
    }
    return current;
  }

  private UninitializedStateException notReady() {
    return lifecycle == Lifecycle.CLOSED
        ? new UninitializedStateException("Display has been torn down")
        : new UninitializedStateException("Display is not initialized; call initialize() first");
  }

  static String baseName(String source) {
    if (source == null) {
      return null;
    }
    String trimmed = source.trim();
    int slash = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
    return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
  }

  /**
   * Print helper bound to a function name, so the name is written once per method.
   */
  public static final class Caller {
    private final Display display;
    private final String function;

    private Caller(Display display, String function) {
      this.display = display;
      this.function = function;
    }

    public boolean print(String template, Object... args) {
      return display.print(function, template, args);
    }

    public boolean printStyled(AnsiStyle style, String template, Object... args) {
      return display.printStyled(function, style, template, args);
    }

    public boolean warning(String template, Object... args) {
      return display.warning(function, template, args);
    }

    public boolean error(String template, Object... args) {
      return display.error(function, template, args);
    }

    public boolean printTo(Destination destination, String template, Object... args) {
      return display.printTo(destination, function, template, args);
    }
  }

  /**
   * Collaborators of a display; defaults suit a console application.
   */
  public static final class Builder {
    private ClockPort clock = new SystemClockAdapter();
    private TerminalProbe terminalProbe = new ProcFdTerminalProbe();
    private MetricsPort metrics = MetricsPort.NO_OP;
    private Destination standardOut = Destinations.stdout();
    private Destination standardErr = Destinations.stderr();

    private Builder() {}

    public Builder clock(ClockPort clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    public Builder terminalProbe(TerminalProbe terminalProbe) {
      this.terminalProbe = Objects.requireNonNull(terminalProbe, "terminalProbe");
      return this;
    }

    public Builder metrics(MetricsPort metrics) {
      this.metrics = Objects.requireNonNull(metrics, "metrics");
      return this;
    }

    /** Destination bound to STANDARD at initialization. */
    public Builder standardOut(Destination standardOut) {
      this.standardOut = Objects.requireNonNull(standardOut, "standardOut");
      return this;
    }

    /** Destination bound to WARNING and ERROR at initialization. */
    public Builder standardErr(Destination standardErr) {
      this.standardErr = Objects.requireNonNull(standardErr, "standardErr");
      return this;
    }

    public Display build() {
      return new Display(this);
    }
  }
}
