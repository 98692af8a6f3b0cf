package ca.gc.cra.display.infrastructure.terminal;

import ca.gc.cra.display.application.port.TerminalProbe;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Detects whether the inherited standard streams are terminals.
 * <p><strong>How:</strong> On Linux, {@code /proc/self/fd/N} links to the open file; a target under
 * {@code /dev/pts/} or {@code /dev/tty} is a terminal, anything else (a file, pipe or socket) counts as redirected.
 * Where {@code /proc} is unavailable the probe falls back to {@link System#console()}, which answers for standard
 * output and input together.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class ProcFdTerminalProbe implements TerminalProbe {
  private static final Logger log = LoggerFactory.getLogger(ProcFdTerminalProbe.class);

  private final Path procFdRoot;
  private final Function<StandardStream, Boolean> fallback;

  public ProcFdTerminalProbe() {
    this(Path.of("/proc/self/fd"), stream -> System.console() != null);
  }

  ProcFdTerminalProbe(Path procFdRoot, Function<StandardStream, Boolean> fallback) {
    this.procFdRoot = procFdRoot;
    this.fallback = fallback;
  }

  @Override
  public boolean isInteractive(StandardStream stream) {
    Path link = procFdRoot.resolve(Integer.toString(stream.descriptor()));
    try {
      String target = Files.readSymbolicLink(link).toString();
      boolean interactive = isTerminalDevice(target);
      log.debug("Standard stream {} -> {} (interactive={})", stream, target, interactive);
      return interactive;
    } catch (IOException | UnsupportedOperationException ex) {
      boolean interactive = fallback.apply(stream);
      log.debug("Cannot resolve {}; console fallback reports interactive={}", link, interactive);
      return interactive;
    }
  }

  static boolean isTerminalDevice(String target) {
    return target.startsWith("/dev/pts/") || target.startsWith("/dev/tty") || target.equals("/dev/console");
  }
}
