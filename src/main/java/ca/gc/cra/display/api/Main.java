package ca.gc.cra.display.api;

import ca.gc.cra.display.application.port.Destination;
import ca.gc.cra.display.application.port.MetricsPort;
import ca.gc.cra.display.config.DisplayConfigLoader;
import ca.gc.cra.display.domain.AnsiStyle;
import ca.gc.cra.display.domain.DisplayException;
import ca.gc.cra.display.domain.PrintCategory;
import ca.gc.cra.display.infrastructure.io.Destinations;
import ca.gc.cra.display.infrastructure.io.WriterDestination;
import ca.gc.cra.display.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.display.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Demo command that walks through every kind of display print.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  static final String HELP_TEXT = """
      DISPLAY demo

      Usage:
        display [flags] [config=<display.yaml>] [file=<output.txt>] [metrics=otel|none]

      Flags:
        --silent, -s     Suppress standard prints (warnings and errors still print)
        --no-color, -n   Never emit ANSI escape sequences
        --verbose, -v    Enable DEBUG diagnostics for the display library
        --help, -h       Show this message
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    Display display = Display.builder().metrics(metricsFor(DisplayArgs.parse(args))).build();
    ExitCode exit = run(args, display);
    System.exit(exit.code());
  }

  /**
   * Selects the metrics adapter named by the {@code metrics=} option.
   *
   * @param input parsed arguments
   * @return OpenTelemetry adapter on the global instance for {@code otel}, otherwise the no-op port
   */
  static MetricsPort metricsFor(DisplayArgs input) {
    String exporter = input.option("metrics");
    if (exporter == null) {
      return MetricsPort.NO_OP;
    }
    return switch (exporter.toLowerCase(Locale.ROOT)) {
      case "otel" -> OpenTelemetryMetricsAdapter.fromGlobal();
      case "none" -> MetricsPort.NO_OP;
      default -> {
        log.warn("Unknown metrics option '{}'; metrics disabled", exporter);
        yield MetricsPort.NO_OP;
      }
    };
  }

  /**
   * Runs the demo against {@code display} without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @param display uninitialized display to drive
   * @return exit status
   */
  static ExitCode run(String[] args, Display display) {
    DisplayArgs input = DisplayArgs.parse(args);
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    display.initialize(Main.class, args);
    try {
      if (input.help()) {
        display.setShowTrace(false);
        for (String line : HELP_TEXT.stripTrailing().split("\n")) {
          display.print("run", "%s", line);
        }
        return ExitCode.SUCCESS;
      }
      String config = input.option("config");
      if (config != null) {
        DisplayConfigLoader.apply(Path.of(config), display::applySetting);
      }
      demo(display, input.option("file"));
      return ExitCode.SUCCESS;
    } catch (IOException | UncheckedIOException ex) {
      log.error("Display demo failed on I/O", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException | DisplayException ex) {
      log.error("Display demo rejected its configuration: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Display demo failed", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      display.teardown();
    }
  }

  private static void demo(Display display, String file) throws IOException {
    Display.Caller out = display.caller("demo");
    out.print("This is a number! %d", 5);
    out.print("Nothing to format, just text!");
    out.error("Welp, this is an error (%s)!", "ignore verbosity");
    out.warning("Numbers: %d, %d, %d", 1, 2, 3);
    out.printStyled(AnsiStyle.ITALIC.with(AnsiStyle.CYAN), "This is a custom color print message!");
    out.printStyled(AnsiStyle.compose(AnsiStyle.BOLD, AnsiStyle.FAINT, AnsiStyle.GREEN), "Hello, %s!", "World");

    display.atomically(() -> {
      out.print("First line of a grouped block.");
      out.error("Second line of the same block.");
    });

    if (file == null) {
      return;
    }
    try (WriterDestination destination = Destinations.file(Path.of(file))) {
      boolean colorful = display.getColorfulness().enabled();
      display.setColorfulness(false);
      Destination previous = display.setStream(PrintCategory.STANDARD, destination);
      try {
        out.print("Hello, text file!");
        out.print("The number five: %d", 5);
        out.printTo(destination, "Another line in the same open %s!", "file");
      } finally {
        display.setStream(PrintCategory.STANDARD, previous);
        display.setColorfulness(colorful);
      }
      out.print("Wrote to output text file, %s.", file);
    }
  }
}
