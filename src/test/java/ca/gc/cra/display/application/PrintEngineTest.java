package ca.gc.cra.display.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.display.domain.AnsiStyle;
import ca.gc.cra.display.domain.RedirectState;
import ca.gc.cra.display.domain.Toggle;
import ca.gc.cra.display.domain.UninitializedStateException;
import ca.gc.cra.display.testutil.FixedClock;
import ca.gc.cra.display.testutil.RecordingDestination;
import ca.gc.cra.display.testutil.RecordingMetrics;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PrintEngineTest {
  private RecordingDestination out;
  private RecordingDestination err;
  private DisplaySettings settings;
  private RecordingMetrics metrics;
  private AdvisoryLock lock;

  @BeforeEach
  void setUp() {
    out = new RecordingDestination("out");
    err = new RecordingDestination("err");
    settings = new DisplaySettings();
    settings.setFilename("app");
    metrics = new RecordingMetrics();
    lock = new AdvisoryLock();
  }

  private PrintEngine engine(RedirectState redirects) {
    StreamRegistry registry = new StreamRegistry(out, err, redirects);
    return new PrintEngine(settings, registry, new TraceHeaderBuilder(FixedClock.noon()), lock, metrics);
  }

  @Test
  void writesWholeLineInOneWrite() {
    settings.setColorfulness(Toggle.DISABLE);

    assertTrue(engine(RedirectState.INTERACTIVE).emit(PrintRequest.standard("main", "value=%d", 5)));

    assertEquals(List.of("[12:00:00][app][main] value=5\n"), out.writes());
    assertEquals(1L, metrics.counter(PrintEngine.EMITTED));
    assertTrue(metrics.observed(PrintEngine.LOCK_WAIT));
  }

  @Test
  void colorfulLineCarriesStyleAndReset() {
    engine(RedirectState.INTERACTIVE).emit(PrintRequest.styled("main", AnsiStyle.CYAN, "hi"));

    assertEquals("\u001b[36m[12:00:00][app][main] hi\u001b[0m\n", out.text());
  }

  @Test
  void redirectedCategoryLosesEscapesOnlyForThatCall() {
    PrintEngine engine = engine(new RedirectState(false, true));

    engine.emit(PrintRequest.error("main", "boom"));
    engine.emit(PrintRequest.standard("main", "fine"));

    assertEquals("[12:00:00][app][main][ERROR] boom\n", err.text());
    assertEquals("\u001b[0m[12:00:00][app][main] fine\u001b[0m\n", out.text());
    assertEquals(Toggle.ENABLE, settings.colorfulness(), "global colorfulness must be untouched");
  }

  @Test
  void closedEngineRejectsPrints() {
    PrintEngine engine = engine(RedirectState.INTERACTIVE);

    engine.close();

    assertTrue(engine.isClosed());
    assertThrows(UninitializedStateException.class,
        () -> engine.emit(PrintRequest.error("main", "late")));
    assertTrue(err.writes().isEmpty());
    assertEquals(0L, metrics.counter(PrintEngine.EMITTED));
  }

  @Test
  void suppressedPrintIsCountedAndNotWritten() {
    settings.setVerbosity(Toggle.DISABLE);

    assertFalse(engine(RedirectState.INTERACTIVE).emit(PrintRequest.standard("main", "quiet")));

    assertTrue(out.writes().isEmpty());
    assertEquals(1L, metrics.counter(PrintEngine.SUPPRESSED));
    assertEquals(0L, metrics.counter(PrintEngine.EMITTED));
  }

  @Test
  void truncationIsCounted() {
    settings.setShowTrace(Toggle.DISABLE);
    settings.setAutoNewline(Toggle.DISABLE);
    settings.setColorfulness(Toggle.DISABLE);

    engine(RedirectState.INTERACTIVE).emit(PrintRequest.standard("main", "%s", "w".repeat(400)));

    assertEquals(MessageBuffer.MAX_RENDERED, out.text().length());
    assertEquals(1L, metrics.counter(PrintEngine.TRUNCATED));
  }

  @Test
  void innerPrintInsideBracketDoesNotReleaseIt() {
    lock.lock();
    try {
      engine(RedirectState.INTERACTIVE).emit(PrintRequest.standard("main", "inside"));
      assertTrue(lock.isHeldByCurrentThread());
      assertFalse(metrics.observed(PrintEngine.LOCK_WAIT));
    } finally {
      lock.unlock();
    }
  }

  @Test
  void writeFailureSurfacesLogsAndReleasesLock() {
    err.failWith(new IOException("disk gone"));
    Logger logger = (Logger) LoggerFactory.getLogger(PrintEngine.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    boolean originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);

    UncheckedIOException thrown;
    try {
      thrown = assertThrows(UncheckedIOException.class,
          () -> engine(RedirectState.INTERACTIVE).emit(PrintRequest.warning("main", "careful")));
    } finally {
      logger.detachAppender(appender);
      logger.setAdditive(originalAdditive);
      appender.stop();
    }

    assertEquals("disk gone", thrown.getCause().getMessage());
    assertFalse(lock.isLocked());
    assertEquals(1L, metrics.counter(PrintEngine.FAILED));
    assertEquals(1, appender.list.size());
    ILoggingEvent event = appender.list.get(0);
    assertEquals(Level.WARN, event.getLevel());
    assertEquals("Display write to err failed", event.getFormattedMessage());
  }
}
