package ca.gc.cra.display.infrastructure.terminal;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.display.application.port.TerminalProbe.StandardStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcFdTerminalProbeTest {
  @TempDir Path tempDir;

  @Test
  void pseudoTerminalLinkIsInteractive() throws IOException {
    Files.createSymbolicLink(tempDir.resolve("1"), Path.of("/dev/pts/3"));
    ProcFdTerminalProbe probe = new ProcFdTerminalProbe(tempDir, stream -> false);

    assertTrue(probe.isInteractive(StandardStream.OUT));
  }

  @Test
  void fileLinkIsRedirected() throws IOException {
    Path target = Files.createFile(tempDir.resolve("captured.log"));
    Files.createSymbolicLink(tempDir.resolve("2"), target);
    ProcFdTerminalProbe probe = new ProcFdTerminalProbe(tempDir, stream -> true);

    assertFalse(probe.isInteractive(StandardStream.ERR));
  }

  @Test
  void missingDescriptorUsesFallback() {
    ProcFdTerminalProbe interactive = new ProcFdTerminalProbe(tempDir.resolve("absent"), stream -> true);
    ProcFdTerminalProbe redirected =
        new ProcFdTerminalProbe(tempDir.resolve("absent"), stream -> stream == StandardStream.ERR);

    assertTrue(interactive.isInteractive(StandardStream.OUT));
    assertFalse(redirected.isInteractive(StandardStream.OUT));
    assertTrue(redirected.isInteractive(StandardStream.ERR));
  }

  @Test
  void recognizesTerminalDevices() {
    assertTrue(ProcFdTerminalProbe.isTerminalDevice("/dev/pts/0"));
    assertTrue(ProcFdTerminalProbe.isTerminalDevice("/dev/tty1"));
    assertTrue(ProcFdTerminalProbe.isTerminalDevice("/dev/console"));
    assertFalse(ProcFdTerminalProbe.isTerminalDevice("pipe:[12345]"));
    assertFalse(ProcFdTerminalProbe.isTerminalDevice("/dev/null"));
  }
}
