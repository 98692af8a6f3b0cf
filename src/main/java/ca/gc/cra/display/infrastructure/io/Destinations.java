package ca.gc.cra.display.infrastructure.io;

import java.io.BufferedWriter;
import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * <strong>What:</strong> Factories for the destinations a display writes to.
 * <p><strong>Why:</strong> Process streams are opened on the native file descriptors rather than through
 * {@code System.out}/{@code System.err}, so traced output is unaffected by logging bridges that replace those
 * streams.</p>
 * <p><strong>Thread-safety:</strong> Factories are stateless; the process stream destinations are shared
 * singletons written only under the display lock.</p>
 *
 * @since 0.1.0
 */
public final class Destinations {
  private static final WriterDestination STDOUT = processStream(FileDescriptor.out, "stdout");
  private static final WriterDestination STDERR = processStream(FileDescriptor.err, "stderr");

  private Destinations() {
    // Utility
  }

  public static WriterDestination stdout() {
    return STDOUT;
  }

  public static WriterDestination stderr() {
    return STDERR;
  }

  /**
   * Opens a file for writing, truncating existing content.
   *
   * @param path file to write
   * @return destination that closes the file when closed
   * @throws IOException if the file cannot be opened
   */
  public static WriterDestination file(Path path) throws IOException {
    return open(path, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
  }

  /**
   * Opens a file for appending, creating it if needed.
   *
   * @param path file to append to
   * @return destination that closes the file when closed
   * @throws IOException if the file cannot be opened
   */
  public static WriterDestination append(Path path) throws IOException {
    return open(path, StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
  }

  /**
   * Wraps an output stream as UTF-8 text.
   *
   * @param out stream to wrap; closed together with the destination
   * @param name diagnostic label
   * @return destination over {@code out}
   */
  public static WriterDestination of(OutputStream out, String name) {
    Objects.requireNonNull(out, "out");
    return new WriterDestination(new OutputStreamWriter(out, StandardCharsets.UTF_8), name, true);
  }

  private static WriterDestination open(Path path, StandardOpenOption... options) throws IOException {
    Objects.requireNonNull(path, "path");
    BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8, options);
    return new WriterDestination(writer, path.toString(), true);
  }

  private static WriterDestination processStream(FileDescriptor descriptor, String name) {
    OutputStreamWriter writer =
        new OutputStreamWriter(new FileOutputStream(descriptor), StandardCharsets.UTF_8);
    return new WriterDestination(writer, name, false);
  }
}
