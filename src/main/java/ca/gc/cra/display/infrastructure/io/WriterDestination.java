package ca.gc.cra.display.infrastructure.io;

import ca.gc.cra.display.application.port.Destination;
import java.io.Closeable;
import java.io.IOException;
import java.io.Writer;
import java.util.Objects;

/**
 * {@link Destination} backed by a {@link Writer}.
 *
 * <p>Writes after {@link #close()} fail with an {@link IOException} instead of being dropped.</p>
 *
 * @since 0.1.0
 */
public final class WriterDestination implements Destination, Closeable {
  private final Writer writer;
  private final String name;
  private final boolean closeable;
  private volatile boolean closed;

  /**
   * @param writer underlying writer
   * @param name label used in diagnostics
   * @param closeable whether {@link #close()} also closes {@code writer}; {@code false} for process streams
   */
  public WriterDestination(Writer writer, String name, boolean closeable) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.name = Objects.requireNonNull(name, "name");
    this.closeable = closeable;
  }

  @Override
  public void write(String text) throws IOException {
    ensureOpen();
    writer.write(text);
  }

  @Override
  public void flush() throws IOException {
    ensureOpen();
    writer.flush();
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    if (closeable) {
      writer.close();
    } else {
      writer.flush();
    }
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("Destination " + name + " is closed");
    }
  }

  @Override
  public String toString() {
    return "WriterDestination[" + name + "]";
  }
}
