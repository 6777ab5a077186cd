package ca.gc.cra.blog.application.writer;

import ca.gc.cra.blog.application.port.LogWriter;
import ca.gc.cra.blog.domain.level.Level;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;

/**
 * <strong>What:</strong> Per-level convenience methods over a {@link LogWriter}.
 * <p><strong>Role:</strong> Decides emission. A call at level {@code L} reaches the writer only when
 * {@code L.isAtLeast(writer.level())}; filtered calls return {@code 0} without touching the buffer.</p>
 * <p><strong>Errors:</strong> Sink failures surface as {@link UncheckedIOException};
 * {@link ca.gc.cra.blog.domain.format.FormatException} and {@link WriterClosedException} pass through.</p>
 * <p><strong>Thread-safety:</strong> Same as the wrapped writer.</p>
 *
 * @since 0.1.0
 */
public final class LeveledWriter implements AutoCloseable {
  private final LogWriter writer;

  /**
   * Wraps a writer. The façade takes ownership and closes it in {@link #close()}.
   *
   * @param writer underlying writer
   */
  public LeveledWriter(LogWriter writer) {
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  public Level level() {
    return writer.level();
  }

  public void setLevel(Level level) {
    writer.setLevel(level);
  }

  /**
   * Checks the threshold.
   *
   * @param level candidate level
   * @return {@code true} when a call at {@code level} would be written
   */
  public boolean isEnabled(Level level) {
    return level.isAtLeast(writer.level());
  }

  /**
   * Writes a literal message when {@code level} passes the threshold.
   *
   * @param level message level
   * @param message message text
   * @return bytes appended, or {@code 0} when filtered
   */
  public int log(Level level, String message) {
    Objects.requireNonNull(level, "level");
    if (!isEnabled(level)) {
      return 0;
    }
    try {
      return writer.write(level, message);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write " + level + " record", ex);
    }
  }

  /**
   * Renders and writes a formatted message when {@code level} passes the threshold. Arguments are not inspected
   * for filtered calls.
   *
   * @param level message level
   * @param format format string
   * @param args positional arguments
   * @return bytes appended, or {@code 0} when filtered
   */
  public int logf(Level level, String format, Object... args) {
    Objects.requireNonNull(level, "level");
    if (!isEnabled(level)) {
      return 0;
    }
    try {
      return writer.writeFormatted(level, format, args);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to write " + level + " record", ex);
    }
  }

  public int debug(String message) {
    return log(Level.DEBUG, message);
  }

  public int debugf(String format, Object... args) {
    return logf(Level.DEBUG, format, args);
  }

  public int trace(String message) {
    return log(Level.TRACE, message);
  }

  public int tracef(String format, Object... args) {
    return logf(Level.TRACE, format, args);
  }

  public int info(String message) {
    return log(Level.INFO, message);
  }

  public int infof(String format, Object... args) {
    return logf(Level.INFO, format, args);
  }

  public int warn(String message) {
    return log(Level.WARN, message);
  }

  public int warnf(String format, Object... args) {
    return logf(Level.WARN, format, args);
  }

  public int error(String message) {
    return log(Level.ERROR, message);
  }

  public int errorf(String format, Object... args) {
    return logf(Level.ERROR, format, args);
  }

  public int critical(String message) {
    return log(Level.CRITICAL, message);
  }

  public int criticalf(String format, Object... args) {
    return logf(Level.CRITICAL, format, args);
  }

  /**
   * Flushes the wrapped writer.
   */
  public void flush() {
    try {
      writer.flush();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to flush writer", ex);
    }
  }

  /**
   * Closes the wrapped writer; repeated calls are no-ops.
   */
  @Override
  public void close() {
    try {
      writer.close();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to close writer", ex);
    }
  }
}
