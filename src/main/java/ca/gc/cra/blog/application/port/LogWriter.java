package ca.gc.cra.blog.application.port;

import ca.gc.cra.blog.domain.level.Level;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;

/**
 * <strong>What:</strong> Port for leveled, buffered message writers.
 * <p><strong>Why:</strong> Lets façades and CLI adapters depend on the write contract instead of the concrete
 * buffered implementation.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append {@code timestamp ++ level prefix ++ body ++ '\n'} records and report their byte length.</li>
 *   <li>Manage the buffer lifecycle: flush, destination swap, close.</li>
 *   <li>Store the severity threshold consulted by callers.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must serialize all buffer and sink mutations.</p>
 * <p><strong>Errors:</strong> Writes, flushes, and swaps after {@link #close()} fail with
 * {@code WriterClosedException}; sink failures propagate as {@link IOException}.</p>
 *
 * @since 0.1.0
 */
public interface LogWriter extends Closeable {
  /**
   * Returns the current severity threshold.
   *
   * @return threshold level
   */
  Level level();

  /**
   * Replaces the severity threshold.
   *
   * @param level new threshold; must not be {@code null}
   */
  void setLevel(Level level);

  /**
   * Appends a literal message without placeholder interpretation.
   *
   * @param level level whose prefix tags the record
   * @param message message text
   * @return number of bytes appended for this record
   * @throws IllegalArgumentException when the encoded record would not fit in a Java array; nothing is appended
   * @throws IOException when draining a full buffer into the sink fails
   */
  int write(Level level, String message) throws IOException;

  /**
   * Renders a format string against positional arguments and appends the result.
   *
   * @param level level whose prefix tags the record
   * @param format format string with {@code %} placeholders
   * @param args one argument per placeholder
   * @return number of bytes appended for this record
   * @throws ca.gc.cra.blog.domain.format.FormatException when placeholders and arguments do not line up; nothing
   *     is appended
   * @throws IllegalArgumentException when the encoded record would not fit in a Java array; nothing is appended
   * @throws IOException when draining a full buffer into the sink fails
   */
  int writeFormatted(Level level, String format, Object... args) throws IOException;

  /**
   * Forces buffered bytes to the destination.
   *
   * @throws IOException when the sink rejects the bytes
   */
  void flush() throws IOException;

  /**
   * Drains the buffer into the current destination and continues on {@code destination}.
   *
   * @param destination new sink, owned by the writer from now on
   * @throws IOException when draining into the current destination fails; the writer keeps it in that case
   */
  void resetDestination(OutputStream destination) throws IOException;

  /**
   * Flushes, closes the destination, and invalidates the writer. Repeated calls are no-ops.
   *
   * @throws IOException when the final flush or the destination close fails
   */
  @Override
  void close() throws IOException;
}
