package ca.gc.cra.blog.application.writer;

import ca.gc.cra.blog.application.port.LogWriter;
import ca.gc.cra.blog.application.port.MetricsPort;
import ca.gc.cra.blog.application.port.TimestampSource;
import ca.gc.cra.blog.domain.format.FormatException;
import ca.gc.cra.blog.domain.format.PlaceholderScanner;
import ca.gc.cra.blog.domain.level.Level;
import ca.gc.cra.blog.domain.level.LevelGate;
import ca.gc.cra.blog.infrastructure.buffer.GrowableBuffer;
import ca.gc.cra.blog.infrastructure.buffer.RecordTooLargeException;
import ca.gc.cra.blog.infrastructure.buffer.SinkBufferedOutputStream;
import ca.gc.cra.blog.infrastructure.time.CachedTimestampSource;
import ca.gc.cra.blog.validation.Numbers;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Thread-safe writer that renders leveled records into a buffered sink.
 * <p><strong>Why:</strong> Gives callers synchronous, allocation-conscious logging to any {@link OutputStream}
 * without a full logging framework.</p>
 * <p><strong>Role:</strong> Central {@link LogWriter} implementation composed of a {@link LevelGate}, a
 * {@link TimestampSource}, the {@link PlaceholderScanner}, and a {@link SinkBufferedOutputStream}.</p>
 * <p><strong>Record layout:</strong> {@code timestamp ++ level prefix ++ body ++ '\n'}, UTF-8 encoded. Each record
 * is composed in a reusable scratch buffer and committed to the buffered stream in one piece, so a record is
 * appended whole or not at all. Records are not capped below the JVM array limit; one that would exceed it raises
 * {@link RecordTooLargeException} and appends nothing.</p>
 * <p><strong>Thread-safety:</strong> One {@link ReentrantLock} serializes the scratch buffer, the buffered stream,
 * and the destination. The level threshold is volatile and read without the lock.</p>
 * <p><strong>Performance:</strong> Writes copy into memory and return unless the buffer has no room for the
 * record, in which case the caller drains it synchronously.</p>
 * <p><strong>Observability:</strong> Emits {@code writer.lines}, {@code writer.bytes}, {@code writer.flushes},
 * {@code writer.format.errors}, and {@code writer.destination.swaps} through {@link MetricsPort}.</p>
 *
 * @since 0.1.0
 */
public final class FormattingWriter implements LogWriter {
  private static final Logger log = LoggerFactory.getLogger(FormattingWriter.class);

  /** Default buffer capacity: one memory page. */
  public static final int DEFAULT_BUFFER_SIZE = 4096;
  /** Smallest accepted buffer capacity. */
  public static final int MIN_BUFFER_SIZE = 64;
  /** Largest accepted buffer capacity. */
  public static final int MAX_BUFFER_SIZE = 16 * 1024 * 1024;

  private static final byte EOL = '\n';

  private final LevelGate levelGate;
  private final TimestampSource timestamps;
  private final MetricsPort metrics;
  private final ReentrantLock lock = new ReentrantLock();
  private final GrowableBuffer record;
  private final int recordRetainBytes;
  private SinkBufferedOutputStream stream;

  /**
   * Creates a writer with default settings and a system-clock timestamp cache.
   *
   * @param destination sink owned by the writer from now on
   */
  public FormattingWriter(OutputStream destination) {
    this(destination, Settings.defaults(), new CachedTimestampSource(), MetricsPort.NO_OP);
  }

  /**
   * Creates a writer.
   *
   * @param destination sink owned by the writer from now on
   * @param settings buffer capacity and initial threshold
   * @param timestamps source of the bytes written in front of each record
   * @param metrics metrics sink; use {@link MetricsPort#NO_OP} to disable
   */
  public FormattingWriter(
      OutputStream destination, Settings settings, TimestampSource timestamps, MetricsPort metrics) {
    Objects.requireNonNull(destination, "destination");
    Objects.requireNonNull(settings, "settings");
    this.timestamps = Objects.requireNonNull(timestamps, "timestamps");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.levelGate = new LevelGate(settings.initialLevel());
    this.stream = new SinkBufferedOutputStream(destination, settings.bufferSize());
    this.recordRetainBytes = settings.bufferSize();
    this.record = new GrowableBuffer(Math.min(settings.bufferSize(), 512));
  }

  @Override
  public Level level() {
    return levelGate.threshold();
  }

  @Override
  public void setLevel(Level level) {
    levelGate.setThreshold(level);
  }

  /**
   * Checks whether a message at {@code level} passes the current threshold.
   *
   * @param level candidate level
   * @return {@code true} when the message should be written
   */
  public boolean isEnabled(Level level) {
    return levelGate.allows(level);
  }

  @Override
  public int write(Level level, String message) throws IOException {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(message, "message");
    lock.lock();
    try {
      SinkBufferedOutputStream out = requireOpen("write");
      appendHeader(level);
      try {
        record.appendText(message);
        record.writeByte(EOL);
      } catch (RecordTooLargeException ex) {
        discardRecord();
        throw ex;
      }
      return commit(out);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int writeFormatted(Level level, String format, Object... args) throws IOException {
    Objects.requireNonNull(level, "level");
    Objects.requireNonNull(format, "format");
    lock.lock();
    try {
      SinkBufferedOutputStream out = requireOpen("write");
      appendHeader(level);
      try {
        PlaceholderScanner.render(format, args, record);
        record.writeByte(EOL);
      } catch (FormatException ex) {
        discardRecord();
        metrics.increment("writer.format.errors");
        throw ex;
      } catch (RecordTooLargeException ex) {
        discardRecord();
        throw ex;
      }
      return commit(out);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void flush() throws IOException {
    lock.lock();
    try {
      requireOpen("flush").flush();
      metrics.increment("writer.flushes");
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void resetDestination(OutputStream destination) throws IOException {
    Objects.requireNonNull(destination, "destination");
    OutputStream previous;
    lock.lock();
    try {
      SinkBufferedOutputStream out = requireOpen("reset destination");
      if (out.sink() == destination) {
        out.flush();
        return;
      }
      previous = out.reset(destination);
      metrics.increment("writer.destination.swaps");
      log.debug("Writer destination swapped to {}", destination.getClass().getName());
      try {
        previous.close();
      } catch (IOException ex) {
        log.warn("Failed to close replaced destination {}", previous.getClass().getName(), ex);
      }
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void close() throws IOException {
    lock.lock();
    try {
      SinkBufferedOutputStream out = stream;
      if (out == null) {
        return;
      }
      stream = null;
      record.reset(MIN_BUFFER_SIZE);
      out.close();
      log.debug("Writer closed");
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the number of bytes waiting in the buffer, or {@code 0} once closed.
   *
   * @return buffered byte count
   */
  public int bufferedBytes() {
    lock.lock();
    try {
      return stream == null ? 0 : stream.bufferedBytes();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Indicates whether {@link #close()} has run.
   *
   * @return {@code true} once closed
   */
  public boolean isClosed() {
    lock.lock();
    try {
      return stream == null;
    } finally {
      lock.unlock();
    }
  }

  private void appendHeader(Level level) {
    record.clear();
    record.write(timestamps.current());
    record.appendText(level.prefix());
  }

  private int commit(SinkBufferedOutputStream out) throws IOException {
    int size = record.readableBytes();
    try {
      out.write(record.array(), 0, size);
    } finally {
      discardRecord();
    }
    metrics.increment("writer.lines");
    metrics.observe("writer.bytes", size);
    return size;
  }

  private void discardRecord() {
    record.reset(recordRetainBytes);
  }

  private SinkBufferedOutputStream requireOpen(String operation) {
    SinkBufferedOutputStream out = stream;
    if (out == null) {
      throw new WriterClosedException(operation);
    }
    return out;
  }

  /**
   * Construction-time settings.
   *
   * @param bufferSize buffered-stream capacity in bytes, {@value #MIN_BUFFER_SIZE} to {@value #MAX_BUFFER_SIZE}
   * @param initialLevel starting threshold
   */
  public record Settings(int bufferSize, Level initialLevel) {
    /**
     * Validates the settings.
     *
     * @throws IllegalArgumentException when the buffer size is out of range
     */
    public Settings {
      Numbers.requireRange("bufferSize", bufferSize, MIN_BUFFER_SIZE, MAX_BUFFER_SIZE);
      Objects.requireNonNull(initialLevel, "initialLevel");
    }

    /**
     * Returns page-sized buffering with the most verbose threshold.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(DEFAULT_BUFFER_SIZE, Level.DEBUG);
    }
  }
}
