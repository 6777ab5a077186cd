package ca.gc.cra.blog.infrastructure.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * Fixed-capacity buffered stream over a rebindable sink.
 *
 * <p>Each {@link #write(byte[], int, int)} call is treated as one record: when the record does not fit in the
 * remaining space the buffer is drained first, and records at least as large as the buffer bypass it. A failed
 * drain therefore never leaves part of a record in the buffer.</p>
 *
 * <p>Not thread-safe; the owning writer serializes access.</p>
 */
public final class SinkBufferedOutputStream extends OutputStream {
  private OutputStream delegate;
  private final byte[] buffer;
  private int position;
  private boolean closed;

  /**
   * Creates a stream buffering up to {@code capacity} bytes in front of {@code delegate}.
   *
   * @param delegate destination sink; must not be {@code null}
   * @param capacity buffer size in bytes; must be positive
   */
  public SinkBufferedOutputStream(OutputStream delegate, int capacity) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.buffer = new byte[capacity];
    this.position = 0;
  }

  @Override
  public void write(int b) throws IOException {
    ensureOpen();
    if (position == buffer.length) {
      flushBuffer();
    }
    buffer[position++] = (byte) b;
  }

  @Override
  public void write(byte[] b, int off, int len) throws IOException {
    ensureOpen();
    Objects.checkFromIndexSize(off, len, b.length);
    if (len == 0) {
      return;
    }
    if (len > buffer.length - position) {
      flushBuffer();
    }
    if (len >= buffer.length) {
      delegate.write(b, off, len);
      return;
    }
    System.arraycopy(b, off, buffer, position, len);
    position += len;
  }

  @Override
  public void flush() throws IOException {
    ensureOpen();
    flushBuffer();
    delegate.flush();
  }

  /**
   * Drains buffered bytes into the current sink and rebinds the stream to {@code next}.
   *
   * <p>The buffer capacity is unchanged. When draining fails the stream stays bound to the current sink with
   * its buffered bytes intact.</p>
   *
   * @param next new sink; must not be {@code null}
   * @return the previous sink, now detached; the caller owns it
   * @throws IOException when draining into the current sink fails
   */
  public OutputStream reset(OutputStream next) throws IOException {
    Objects.requireNonNull(next, "next");
    ensureOpen();
    flushBuffer();
    delegate.flush();
    OutputStream previous = delegate;
    delegate = next;
    return previous;
  }

  /**
   * Returns the sink currently bound to this stream.
   */
  public OutputStream sink() {
    return delegate;
  }

  /**
   * Returns the number of bytes waiting in the buffer.
   */
  public int bufferedBytes() {
    return position;
  }

  /**
   * Returns the buffer capacity in bytes.
   */
  public int capacity() {
    return buffer.length;
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    IOException error = null;
    try {
      flushBuffer();
      delegate.flush();
    } catch (IOException flushError) {
      error = flushError;
    }
    try {
      delegate.close();
    } catch (IOException closeError) {
      if (error == null) {
        error = closeError;
      } else {
        error.addSuppressed(closeError);
      }
    } finally {
      closed = true;
    }
    if (error != null) {
      throw error;
    }
  }

  private void flushBuffer() throws IOException {
    if (position == 0) {
      return;
    }
    delegate.write(buffer, 0, position);
    position = 0;
  }

  private void ensureOpen() throws IOException {
    if (closed) {
      throw new IOException("stream closed");
    }
  }
}
