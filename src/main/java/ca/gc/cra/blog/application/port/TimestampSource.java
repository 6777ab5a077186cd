package ca.gc.cra.blog.application.port;

import java.nio.ByteBuffer;

/**
 * <strong>What:</strong> Port supplying the pre-rendered timestamp written in front of each record.
 * <p><strong>Why:</strong> Keeps time rendering out of the write path; writers copy the bytes as-is.</p>
 * <p><strong>Contract:</strong> Each call returns a read-only buffer with its own position, so callers may
 * consume it but cannot alter the cached bytes. Refresh cadence is owned by the implementation.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent readers.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.blog.infrastructure.time.CachedTimestampSource
 */
public interface TimestampSource {
  /**
   * Returns the bytes representing "now".
   *
   * @return read-only timestamp bytes between position and limit, possibly empty; never {@code null}
   */
  ByteBuffer current();

  /**
   * Source that writes no timestamp.
   */
  TimestampSource NONE = new TimestampSource() {
    private final ByteBuffer empty = ByteBuffer.allocate(0).asReadOnlyBuffer();

    @Override
    public ByteBuffer current() {
      return empty;
    }
  };
}
