package ca.gc.cra.blog.application.port;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the timestamp cache.
 * <p><strong>Why:</strong> Lets tests drive timestamp refreshes with a deterministic clock.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; every writing thread may read the clock
 * when the cached timestamp expires.</p>
 * <p><strong>Performance:</strong> Expected to be constant-time.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.blog.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();
}
