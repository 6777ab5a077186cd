package ca.gc.cra.blog.infrastructure.time;

import ca.gc.cra.blog.application.port.ClockPort;
import ca.gc.cra.blog.application.port.TimestampSource;
import ca.gc.cra.blog.validation.Numbers;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * {@link TimestampSource} that renders the current time once per refresh window and serves the cached bytes.
 *
 * <p>Windows are aligned to multiples of the refresh interval, so with a one-second interval the cached text
 * changes exactly when the rendered second does. Refreshes happen lazily on the first read after a window
 * ends; concurrent readers may render the same window twice, and the last render wins. Readers receive read-only
 * views of the cached bytes.</p>
 *
 * @since 0.1.0
 */
public final class CachedTimestampSource implements TimestampSource {
  /** Default pattern, rendering for example {@code 2024/05/01:13:45:07 }. */
  public static final String DEFAULT_PATTERN = "yyyy/MM/dd:HH:mm:ss ";
  /** Default refresh interval in milliseconds. */
  public static final long DEFAULT_REFRESH_MILLIS = 1_000L;

  private final ClockPort clock;
  private final DateTimeFormatter formatter;
  private final long refreshMillis;
  private volatile Snapshot snapshot;

  /**
   * Creates a source using the system clock, the default pattern, and the system time zone.
   */
  public CachedTimestampSource() {
    this(new SystemClockAdapter(), DEFAULT_PATTERN, ZoneId.systemDefault(), DEFAULT_REFRESH_MILLIS);
  }

  /**
   * Creates a source.
   *
   * @param clock time source
   * @param pattern {@link DateTimeFormatter} pattern
   * @param zone zone used for rendering
   * @param refreshMillis refresh window in milliseconds, 1 to 60000
   * @throws IllegalArgumentException when the pattern is invalid or the window is out of range
   */
  public CachedTimestampSource(ClockPort clock, String pattern, ZoneId zone, long refreshMillis) {
    this.clock = Objects.requireNonNull(clock, "clock");
    Objects.requireNonNull(pattern, "pattern");
    Objects.requireNonNull(zone, "zone");
    this.formatter = DateTimeFormatter.ofPattern(pattern).withZone(zone);
    this.refreshMillis = Numbers.requireRange("timestampRefreshMillis", refreshMillis, 1, 60_000);
    this.snapshot = render(clock.nowMillis());
  }

  @Override
  public ByteBuffer current() {
    Snapshot current = snapshot;
    long now = clock.nowMillis();
    if (now < current.windowStart() || now >= current.windowStart() + refreshMillis) {
      current = render(now);
      snapshot = current;
    }
    return current.bytes().duplicate();
  }

  private Snapshot render(long now) {
    long windowStart = Math.floorDiv(now, refreshMillis) * refreshMillis;
    byte[] bytes = formatter.format(Instant.ofEpochMilli(windowStart)).getBytes(StandardCharsets.UTF_8);
    return new Snapshot(windowStart, ByteBuffer.wrap(bytes).asReadOnlyBuffer());
  }

  private record Snapshot(long windowStart, ByteBuffer bytes) {}
}
