package ca.gc.cra.blog.infrastructure.time;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.blog.application.port.ClockPort;
import java.nio.ByteBuffer;
import java.nio.ReadOnlyBufferException;
import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.Test;

class CachedTimestampSourceTest {

  private final AtomicLong now = new AtomicLong(1_500L);
  private final ClockPort clock = now::get;

  private static String text(ByteBuffer bytes) {
    return StandardCharsets.UTF_8.decode(bytes).toString();
  }

  @Test
  void rendersStartOfCurrentWindow() {
    CachedTimestampSource source = new CachedTimestampSource(clock, "HH:mm:ss.SSS ", ZoneOffset.UTC, 1_000);

    assertEquals("00:00:01.000 ", text(source.current()));
  }

  @Test
  void reusesBytesWithinWindowAndRefreshesAfter() {
    CachedTimestampSource source = new CachedTimestampSource(clock, "HH:mm:ss", ZoneOffset.UTC, 1_000);
    assertEquals("00:00:01", text(source.current()));

    now.set(1_999L);
    assertEquals("00:00:01", text(source.current()));

    now.set(2_000L);
    assertEquals("00:00:02", text(source.current()));
  }

  @Test
  void callersCannotAlterCachedBytes() {
    CachedTimestampSource source = new CachedTimestampSource(clock, "HH:mm:ss", ZoneOffset.UTC, 1_000);
    ByteBuffer handed = source.current();

    assertTrue(handed.isReadOnly());
    assertThrows(ReadOnlyBufferException.class, () -> handed.put(0, (byte) 'X'));
    assertThrows(ReadOnlyBufferException.class, () -> handed.array());
    handed.position(handed.limit());

    assertEquals("00:00:01", text(source.current()));
  }

  @Test
  void clockMovingBackwardsRerenders() {
    CachedTimestampSource source = new CachedTimestampSource(clock, "HH:mm:ss", ZoneOffset.UTC, 1_000);
    source.current();

    now.set(500L);

    assertEquals("00:00:00", text(source.current()));
  }

  @Test
  void defaultPatternMatchesDocumentedLayout() {
    now.set(1_714_571_107_000L);
    CachedTimestampSource source = new CachedTimestampSource(
        clock, CachedTimestampSource.DEFAULT_PATTERN, ZoneOffset.UTC, CachedTimestampSource.DEFAULT_REFRESH_MILLIS);

    assertEquals("2024/05/01:13:45:07 ", text(source.current()));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class,
        () -> new CachedTimestampSource(clock, "HH", ZoneOffset.UTC, 0));
    assertThrows(IllegalArgumentException.class,
        () -> new CachedTimestampSource(clock, "HH", ZoneOffset.UTC, 60_001));
    assertThrows(IllegalArgumentException.class,
        () -> new CachedTimestampSource(clock, "{", ZoneOffset.UTC, 1_000));
  }
}
