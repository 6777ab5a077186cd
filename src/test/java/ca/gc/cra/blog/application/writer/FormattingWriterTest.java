package ca.gc.cra.blog.application.writer;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.blog.application.port.TimestampSource;
import ca.gc.cra.blog.domain.format.FormatException;
import ca.gc.cra.blog.domain.level.Level;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class FormattingWriterTest {
  private static final byte[] STAMP = "2024/05/01:13:45:07 ".getBytes(StandardCharsets.US_ASCII);

  private CapturingSink sink;
  private RecordingMetricsPort metrics;
  private FormattingWriter writer;

  @BeforeEach
  void setUp() {
    sink = new CapturingSink();
    metrics = new RecordingMetricsPort();
    writer = newWriter(sink, 4096, () -> ByteBuffer.wrap(STAMP).asReadOnlyBuffer());
  }

  @AfterEach
  void tearDown() throws IOException {
    writer.close();
  }

  private FormattingWriter newWriter(CapturingSink target, int bufferSize, TimestampSource timestamps) {
    return new FormattingWriter(
        target, new FormattingWriter.Settings(bufferSize, Level.DEBUG), timestamps, metrics);
  }

  @Test
  void writeAppendsTimestampPrefixMessageAndNewline() throws IOException {
    int written = writer.write(Level.INFO, "service started");
    writer.flush();

    String expected = "2024/05/01:13:45:07 [INFO] service started\n";
    assertEquals(expected, sink.text());
    assertEquals(expected.getBytes(StandardCharsets.UTF_8).length, written);
  }

  @Test
  void writeDoesNotInterpretPlaceholders() throws IOException {
    writer.write(Level.WARN, "disk 100% full: %s %d");
    writer.flush();

    assertEquals("2024/05/01:13:45:07 [WARN] disk 100% full: %s %d\n", sink.text());
  }

  @Test
  void returnedLengthCountsUtf8Bytes() throws IOException {
    FormattingWriter plain = newWriter(new CapturingSink(), 4096, TimestampSource.NONE);

    assertEquals("[INFO] é\n".getBytes(StandardCharsets.UTF_8).length, plain.write(Level.INFO, "é"));
    assertEquals(10, plain.write(Level.INFO, "é"));
    plain.close();
  }

  @Test
  void writeFormattedRendersArguments() throws IOException {
    int written = writer.writeFormatted(Level.ERROR, "hello %s, you are %d", "world", 3);
    writer.flush();

    String expected = "2024/05/01:13:45:07 [ERROR] hello world, you are 3\n";
    assertEquals(expected, sink.text());
    assertEquals(expected.length(), written);
  }

  @Test
  void formatErrorAppendsNothing() throws IOException {
    writer.write(Level.INFO, "before");
    int buffered = writer.bufferedBytes();

    assertThrows(FormatException.class, () -> writer.writeFormatted(Level.INFO, "%s and %s", "one"));
    assertThrows(FormatException.class, () -> writer.writeFormatted(Level.INFO, "%d", "x"));

    assertEquals(buffered, writer.bufferedBytes());
    assertEquals(2, metrics.count("writer.format.errors"));
    writer.write(Level.INFO, "after");
    writer.flush();
    assertEquals("2024/05/01:13:45:07 [INFO] before\n2024/05/01:13:45:07 [INFO] after\n", sink.text());
  }

  @Test
  void recordsStayBufferedUntilCapacityIsReached() throws IOException {
    CapturingSink small = new CapturingSink();
    FormattingWriter buffered = newWriter(small, 64, TimestampSource.NONE);
    String record = "[INFO] 0123456789\n";

    buffered.write(Level.INFO, "0123456789");
    buffered.write(Level.INFO, "0123456789");
    buffered.write(Level.INFO, "0123456789");
    assertEquals(0, small.size());

    buffered.write(Level.INFO, "0123456789");
    assertEquals(record.repeat(3), small.text());
    assertEquals(record.length(), buffered.bufferedBytes());
    buffered.close();
  }

  @Test
  void recordLargerThanBufferIsWrittenThrough() throws IOException {
    CapturingSink small = new CapturingSink();
    FormattingWriter buffered = newWriter(small, 64, TimestampSource.NONE);
    String message = "x".repeat(100);

    int written = buffered.write(Level.DEBUG, message);

    assertEquals(109, written);
    assertEquals("[DEBUG] " + message + "\n", small.text());
    assertEquals(0, buffered.bufferedBytes());
    buffered.close();
  }

  @Test
  void multiMebibyteMessagesAreWrittenWhole() throws IOException {
    int length = 11 * 1024 * 1024 + 1;
    String message = "x".repeat(length);
    int header = STAMP.length + "[INFO] ".length();

    int literal = writer.write(Level.INFO, message);
    int formatted = writer.writeFormatted(Level.INFO, "%s", message);
    writer.flush();

    assertEquals(header + length + 1, literal);
    assertEquals(literal, formatted);
    assertEquals(2L * literal, sink.size());
    assertEquals(2, metrics.count("writer.lines"));
  }

  @Test
  void smallRecordsStillWorkAfterALargeOne() throws IOException {
    writer.write(Level.INFO, "y".repeat(12 * 1024 * 1024));
    writer.flush();
    int before = sink.size();

    writer.write(Level.WARN, "small");
    writer.flush();

    assertEquals(before + STAMP.length + "[WARN] small\n".length(), sink.size());
  }

  @Test
  void flushIsIdempotent() throws IOException {
    writer.write(Level.INFO, "once");
    writer.flush();
    String afterFirst = sink.text();

    writer.flush();

    assertEquals(afterFirst, sink.text());
    assertEquals(2, metrics.count("writer.flushes"));
  }

  @Test
  void resetDestinationConservesEveryRecord() throws IOException {
    CapturingSink next = new CapturingSink();
    writer.write(Level.INFO, "first");

    writer.resetDestination(next);
    writer.write(Level.INFO, "second");
    writer.flush();

    assertEquals("2024/05/01:13:45:07 [INFO] first\n", sink.text());
    assertTrue(sink.closed());
    assertEquals("2024/05/01:13:45:07 [INFO] second\n", next.text());
    assertFalse(next.closed());
    assertEquals(1, metrics.count("writer.destination.swaps"));
  }

  @Test
  void resetToSameDestinationOnlyFlushes() throws IOException {
    writer.write(Level.INFO, "kept");

    writer.resetDestination(sink);

    assertEquals("2024/05/01:13:45:07 [INFO] kept\n", sink.text());
    assertFalse(sink.closed());
    assertEquals(0, metrics.count("writer.destination.swaps"));
  }

  @Test
  void failureClosingReplacedDestinationDoesNotFailSwap() throws IOException {
    CapturingSink next = new CapturingSink();
    sink.failOnClose(true);
    writer.write(Level.INFO, "old");

    assertDoesNotThrow(() -> writer.resetDestination(next));
    writer.write(Level.INFO, "new");
    writer.flush();

    assertEquals("2024/05/01:13:45:07 [INFO] new\n", next.text());
  }

  @Test
  void failedDrainKeepsBufferedRecordsAndDropsTheNewOne() throws IOException {
    CapturingSink flaky = new CapturingSink();
    FormattingWriter buffered = newWriter(flaky, 64, TimestampSource.NONE);
    buffered.write(Level.INFO, "0123456789");
    buffered.write(Level.INFO, "0123456789");
    buffered.write(Level.INFO, "0123456789");
    flaky.failing(true);

    assertThrows(IOException.class, () -> buffered.write(Level.INFO, "lost-record"));
    assertThrows(IOException.class, () -> buffered.resetDestination(new ByteArrayOutputStream()));
    assertEquals(54, buffered.bufferedBytes());

    flaky.failing(false);
    buffered.flush();
    assertEquals("[INFO] 0123456789\n".repeat(3), flaky.text());
    buffered.close();
  }

  @Test
  void writeThenCloseYieldsOneLineThenRejectsWrites() throws IOException {
    writer.write(Level.CRITICAL, "shutting down");

    writer.close();

    assertEquals("2024/05/01:13:45:07 [CRITICAL] shutting down\n", sink.text());
    assertTrue(sink.closed());
    assertTrue(writer.isClosed());
    assertEquals(0, writer.bufferedBytes());
    assertThrows(WriterClosedException.class, () -> writer.write(Level.INFO, "late"));
    assertThrows(WriterClosedException.class, () -> writer.writeFormatted(Level.INFO, "%s", "late"));
    assertThrows(WriterClosedException.class, () -> writer.flush());
    assertThrows(WriterClosedException.class, () -> writer.resetDestination(new ByteArrayOutputStream()));
  }

  @Test
  void secondCloseIsNoOp() throws IOException {
    writer.close();
    int calls = sink.writeCalls();

    assertDoesNotThrow(() -> writer.close());
    assertEquals(calls, sink.writeCalls());
  }

  @Test
  void closeInvalidatesWriterEvenWhenSinkCloseFails() {
    sink.failOnClose(true);

    assertThrows(IOException.class, () -> writer.close());
    assertTrue(writer.isClosed());
    assertThrows(WriterClosedException.class, () -> writer.write(Level.INFO, "late"));
  }

  @Test
  void levelIsStoredButNotEnforcedByTheWriter() throws IOException {
    writer.setLevel(Level.ERROR);

    assertEquals(Level.ERROR, writer.level());
    assertFalse(writer.isEnabled(Level.INFO));
    assertTrue(writer.isEnabled(Level.CRITICAL));
    assertTrue(writer.write(Level.DEBUG, "still written") > 0);
  }

  @Test
  void recordsLineAndByteMetrics() throws IOException {
    int first = writer.write(Level.INFO, "a");
    int second = writer.writeFormatted(Level.INFO, "%d", 12);

    assertEquals(2, metrics.count("writer.lines"));
    assertEquals(List.of((long) first, (long) second), metrics.observed("writer.bytes"));
  }

  @Test
  void settingsRejectOutOfRangeBufferSizes() {
    assertThrows(IllegalArgumentException.class, () -> new FormattingWriter.Settings(63, Level.INFO));
    assertThrows(IllegalArgumentException.class,
        () -> new FormattingWriter.Settings(FormattingWriter.MAX_BUFFER_SIZE + 1, Level.INFO));
    assertEquals(FormattingWriter.DEFAULT_BUFFER_SIZE, FormattingWriter.Settings.defaults().bufferSize());
    assertEquals(Level.DEBUG, FormattingWriter.Settings.defaults().initialLevel());
  }
}
