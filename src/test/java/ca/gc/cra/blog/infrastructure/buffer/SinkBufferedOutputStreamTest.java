package ca.gc.cra.blog.infrastructure.buffer;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import org.junit.jupiter.api.Test;

class SinkBufferedOutputStreamTest {

  @Test
  void holdsRecordsUntilTheNextOneDoesNotFit() throws IOException {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(sink, 16);

    stream.write(bytes(10, 'a'), 0, 10);
    assertEquals(0, sink.size());
    assertEquals(10, stream.bufferedBytes());

    stream.write(bytes(10, 'b'), 0, 10);
    assertArrayEquals(bytes(10, 'a'), sink.toByteArray());
    assertEquals(10, stream.bufferedBytes());
  }

  @Test
  void recordsAsLargeAsTheBufferBypassIt() throws IOException {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(sink, 16);
    stream.write(bytes(4, 'a'), 0, 4);

    stream.write(bytes(16, 'b'), 0, 16);

    assertEquals(20, sink.size());
    assertEquals(0, stream.bufferedBytes());
  }

  @Test
  void flushDrainsBufferedBytes() throws IOException {
    ByteArrayOutputStream sink = new ByteArrayOutputStream();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(sink, 64);
    stream.write('x');
    stream.write(bytes(3, 'y'), 0, 3);

    stream.flush();
    stream.flush();

    assertEquals("xyyy", sink.toString());
    assertEquals(0, stream.bufferedBytes());
  }

  @Test
  void resetDrainsIntoOldSinkAndRebinds() throws IOException {
    ByteArrayOutputStream first = new ByteArrayOutputStream();
    ByteArrayOutputStream second = new ByteArrayOutputStream();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(first, 64);
    stream.write(bytes(5, 'a'), 0, 5);

    OutputStream previous = stream.reset(second);
    stream.write(bytes(3, 'b'), 0, 3);
    stream.flush();

    assertSame(first, previous);
    assertSame(second, stream.sink());
    assertEquals("aaaaa", first.toString());
    assertEquals("bbb", second.toString());
    assertEquals(64, stream.capacity());
  }

  @Test
  void failedDrainKeepsSinkAndBufferedBytes() throws IOException {
    FlakySink sink = new FlakySink();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(sink, 16);
    stream.write(bytes(10, 'a'), 0, 10);
    sink.failing = true;

    assertThrows(IOException.class, () -> stream.write(bytes(10, 'b'), 0, 10));
    assertThrows(IOException.class, () -> stream.reset(new ByteArrayOutputStream()));
    assertSame(sink, stream.sink());
    assertEquals(10, stream.bufferedBytes());

    sink.failing = false;
    stream.flush();
    assertArrayEquals(bytes(10, 'a'), sink.data.toByteArray());
  }

  @Test
  void closeFlushesClosesAndRejectsFurtherWrites() throws IOException {
    FlakySink sink = new FlakySink();
    SinkBufferedOutputStream stream = new SinkBufferedOutputStream(sink, 16);
    stream.write(bytes(2, 'z'), 0, 2);

    stream.close();
    stream.close();

    assertEquals("zz", sink.data.toString());
    assertTrue(sink.closed);
    assertThrows(IOException.class, () -> stream.write('q'));
  }

  private static byte[] bytes(int length, char fill) {
    byte[] out = new byte[length];
    java.util.Arrays.fill(out, (byte) fill);
    return out;
  }

  private static final class FlakySink extends OutputStream {
    final ByteArrayOutputStream data = new ByteArrayOutputStream();
    boolean failing;
    boolean closed;

    @Override
    public void write(int b) throws IOException {
      if (failing) {
        throw new IOException("sink unavailable");
      }
      data.write(b);
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
      if (failing) {
        throw new IOException("sink unavailable");
      }
      data.write(b, off, len);
    }

    @Override
    public void close() {
      closed = true;
    }
  }
}
