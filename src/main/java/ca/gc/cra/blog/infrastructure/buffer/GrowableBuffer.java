package ca.gc.cra.blog.infrastructure.buffer;

import ca.gc.cra.blog.domain.format.RenderTarget;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Expandable byte buffer used as the per-writer record scratch.
 * <p>Supports amortized O(1) appends with exponential growth and encodes text to UTF-8 in place, so a record is
 * composed without intermediate {@code byte[]} copies of its literal parts. Text reserves exactly its encoded
 * length, so the only limit on content is {@link #MAX_CAPACITY}, the largest array the JVM allocates.</p>
 */
public final class GrowableBuffer implements RenderTarget {
  private static final int DEFAULT_CAPACITY = 256;
  /** Largest number of bytes the buffer holds. */
  public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;
  private static final byte REPLACEMENT = '?';

  private byte[] data;
  private int writeIndex;

  /**
   * Creates a buffer using the default initial capacity.
   */
  public GrowableBuffer() {
    this(DEFAULT_CAPACITY);
  }

  /**
   * Creates a buffer with a caller-supplied initial capacity.
   *
   * @param initialCapacity minimum backing array size
   * @throws IllegalArgumentException when {@code initialCapacity} is not positive
   */
  public GrowableBuffer(int initialCapacity) {
    if (initialCapacity <= 0) {
      throw new IllegalArgumentException("initialCapacity must be positive");
    }
    data = new byte[Math.min(MAX_CAPACITY, align(initialCapacity))];
    writeIndex = 0;
  }

  /**
   * Appends a single byte into the buffer.
   */
  public void writeByte(byte value) {
    ensureWritable(1);
    data[writeIndex++] = value;
  }

  /**
   * Appends the provided bytes into the buffer, growing it if required.
   *
   * @param src source array; must not be {@code null}
   */
  public void write(byte[] src) {
    Objects.requireNonNull(src, "src");
    if (src.length == 0) {
      return;
    }
    ensureWritable(src.length);
    System.arraycopy(src, 0, data, writeIndex, src.length);
    writeIndex += src.length;
  }

  /**
   * Appends the remaining bytes of {@code src}, advancing its position.
   *
   * @param src source buffer; must not be {@code null}
   */
  public void write(ByteBuffer src) {
    Objects.requireNonNull(src, "src");
    int length = src.remaining();
    if (length == 0) {
      return;
    }
    ensureWritable(length);
    src.get(data, writeIndex, length);
    writeIndex += length;
  }

  @Override
  public void appendText(CharSequence text, int start, int end) {
    Objects.requireNonNull(text, "text");
    Objects.checkFromToIndex(start, end, text.length());
    ensureWritable(encodedLength(text, start, end));
    byte[] dst = data;
    int pos = writeIndex;
    for (int i = start; i < end; i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        dst[pos++] = (byte) c;
      } else if (c < 0x800) {
        dst[pos++] = (byte) (0xC0 | (c >> 6));
        dst[pos++] = (byte) (0x80 | (c & 0x3F));
      } else if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(text.charAt(i + 1))) {
        int cp = Character.toCodePoint(c, text.charAt(++i));
        dst[pos++] = (byte) (0xF0 | (cp >> 18));
        dst[pos++] = (byte) (0x80 | ((cp >> 12) & 0x3F));
        dst[pos++] = (byte) (0x80 | ((cp >> 6) & 0x3F));
        dst[pos++] = (byte) (0x80 | (cp & 0x3F));
      } else if (Character.isSurrogate(c)) {
        dst[pos++] = REPLACEMENT;
      } else {
        dst[pos++] = (byte) (0xE0 | (c >> 12));
        dst[pos++] = (byte) (0x80 | ((c >> 6) & 0x3F));
        dst[pos++] = (byte) (0x80 | (c & 0x3F));
      }
    }
    writeIndex = pos;
  }

  /**
   * Returns the number of bytes {@link #appendText(CharSequence, int, int)} writes for {@code text[start, end)}.
   */
  static long encodedLength(CharSequence text, int start, int end) {
    long length = 0;
    for (int i = start; i < end; i++) {
      char c = text.charAt(i);
      if (c < 0x80) {
        length++;
      } else if (c < 0x800) {
        length += 2;
      } else if (Character.isHighSurrogate(c) && i + 1 < end && Character.isLowSurrogate(text.charAt(i + 1))) {
        length += 4;
        i++;
      } else if (Character.isSurrogate(c)) {
        length++;
      } else {
        length += 3;
      }
    }
    return length;
  }

  @Override
  public void appendAscii(char c) {
    writeByte((byte) c);
  }

  /**
   * Returns the number of readable bytes.
   */
  public int readableBytes() {
    return writeIndex;
  }

  /**
   * Provides the backing array for zero-copy hand-off; valid bytes are {@code [0, readableBytes())}.
   */
  public byte[] array() {
    return data;
  }

  /**
   * Copies all readable bytes into a freshly allocated array.
   */
  public byte[] toByteArray() {
    byte[] out = new byte[writeIndex];
    System.arraycopy(data, 0, out, 0, writeIndex);
    return out;
  }

  /**
   * Ensures at least {@code minWritableBytes} bytes can be appended without reallocating.
   *
   * @throws RecordTooLargeException when the content would exceed {@link #MAX_CAPACITY}
   */
  public void ensureWritable(long minWritableBytes) {
    if (minWritableBytes <= 0) {
      return;
    }
    if (data.length - writeIndex >= minWritableBytes) {
      return;
    }
    long required = (long) writeIndex + minWritableBytes;
    if (required > MAX_CAPACITY) {
      throw new RecordTooLargeException(required, MAX_CAPACITY);
    }
    long newCapacity = data.length;
    while (newCapacity < required) {
      newCapacity <<= 1;
    }
    byte[] next = new byte[(int) Math.min(newCapacity, MAX_CAPACITY)];
    System.arraycopy(data, 0, next, 0, writeIndex);
    data = next;
  }

  /**
   * Clears the buffer content without shrinking its capacity.
   */
  public void clear() {
    writeIndex = 0;
  }

  /**
   * Clears the buffer and shrinks a backing array grown past {@code capacity} (rounded up to a power of two).
   *
   * @param capacity capacity to keep when the current array is larger
   */
  public void reset(int capacity) {
    writeIndex = 0;
    int retained = align(Math.max(1, capacity));
    if (data.length > retained) {
      data = new byte[retained];
    }
  }

  private static int align(int value) {
    int n = 1;
    while (n < value) {
      n <<= 1;
    }
    return n;
  }
}
