package ca.gc.cra.blog.infrastructure.buffer;

/**
 * Raised when a record's encoded bytes would not fit in a single Java array.
 *
 * <p>Writers discard the partially composed record and remain usable.</p>
 *
 * @since 0.1.0
 */
public class RecordTooLargeException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final long requiredBytes;

  /**
   * Creates an exception describing the rejected size.
   *
   * @param requiredBytes bytes the record needed
   * @param maxBytes largest supported record
   */
  public RecordTooLargeException(long requiredBytes, long maxBytes) {
    super("record of " + requiredBytes + " bytes exceeds maximum of " + maxBytes);
    this.requiredBytes = requiredBytes;
  }

  /**
   * Returns the number of bytes the rejected record needed.
   */
  public long requiredBytes() {
    return requiredBytes;
  }
}
