package ca.gc.cra.blog.domain.format;

/**
 * Byte-oriented destination the placeholder scanner renders into.
 *
 * <p>Implementations encode text as UTF-8. They are not expected to be thread-safe; the caller owns the
 * target for the duration of one render.</p>
 *
 * @since 0.1.0
 */
public interface RenderTarget {
  /**
   * Appends the UTF-8 encoding of {@code text[start, end)}.
   *
   * @param text source characters
   * @param start first character index, inclusive
   * @param end last character index, exclusive
   */
  void appendText(CharSequence text, int start, int end);

  /**
   * Appends the UTF-8 encoding of {@code text}.
   *
   * @param text source characters
   */
  default void appendText(CharSequence text) {
    appendText(text, 0, text.length());
  }

  /**
   * Appends a single ASCII character.
   *
   * @param c character in the range {@code 0x00-0x7F}
   */
  void appendAscii(char c);
}
