package ca.gc.cra.blog.domain.format;

/**
 * Flags, width and precision captured between a {@code %} and its verb.
 *
 * <p>Grammar: {@code [-+# 0]* [width] [.precision]}. Escape markers ({@code \}) inside the placeholder are
 * handled by the scanner and skipped here.</p>
 *
 * @param leftAlign {@code -}: pad on the right instead of the left
 * @param plus {@code +}: always print a sign for numbers
 * @param space {@code ' '}: leave a space for the sign of positive numbers; separates hex bytes
 * @param zeroPad {@code 0}: pad numbers with leading zeros
 * @param alternate {@code #}: radix prefixes and alternate forms
 * @param width minimum field width, or {@code -1} when absent
 * @param precision precision, or {@code -1} when absent
 * @since 0.1.0
 */
public record FormatModifiers(
    boolean leftAlign,
    boolean plus,
    boolean space,
    boolean zeroPad,
    boolean alternate,
    int width,
    int precision) {

  /** Modifiers of a bare placeholder such as {@code %d}. */
  public static final FormatModifiers NONE = new FormatModifiers(false, false, false, false, false, -1, -1);

  private static final int MAX_WIDTH = 4096;

  /**
   * Parses the modifier text {@code format[start, end)}.
   *
   * @param format full format string
   * @param start index just after the opening {@code %}
   * @param end index of the verb character
   * @return parsed modifiers
   * @throws FormatException when the text does not follow the modifier grammar
   */
  public static FormatModifiers parse(String format, int start, int end) {
    if (start >= end) {
      return NONE;
    }
    boolean leftAlign = false;
    boolean plus = false;
    boolean space = false;
    boolean zeroPad = false;
    boolean alternate = false;
    int width = -1;
    int precision = -1;

    int i = start;
    flags:
    for (; i < end; i++) {
      switch (format.charAt(i)) {
        case '-' -> leftAlign = true;
        case '+' -> plus = true;
        case ' ' -> space = true;
        case '0' -> zeroPad = true;
        case '#' -> alternate = true;
        case '\\' -> { }
        default -> {
          break flags;
        }
      }
    }
    int digitsStart = i;
    int value = 0;
    for (; i < end && isDigitOrEscape(format.charAt(i)); i++) {
      value = accumulate(value, format.charAt(i), format, start, end);
    }
    if (hasDigits(format, digitsStart, i)) {
      width = value;
    }
    if (i < end && format.charAt(i) == '.') {
      i++;
      value = 0;
      for (; i < end && isDigitOrEscape(format.charAt(i)); i++) {
        value = accumulate(value, format.charAt(i), format, start, end);
      }
      precision = value;
    }
    if (i != end) {
      throw new FormatException("unsupported modifier '" + format.charAt(i) + "' in placeholder "
          + format.substring(start - 1, end + 1));
    }
    return new FormatModifiers(leftAlign, plus, space, zeroPad, alternate, width, precision);
  }

  /**
   * Indicates whether a field width was given.
   *
   * @return {@code true} when {@link #width()} is meaningful
   */
  public boolean hasWidth() {
    return width >= 0;
  }

  /**
   * Indicates whether a precision was given.
   *
   * @return {@code true} when {@link #precision()} is meaningful
   */
  public boolean hasPrecision() {
    return precision >= 0;
  }

  private static boolean isDigitOrEscape(char c) {
    return (c >= '0' && c <= '9') || c == '\\';
  }

  private static boolean hasDigits(String format, int from, int to) {
    for (int i = from; i < to; i++) {
      if (format.charAt(i) != '\\') {
        return true;
      }
    }
    return false;
  }

  private static int accumulate(int value, char c, String format, int start, int end) {
    if (c == '\\') {
      return value;
    }
    int next = value * 10 + (c - '0');
    if (next > MAX_WIDTH) {
      throw new FormatException("width or precision exceeds " + MAX_WIDTH + " in placeholder "
          + format.substring(start - 1, end + 1));
    }
    return next;
  }
}
