package ca.gc.cra.blog.domain.format;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.IllegalFormatException;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <strong>What:</strong> Renders one placeholder argument according to its verb and modifiers.
 * <p><strong>Role:</strong> Value-to-text step of the placeholder scanner.</p>
 * <p><strong>Verbs:</strong>
 * <ul>
 *   <li>{@code d b o x X}: integers in decimal, binary, octal and hex; {@code x X} also hex-encode strings
 *   and byte arrays.</li>
 *   <li>{@code f e E g G}: floating point via {@link java.util.Formatter}.</li>
 *   <li>{@code v s}: generic value text; {@code s} honours precision as a maximum length.</li>
 *   <li>{@code c q U}: character, quoted string or character, and {@code U+XXXX} code point.</li>
 *   <li>{@code t}: booleans and {@link Duration}s.</li>
 *   <li>{@code p T}: identity pointer and runtime type name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class VerbRenderer {
  private static final char[] HEX_LOWER = "0123456789abcdef".toCharArray();
  private static final char[] HEX_UPPER = "0123456789ABCDEF".toCharArray();

  private VerbRenderer() {}

  /**
   * Checks whether a character selects a rendering rule.
   *
   * @param c candidate character
   * @return {@code true} for one of {@code d f v b o x X c p t s T q U e E g G}
   */
  public static boolean isVerb(char c) {
    return switch (c) {
      case 'd', 'f', 'v', 'b', 'o', 'x', 'X', 'c', 'p', 't', 's', 'T', 'q', 'U', 'e', 'E', 'g', 'G' -> true;
      default -> false;
    };
  }

  /**
   * Renders {@code arg} for the given verb.
   *
   * @param verb verb character; see {@link #isVerb(char)}
   * @param modifiers parsed flags, width and precision
   * @param arg argument to render; may be {@code null}
   * @return rendered text
   * @throws FormatException when the verb cannot render the argument
   */
  public static String render(char verb, FormatModifiers modifiers, Object arg) {
    return switch (verb) {
      case 'd' -> integer(verb, modifiers, arg, 10);
      case 'b' -> integer(verb, modifiers, arg, 2);
      case 'o' -> integer(verb, modifiers, arg, 8);
      case 'x', 'X' -> hex(verb, modifiers, arg);
      case 'f', 'e', 'E', 'g', 'G' -> floating(verb, modifiers, arg);
      case 'v' -> pad(valueText(arg), modifiers);
      case 's' -> pad(truncate(stringText(arg), modifiers), modifiers);
      case 'c' -> pad(Character.toString(codePoint(verb, arg)), modifiers);
      case 'q' -> pad(quoted(verb, arg), modifiers);
      case 'U' -> pad(unicode(verb, modifiers, arg), modifiers);
      case 't' -> pad(truth(verb, arg), modifiers);
      case 'p' -> pad(pointer(arg), modifiers);
      case 'T' -> pad(arg == null ? "null" : arg.getClass().getTypeName(), modifiers);
      default -> throw new FormatException("unknown verb %" + verb);
    };
  }

  private static String integer(char verb, FormatModifiers modifiers, Object arg, int radix) {
    BigInteger value = toBigInteger(arg);
    if (value == null) {
      throw mismatch(verb, arg);
    }
    String digits = value.abs().toString(radix);
    if (verb == 'X') {
      digits = digits.toUpperCase(Locale.ROOT);
    }
    return number(value.signum() < 0, radixPrefix(verb, modifiers), digits, modifiers);
  }

  private static String hex(char verb, FormatModifiers modifiers, Object arg) {
    byte[] bytes = null;
    if (arg instanceof CharSequence text) {
      bytes = text.toString().getBytes(StandardCharsets.UTF_8);
    } else if (arg instanceof byte[] raw) {
      bytes = raw;
    }
    if (bytes == null) {
      return integer(verb, modifiers, arg, 16);
    }
    char[] alphabet = verb == 'X' ? HEX_UPPER : HEX_LOWER;
    int limit = modifiers.hasPrecision() ? Math.min(modifiers.precision(), bytes.length) : bytes.length;
    StringBuilder out = new StringBuilder(limit * 3 + 2);
    for (int i = 0; i < limit; i++) {
      if (modifiers.space() && i > 0) {
        out.append(' ');
      }
      if (modifiers.alternate() && (i == 0 || modifiers.space())) {
        out.append(verb == 'X' ? "0X" : "0x");
      }
      out.append(alphabet[(bytes[i] >> 4) & 0x0F]).append(alphabet[bytes[i] & 0x0F]);
    }
    return pad(out.toString(), modifiers);
  }

  private static String floating(char verb, FormatModifiers modifiers, Object arg) {
    Object value;
    if (arg instanceof BigDecimal decimal) {
      value = decimal;
    } else if (arg instanceof BigInteger big) {
      value = new BigDecimal(big);
    } else if (arg instanceof Number number) {
      value = number.doubleValue();
    } else {
      throw mismatch(verb, arg);
    }
    StringBuilder pattern = new StringBuilder(8).append('%');
    if (modifiers.leftAlign()) {
      pattern.append('-');
    }
    if (modifiers.plus()) {
      pattern.append('+');
    } else if (modifiers.space()) {
      pattern.append(' ');
    }
    if (modifiers.zeroPad() && !modifiers.leftAlign() && modifiers.hasWidth()) {
      pattern.append('0');
    }
    if (modifiers.alternate()) {
      pattern.append('#');
    }
    if (modifiers.hasWidth()) {
      pattern.append(modifiers.width());
    }
    if (modifiers.hasPrecision()) {
      pattern.append('.').append(modifiers.precision());
    }
    pattern.append(verb);
    try {
      return String.format(Locale.ROOT, pattern.toString(), value);
    } catch (IllegalFormatException ex) {
      throw new FormatException("cannot apply %" + pattern.substring(1) + " to " + typeName(arg), ex);
    }
  }

  private static int codePoint(char verb, Object arg) {
    if (arg instanceof Character c) {
      return c;
    }
    BigInteger value = toBigInteger(arg);
    if (value == null || value.bitLength() > 31 || !Character.isValidCodePoint(value.intValue())) {
      throw mismatch(verb, arg);
    }
    return value.intValue();
  }

  private static String quoted(char verb, Object arg) {
    if (arg instanceof CharSequence text) {
      StringBuilder out = new StringBuilder(text.length() + 2).append('"');
      for (int i = 0; i < text.length(); i++) {
        escape(text.charAt(i), '"', out);
      }
      return out.append('"').toString();
    }
    int cp = codePoint(verb, arg);
    StringBuilder out = new StringBuilder(8).append('\'');
    if (Character.isBmpCodePoint(cp)) {
      escape((char) cp, '\'', out);
    } else {
      out.appendCodePoint(cp);
    }
    return out.append('\'').toString();
  }

  private static void escape(char c, char quote, StringBuilder out) {
    switch (c) {
      case '\\' -> out.append("\\\\");
      case '\n' -> out.append("\\n");
      case '\r' -> out.append("\\r");
      case '\t' -> out.append("\\t");
      default -> {
        if (c == quote) {
          out.append('\\').append(c);
        } else if (Character.isISOControl(c)) {
          out.append(String.format(Locale.ROOT, "\\u%04x", (int) c));
        } else {
          out.append(c);
        }
      }
    }
  }

  private static String unicode(char verb, FormatModifiers modifiers, Object arg) {
    int cp = codePoint(verb, arg);
    String text = String.format(Locale.ROOT, "U+%04X", cp);
    if (modifiers.alternate()) {
      text = text + " '" + Character.toString(cp) + "'";
    }
    return text;
  }

  private static String truth(char verb, Object arg) {
    if (arg instanceof Boolean flag) {
      return flag.toString();
    }
    if (arg instanceof Duration duration) {
      return duration.toString();
    }
    throw mismatch(verb, arg);
  }

  private static String pointer(Object arg) {
    if (arg == null) {
      return "0x0";
    }
    return "0x" + Integer.toHexString(System.identityHashCode(arg));
  }

  private static String stringText(Object arg) {
    if (arg instanceof byte[] raw) {
      return new String(raw, StandardCharsets.UTF_8);
    }
    return valueText(arg);
  }

  private static String valueText(Object arg) {
    if (arg == null) {
      return "null";
    }
    if (arg.getClass().isArray()) {
      String wrapped = Arrays.deepToString(new Object[] {arg});
      return wrapped.substring(1, wrapped.length() - 1);
    }
    return String.valueOf(arg);
  }

  private static String truncate(String text, FormatModifiers modifiers) {
    if (!modifiers.hasPrecision() || text.codePointCount(0, text.length()) <= modifiers.precision()) {
      return text;
    }
    return text.substring(0, text.offsetByCodePoints(0, modifiers.precision()));
  }

  private static String number(boolean negative, String prefix, String digits, FormatModifiers modifiers) {
    StringBuilder body = new StringBuilder(digits.length() + 4);
    if (modifiers.hasPrecision()) {
      for (int i = digits.length(); i < modifiers.precision(); i++) {
        body.append('0');
      }
    }
    body.append(digits);

    String sign = negative ? "-" : modifiers.plus() ? "+" : modifiers.space() ? " " : "";
    int length = sign.length() + prefix.length() + body.length();
    if (modifiers.zeroPad() && !modifiers.leftAlign() && !modifiers.hasPrecision()
        && modifiers.width() > length) {
      body.insert(0, "0".repeat(modifiers.width() - length));
    }
    return pad(sign + prefix + body, modifiers);
  }

  private static String radixPrefix(char verb, FormatModifiers modifiers) {
    if (!modifiers.alternate()) {
      return "";
    }
    return switch (verb) {
      case 'b' -> "0b";
      case 'o' -> "0";
      case 'x' -> "0x";
      case 'X' -> "0X";
      default -> "";
    };
  }

  private static String pad(String text, FormatModifiers modifiers) {
    if (!modifiers.hasWidth()) {
      return text;
    }
    int length = text.codePointCount(0, text.length());
    if (length >= modifiers.width()) {
      return text;
    }
    String fill = " ".repeat(modifiers.width() - length);
    return modifiers.leftAlign() ? text + fill : fill + text;
  }

  private static BigInteger toBigInteger(Object arg) {
    if (arg instanceof Long || arg instanceof Integer || arg instanceof Short || arg instanceof Byte
        || arg instanceof AtomicInteger || arg instanceof AtomicLong) {
      return BigInteger.valueOf(((Number) arg).longValue());
    }
    if (arg instanceof BigInteger big) {
      return big;
    }
    if (arg instanceof Character c) {
      return BigInteger.valueOf(c);
    }
    return null;
  }

  private static FormatException mismatch(char verb, Object arg) {
    return new FormatException("%" + verb + " cannot render " + typeName(arg));
  }

  private static String typeName(Object arg) {
    return arg == null ? "null" : arg.getClass().getTypeName();
  }
}
