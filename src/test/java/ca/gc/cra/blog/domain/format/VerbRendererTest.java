package ca.gc.cra.blog.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigInteger;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class VerbRendererTest {

  private static String render(String placeholder, Object arg) {
    int verb = placeholder.length() - 1;
    FormatModifiers modifiers = FormatModifiers.parse(placeholder, 1, verb);
    return VerbRenderer.render(placeholder.charAt(verb), modifiers, arg);
  }

  @Test
  void recognisesEveryVerb() {
    for (char c : "dfvboxXcptsTqUeEgG".toCharArray()) {
      assertTrue(VerbRenderer.isVerb(c), "verb " + c);
    }
    assertFalse(VerbRenderer.isVerb('z'));
    assertFalse(VerbRenderer.isVerb('%'));
    assertFalse(VerbRenderer.isVerb('5'));
  }

  @Test
  void rendersIntegersInEachRadix() {
    assertEquals("42", render("%d", 42));
    assertEquals("-7", render("%d", -7L));
    assertEquals("101", render("%b", 5));
    assertEquals("10", render("%o", 8));
    assertEquals("ff", render("%x", 255));
    assertEquals("FF", render("%X", 255));
    assertEquals("18446744073709551616", render("%d", BigInteger.ONE.shiftLeft(64)));
  }

  @Test
  void alternateFlagAddsRadixPrefix() {
    assertEquals("0xff", render("%#x", 255));
    assertEquals("010", render("%#o", 8));
    assertEquals("0b11", render("%#b", 3));
  }

  @Test
  void signAndZeroPadding() {
    assertEquals("+5", render("%+d", 5));
    assertEquals("-0042", render("%05d", -42));
    assertEquals("   42", render("%5d", 42));
    assertEquals("42   ", render("%-5d", 42));
    assertEquals("007", render("%.3d", 7));
  }

  @Test
  void hexEncodesStringsAndBytes() {
    assertEquals("6869", render("%x", "hi"));
    assertEquals("01 AB", render("% X", new byte[] {0x01, (byte) 0xAB}));
  }

  @Test
  void rendersFloatingPointWithRootLocale() {
    assertEquals("3.14", render("%.2f", 3.14159));
    assertEquals("1.500000", render("%f", 1.5f));
    assertEquals("1.234568e+04", render("%e", 12345.678));
    assertEquals("  2.50", render("%6.2f", 2.5));
  }

  @Test
  void genericAndStringVerbs() {
    assertEquals("null", render("%v", null));
    assertEquals("[1, 2]", render("%v", new int[] {1, 2}));
    assertEquals("abc", render("%.3s", "abcdef"));
    assertEquals("bytes", render("%s", "bytes".getBytes(java.nio.charset.StandardCharsets.UTF_8)));
    assertEquals("   ab", render("%5s", "ab"));
  }

  @Test
  void characterQuoteAndUnicodeVerbs() {
    assertEquals("A", render("%c", 65));
    assertEquals("\"a\\\"b\\n\"", render("%q", "a\"b\n"));
    assertEquals("'x'", render("%q", 'x'));
    assertEquals("U+1F600", render("%U", 0x1F600));
    assertEquals("U+0041 'A'", render("%#U", 65));
  }

  @Test
  void truthPointerAndTypeVerbs() {
    assertEquals("true", render("%t", Boolean.TRUE));
    assertEquals("PT5S", render("%t", Duration.ofSeconds(5)));
    assertEquals("0x0", render("%p", null));
    assertTrue(render("%p", new Object()).startsWith("0x"));
    assertEquals("java.lang.String", render("%T", "x"));
    assertEquals("int[]", render("%T", new int[0]));
  }

  @Test
  void mismatchedArgumentsThrow() {
    assertThrows(FormatException.class, () -> render("%d", "abc"));
    assertThrows(FormatException.class, () -> render("%f", "abc"));
    assertThrows(FormatException.class, () -> render("%t", "yes"));
    assertThrows(FormatException.class, () -> render("%c", -1));
  }
}
