package ca.gc.cra.blog.domain.format;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PlaceholderScannerTest {

  private static String render(String format, Object... args) {
    StringRenderTarget out = new StringRenderTarget();
    PlaceholderScanner.render(format, args, out);
    return out.toString();
  }

  @Test
  void substitutesArgumentsInOrder() {
    StringRenderTarget out = new StringRenderTarget();

    int rendered = PlaceholderScanner.render("hello %s, you are %d", new Object[] {"world", 3}, out);

    assertEquals(2, rendered);
    assertEquals("hello world, you are 3", out.toString());
  }

  @Test
  void formatWithoutPlaceholdersIsCopied() {
    assertEquals("plain text", render("plain text"));
    StringRenderTarget out = new StringRenderTarget();
    assertEquals(0, PlaceholderScanner.render("no args", null, out));
    assertEquals("no args", out.toString());
  }

  @Test
  void doublePercentWritesOneLiteralPercent() {
    assertEquals("100% sure", render("100%% sure"));
    assertEquals("7%", render("%d%%", 7));
  }

  @Test
  void backslashOutsidePlaceholderIsOrdinaryText() {
    assertEquals("C:\\temp\\logs", render("C:\\temp\\logs"));
  }

  @Test
  void singleBackslashInsidePlaceholderIsDropped() {
    assertEquals("x=7", render("x=%\\d", 7));
  }

  @Test
  void doubleBackslashInsidePlaceholderWritesOneBackslash() {
    assertEquals("\\name", render("%\\\\s", "name"));
  }

  @Test
  void percentInsideOpenPlaceholderAbandonsIt() {
    assertEquals("50%59", render("50%5%d", 9));
    assertEquals("a%-b", render("a%-%s", "b"));
  }

  @Test
  void placeholderOpenAtEndIsWrittenLiterally() {
    assertEquals("rate 10%", render("rate 10%"));
    assertEquals("trailing %-5", render("trailing %-5"));
  }

  @Test
  void modifiersReachTheVerb() {
    assertEquals("[   42|ab   |3.14]", render("[%5d|%-5s|%.2f]", 42, "ab", 3.14159));
  }

  @Test
  void missingArgumentThrows() {
    FormatException ex = assertThrows(FormatException.class, () -> render("%s and %s", "one"));
    assertTrue(ex.getMessage().contains("%s"), ex.getMessage());
  }

  @Test
  void extraArgumentThrows() {
    assertThrows(FormatException.class, () -> render("only %d", 1, 2));
    assertThrows(FormatException.class, () -> render("none", "extra"));
  }

  @Test
  void argumentOfWrongKindThrows() {
    assertThrows(FormatException.class, () -> render("%d", "not a number"));
  }
}
