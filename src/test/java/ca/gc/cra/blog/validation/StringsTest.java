package ca.gc.cra.blog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankNullAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0000b"));
  }

  @Test
  void requirePrintableAsciiEnforcesCharsetAndLength() {
    assertEquals("k=v,team=ops", Strings.requirePrintableAscii("attrs", "k=v,team=ops", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 32));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
  }

  @Test
  void containsControlDetectsIsoControls() {
    assertTrue(Strings.containsControl("tab\there"));
    assertFalse(Strings.containsControl("plain text"));
  }
}
