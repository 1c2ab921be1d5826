package ca.gc.cra.reach.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("10.0.0.1", Strings.requireNonBlank("host", "  10.0.0.1 "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("host", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("host", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("host", null));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("env=lab", Strings.requirePrintableAscii("attrs", "env=lab", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=lab", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=läb", 16));
  }

  @Test
  void isBlankTreatsNullAsBlank() {
    assertTrue(Strings.isBlank(null));
    assertTrue(Strings.isBlank(" \t"));
    assertFalse(Strings.isBlank("x"));
  }
}
