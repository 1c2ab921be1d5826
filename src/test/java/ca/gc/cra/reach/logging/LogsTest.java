package ca.gc.cra.reach.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateShortensAndReportsOriginalLength() {
    assertEquals("abc... (truncated, 6 chars)", Logs.truncate("abcdef", 3));
    assertEquals("abcdef", Logs.truncate("abcdef", 6));
  }

  @Test
  void truncateReplacesControlCharacters() {
    assertEquals("a?b", Logs.truncate("a\nb", 10));
    assertEquals("<null>", Logs.truncate(null, 10));
  }

  @Test
  void truncateRequiresPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void progressFormatsPercentage() {
    assertEquals("100/2540 (3.9%)", Logs.progress(100, 2540));
    assertEquals("2540/2540 (100.0%)", Logs.progress(2540, 2540));
    assertEquals("0/0 (100.0%)", Logs.progress(0, 0));
  }
}
