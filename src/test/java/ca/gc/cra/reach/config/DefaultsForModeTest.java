package ca.gc.cra.reach.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void scanDefaultsMatchDocumentedValues() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("scan");

    assertEquals("0.5", defaults.get("timeout"));
    assertEquals("200", defaults.get("workers"));
    assertEquals("false", defaults.get("pingFirst"));
    assertEquals("false", defaults.get("noPrint"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("ports"));
  }

  @Test
  void targetsDefaultsCarryOnlyCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" TARGETS ");

    assertEquals("none", defaults.get("metricsExporter"));
    assertFalse(defaults.containsKey("timeout"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
