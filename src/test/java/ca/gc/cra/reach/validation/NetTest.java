package ca.gc.cra.reach.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NetTest {

  @Test
  void parsesAndFormatsIpv4() {
    assertEquals(0xC0A8_0101L, Net.parseIpv4("192.168.1.1"));
    assertEquals(Net.MAX_IPV4, Net.parseIpv4("255.255.255.255"));
    assertEquals("10.0.1.0", Net.formatIpv4(Net.parseIpv4("10.0.0.255") + 1));
  }

  @Test
  void rejectsMalformedIpv4() {
    assertThrows(IllegalArgumentException.class, () -> Net.parseIpv4("256.0.0.1"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseIpv4("10.0.0"));
    assertThrows(IllegalArgumentException.class, () -> Net.parseIpv4("example.org"));
    assertThrows(IllegalArgumentException.class, () -> Net.formatIpv4(Net.MAX_IPV4 + 1));
  }

  @Test
  void recognisesDottedQuadShape() {
    assertTrue(Net.looksLikeIpv4(" 10.0.0.1 "));
    assertTrue(Net.looksLikeIpv4("10.0.0.999"));
    assertFalse(Net.looksLikeIpv4("db-01.example.org"));
    assertFalse(Net.looksLikeIpv4("10.0.0"));
    assertFalse(Net.looksLikeIpv4(null));
  }
}
