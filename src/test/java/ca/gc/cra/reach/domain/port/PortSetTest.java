package ca.gc.cra.reach.domain.port;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class PortSetTest {

  @Test
  void iteratesInAscendingOrder() {
    List<Integer> seen = new ArrayList<>();
    for (int port : PortSet.of(443, 22, 80, 22)) {
      seen.add(port);
    }

    assertEquals(List.of(22, 80, 443), seen);
  }

  @Test
  void membershipAndEmptiness() {
    PortSet ports = PortSet.of(22, 80);

    assertTrue(ports.contains(22));
    assertFalse(ports.contains(23));
    assertFalse(ports.isEmpty());
    assertTrue(PortSet.of(0, 65536).isEmpty());
    assertEquals(PortSet.empty(), PortSet.of());
  }

  @Test
  void toArrayReturnsCopy() {
    PortSet ports = PortSet.of(22, 80);
    int[] copy = ports.toArray();
    copy[0] = 9999;

    assertTrue(ports.contains(22));
    assertFalse(ports.contains(9999));
  }

  @Test
  void specCollapsesRuns() {
    assertEquals("22", PortSet.of(22).toSpec());
    assertEquals("1-3,5", PortSet.of(1, 2, 3, 5).toSpec());
    assertEquals("", PortSet.empty().toSpec());
  }
}
