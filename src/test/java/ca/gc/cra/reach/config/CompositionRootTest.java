package ca.gc.cra.reach.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.reach.application.port.LivenessProbePort;
import ca.gc.cra.reach.application.port.TcpProbePort;
import ca.gc.cra.reach.domain.scan.ProbeResult;
import ca.gc.cra.reach.domain.scan.ScanPlan;
import ca.gc.cra.reach.domain.scan.ScanReport;
import ca.gc.cra.reach.infrastructure.persistence.ConsoleResultSink;
import ca.gc.cra.reach.infrastructure.persistence.UnsupportedOutputFormatException;
import java.io.IOException;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private final List<String> console = new CopyOnWriteArrayList<>();
  private final TcpProbePort tcp =
      (task, timeout) -> task.port() == 443 ? ProbeResult.open(task) : ProbeResult.notOpen(task);
  private final LivenessProbePort liveness = (host, timeout) -> !host.endsWith(".2");

  @Test
  void wiresUseCaseWithLiveOpenLines() throws IOException, InterruptedException {
    ScanConfig config = config(Map.of("cidr", "10.0.0.0/30", "ports", "80,443", "pingFirst", "true"));

    ScanReport report;
    try (CompositionRoot root = new CompositionRoot(config, console::add, tcp, liveness)) {
      report = root.scanUseCase().execute(plan(config, List.of("10.0.0.1", "10.0.0.2")));
      root.resultSink().write(report.openPairs());
    }

    assertEquals(1, report.probedHosts());
    assertEquals(List.of("[+] 10.0.0.1:443 open", "Open ports:", "10.0.0.1:443"), console);
  }

  @Test
  void noPrintSuppressesLiveLines() throws InterruptedException {
    ScanConfig config = config(Map.of("host", "10.0.0.1", "ports", "443", "noPrint", "true"));

    try (CompositionRoot root = new CompositionRoot(config, console::add, tcp, liveness)) {
      ScanReport report = root.scanUseCase().execute(plan(config, List.of("10.0.0.1")));
      assertEquals(1, report.openCount());
    }

    assertTrue(console.isEmpty());
  }

  @Test
  void resultSinkFollowsOutputSetting() {
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of("host", "h", "ports", "1")), console::add, tcp, liveness)) {
      assertInstanceOf(ConsoleResultSink.class, root.resultSink());
    }
    try (CompositionRoot root = new CompositionRoot(
        config(Map.of("host", "h", "ports", "1", "out", "result.xml")), console::add, tcp, liveness)) {
      assertThrows(UnsupportedOutputFormatException.class, root::resultSink);
    }
  }

  private static ScanConfig config(Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap(DefaultsForMode.SCAN));
    options.putAll(overrides);
    return ScanConfig.fromMap(options);
  }

  private static ScanPlan plan(ScanConfig config, List<String> hosts) {
    return new ScanPlan(hosts, config.ports(), Duration.ofMillis(100), 2, config.pingFirst());
  }
}
