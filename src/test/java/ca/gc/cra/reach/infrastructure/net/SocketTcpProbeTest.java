package ca.gc.cra.reach.infrastructure.net;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.reach.domain.scan.ProbeOutcome;
import ca.gc.cra.reach.domain.scan.ProbeResult;
import ca.gc.cra.reach.domain.scan.ProbeTask;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketAddress;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class SocketTcpProbeTest {
  private static final Duration TIMEOUT = Duration.ofSeconds(2);

  private final SocketTcpProbe probe = new SocketTcpProbe();

  @Test
  void listeningPortIsOpen() throws IOException {
    try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
      ProbeTask task = new ProbeTask("127.0.0.1", server.getLocalPort());

      ProbeResult result = probe.probe(task, TIMEOUT);

      assertEquals(ProbeOutcome.OPEN, result.outcome());
      assertEquals(task, result.task());
    }
  }

  @Test
  void closedPortIsNotOpen() throws IOException {
    int port;
    try (ServerSocket server = new ServerSocket(0, 50, InetAddress.getLoopbackAddress())) {
      port = server.getLocalPort();
    }

    ProbeResult result = probe.probe(new ProbeTask("127.0.0.1", port), TIMEOUT);

    assertFalse(result.isOpen());
  }

  @Test
  void unresolvableHostIsNotOpen() {
    ProbeResult result = probe.probe(new ProbeTask("no-such-host.invalid", 80), TIMEOUT);

    assertFalse(result.isOpen());
  }

  @Test
  void connectTimeoutIsPassedInMillisecondsAndSocketClosed() {
    RecordingSocket socket = new RecordingSocket();
    SocketTcpProbe recording = new SocketTcpProbe(() -> socket);

    ProbeResult result = recording.probe(new ProbeTask("127.0.0.1", 8080), Duration.ofMillis(750));

    assertTrue(result.isOpen());
    assertEquals(750, socket.timeout);
    assertTrue(socket.isClosed());
  }

  @Test
  void runtimeFailureIsNotOpen() {
    SocketTcpProbe failing = new SocketTcpProbe(() -> {
      throw new SecurityException("connect denied");
    });

    assertFalse(failing.probe(new ProbeTask("127.0.0.1", 22), TIMEOUT).isOpen());
  }

  @Test
  void timeoutConversionNeverYieldsInfiniteWait() {
    assertEquals(1, SocketTcpProbe.toTimeoutMillis(Duration.ofNanos(10)));
    assertEquals(500, SocketTcpProbe.toTimeoutMillis(Duration.ofMillis(500)));
    assertEquals(Integer.MAX_VALUE, SocketTcpProbe.toTimeoutMillis(Duration.ofDays(365)));
  }

  private static final class RecordingSocket extends Socket {
    private int timeout = -1;

    @Override
    public void connect(SocketAddress endpoint, int timeout) {
      this.timeout = timeout;
    }
  }
}
