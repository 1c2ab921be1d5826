package ca.gc.cra.reach.infrastructure.net;

import ca.gc.cra.reach.application.port.TcpProbePort;
import ca.gc.cra.reach.domain.scan.ProbeResult;
import ca.gc.cra.reach.domain.scan.ProbeTask;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link TcpProbePort} adapter performing a blocking {@link Socket#connect(java.net.SocketAddress, int)} with a
 * connect timeout.
 *
 * <p>A completed handshake is {@code OPEN}; timeouts, refusals, unreachable networks and resolution failures are
 * all {@code NOT_OPEN}. The socket is closed immediately after the handshake, no payload is sent.</p>
 *
 * <p>Thread-safe; each probe opens its own socket.</p>
 *
 * @since 0.1.0
 */
public final class SocketTcpProbe implements TcpProbePort {
  private static final Logger log = LoggerFactory.getLogger(SocketTcpProbe.class);

  private final Supplier<Socket> socketFactory;

  /**
   * Creates a probe backed by plain {@link Socket} instances.
   */
  public SocketTcpProbe() {
    this(Socket::new);
  }

  SocketTcpProbe(Supplier<Socket> socketFactory) {
    this.socketFactory = Objects.requireNonNull(socketFactory, "socketFactory");
  }

  @Override
  public ProbeResult probe(ProbeTask task, Duration timeout) {
    Objects.requireNonNull(task, "task");
    int timeoutMillis = toTimeoutMillis(timeout);
    try (Socket socket = socketFactory.get()) {
      socket.connect(new InetSocketAddress(task.host(), task.port()), timeoutMillis);
      return ProbeResult.open(task);
    } catch (IOException ex) {
      log.trace("Probe {} not open: {}", task, ex.toString());
      return ProbeResult.notOpen(task);
    } catch (RuntimeException ex) {
      // IllegalArgumentException / SecurityException from address construction or connect
      log.debug("Probe {} failed unexpectedly: {}", task, ex.toString());
      return ProbeResult.notOpen(task);
    }
  }

  static int toTimeoutMillis(Duration timeout) {
    Objects.requireNonNull(timeout, "timeout");
    long millis = timeout.toMillis();
    // connect() treats 0 as "no timeout"
    if (millis < 1) {
      return 1;
    }
    return (int) Math.min(Integer.MAX_VALUE, millis);
  }
}
