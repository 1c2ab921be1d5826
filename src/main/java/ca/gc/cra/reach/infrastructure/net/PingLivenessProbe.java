package ca.gc.cra.reach.infrastructure.net;

import ca.gc.cra.reach.application.port.LivenessProbePort;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link LivenessProbePort} adapter that shells out to the platform {@code ping} command with a single packet.
 *
 * <p>Command lines per platform:
 * <ul>
 *   <li>Windows: {@code ping -n 1 -w <millis> host}</li>
 *   <li>macOS: {@code ping -c 1 -W <millis> host}</li>
 *   <li>Linux and other Unix: {@code ping -c 1 -W <seconds> host}</li>
 * </ul>
 * Exit status 0 means alive. A non-zero status, a launch failure, a child process that outlives the timeout
 * plus {@link #PROCESS_GRACE}, or interruption all mean not alive.</p>
 *
 * <p>Thread-safe; each call starts its own child process.</p>
 *
 * @since 0.1.0
 */
public final class PingLivenessProbe implements LivenessProbePort {
  private static final Logger log = LoggerFactory.getLogger(PingLivenessProbe.class);

  /** Extra time granted to the child process beyond the ping timeout before it is destroyed. */
  static final Duration PROCESS_GRACE = Duration.ofSeconds(2);

  private final Platform platform;
  private final CommandRunner runner;

  /**
   * Creates a probe for the running operating system.
   */
  public PingLivenessProbe() {
    this(Platform.detect(System.getProperty("os.name", "")), PingLivenessProbe::runProcess);
  }

  PingLivenessProbe(Platform platform, CommandRunner runner) {
    this.platform = Objects.requireNonNull(platform, "platform");
    this.runner = Objects.requireNonNull(runner, "runner");
  }

  @Override
  public boolean isAlive(String host, Duration timeout) {
    if (host == null || host.isBlank() || host.startsWith("-")) {
      return false;
    }
    List<String> command = command(host, timeout);
    try {
      int exit = runner.run(command, timeout.plus(PROCESS_GRACE));
      log.trace("ping {} exited with {}", host, exit);
      return exit == 0;
    } catch (IOException ex) {
      log.debug("ping {} could not be executed: {}", host, ex.toString());
      return false;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("ping {} interrupted", host);
      return false;
    } catch (RuntimeException ex) {
      log.debug("ping {} failed: {}", host, ex.toString());
      return false;
    }
  }

  /**
   * Builds the ping command line for this platform.
   *
   * @param host target host
   * @param timeout answer timeout
   * @return command and arguments
   */
  List<String> command(String host, Duration timeout) {
    long millis = Math.max(1, timeout.toMillis());
    long seconds = Math.max(1, timeout.getSeconds());
    return switch (platform) {
      case WINDOWS -> List.of("ping", "-n", "1", "-w", Long.toString(millis), host);
      case MAC -> List.of("ping", "-c", "1", "-W", Long.toString(millis), host);
      case UNIX -> List.of("ping", "-c", "1", "-W", Long.toString(seconds), host);
    };
  }

  private static int runProcess(List<String> command, Duration limit)
      throws IOException, InterruptedException {
    Process process = new ProcessBuilder(command)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .redirectError(ProcessBuilder.Redirect.DISCARD)
        .start();
    try {
      if (!process.waitFor(limit.toMillis(), TimeUnit.MILLISECONDS)) {
        log.trace("ping exceeded {} ms; destroying {}", limit.toMillis(), command);
        return -1;
      }
      return process.exitValue();
    } finally {
      if (process.isAlive()) {
        process.destroyForcibly();
      }
    }
  }

  /** Operating-system families with distinct ping flags. */
  enum Platform {
    WINDOWS,
    MAC,
    UNIX;

    static Platform detect(String osName) {
      String normalized = osName == null ? "" : osName.toLowerCase(Locale.ROOT);
      if (normalized.startsWith("windows")) {
        return WINDOWS;
      }
      if (normalized.contains("mac") || normalized.contains("darwin")) {
        return MAC;
      }
      return UNIX;
    }
  }

  /** Runs a command and returns its exit status, or a negative value when it timed out. */
  @FunctionalInterface
  interface CommandRunner {
    int run(List<String> command, Duration limit) throws IOException, InterruptedException;
  }
}
