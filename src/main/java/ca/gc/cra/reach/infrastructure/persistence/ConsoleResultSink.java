package ca.gc.cra.reach.infrastructure.persistence;

import ca.gc.cra.reach.application.port.ResultSinkPort;
import ca.gc.cra.reach.domain.scan.OpenPair;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Prints open pairs as {@code host:port} lines after a header, or a single notice when nothing is open.
 *
 * @since 0.1.0
 */
public final class ConsoleResultSink implements ResultSinkPort {
  static final String HEADER = "Open ports:";
  static final String NONE_FOUND = "No open ports found.";

  private final Consumer<String> lines;

  /**
   * Creates a console sink.
   *
   * @param lines receives each output line, typically the CLI printer
   */
  public ConsoleResultSink(Consumer<String> lines) {
    this.lines = Objects.requireNonNull(lines, "lines");
  }

  @Override
  public void write(List<OpenPair> openPairs) {
    if (openPairs.isEmpty()) {
      lines.accept(NONE_FOUND);
      return;
    }
    lines.accept(HEADER);
    for (OpenPair pair : openPairs) {
      lines.accept(pair.host() + ":" + pair.port());
    }
  }

  @Override
  public String describe() {
    return "console";
  }
}
