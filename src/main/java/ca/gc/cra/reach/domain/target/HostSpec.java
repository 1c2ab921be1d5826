package ca.gc.cra.reach.domain.target;

import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Describes where scan targets come from.
 * <p><strong>Why:</strong> Operators address hosts as a CIDR block, an inclusive IPv4 range, a hosts file, or a
 * single host; exactly one form is selected per run.</p>
 * <p><strong>Role:</strong> Domain value object resolved by {@link TargetExpander}.</p>
 * <p><strong>Thread-safety:</strong> All implementations are immutable records.</p>
 *
 * @since 0.1.0
 */
public sealed interface HostSpec
    permits HostSpec.Cidr, HostSpec.Range, HostSpec.HostsFile, HostSpec.Single {

  /**
   * Returns a short operator-facing description used in logs and dry-run plans.
   *
   * @return description such as {@code cidr 10.0.0.0/24}
   */
  String describe();

  /**
   * Network block in {@code address/prefix} notation; host bits in the address are masked.
   *
   * @param block CIDR text, e.g. {@code 192.168.1.0/24}
   */
  record Cidr(String block) implements HostSpec {
    public Cidr {
      Objects.requireNonNull(block, "block");
    }

    @Override
    public String describe() {
      return "cidr " + block;
    }
  }

  /**
   * Inclusive IPv4 range; endpoints may be given in either order.
   *
   * @param start first IPv4 literal
   * @param end last IPv4 literal
   */
  record Range(String start, String end) implements HostSpec {
    public Range {
      Objects.requireNonNull(start, "start");
      Objects.requireNonNull(end, "end");
    }

    @Override
    public String describe() {
      return "range " + start + " - " + end;
    }
  }

  /**
   * Newline-delimited hosts file; blank lines and {@code #} comments are skipped.
   *
   * @param path location of the file
   */
  record HostsFile(Path path) implements HostSpec {
    public HostsFile {
      Objects.requireNonNull(path, "path");
    }

    @Override
    public String describe() {
      return "hosts file " + path;
    }
  }

  /**
   * A single hostname or IP literal.
   *
   * @param host target host
   */
  record Single(String host) implements HostSpec {
    public Single {
      Objects.requireNonNull(host, "host");
    }

    @Override
    public String describe() {
      return "host " + host;
    }
  }
}
