package ca.gc.cra.reach.domain.target;

import ca.gc.cra.reach.validation.Net;
import ca.gc.cra.reach.validation.Paths;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Resolves a {@link HostSpec} into a concrete, ordered list of host identifiers.
 * <p><strong>Role:</strong> Leaf domain component run once, synchronously, before any probing.</p>
 * <p><strong>Ordering:</strong> CIDR blocks and ranges enumerate in ascending address order; hosts files keep
 * their line order.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class TargetExpander {
  /** Upper bound on hosts produced by a single CIDR block or range (a {@code /8}). */
  public static final long MAX_EXPANDED_HOSTS = 1L << 24;

  private TargetExpander() {}

  /**
   * Resolves the specification and rejects empty results.
   *
   * @param spec target specification; must not be {@code null}
   * @return immutable ordered host list, never empty
   * @throws InvalidTargetSpecException if literals do not parse or the hosts file cannot be read
   * @throws EmptyTargetSpecException if the specification yields no hosts
   */
  public static List<String> expand(HostSpec spec) {
    Objects.requireNonNull(spec, "spec");
    List<String> hosts;
    if (spec instanceof HostSpec.Cidr cidr) {
      hosts = expandCidr(cidr.block());
    } else if (spec instanceof HostSpec.Range range) {
      hosts = expandRange(range.start(), range.end());
    } else if (spec instanceof HostSpec.HostsFile file) {
      hosts = loadHostsFile(file.path());
    } else {
      // HostSpec is sealed; Single is the only remaining form
      hosts = singleHost(((HostSpec.Single) spec).host());
    }
    if (hosts.isEmpty()) {
      throw new EmptyTargetSpecException("No target hosts resolved from " + spec.describe());
    }
    return hosts;
  }

  /**
   * Expands a CIDR block into its usable host addresses.
   *
   * <p>Host bits in the address are masked (non-strict parsing). Network and broadcast addresses are excluded
   * for prefixes up to {@code /30}; a {@code /31} yields both addresses and a {@code /32} the single address.
   * The prefix may also be written as a dotted netmask; a bare address is treated as {@code /32}.</p>
   *
   * @param block CIDR text such as {@code 192.168.1.0/24}
   * @return ascending host addresses
   * @throws InvalidTargetSpecException if the block does not parse or is larger than {@link #MAX_EXPANDED_HOSTS}
   */
  public static List<String> expandCidr(String block) {
    if (block == null || block.isBlank()) {
      throw new InvalidTargetSpecException("CIDR block must not be blank");
    }
    String trimmed = block.trim();
    int slash = trimmed.indexOf('/');
    String addressPart = slash < 0 ? trimmed : trimmed.substring(0, slash);
    String prefixPart = slash < 0 ? "32" : trimmed.substring(slash + 1).trim();

    long address = parseAddress(addressPart, trimmed);
    int prefix = parsePrefix(prefixPart, trimmed);

    long size = 1L << (32 - prefix);
    if (size > MAX_EXPANDED_HOSTS) {
      throw new InvalidTargetSpecException(
          "CIDR block " + trimmed + " expands to " + size + " addresses (limit " + MAX_EXPANDED_HOSTS + ")");
    }
    long mask = (Net.MAX_IPV4 << (32 - prefix)) & Net.MAX_IPV4;
    long network = address & mask;
    long broadcast = network + size - 1;

    long first = network;
    long last = broadcast;
    if (prefix <= 30) {
      first = network + 1;
      last = broadcast - 1;
    }
    return enumerate(first, last);
  }

  /**
   * Enumerates every IPv4 address between two endpoints, inclusive, swapping reversed endpoints.
   *
   * @param start first IPv4 literal
   * @param end last IPv4 literal
   * @return ascending host addresses
   * @throws InvalidTargetSpecException if either endpoint is not an IPv4 literal or the range is too large
   */
  public static List<String> expandRange(String start, String end) {
    long lo = parseAddress(start, "range start");
    long hi = parseAddress(end, "range end");
    if (lo > hi) {
      long swap = lo;
      lo = hi;
      hi = swap;
    }
    long size = hi - lo + 1;
    if (size > MAX_EXPANDED_HOSTS) {
      throw new InvalidTargetSpecException(
          "IP range " + start + " - " + end + " spans " + size + " addresses (limit " + MAX_EXPANDED_HOSTS + ")");
    }
    return enumerate(lo, hi);
  }

  /**
   * Reads one host per line, skipping blank lines and {@code #} comments, preserving file order.
   *
   * @param path UTF-8 hosts file
   * @return hosts in file order; may be empty
   * @throws InvalidTargetSpecException if the file cannot be opened or read
   */
  public static List<String> loadHostsFile(Path path) {
    Objects.requireNonNull(path, "path");
    Path file;
    try {
      file = Paths.requireReadableFile("hostsFile", path);
    } catch (IllegalArgumentException ex) {
      throw new InvalidTargetSpecException("Unable to read hosts file: " + ex.getMessage(), ex);
    }
    List<String> hosts = new ArrayList<>();
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        String trimmed = line.strip();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        hosts.add(trimmed);
      }
    } catch (IOException ex) {
      throw new InvalidTargetSpecException("Unable to read hosts file " + path + ": " + ex.getMessage(), ex);
    }
    return List.copyOf(hosts);
  }

  private static List<String> singleHost(String host) {
    String value = host.strip();
    if (value.isEmpty()) {
      throw new InvalidTargetSpecException("Single host must not be blank");
    }
    if (Net.looksLikeIpv4(value)) {
      parseAddress(value, "host " + value);
    }
    return List.of(value);
  }

  private static long parseAddress(String literal, String context) {
    try {
      return Net.parseIpv4(literal);
    } catch (IllegalArgumentException ex) {
      throw new InvalidTargetSpecException("Invalid IPv4 address in " + context + ": " + ex.getMessage(), ex);
    }
  }

  private static int parsePrefix(String raw, String block) {
    if (raw.isEmpty()) {
      throw new InvalidTargetSpecException("CIDR block " + block + " is missing a prefix length");
    }
    if (raw.indexOf('.') >= 0) {
      return netmaskToPrefix(raw, block);
    }
    for (int i = 0; i < raw.length(); i++) {
      if (!Character.isDigit(raw.charAt(i))) {
        throw new InvalidTargetSpecException("CIDR prefix must be numeric in " + block);
      }
    }
    if (raw.length() > 2) {
      throw new InvalidTargetSpecException("CIDR prefix must be between 0 and 32 in " + block);
    }
    int prefix = Integer.parseInt(raw);
    if (prefix > 32) {
      throw new InvalidTargetSpecException("CIDR prefix must be between 0 and 32 in " + block);
    }
    return prefix;
  }

  private static int netmaskToPrefix(String raw, String block) {
    long mask = parseAddress(raw, "netmask of " + block);
    int prefix = Long.bitCount(mask);
    long expected = (Net.MAX_IPV4 << (32 - prefix)) & Net.MAX_IPV4;
    if (mask != expected) {
      throw new InvalidTargetSpecException("Netmask " + raw + " is not contiguous in " + block);
    }
    return prefix;
  }

  private static List<String> enumerate(long first, long last) {
    if (last < first) {
      return List.of();
    }
    List<String> hosts = new ArrayList<>((int) (last - first + 1));
    for (long current = first; current <= last; current++) {
      hosts.add(Net.formatIpv4(current));
    }
    return List.copyOf(hosts);
  }
}
