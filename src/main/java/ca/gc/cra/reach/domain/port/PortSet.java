package ca.gc.cra.reach.domain.port;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Immutable set of TCP port numbers in {@code [1, 65535]}, iterated in ascending order.
 * <p><strong>Role:</strong> Domain value produced by {@link PortSpecParser} and consumed by the scan engine.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the backing array is never exposed.</p>
 *
 * @since 0.1.0
 */
public final class PortSet implements Iterable<Integer> {
  /** Lowest valid TCP port. */
  public static final int MIN_PORT = 1;
  /** Highest valid TCP port. */
  public static final int MAX_PORT = 65_535;

  private static final PortSet EMPTY = new PortSet(new int[0]);

  private final int[] ports;

  private PortSet(int[] ports) {
    this.ports = ports;
  }

  /**
   * Builds a set from a bitmap of port numbers; bits outside {@code [1, 65535]} are ignored.
   *
   * @param bits port bitmap indexed by port number
   * @return immutable set
   */
  static PortSet fromBits(BitSet bits) {
    int[] values = bits.stream()
        .filter(p -> p >= MIN_PORT && p <= MAX_PORT)
        .toArray();
    return values.length == 0 ? EMPTY : new PortSet(values);
  }

  /**
   * Creates a set from explicit values; duplicates collapse and out-of-range values are dropped.
   *
   * @param values candidate port numbers
   * @return immutable set
   */
  public static PortSet of(int... values) {
    BitSet bits = new BitSet(MAX_PORT + 1);
    for (int value : values) {
      if (value >= MIN_PORT && value <= MAX_PORT) {
        bits.set(value);
      }
    }
    return fromBits(bits);
  }

  /**
   * Returns the empty set.
   *
   * @return shared empty instance
   */
  public static PortSet empty() {
    return EMPTY;
  }

  /**
   * Returns the number of ports in the set.
   *
   * @return cardinality
   */
  public int size() {
    return ports.length;
  }

  public boolean isEmpty() {
    return ports.length == 0;
  }

  /**
   * Tests membership.
   *
   * @param port candidate port
   * @return {@code true} if the port is present
   */
  public boolean contains(int port) {
    return Arrays.binarySearch(ports, port) >= 0;
  }

  /**
   * Returns the ports as a fresh ascending array.
   *
   * @return copy of the ports
   */
  public int[] toArray() {
    return ports.clone();
  }

  /**
   * Renders the canonical specification: ascending, with runs of consecutive ports collapsed to ranges,
   * e.g. {@code 22,80,8000-8010}. Parsing it yields an equal set.
   *
   * @return specification string, empty for the empty set
   */
  public String toSpec() {
    StringJoiner joiner = new StringJoiner(",");
    int i = 0;
    while (i < ports.length) {
      int runEnd = i;
      while (runEnd + 1 < ports.length && ports[runEnd + 1] == ports[runEnd] + 1) {
        runEnd++;
      }
      joiner.add(runEnd == i ? Integer.toString(ports[i]) : ports[i] + "-" + ports[runEnd]);
      i = runEnd + 1;
    }
    return joiner.toString();
  }

  @Override
  public Iterator<Integer> iterator() {
    return new Iterator<>() {
      private int index;

      @Override
      public boolean hasNext() {
        return index < ports.length;
      }

      @Override
      public Integer next() {
        if (index >= ports.length) {
          throw new NoSuchElementException();
        }
        return ports[index++];
      }
    };
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    return other instanceof PortSet that && Arrays.equals(ports, that.ports);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(ports);
  }

  @Override
  public String toString() {
    return "PortSet[size=" + ports.length + "]";
  }
}
