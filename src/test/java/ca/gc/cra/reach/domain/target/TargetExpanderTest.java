package ca.gc.cra.reach.domain.target;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TargetExpanderTest {
  @TempDir Path tempDir;

  @Test
  void slash24ExcludesNetworkAndBroadcast() {
    List<String> hosts = TargetExpander.expandCidr("192.168.1.0/24");

    assertEquals(254, hosts.size());
    assertEquals("192.168.1.1", hosts.get(0));
    assertEquals("192.168.1.254", hosts.get(253));
  }

  @Test
  void slash30YieldsTwoUsableHosts() {
    assertEquals(List.of("10.0.0.1", "10.0.0.2"), TargetExpander.expandCidr("10.0.0.0/30"));
  }

  @Test
  void slash31YieldsBothAddresses() {
    assertEquals(List.of("10.0.0.4", "10.0.0.5"), TargetExpander.expandCidr("10.0.0.4/31"));
  }

  @Test
  void slash32AndBareAddressYieldTheAddress() {
    assertEquals(List.of("10.1.2.3"), TargetExpander.expandCidr("10.1.2.3/32"));
    assertEquals(List.of("10.1.2.3"), TargetExpander.expandCidr("10.1.2.3"));
  }

  @Test
  void hostBitsAreMasked() {
    assertEquals(TargetExpander.expandCidr("192.168.1.0/24"), TargetExpander.expandCidr("192.168.1.77/24"));
  }

  @Test
  void dottedNetmaskIsAccepted() {
    assertEquals(TargetExpander.expandCidr("10.0.0.0/30"), TargetExpander.expandCidr("10.0.0.0/255.255.255.252"));
  }

  @Test
  void nonContiguousNetmaskIsRejected() {
    assertThrows(InvalidTargetSpecException.class,
        () -> TargetExpander.expandCidr("10.0.0.0/255.0.255.0"));
  }

  @Test
  void malformedBlocksAreRejected() {
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("10.0.0/24"));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("10.0.0.0/33"));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("10.0.0.0/abc"));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("10.0.0.0/"));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("300.0.0.0/24"));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr(" "));
  }

  @Test
  void blocksLargerThanLimitAreRejected() {
    InvalidTargetSpecException ex =
        assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandCidr("10.0.0.0/7"));
    assertTrue(ex.getMessage().contains("limit"));
  }

  @Test
  void rangeIsInclusiveAndOrderInsensitive() {
    List<String> expected = List.of("10.0.0.254", "10.0.0.255", "10.0.1.0", "10.0.1.1");

    assertEquals(expected, TargetExpander.expandRange("10.0.0.254", "10.0.1.1"));
    assertEquals(expected, TargetExpander.expandRange("10.0.1.1", "10.0.0.254"));
    assertEquals(List.of("10.0.0.9"), TargetExpander.expandRange("10.0.0.9", "10.0.0.9"));
  }

  @Test
  void rangeRejectsNonIpv4Endpoints() {
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expandRange("host.example", "10.0.0.1"));
  }

  @Test
  void hostsFileSkipsBlanksAndCommentsAndKeepsOrder() throws IOException {
    Path file = tempDir.resolve("hosts.txt");
    Files.writeString(file, String.join("\n",
        "# lab hosts",
        "10.0.0.9",
        "",
        "   db.internal   ",
        "  # indented comment",
        "10.0.0.2",
        ""), StandardCharsets.UTF_8);

    List<String> hosts = TargetExpander.expand(new HostSpec.HostsFile(file));

    assertEquals(List.of("10.0.0.9", "db.internal", "10.0.0.2"), hosts);
  }

  @Test
  void missingHostsFileIsInvalid() {
    assertThrows(InvalidTargetSpecException.class,
        () -> TargetExpander.expand(new HostSpec.HostsFile(tempDir.resolve("absent.txt"))));
  }

  @Test
  void hostsFileWithOnlyCommentsIsEmpty() throws IOException {
    Path file = tempDir.resolve("empty.txt");
    Files.writeString(file, "# nothing here\n\n", StandardCharsets.UTF_8);

    assertThrows(EmptyTargetSpecException.class, () -> TargetExpander.expand(new HostSpec.HostsFile(file)));
  }

  @Test
  void singleHostIsPassedThroughTrimmed() {
    assertEquals(List.of("scanner.example.org"), TargetExpander.expand(new HostSpec.Single(" scanner.example.org ")));
    assertEquals(List.of("db_primary"), TargetExpander.expand(new HostSpec.Single("db_primary")));
    assertEquals(List.of("[::1]"), TargetExpander.expand(new HostSpec.Single("[::1]")));
    assertEquals(List.of("10.0.0.7"), TargetExpander.expand(new HostSpec.Single("10.0.0.7")));
  }

  @Test
  void singleHostMatchesHostsFileAcceptance() throws IOException {
    Path file = tempDir.resolve("one.txt");
    Files.writeString(file, "db_primary\n", StandardCharsets.UTF_8);

    assertEquals(
        TargetExpander.expand(new HostSpec.HostsFile(file)),
        TargetExpander.expand(new HostSpec.Single("db_primary")));
  }

  @Test
  void singleHostRejectsBlankAndBadIpv4Literal() {
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expand(new HostSpec.Single("  ")));
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expand(new HostSpec.Single("10.0.0.999")));
  }

  @Test
  void hostsFileThatIsADirectoryIsRejected() {
    assertThrows(InvalidTargetSpecException.class, () -> TargetExpander.expand(new HostSpec.HostsFile(tempDir)));
  }

  @Test
  void expandDispatchesOnSpecification() {
    assertEquals(2, TargetExpander.expand(new HostSpec.Cidr("10.0.0.0/30")).size());
    assertEquals(3, TargetExpander.expand(new HostSpec.Range("10.0.0.1", "10.0.0.3")).size());
  }
}
