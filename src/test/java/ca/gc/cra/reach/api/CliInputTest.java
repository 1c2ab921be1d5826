package ca.gc.cra.reach.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesCommandOptionsFlagsAndPositionals() {
    CliInput input = CliInput.parse(new String[] {
        "Scan", "cidr=10.0.0.0/24", "--ping-first", "--DRY-RUN", "extra", "-v"});

    assertEquals(Optional.of("scan"), input.command());
    assertArrayEquals(new String[] {"cidr=10.0.0.0/24"}, input.keyValueArgs());
    assertEquals(List.of("extra"), input.positionals());
    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--dry-run"));
    assertEquals(Map.of("pingFirst", "true", "dryRun", "true"), input.flagOptions());
    assertTrue(input.unknownFlags().isEmpty());
  }

  @Test
  void helpAliasesAreRecognized() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertTrue(CliInput.parse(new String[] {"--HELP"}).help());
  }

  @Test
  void unknownFlagsKeepCommandLineOrder() {
    CliInput input = CliInput.parse(new String[] {"--zeta", "--no-print", "--alpha"});

    assertEquals(List.of("--zeta", "--alpha"), input.unknownFlags());
    assertEquals(Map.of("noPrint", "true"), input.flagOptions());
  }

  @Test
  void emptyInput() {
    CliInput input = CliInput.parse(null);

    assertTrue(input.command().isEmpty());
    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.hasFlag(null));
  }
}
