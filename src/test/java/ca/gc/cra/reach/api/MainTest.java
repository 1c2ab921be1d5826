package ca.gc.cra.reach.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsSummaryUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: reach <scan|targets>"));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("targets     Print the hosts"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture", "iface=en0"}));
  }

  @Test
  void dispatchesToTargetsWithoutCommandWord() {
    ExitCode code = Main.run(new String[] {"targets", "host=10.0.0.7"});

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of("10.0.0.7"), buffer.toString().lines().toList());
  }

  @Test
  void dispatchesScanHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"SCAN", "--help"}));
    assertTrue(buffer.toString().contains("REACH TCP reachability scan"));
  }
}
