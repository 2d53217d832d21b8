package ca.gc.cra.scout.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void missingCommandPrintsUsage() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: scout"));
  }

  @Test
  void unknownCommandIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void helpListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("deployments"));
  }

  @Test
  void subcommandHelpIsDelegated() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"collect", "--help"}));
    assertTrue(buffer.toString().contains("scout collect"));
    assertTrue(buffer.toString().contains("paths are read on the host running scout"));
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"deployments", "-h"}));
    assertTrue(buffer.toString().contains("scout deployments"));
  }

  @Test
  void collectWithoutPodsFailsBeforeTouchingCluster() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"collect", "namespace=uecm"}));
    assertTrue(buffer.toString().contains("usage: collect"));
  }
}
