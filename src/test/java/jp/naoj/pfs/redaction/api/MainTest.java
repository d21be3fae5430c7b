package jp.naoj.pfs.redaction.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import jp.naoj.pfs.redaction.testutil.FiberFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  private StringWriter buffer;

  @BeforeEach
  void captureOutput() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void restoreOutput() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandListsCommands() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("proposals   List the proposals"));
  }

  @Test
  void helpWordIsAccepted() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"help"}));
  }

  @Test
  void missingCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: pfs-redaction"));
  }

  @Test
  void unknownCommandIsInvalid() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture", "design=0x1"}));
    assertTrue(buffer.toString().contains("usage: pfs-redaction <redact|proposals> [options]"));
  }

  @Test
  void dispatchesToProposals(@TempDir Path dir) throws IOException {
    FiberFixtures.copyDesignFixture(dir);

    ExitCode code = Main.run(new String[] {"design=0x4f966fa98c958b91", "proposals", "in=" + dir});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("S24A-001\t"));
  }

  @Test
  void dispatchesRedactHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"REDACT", "--help"}));
    assertTrue(buffer.toString().contains("mask.<field>=VALUE"));
  }
}
