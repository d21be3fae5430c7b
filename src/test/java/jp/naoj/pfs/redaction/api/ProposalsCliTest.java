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

class ProposalsCliTest {
  @TempDir Path tempDir;

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
  void listsProposalsWithCatalogs() throws IOException {
    FiberFixtures.copyDesignFixture(tempDir);

    ExitCode code = ProposalsCli.run(new String[] {"design=5734893949501672337", "in=" + tempDir});

    assertEquals(ExitCode.SUCCESS, code);
    String[] lines = buffer.toString().split("\\R");
    assertEquals(2, lines.length);
    assertEquals("S24A-001\t1000,3006", lines[0]);
    assertEquals("S24A-002\t2000", lines[1]);
  }

  @Test
  void missingDesignPrintsUsage() {
    ExitCode code = ProposalsCli.run(new String[] {"in=" + tempDir});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: proposals"));
  }

  @Test
  void missingFileIsIoError() {
    ExitCode code = ProposalsCli.run(new String[] {"design=0x2", "in=" + tempDir});

    assertEquals(ExitCode.IO_ERROR, code);
  }
}
