package jp.naoj.pfs.redaction.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.StringJoiner;
import jp.naoj.pfs.redaction.application.pipeline.RedactionPlan;
import jp.naoj.pfs.redaction.config.RedactConfig;

/**
 * Console output for the redaction commands: usage text, written paths, dry-run plans and proposal listings.
 *
 * <p>Writes to the stdout file descriptor directly so command output stays separate from log output, which
 * goes to stderr. Scripts consume the path and listing formats, so they carry no decoration.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints zero or more lines.
   *
   * @param lines lines to emit; {@code null} prints nothing
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
    writer.flush();
  }

  /**
   * Prints one written view per line, in the order the run produced them.
   *
   * @param written paths returned by the redaction run
   */
  static void printWritten(List<Path> written) {
    PrintWriter writer = writer();
    for (Path path : written) {
      writer.println(path);
    }
    writer.flush();
  }

  /**
   * Prints what a redaction run would do, followed by one {@code proposal -> file} line per view.
   *
   * @param config effective configuration
   * @param plan plan computed from the input
   * @param allowOverwrite whether a non-empty output directory would be accepted
   */
  static void printDryRunPlan(RedactConfig config, RedactionPlan plan, boolean allowOverwrite) {
    printLines(
        "Redaction dry-run: no files will be written.",
        " Input file        : " + plan.source(),
        " Fibers            : " + plan.fibers(),
        " Proposals         : " + plan.proposals().size(),
        " Output directory  : " + config.outputDirectory(),
        " Object id strategy: " + config.policy().objIdStrategy(),
        " Workers           : " + config.workers(),
        " Allow overwrite   : " + allowOverwrite);
    PrintWriter writer = writer();
    for (int i = 0; i < plan.proposals().size(); i++) {
      writer.println("  " + plan.proposals().get(i) + " -> " + plan.targets().get(i).getFileName());
    }
    writer.println(" Re-run without --dry-run to write the files.");
    writer.flush();
  }

  /**
   * Prints {@code proposalId<TAB>catId,catId,...} per proposal.
   *
   * @param listing catalogs per proposal, ordered by proposal id
   */
  static void printProposalListing(SortedMap<String, SortedSet<Integer>> listing) {
    PrintWriter writer = writer();
    for (Map.Entry<String, SortedSet<Integer>> entry : listing.entrySet()) {
      StringJoiner catalogs = new StringJoiner(",");
      for (Integer catId : entry.getValue()) {
        catalogs.add(catId.toString());
      }
      writer.println(entry.getKey() + '\t' + catalogs);
    }
    writer.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    PrintWriter current = override;
    return current != null ? current : STDOUT;
  }
}
