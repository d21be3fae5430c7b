package jp.naoj.pfs.redaction.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import jp.naoj.pfs.redaction.application.pipeline.RedactionPlan;
import jp.naoj.pfs.redaction.config.DefaultsForMode;
import jp.naoj.pfs.redaction.config.RedactConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CliPrinterTest {
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
  void listingIsTabSeparatedWithSortedCatalogs() {
    SortedMap<String, SortedSet<Integer>> listing = new TreeMap<>();
    listing.put("S24A-002", new TreeSet<>(List.of(2000)));
    listing.put("S24A-001", new TreeSet<>(List.of(3006, 1000)));

    CliPrinter.printProposalListing(listing);

    assertEquals(List.of("S24A-001\t1000,3006", "S24A-002\t2000"), lines());
  }

  @Test
  void emptyListingPrintsNothing() {
    CliPrinter.printProposalListing(new TreeMap<>());

    assertEquals("", buffer.toString());
  }

  @Test
  void writtenPathsArePrintedOnePerLine() {
    Path first = Path.of("out", "a_P1.json");
    Path second = Path.of("out", "a_P2.json");

    CliPrinter.printWritten(List.of(first, second));

    assertEquals(List.of(first.toString(), second.toString()), lines());
  }

  @Test
  void dryRunPlanNamesEveryTarget() {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("redact"));
    options.put("design", "0x4f966fa98c958b91");
    options.put("objIdStrategy", "NEGATED_FIBER_ID");
    RedactConfig config = RedactConfig.fromMap(options, name -> null);
    RedactionPlan plan = new RedactionPlan(Path.of("in", "pfsDesign-0x4f966fa98c958b91.json"), 4,
        List.of("S24A-001", "S24A-002"),
        List.of(Path.of("out", "p_S24A-001.json"), Path.of("out", "p_S24A-002.json")));

    CliPrinter.printDryRunPlan(config, plan, false);

    String text = buffer.toString();
    assertTrue(text.startsWith("Redaction dry-run: no files will be written."), text);
    assertTrue(text.contains(" Fibers            : 4"), text);
    assertTrue(text.contains(" Object id strategy: NEGATED_FIBER_ID"), text);
    assertTrue(text.contains("  S24A-002 -> p_S24A-002.json"), text);
    assertTrue(text.contains(" Allow overwrite   : false"), text);
  }

  private List<String> lines() {
    return List.of(buffer.toString().split("\\R"));
  }
}
