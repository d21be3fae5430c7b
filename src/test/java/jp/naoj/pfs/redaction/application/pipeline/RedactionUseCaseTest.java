package jp.naoj.pfs.redaction.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import jp.naoj.pfs.redaction.application.port.RedactionListener;
import jp.naoj.pfs.redaction.config.CompositionRoot;
import jp.naoj.pfs.redaction.config.DefaultsForMode;
import jp.naoj.pfs.redaction.config.RedactConfig;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;
import jp.naoj.pfs.redaction.domain.redaction.InputValidationException;
import jp.naoj.pfs.redaction.infrastructure.persistence.json.JsonConfigurationCodec;
import jp.naoj.pfs.redaction.testutil.FiberFixtures;
import jp.naoj.pfs.redaction.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.MDC;

class RedactionUseCaseTest {
  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();
  private final JsonConfigurationCodec codec = new JsonConfigurationCodec();

  @Test
  void runWritesOneViewPerProposal() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    FiberFixtures.copyDesignFixture(in);
    RedactConfig config = config(in, Map.of());

    List<Path> written = useCase(config).run();

    Path out = tempDir.resolve("out");
    assertEquals(List.of(
        out.resolve("pfsDesign-0x4f966fa98c958b91_S24A-001.json"),
        out.resolve("pfsDesign-0x4f966fa98c958b91_S24A-002.json")), written);
    assertEquals(2, metrics.count("redaction.files.written"));
    assertEquals(List.of(4L), metrics.observed("redaction.input.fibers"));

    ConfigurationSet first = read(written.get(0));
    assertEquals(4, first.size());
    assertEquals(101, first.row(0).fiberId());
    assertEquals("S24A-001", first.row(0).proposalId());
    FiberRecord foreign = first.row(1);
    assertEquals(TargetType.SCIENCE_MASKED, foreign.targetType());
    assertEquals(-102L, foreign.objId());
    assertEquals(9000, foreign.catId());
    assertEquals(List.of("none"), foreign.filterNames());
    assertTrue(Double.isNaN(foreign.psfFlux()[0]));
    assertEquals(TargetType.FLUXSTD, first.row(3).targetType());

    ConfigurationSet second = read(written.get(1));
    assertEquals(TargetType.SCIENCE_MASKED, second.row(0).targetType());
    assertEquals("S24A-002", second.row(1).proposalId());
    assertEquals(20L, second.row(1).objId());
  }

  @Test
  void configuredOverridesAndPrefixReachOutput() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    FiberFixtures.copyDesignFixture(in);
    RedactConfig config = config(in, Map.of("prefix", "night1", "mask.catId", "8000", "fluxFields", "psfFlux"));

    List<Path> written = useCase(config).run();

    assertEquals("night1_S24A-001.json", written.get(0).getFileName().toString());
    FiberRecord foreign = read(written.get(0)).row(1);
    assertEquals(8000, foreign.catId());
    assertTrue(Double.isNaN(foreign.psfFlux()[0]));
    assertEquals(500.0, foreign.fiberFlux()[0]);
  }

  @Test
  void planListsTargetsWithoutWriting() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    Path source = FiberFixtures.copyDesignFixture(in);
    RedactConfig config = config(in, Map.of());

    RedactionPlan plan = useCase(config).plan();

    assertEquals(source, plan.source());
    assertEquals(4, plan.fibers());
    assertEquals(List.of("S24A-001", "S24A-002"), plan.proposals());
    assertEquals(tempDir.resolve("out").resolve("pfsDesign-0x4f966fa98c958b91_S24A-002.json"), plan.targets().get(1));
    assertFalse(Files.exists(tempDir.resolve("out")));
  }

  @Test
  void inputWithoutProposalsWritesNothing() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    ConfigurationSet skyOnly = new ConfigurationSet(FiberFixtures.header(), List.of(FiberFixtures.sky(1)));
    write(skyOnly, in.resolve(FiberFixtures.DESIGN_FILE));

    List<Path> written = useCase(config(in, Map.of())).run();

    assertTrue(written.isEmpty());
    assertEquals(0, metrics.count("redaction.files.written"));
    assertFalse(Files.exists(tempDir.resolve("out")));
  }

  @Test
  void malformedInputFailsBeforeWriting() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    FiberRecord duplicate = FiberFixtures.science(1, "P2", 2000, 20);
    ConfigurationSet broken = new ConfigurationSet(FiberFixtures.header(),
        List.of(FiberFixtures.science(1, "P1", 1000, 10), duplicate));
    write(broken, in.resolve(FiberFixtures.DESIGN_FILE));

    assertThrows(InputValidationException.class, () -> useCase(config(in, Map.of())).run());
    assertFalse(Files.exists(tempDir.resolve("out")));
  }

  @Test
  void unsafeProposalIdFailsBeforeAnyViewIsWritten() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    ConfigurationSet set = new ConfigurationSet(FiberFixtures.header(), List.of(
        FiberFixtures.science(1, "A1", 1000, 10),
        FiberFixtures.science(2, "Z 9", 2000, 20)));
    write(set, in.resolve(FiberFixtures.DESIGN_FILE));

    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> useCase(config(in, Map.of())).run());

    assertTrue(ex.getMessage().contains("Z 9"), ex.getMessage());
    assertFalse(Files.exists(tempDir.resolve("out")));
    assertEquals(0, metrics.count("redaction.files.written"));
  }

  @Test
  void missingInputIsReported() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));

    assertThrows(NoSuchFileException.class, () -> useCase(config(in, Map.of())).run());
  }

  @Test
  void inputDirectoryIsTaggedOnlyDuringRun() throws IOException {
    Path in = Files.createDirectories(tempDir.resolve("in"));
    FiberFixtures.copyDesignFixture(in);

    useCase(config(in, Map.of())).run();

    assertNull(MDC.get("redaction.in"));
  }

  private RedactionUseCase useCase(RedactConfig config) {
    return new CompositionRoot(metrics, RedactionListener.NO_OP).redactionUseCase(config);
  }

  private RedactConfig config(Path in, Map<String, String> overrides) {
    Map<String, String> options = new HashMap<>(DefaultsForMode.asFlatMap("redact"));
    options.put("design", "0x4f966fa98c958b91");
    options.put("in", in.toString());
    options.put("out", tempDir.resolve("out").toString());
    options.put("objIdStrategy", "NEGATED_FIBER_ID");
    options.putAll(overrides);
    return RedactConfig.fromMap(options, name -> null);
  }

  private ConfigurationSet read(Path file) throws IOException {
    try (InputStream stream = Files.newInputStream(file)) {
      return codec.read(stream);
    }
  }

  private void write(ConfigurationSet set, Path file) throws IOException {
    try (OutputStream stream = Files.newOutputStream(file)) {
      codec.write(set, stream);
    }
  }
}
