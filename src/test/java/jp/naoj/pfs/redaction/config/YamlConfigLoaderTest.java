package jp.naoj.pfs.redaction.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class YamlConfigLoaderTest {

  @TempDir Path tempDir;

  @Test
  void loadMergesCommonAndModeSections() throws IOException {
    Path yaml = tempDir.resolve("redaction.yaml");
    Files.writeString(yaml, """
        common:
          in: /data/designs
          design: "0x4f966fa98c958b91"
        redact:
          workers: 4
          prefix: night1
        proposals:
          in: /elsewhere
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "redact").orElseThrow();

    assertEquals("/data/designs", map.get("in"));
    assertEquals("0x4f966fa98c958b91", map.get("design"));
    assertEquals("4", map.get("workers"));
    assertEquals("night1", map.get("prefix"));
  }

  @Test
  void modeSectionOverridesCommon() throws IOException {
    Path yaml = tempDir.resolve("override.yaml");
    Files.writeString(yaml, """
        common:
          in: /data/designs
        proposals:
          in: /data/configs
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "PROPOSALS").orElseThrow();

    assertEquals("/data/configs", map.get("in"));
  }

  @Test
  void nestedMapsAndListsAreFlattened() throws IOException {
    Path yaml = tempDir.resolve("mask.yaml");
    Files.writeString(yaml, """
        redact:
          mask:
            catId: 8000
            patch: "0,0"
          fluxFields: [psfFlux, psfFluxErr]
          saltEnv:
        """);

    Map<String, String> map = YamlConfigLoader.load(yaml, "redact").orElseThrow();

    assertEquals("8000", map.get("mask.catId"));
    assertEquals("0,0", map.get("mask.patch"));
    assertEquals("psfFlux,psfFluxErr", map.get("fluxFields"));
    assertEquals("", map.get("saltEnv"));
  }

  @Test
  void bundledFixtureLoads() throws Exception {
    Path fixture = Path.of(getClass().getResource("/fixtures/redact-config.yaml").toURI());

    Map<String, String> map = YamlConfigLoader.load(fixture, "redact").orElseThrow();

    assertEquals("hex", map.get("idType"));
    assertEquals("negated-fiber-id", map.get("objIdStrategy"));
    assertEquals("-1.0", map.get("mask.ra"));
  }

  @Test
  void missingFileReturnsEmpty() throws IOException {
    Optional<Map<String, String>> result = YamlConfigLoader.load(tempDir.resolve("absent.yaml"), "redact");

    assertFalse(result.isPresent());
  }

  @Test
  void emptyDocumentYieldsEmptyMap() throws IOException {
    Path yaml = tempDir.resolve("empty.yaml");
    Files.writeString(yaml, "");

    assertTrue(YamlConfigLoader.load(yaml, "redact").orElseThrow().isEmpty());
  }

  @Test
  void nonScalarListEntriesAreRejected() throws IOException {
    Path yaml = tempDir.resolve("bad-list.yaml");
    Files.writeString(yaml, """
        redact:
          fluxFields:
            - name: psfFlux
        """);

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "redact"));
  }

  @Test
  void malformedYamlIsRejected() throws IOException {
    Path yaml = tempDir.resolve("broken.yaml");
    Files.writeString(yaml, "redact: [unclosed");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "redact"));
  }

  @Test
  void sectionsMustBeMappings() throws IOException {
    Path yaml = tempDir.resolve("scalar.yaml");
    Files.writeString(yaml, "common: 3\n");

    assertThrows(IllegalArgumentException.class, () -> YamlConfigLoader.load(yaml, "redact"));
  }
}
