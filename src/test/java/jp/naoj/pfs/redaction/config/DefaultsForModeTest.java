package jp.naoj.pfs.redaction.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;
import org.junit.jupiter.api.Test;

class DefaultsForModeTest {

  @Test
  void redactDefaultsIncludeMaskingPolicy() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap("redact");

    assertEquals("SALTED_HASH", defaults.get("objIdStrategy"));
    assertEquals("PFS_REDACTION_SALT", defaults.get("saltEnv"));
    assertEquals("9000", defaults.get("mask.catId"));
    assertEquals("fiberFlux,psfFlux,totalFlux,fiberFluxErr,psfFluxErr,totalFluxErr", defaults.get("fluxFields"));
    assertEquals("NaN", defaults.get("fluxFill"));
    assertEquals("none", defaults.get("filterFill"));
    assertEquals("none", defaults.get("metricsExporter"));
    assertEquals("1", defaults.get("workers"));
    assertEquals(".", defaults.get("in"));
  }

  @Test
  void proposalsDefaultsCarryOnlyCommonKeys() {
    Map<String, String> defaults = DefaultsForMode.asFlatMap(" Proposals ");

    assertEquals("auto", defaults.get("idType"));
    assertFalse(defaults.containsKey("out"));
    assertFalse(defaults.containsKey("salt"));
  }

  @Test
  void unknownModeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> DefaultsForMode.asFlatMap("capture"));
  }
}
