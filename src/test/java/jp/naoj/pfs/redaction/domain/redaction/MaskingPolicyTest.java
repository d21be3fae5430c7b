package jp.naoj.pfs.redaction.domain.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.fiber.FocalPlanePoint;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;
import org.junit.jupiter.api.Test;

class MaskingPolicyTest {

  @Test
  void defaultsCoverEveryMaskedField() {
    MaskingPolicy policy = MaskingPolicy.defaults();

    assertEquals(EnumSet.allOf(MaskedField.class), policy.overrides().keySet());
    assertEquals(9000, policy.catIdOverride());
    assertEquals(-1, policy.override(MaskedField.TRACT));
    assertEquals("-1,-1", policy.override(MaskedField.PATCH));
    assertEquals(-99.0, policy.override(MaskedField.RA));
    assertEquals(-99.0, policy.override(MaskedField.DEC));
    assertEquals(0.0, policy.override(MaskedField.PM_RA));
    assertEquals(1e-7, policy.override(MaskedField.PARALLAX));
    assertEquals("masked", policy.override(MaskedField.PROPOSAL_ID));
    assertEquals("masked", policy.override(MaskedField.OB_CODE));
    assertEquals(FocalPlanePoint.NAN, policy.override(MaskedField.PFI_NOMINAL));
    assertEquals(TargetType.SCIENCE_MASKED, policy.override(MaskedField.TARGET_TYPE));
    assertEquals(EnumSet.allOf(FluxField.class), policy.fluxFields());
    assertTrue(Double.isNaN(policy.fluxFill()));
    assertEquals("none", policy.filterFill());
    assertEquals(ObjectIdStrategy.SALTED_HASH, policy.objIdStrategy());
    assertEquals(Optional.empty(), policy.secretSalt());
  }

  @Test
  void overridesAreCoercedFromText() {
    MaskingPolicy policy = MaskingPolicy.builder()
        .override(MaskedField.CAT_ID, "8000")
        .override(MaskedField.RA, "0")
        .override(MaskedField.PFI_CENTER, "(1.5, -2)")
        .override(MaskedField.TARGET_TYPE, "SKY")
        .build();

    assertEquals(8000, policy.catIdOverride());
    assertEquals(0.0, policy.override(MaskedField.RA));
    assertEquals(new FocalPlanePoint(1.5, -2.0), policy.override(MaskedField.PFI_CENTER));
    assertEquals(TargetType.SKY, policy.override(MaskedField.TARGET_TYPE));
    assertEquals(-99.0, policy.override(MaskedField.DEC));
  }

  @Test
  void wrongTypedOverrideIsAConfigurationError() {
    assertThrows(MaskingConfigurationException.class,
        () -> MaskingPolicy.builder().override(MaskedField.CAT_ID, "nine thousand").build());
    assertThrows(MaskingConfigurationException.class,
        () -> MaskingPolicy.builder().override(MaskedField.TRACT, 1.5).build());
    assertThrows(MaskingConfigurationException.class,
        () -> MaskingPolicy.builder().override(MaskedField.TARGET_TYPE, "planet").build());
  }

  @Test
  void blankFilterFillIsRejected() {
    assertThrows(MaskingConfigurationException.class, () -> MaskingPolicy.builder().filterFill(" ").build());
  }

  @Test
  void emptyFluxFieldListMasksNoPhotometry() {
    MaskingPolicy policy = MaskingPolicy.builder().fluxFields(List.of()).build();

    assertTrue(policy.fluxFields().isEmpty());
  }

  @Test
  void blankSaltIsTreatedAsAbsent() {
    MaskingPolicy policy = MaskingPolicy.builder().secretSalt("  ").build();

    assertFalse(policy.secretSalt().isPresent());
    assertThrows(MaskingConfigurationException.class, policy::objectIdDeriver);
  }

  @Test
  void toStringRedactsTheSalt() {
    MaskingPolicy policy = MaskingPolicy.builder().secretSalt("hunter2").build();

    assertFalse(policy.toString().contains("hunter2"));
  }

  @Test
  void toBuilderRoundTrips() {
    MaskingPolicy policy = MaskingPolicy.builder()
        .catIdOverride(1234)
        .fluxFields(List.of(FluxField.PSF_FLUX))
        .fluxFill(0.0)
        .filterFill("masked")
        .objIdStrategy(ObjectIdStrategy.NEGATED_FIBER_ID)
        .build();

    assertEquals(policy, policy.toBuilder().build());
  }

  @Test
  void maskedFieldParseAcceptsColumnAndEnumNames() {
    assertEquals(MaskedField.PM_RA, MaskedField.parse("pmRa"));
    assertEquals(MaskedField.PM_RA, MaskedField.parse("PM_RA"));
    assertThrows(MaskingConfigurationException.class, () -> MaskedField.parse("objId"));
  }
}
