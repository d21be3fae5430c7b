package jp.naoj.pfs.redaction.domain.fiber;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import jp.naoj.pfs.redaction.testutil.FiberFixtures;
import org.junit.jupiter.api.Test;

class FiberRecordTest {

  @Test
  void fluxArraysAreCopiedOnTheWayInAndOut() {
    double[] values = {1.0, 2.0};
    FiberRecord row = FiberRecord.builder()
        .fiberId(1)
        .flux(FluxField.PSF_FLUX, values)
        .filterNames(List.of("g", "r"))
        .build();

    values[0] = 99.0;
    assertEquals(1.0, row.psfFlux()[0]);

    double[] exposed = row.psfFlux();
    exposed[1] = -1.0;
    assertEquals(2.0, row.flux(FluxField.PSF_FLUX)[1]);
    assertEquals(2, row.fluxLength(FluxField.PSF_FLUX));
    assertEquals(0, row.fluxLength(FluxField.TOTAL_FLUX));
  }

  @Test
  void deepCopyIsEqualButIndependent() {
    FiberRecord row = FiberFixtures.science(12, "S24A-001", 1000, 55);
    FiberRecord copy = row.deepCopy();

    assertEquals(row, copy);
    assertEquals(row.hashCode(), copy.hashCode());
    assertNotSame(row.fiberFlux(), copy.fiberFlux());
  }

  @Test
  void equalityTreatsNanFluxAsEqual() {
    FiberRecord a = FiberRecord.builder().fiberId(3).photometry(List.of("g"), Double.NaN).build();
    FiberRecord b = FiberRecord.builder().fiberId(3).photometry(List.of("g"), Double.NaN).build();

    assertEquals(a, b);
  }

  @Test
  void proposalAndScienceQueries() {
    FiberRecord science = FiberFixtures.science(1, "P1", 1000, 1);
    FiberRecord sky = FiberFixtures.sky(2);

    assertTrue(science.hasProposal());
    assertTrue(science.isScience());
    assertFalse(sky.hasProposal());
    assertFalse(sky.isScience());
    assertFalse(science.toBuilder().targetType(TargetType.SCIENCE_MASKED).build().isScience());
  }

  @Test
  void photometryRejectsMismatchedLengths() {
    assertThrows(IllegalArgumentException.class,
        () -> FiberRecord.builder().photometry(List.of("g", "r"), 1.0));
  }

  @Test
  void builderDefaultsDescribeAnEmptyUnassignedFiber() {
    FiberRecord row = FiberRecord.builder().fiberId(9).build();

    assertEquals(FiberRecord.NO_PROPOSAL, row.proposalId());
    assertEquals(TargetType.UNASSIGNED, row.targetType());
    assertEquals(FocalPlanePoint.NAN, row.pfiCenter());
    assertArrayEquals(new double[0], row.totalFluxErr());
    assertTrue(row.filterNames().isEmpty());
  }

  @Test
  void missingReferenceColumnIsRejected() {
    assertThrows(NullPointerException.class, () -> FiberRecord.builder().patch(null).build());
  }
}
