package jp.naoj.pfs.redaction.application.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import jp.naoj.pfs.redaction.application.port.RedactionListener;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.fiber.TargetType;
import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;
import jp.naoj.pfs.redaction.domain.redaction.InputValidationException;
import jp.naoj.pfs.redaction.domain.redaction.MaskedField;
import jp.naoj.pfs.redaction.domain.redaction.MaskingConfigurationException;
import jp.naoj.pfs.redaction.domain.redaction.MaskingPolicy;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;
import jp.naoj.pfs.redaction.domain.redaction.RedactionSummary;
import jp.naoj.pfs.redaction.testutil.FiberFixtures;
import jp.naoj.pfs.redaction.testutil.RecordingMetricsPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class RedactionEngineTest {
  private final MaskingPolicy policy = FiberFixtures.saltedPolicy();

  @AfterEach
  void clearMdc() {
    MDC.clear();
  }

  @Test
  void producesOneViewPerProposalInOrder() {
    List<RedactionResult> results = new RedactionEngine().redact(FiberFixtures.mixed(), policy);

    assertEquals(List.of("P1", "P2", "P3"), results.stream().map(RedactionResult::proposalId).toList());
    assertEquals(List.of(1L, 2L, 3L), results.stream().map(RedactionResult::sequenceId).toList());
  }

  @Test
  void ownRowsAndNonScienceRowsAreUnchanged() {
    ConfigurationSet source = FiberFixtures.mixed();

    ConfigurationSet view = new RedactionEngine().redact(source, policy).get(0).configuration();

    assertEquals(source.header(), view.header());
    assertEquals(source.size(), view.size());
    assertEquals(source.row(0), view.row(0));
    assertEquals(source.row(1), view.row(1));
    assertEquals(source.row(3), view.row(3));
    assertEquals(source.row(4), view.row(4));
    assertEquals(source.row(6), view.row(6));
  }

  @Test
  void otherProposalsScienceRowsAreMasked() {
    ConfigurationSet source = FiberFixtures.mixed();

    ConfigurationSet view = new RedactionEngine().redact(source, policy).get(0).configuration();

    FiberRecord p2 = view.row(2);
    assertEquals(3, p2.fiberId());
    assertEquals("masked", p2.proposalId());
    assertEquals(TargetType.SCIENCE_MASKED, p2.targetType());
    assertEquals(9000, p2.catId());
    assertEquals(4266158646810612241L, p2.objId());
    assertEquals(-99.0, p2.ra());
    assertEquals(List.of("none", "none"), p2.filterNames());

    FiberRecord p3 = view.row(5);
    assertEquals(2705022698936682808L, p3.objId());
    assertEquals(3, p3.fluxLength(FluxField.TOTAL_FLUX));
    assertTrue(Double.isNaN(p3.totalFlux()[2]));
  }

  @Test
  void everyViewKeepsItsOwnScienceCount() {
    ConfigurationSet source = FiberFixtures.mixed();

    for (RedactionResult result : new RedactionEngine().redact(source, policy)) {
      String proposal = result.proposalId();
      assertEquals(InvariantChecker.countScience(source, proposal),
          InvariantChecker.countScience(result.configuration(), proposal), proposal);
      for (FiberRecord row : result.configuration().rows()) {
        if (row.isScience()) {
          assertEquals(proposal, row.proposalId());
        }
      }
    }
  }

  @Test
  void sourceIsNeverModified() {
    ConfigurationSet source = FiberFixtures.mixed();
    ConfigurationSet snapshot = source.deepCopy();

    new RedactionEngine().redact(source, policy);

    assertEquals(snapshot, source);
  }

  @Test
  void redactingTwiceGivesIdenticalResults() {
    ConfigurationSet source = FiberFixtures.mixed();

    assertEquals(new RedactionEngine().redact(source, policy), new RedactionEngine().redact(source, policy));
  }

  @Test
  void differentSaltsGiveDifferentMaskedIdentifiers() {
    ConfigurationSet source = FiberFixtures.mixed();
    MaskingPolicy other = policy.toBuilder().secretSalt("other-salt").build();

    long first = new RedactionEngine().redact(source, policy).get(0).configuration().row(2).objId();
    long second = new RedactionEngine().redact(source, other).get(0).configuration().row(2).objId();

    assertNotEquals(first, second);
  }

  @Test
  void parallelWorkersMatchSequentialOutput() {
    ConfigurationSet source = FiberFixtures.mixed();

    List<RedactionResult> sequential = new RedactionEngine().redact(source, policy);
    List<RedactionResult> parallel = new RedactionEngine(null, null, 4, 0L).redact(source, policy);

    assertEquals(sequential, parallel);
  }

  @Test
  void sequenceBaseOffsetsResultNumbers() {
    List<RedactionResult> results = new RedactionEngine(null, null, 2, 100L).redact(FiberFixtures.mixed(), policy);

    assertEquals(List.of(101L, 102L, 103L), results.stream().map(RedactionResult::sequenceId).toList());
  }

  @Test
  void configurationWithoutProposalsYieldsNothing() {
    ConfigurationSet skyOnly = new ConfigurationSet(FiberFixtures.header(),
        List.of(FiberFixtures.sky(1), FiberFixtures.sky(2)));

    assertTrue(new RedactionEngine().redact(skyOnly, policy).isEmpty());
    assertTrue(new RedactionEngine().redact(ConfigurationSet.empty(), policy).isEmpty());
  }

  @Test
  void singleProposalViewLeavesEverythingUnmasked() {
    ConfigurationSet source = new ConfigurationSet(FiberFixtures.header(), List.of(
        FiberFixtures.science(1, "P1", 1000, 1),
        FiberFixtures.sky(2)));

    List<RedactionResult> results = new RedactionEngine().redact(source, policy);

    assertEquals(1, results.size());
    assertEquals(source, results.get(0).configuration());
  }

  @Test
  void sentinelProposalIsSkipped() {
    assertEquals(Optional.empty(),
        new RedactionEngine().redactProposal(FiberFixtures.mixed(), policy, FiberRecord.NO_PROPOSAL));
  }

  @Test
  void singleProposalRedactionMatchesFullRun() {
    ConfigurationSet source = FiberFixtures.mixed();

    RedactionResult single = new RedactionEngine().redactProposal(source, policy, "P2").orElseThrow();
    RedactionResult fromAll = new RedactionEngine().redact(source, policy).get(1);

    assertEquals(fromAll.configuration(), single.configuration());
  }

  @Test
  void unknownProposalMasksEveryScienceRow() {
    ConfigurationSet view = new RedactionEngine()
        .redactProposal(FiberFixtures.mixed(), policy, "P9").orElseThrow().configuration();

    assertEquals(0, InvariantChecker.countScience(view, "P9"));
    assertTrue(view.rows().stream().noneMatch(FiberRecord::isScience));
  }

  @Test
  void missingSaltFailsBeforeAnyRowIsProcessed() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    RedactionEngine engine = new RedactionEngine(metrics, null, 1, 0L);

    assertThrows(MaskingConfigurationException.class,
        () -> engine.redact(FiberFixtures.mixed(), MaskingPolicy.defaults()));
    assertEquals(0, metrics.count("redaction.proposals"));
  }

  @Test
  void malformedInputIsRejected() {
    ConfigurationSet duplicate = new ConfigurationSet(FiberFixtures.header(), List.of(
        FiberFixtures.science(1, "P1", 1000, 1),
        FiberFixtures.science(1, "P2", 1000, 2)));

    assertThrows(InputValidationException.class, () -> new RedactionEngine().redact(duplicate, policy));
  }

  @Test
  void policyThatForgesOwnershipFailsTheConsistencyCheck() {
    MaskingPolicy forging = policy.toBuilder()
        .override(MaskedField.PROPOSAL_ID, "P1")
        .override(MaskedField.TARGET_TYPE, TargetType.SCIENCE)
        .build();
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    List<ConsistencyException> failures = Collections.synchronizedList(new ArrayList<>());
    RedactionListener listener = new RedactionListener() {
      @Override
      public void onProposalRedacted(RedactionSummary summary) {}

      @Override
      public void onConsistencyFailure(ConsistencyException failure) {
        failures.add(failure);
      }
    };

    ConsistencyException ex = assertThrows(ConsistencyException.class,
        () -> new RedactionEngine(metrics, listener, 1, 0L).redact(FiberFixtures.mixed(), forging));

    assertEquals("P1", ex.proposalId());
    assertEquals(2, ex.expected());
    assertEquals(4, ex.actual());
    assertEquals(1, metrics.count("redaction.consistency.failures"));
    assertEquals(1, failures.size());
    assertSame(ex, failures.get(0));
  }

  @Test
  void metricsAndSummariesDescribeEachProposal() {
    RecordingMetricsPort metrics = new RecordingMetricsPort();
    List<RedactionSummary> summaries = Collections.synchronizedList(new ArrayList<>());

    new RedactionEngine(metrics, summaries::add, 1, 0L).redact(FiberFixtures.mixed(), policy);

    assertEquals(3, metrics.count("redaction.proposals"));
    assertEquals(List.of(2L, 3L, 3L), metrics.observed("redaction.rows.masked"));
    assertEquals(List.of(5L, 4L, 4L), metrics.observed("redaction.rows.unmasked"));
    assertEquals(3, metrics.observed("redaction.proposal.latencyNanos").size());
    assertEquals(3, summaries.size());
    RedactionSummary p1 = summaries.get(0);
    assertEquals("P1", p1.proposalId());
    assertEquals(7, p1.totalRows());
    assertEquals(2, p1.maskedRows());
    assertEquals(2, p1.ownScienceRows());
  }

  @Test
  void callerMdcIsRestored() {
    MDC.put(RedactionEngine.MDC_PROPOSAL, "outer");

    new RedactionEngine().redact(FiberFixtures.mixed(), policy);

    assertEquals("outer", MDC.get(RedactionEngine.MDC_PROPOSAL));
  }

  @Test
  void invalidConstructionIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new RedactionEngine(null, null, 0, 0L));
    assertThrows(IllegalArgumentException.class, () -> new RedactionEngine(null, null, 1, -1L));
  }
}
