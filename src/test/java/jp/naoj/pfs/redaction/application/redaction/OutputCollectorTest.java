package jp.naoj.pfs.redaction.application.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;
import org.junit.jupiter.api.Test;

class OutputCollectorTest {

  @Test
  void resultsAreSortedRegardlessOfInsertionOrder() {
    OutputCollector collector = new OutputCollector();
    collector.add(new RedactionResult("P3", ConfigurationSet.empty(), 3));
    collector.add(new RedactionResult("P1", ConfigurationSet.empty(), 1));
    collector.add(new RedactionResult("P2", ConfigurationSet.empty(), 2));

    assertEquals(List.of("P1", "P2", "P3"),
        collector.results().stream().map(RedactionResult::proposalId).toList());
    assertEquals(List.of("P1", "P2", "P3"), List.copyOf(collector.asMap().keySet()));
  }

  @Test
  void duplicateProposalIsRejected() {
    OutputCollector collector = new OutputCollector();
    collector.add(new RedactionResult("P1", ConfigurationSet.empty(), 1));

    assertThrows(IllegalStateException.class,
        () -> collector.add(new RedactionResult("P1", ConfigurationSet.empty(), 2)));
  }

  @Test
  void concurrentAddsAreAllRecorded() throws InterruptedException {
    OutputCollector collector = new OutputCollector();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    for (int i = 0; i < 200; i++) {
      String proposal = String.format("P%03d", i);
      long sequence = i + 1;
      pool.execute(() -> collector.add(new RedactionResult(proposal, ConfigurationSet.empty(), sequence)));
    }
    pool.shutdown();
    assertEquals(true, pool.awaitTermination(10, TimeUnit.SECONDS));

    assertEquals(200, collector.size());
    assertEquals("P000", collector.results().get(0).proposalId());
    assertEquals("P199", collector.results().get(199).proposalId());
  }
}
