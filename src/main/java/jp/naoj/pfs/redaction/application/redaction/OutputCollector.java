package jp.naoj.pfs.redaction.application.redaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;

/**
 * Gathers per-proposal results and releases them in proposal order.
 *
 * <p>Workers may add results in any order; {@link #results()} sorts by proposal id so the output
 * never depends on completion order. Adding the same proposal twice is rejected.</p>
 *
 * <p>Thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class OutputCollector {
  private final Map<String, RedactionResult> byProposal = new LinkedHashMap<>();

  /**
   * Records a finished result.
   *
   * @param result checked result
   * @throws IllegalStateException when a result for the same proposal was already added
   */
  public synchronized void add(RedactionResult result) {
    Objects.requireNonNull(result, "result");
    if (byProposal.putIfAbsent(result.proposalId(), result) != null) {
      throw new IllegalStateException("duplicate result for proposal " + result.proposalId());
    }
  }

  /**
   * Returns every result sorted by proposal id.
   *
   * @return unmodifiable list
   */
  public synchronized List<RedactionResult> results() {
    List<RedactionResult> sorted = new ArrayList<>(byProposal.values());
    sorted.sort(Comparator.comparing(RedactionResult::proposalId));
    return Collections.unmodifiableList(sorted);
  }

  /**
   * Returns the results as a proposal-ordered mapping.
   *
   * @return unmodifiable map, iterated in proposal order
   */
  public synchronized Map<String, ConfigurationSet> asMap() {
    Map<String, ConfigurationSet> map = new LinkedHashMap<>();
    for (RedactionResult result : results()) {
      map.put(result.proposalId(), result.configuration());
    }
    return Collections.unmodifiableMap(map);
  }

  public synchronized int size() {
    return byProposal.size();
  }
}
