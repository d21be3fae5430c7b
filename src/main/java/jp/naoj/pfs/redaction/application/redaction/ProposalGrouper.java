package jp.naoj.pfs.redaction.application.redaction;

import java.util.Collections;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;

/**
 * Enumerates the proposals that receive a redacted view.
 *
 * <p>Grouping is by {@code proposalId} alone. Several catalogs under one proposal still yield a
 * single view; {@link #catalogsByProposal(ConfigurationSet)} reports them for logging only. The
 * {@link FiberRecord#NO_PROPOSAL} sentinel is never a key.</p>
 *
 * @since 0.1.0
 */
public final class ProposalGrouper {

  /**
   * Returns the distinct proposal identifiers of a configuration in natural string order.
   *
   * @param source configuration to scan
   * @return unmodifiable sorted set; empty for zero rows or sentinel-only rows
   */
  public SortedSet<String> proposals(ConfigurationSet source) {
    SortedSet<String> proposals = new TreeSet<>();
    for (FiberRecord row : source.rows()) {
      if (row.hasProposal()) {
        proposals.add(row.proposalId());
      }
    }
    return Collections.unmodifiableSortedSet(proposals);
  }

  /**
   * Lists the catalogs each proposal draws targets from.
   *
   * @param source configuration to scan
   * @return proposal id to sorted catalog ids; informational only
   */
  public SortedMap<String, SortedSet<Integer>> catalogsByProposal(ConfigurationSet source) {
    SortedMap<String, SortedSet<Integer>> catalogs = new TreeMap<>();
    for (FiberRecord row : source.rows()) {
      if (row.hasProposal()) {
        catalogs.computeIfAbsent(row.proposalId(), key -> new TreeSet<>()).add(row.catId());
      }
    }
    return Collections.unmodifiableSortedMap(catalogs);
  }
}
