package jp.naoj.pfs.redaction.application.redaction;

import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;

/**
 * Verifies a redacted copy against its source before it is released.
 *
 * <p>The decisive check counts science fibers attributed to the requesting proposal: the source
 * and the copy must agree, otherwise the proposal either lost one of its own rows or kept one it
 * should not see. The copy must also have the source's row count and every row must keep the
 * length of its flux and filter sequences.</p>
 *
 * <p>Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class InvariantChecker {

  /**
   * Runs every check.
   *
   * @param source original configuration
   * @param redacted copy produced for {@code proposalId}
   * @param proposalId requesting proposal
   * @return number of the proposal's own science rows
   * @throws ConsistencyException on the first violated check
   */
  public int check(ConfigurationSet source, ConfigurationSet redacted, String proposalId) {
    if (source.size() != redacted.size()) {
      throw new ConsistencyException(proposalId, "rows", source.size(), redacted.size());
    }
    int wantScience = countScience(source, proposalId);
    int gotScience = countScience(redacted, proposalId);
    if (wantScience != gotScience) {
      throw new ConsistencyException(proposalId, "science fibers", wantScience, gotScience);
    }
    for (int i = 0; i < source.size(); i++) {
      checkShape(proposalId, source.row(i), redacted.row(i));
    }
    return wantScience;
  }

  /**
   * Counts rows that are {@code SCIENCE} and attributed to {@code proposalId}.
   *
   * @param set configuration to scan
   * @param proposalId proposal to count
   * @return matching row count
   */
  public static int countScience(ConfigurationSet set, String proposalId) {
    int count = 0;
    for (FiberRecord row : set.rows()) {
      if (row.isScience() && row.proposalId().equals(proposalId)) {
        count++;
      }
    }
    return count;
  }

  private static void checkShape(String proposalId, FiberRecord original, FiberRecord copy) {
    if (original.filterNames().size() != copy.filterNames().size()) {
      throw new ConsistencyException(proposalId, "filter names on fiber " + original.fiberId(),
          original.filterNames().size(), copy.filterNames().size());
    }
    for (FluxField field : FluxField.values()) {
      int expected = original.fluxLength(field);
      int actual = copy.fluxLength(field);
      if (expected != actual) {
        throw new ConsistencyException(proposalId,
            field.columnName() + " values on fiber " + original.fiberId(), expected, actual);
      }
    }
  }
}
