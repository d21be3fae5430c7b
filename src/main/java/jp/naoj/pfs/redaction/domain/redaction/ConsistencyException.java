package jp.naoj.pfs.redaction.domain.redaction;

/**
 * Raised when a redacted copy fails its post-masking check: a proposal's own science fibers were
 * lost or a foreign one survived, or the copy's shape drifted from the source.
 *
 * <p>Fatal for the whole batch; no partial result is returned once this is thrown.</p>
 *
 * @since 0.1.0
 */
public final class ConsistencyException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String proposalId;
  private final long expected;
  private final long actual;

  /**
   * Creates an exception describing a count mismatch.
   *
   * @param proposalId proposal whose copy failed the check
   * @param what name of the quantity compared, e.g. {@code science fibers}
   * @param expected value derived from the source
   * @param actual value found in the redacted copy
   */
  public ConsistencyException(String proposalId, String what, long expected, long actual) {
    super("redacted copy for proposal " + proposalId + " has " + actual + " " + what
        + " but the source has " + expected);
    this.proposalId = proposalId;
    this.expected = expected;
    this.actual = actual;
  }

  public String proposalId() {
    return proposalId;
  }

  public long expected() {
    return expected;
  }

  public long actual() {
    return actual;
  }
}
