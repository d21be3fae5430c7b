package jp.naoj.pfs.redaction.domain.redaction;

/**
 * Row counts reported after one proposal has been redacted and checked.
 *
 * @param proposalId proposal the counts belong to
 * @param totalRows rows in the redacted configuration
 * @param maskedRows rows obscured for this proposal
 * @param unmaskedRows rows left untouched
 * @param ownScienceRows science rows of the proposal itself
 * @param elapsedNanos time spent copying, masking and checking
 * @since 0.1.0
 */
public record RedactionSummary(
    String proposalId, int totalRows, int maskedRows, int unmaskedRows, int ownScienceRows, long elapsedNanos) {

  public RedactionSummary {
    if (maskedRows + unmaskedRows != totalRows) {
      throw new IllegalArgumentException("masked + unmasked must equal total rows");
    }
  }
}
