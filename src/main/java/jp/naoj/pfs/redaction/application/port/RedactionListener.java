package jp.naoj.pfs.redaction.application.port;

import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;
import jp.naoj.pfs.redaction.domain.redaction.RedactionSummary;

/**
 * Observability hook invoked once per proposal after its view passed the consistency check.
 *
 * <p>Callbacks run on the worker that produced the view and must not throw; they are outside the
 * masking control flow and cannot change its outcome.</p>
 *
 * @since 0.1.0
 */
public interface RedactionListener {
  /**
   * Receives the row counts of one proposal's view.
   *
   * @param summary counts for the proposal
   */
  void onProposalRedacted(RedactionSummary summary);

  /**
   * Receives a consistency failure before it aborts the run.
   *
   * @param failure failed check
   */
  default void onConsistencyFailure(ConsistencyException failure) {}

  /** Listener that ignores every callback. */
  RedactionListener NO_OP = summary -> {};

  /**
   * Combines listeners; each is called in order.
   *
   * @param first first listener
   * @param second second listener
   * @return listener forwarding to both
   */
  static RedactionListener both(RedactionListener first, RedactionListener second) {
    return new RedactionListener() {
      @Override
      public void onProposalRedacted(RedactionSummary summary) {
        first.onProposalRedacted(summary);
        second.onProposalRedacted(summary);
      }

      @Override
      public void onConsistencyFailure(ConsistencyException failure) {
        first.onConsistencyFailure(failure);
        second.onConsistencyFailure(failure);
      }
    };
  }
}
