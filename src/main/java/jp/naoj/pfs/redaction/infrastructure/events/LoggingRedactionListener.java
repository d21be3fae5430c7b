package jp.naoj.pfs.redaction.infrastructure.events;

import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.TimeUnit;
import jp.naoj.pfs.redaction.application.port.RedactionListener;
import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;
import jp.naoj.pfs.redaction.domain.redaction.RedactionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs one structured line per redacted proposal.
 *
 * @since 0.1.0
 */
public final class LoggingRedactionListener implements RedactionListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingRedactionListener.class);

  @Override
  public void onProposalRedacted(RedactionSummary summary) {
    Objects.requireNonNull(summary, "summary");
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("proposal=" + summary.proposalId());
    joiner.add("total=" + summary.totalRows());
    joiner.add("masked=" + summary.maskedRows());
    joiner.add("unmasked=" + summary.unmaskedRows());
    joiner.add("ownScience=" + summary.ownScienceRows());
    joiner.add("elapsedMs=" + TimeUnit.NANOSECONDS.toMillis(summary.elapsedNanos()));
    log.info("redaction.proposal {}", joiner);
  }

  @Override
  public void onConsistencyFailure(ConsistencyException failure) {
    log.error("redaction.consistency proposal={} expected={} actual={}: {}",
        failure.proposalId(), failure.expected(), failure.actual(), failure.getMessage());
  }
}
