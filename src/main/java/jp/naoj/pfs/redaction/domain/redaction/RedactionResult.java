package jp.naoj.pfs.redaction.domain.redaction;

import java.util.Objects;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;

/**
 * The private view produced for one proposal.
 *
 * @param proposalId proposal the view was produced for
 * @param configuration redacted configuration, owned exclusively by this result
 * @param sequenceId position of this result in the run, starting at the configured base plus one
 * @since 0.1.0
 */
public record RedactionResult(String proposalId, ConfigurationSet configuration, long sequenceId) {
  public RedactionResult {
    Objects.requireNonNull(proposalId, "proposalId");
    Objects.requireNonNull(configuration, "configuration");
  }
}
