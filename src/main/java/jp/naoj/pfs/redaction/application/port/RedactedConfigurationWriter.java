package jp.naoj.pfs.redaction.application.port;

import java.io.IOException;
import java.nio.file.Path;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;

/**
 * <strong>What:</strong> Outbound port persisting one redacted view per proposal.
 * <p><strong>Why:</strong> The engine never builds file names or touches storage.</p>
 * <p><strong>Thread-safety:</strong> Implementations are called from the CLI thread only.</p>
 *
 * @since 0.1.0
 */
public interface RedactedConfigurationWriter {
  /**
   * Names the artifact a result would be written to without writing it.
   *
   * @param prefix input-derived prefix
   * @param proposalId proposal the view belongs to
   * @return target path
   * @throws IllegalArgumentException when the prefix or proposal id cannot form a safe file name
   */
  Path target(String prefix, String proposalId);

  /**
   * Persists a redacted view.
   *
   * @param prefix input-derived prefix
   * @param result result to persist
   * @return path of the written artifact
   * @throws IOException when writing fails
   */
  Path write(String prefix, RedactionResult result) throws IOException;
}
