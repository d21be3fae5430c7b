package jp.naoj.pfs.redaction.infrastructure.persistence.json;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import jp.naoj.pfs.redaction.application.port.RedactedConfigurationWriter;
import jp.naoj.pfs.redaction.domain.design.DesignIdentifier;
import jp.naoj.pfs.redaction.domain.redaction.RedactionResult;
import jp.naoj.pfs.redaction.validation.Strings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each redacted view to {@code <prefix>_<proposalId>.json} in the output directory.
 *
 * <p>Files are written to a temporary sibling first and moved into place, so a failed run never
 * leaves a truncated view behind. Prefix and proposal id must be file-name tokens.</p>
 *
 * @since 0.1.0
 */
public final class JsonRedactedConfigurationWriter implements RedactedConfigurationWriter {
  private static final Logger log = LoggerFactory.getLogger(JsonRedactedConfigurationWriter.class);

  private final Path outputDirectory;
  private final JsonConfigurationCodec codec;

  public JsonRedactedConfigurationWriter(Path outputDirectory) {
    this(outputDirectory, new JsonConfigurationCodec());
  }

  public JsonRedactedConfigurationWriter(Path outputDirectory, JsonConfigurationCodec codec) {
    this.outputDirectory = Objects.requireNonNull(outputDirectory, "outputDirectory");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public Path target(String prefix, String proposalId) {
    String safePrefix = Strings.sanitizeFileToken("prefix", prefix);
    String safeProposal = Strings.sanitizeFileToken("proposalId", proposalId);
    return outputDirectory.resolve(safePrefix + "_" + safeProposal + DesignIdentifier.EXTENSION);
  }

  @Override
  public synchronized Path write(String prefix, RedactionResult result) throws IOException {
    Objects.requireNonNull(result, "result");
    Path target = target(prefix, result.proposalId());
    Files.createDirectories(outputDirectory);
    Path temp = Files.createTempFile(outputDirectory, "." + target.getFileName(), ".tmp");
    try {
      try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(temp))) {
        codec.write(result.configuration(), out);
      }
      move(temp, target);
    } catch (IOException | RuntimeException ex) {
      Files.deleteIfExists(temp);
      throw ex;
    }
    log.info("Wrote {} fibers for proposal {} (sequence {}) to {}",
        result.configuration().size(), result.proposalId(), result.sequenceId(), target);
    return target;
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; falling back to replace", target, ex);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }
}
