package jp.naoj.pfs.redaction.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.OptionalInt;
import jp.naoj.pfs.redaction.domain.design.DesignIdentifier;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;

/**
 * <strong>What:</strong> Inbound port that materializes a {@link ConfigurationSet} from storage.
 * <p><strong>Why:</strong> Keeps the redaction engine free of file formats and identifier resolution.</p>
 * <p><strong>Thread-safety:</strong> Implementations are used from the CLI thread only.</p>
 *
 * @since 0.1.0
 */
public interface ConfigurationSetReader {
  /**
   * Resolves the file an identifier refers to.
   *
   * @param identifier numeric, hexadecimal or file identifier
   * @param visit exposure visit; present selects the per-exposure configuration
   * @return path of the file that {@link #read(DesignIdentifier, OptionalInt)} would open
   */
  Path resolve(DesignIdentifier identifier, OptionalInt visit);

  /**
   * Loads a configuration.
   *
   * @param identifier numeric, hexadecimal or file identifier
   * @param visit exposure visit; present selects the per-exposure configuration
   * @return fully materialized configuration
   * @throws IOException when the file is missing, unreadable or malformed
   */
  ConfigurationSet read(DesignIdentifier identifier, OptionalInt visit) throws IOException;
}
