package jp.naoj.pfs.redaction.infrastructure.persistence.json;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalInt;
import jp.naoj.pfs.redaction.application.port.ConfigurationSetReader;
import jp.naoj.pfs.redaction.domain.design.DesignIdentifier;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads configurations stored as JSON files in one input directory.
 *
 * <p>Numeric and hexadecimal identifiers resolve to the canonical {@code pfsDesign}/{@code pfsConfig}
 * file name; file identifiers are used as given, relative to the input directory.</p>
 *
 * @since 0.1.0
 */
public final class JsonConfigurationSetReader implements ConfigurationSetReader {
  private static final Logger log = LoggerFactory.getLogger(JsonConfigurationSetReader.class);

  private final Path inputDirectory;
  private final JsonConfigurationCodec codec;

  public JsonConfigurationSetReader(Path inputDirectory) {
    this(inputDirectory, new JsonConfigurationCodec());
  }

  public JsonConfigurationSetReader(Path inputDirectory, JsonConfigurationCodec codec) {
    this.inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory");
    this.codec = Objects.requireNonNull(codec, "codec");
  }

  @Override
  public Path resolve(DesignIdentifier identifier, OptionalInt visit) {
    Path candidate = inputDirectory.resolve(identifier.resolveFileName(visit)).normalize();
    if (!candidate.startsWith(inputDirectory.normalize())) {
      throw new IllegalArgumentException("design file " + candidate + " escapes input directory " + inputDirectory);
    }
    return candidate;
  }

  @Override
  public ConfigurationSet read(DesignIdentifier identifier, OptionalInt visit) throws IOException {
    Path file = resolve(identifier, visit);
    if (!Files.isRegularFile(file)) {
      throw new NoSuchFileException(file.toString(), null, "configuration file not found");
    }
    log.info("Reading configuration from {}", file);
    ConfigurationSet set;
    try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
      set = codec.read(in);
    }
    if (identifier.designId().isPresent() && identifier.designId().getAsLong() != set.header().pfsDesignId()) {
      log.warn("File {} holds design {} but {} was requested", file, set.header().designIdHex(),
          String.format(Locale.ROOT, "0x%016x", identifier.designId().getAsLong()));
    }
    log.debug("Loaded {} from {}", set, file);
    return set;
  }
}
