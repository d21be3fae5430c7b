package jp.naoj.pfs.redaction.config;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import jp.naoj.pfs.redaction.domain.design.DesignIdentifier;
import jp.naoj.pfs.redaction.validation.Numbers;

/**
 * Selects the configuration file a command reads.
 *
 * @param design design identifier as numeric id, hexadecimal id or file name
 * @param visit exposure visit; present selects {@code pfsConfig-0x...-NNNNNN.json}
 * @param inputDirectory directory holding design and configuration files
 * @since 0.1.0
 */
public record SourceSelection(DesignIdentifier design, OptionalInt visit, Path inputDirectory) {
  static final int MAX_VISIT = 999_999;

  public SourceSelection {
    Objects.requireNonNull(design, "design");
    visit = Objects.requireNonNullElse(visit, OptionalInt.empty());
    inputDirectory = Objects.requireNonNull(inputDirectory, "inputDirectory").toAbsolutePath().normalize();
  }

  /**
   * Builds a selection from flattened configuration.
   *
   * <p>Reads {@code design}, {@code idType}, {@code visit} and {@code in}. When {@code visit} is absent
   * and the design is a canonical {@code pfsConfig} file name, the visit is taken from the name.</p>
   *
   * @param options merged configuration
   * @return selection
   * @throws IllegalArgumentException when {@code design} is missing or any value is malformed
   */
  public static SourceSelection fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    String rawDesign = options.get("design");
    if (rawDesign == null || rawDesign.isBlank()) {
      throw new IllegalArgumentException("design is required (numeric id, 0x hex id, or file name)");
    }
    Optional<DesignIdentifier.Kind> kind = DesignIdentifier.Kind.parseOption(options.get("idType"));
    DesignIdentifier design = DesignIdentifier.parse(rawDesign, kind);

    OptionalInt visit = OptionalInt.empty();
    String rawVisit = options.get("visit");
    if (rawVisit != null && !rawVisit.isBlank()) {
      visit = OptionalInt.of((int) Numbers.requireRange("visit", Numbers.parseLong("visit", rawVisit), 0, MAX_VISIT));
    } else {
      visit = design.visitFromFileName();
    }

    String rawIn = options.getOrDefault("in", ".");
    Path input;
    try {
      input = Path.of(rawIn.isBlank() ? "." : rawIn.trim());
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("in must be a valid path (was " + rawIn + ")", ex);
    }
    return new SourceSelection(design, visit, input);
  }

  /**
   * Returns the file name this selection resolves to.
   *
   * @return file name relative to {@link #inputDirectory()}
   */
  public String fileName() {
    return design.resolveFileName(visit);
  }
}
