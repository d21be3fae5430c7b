package jp.naoj.pfs.redaction.domain.design;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.OptionalLong;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies the design or configuration a run should load.
 *
 * <p>Operators refer to a design either by its 64-bit identifier written in decimal
 * ({@code 5734893949501672337}) or hexadecimal ({@code 0x4f966fa98c958b91}), or by a file name
 * ({@code pfsDesign-0x4f966fa98c958b91.json}). Identifiers are stored as the raw 64 bits, so values
 * above {@link Long#MAX_VALUE} round-trip through their hexadecimal form.</p>
 *
 * @param kind how the identifier was supplied
 * @param designId design identifier when known; a file name that does not follow the canonical
 *     pattern leaves it empty until the file header is read
 * @param fileName file name for {@link Kind#FILE}; empty otherwise
 * @since 0.1.0
 */
public record DesignIdentifier(Kind kind, OptionalLong designId, Optional<String> fileName) {
  /** File extension written and read by the JSON persistence adapter. */
  public static final String EXTENSION = ".json";

  private static final Pattern HEX = Pattern.compile("^0[xX]([0-9a-fA-F]{1,16})$");
  private static final Pattern DECIMAL = Pattern.compile("^[0-9]{1,20}$");
  private static final Pattern CANONICAL_FILE =
      Pattern.compile("^pfs(?:Design|Config)-0x([0-9a-fA-F]{16})(?:-([0-9]{6}))?\\.[A-Za-z]+$");

  /** How an identifier was written. */
  public enum Kind {
    NUMERIC,
    HEX,
    FILE;

    /**
     * Parses the {@code idType} option; {@code auto} or blank yields {@link Optional#empty()}.
     *
     * @param raw option value
     * @return explicit kind or empty for auto-detection
     */
    public static Optional<Kind> parseOption(String raw) {
      if (raw == null || raw.isBlank()) {
        return Optional.empty();
      }
      return switch (raw.trim().toLowerCase(Locale.ROOT)) {
        case "auto" -> Optional.empty();
        case "int", "numeric", "decimal" -> Optional.of(NUMERIC);
        case "hex" -> Optional.of(HEX);
        case "file", "filename" -> Optional.of(FILE);
        default -> throw new IllegalArgumentException("idType must be auto, int, hex, or file (was " + raw + ")");
      };
    }
  }

  public DesignIdentifier {
    Objects.requireNonNull(kind, "kind");
    designId = Objects.requireNonNullElse(designId, OptionalLong.empty());
    fileName = Objects.requireNonNullElse(fileName, Optional.empty());
    if (kind == Kind.FILE && fileName.isEmpty()) {
      throw new IllegalArgumentException("file identifiers require a file name");
    }
    if (kind != Kind.FILE && designId.isEmpty()) {
      throw new IllegalArgumentException(kind + " identifiers require a design id");
    }
  }

  /**
   * Parses an identifier, detecting its kind when {@code kind} is empty.
   *
   * @param raw identifier text
   * @param kind explicit kind, or empty to detect
   * @return parsed identifier
   * @throws IllegalArgumentException when the text does not match the requested or any kind
   */
  public static DesignIdentifier parse(String raw, Optional<Kind> kind) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("design identifier must not be blank");
    }
    String trimmed = raw.trim();
    Kind effective = kind.orElseGet(() -> detect(trimmed));
    return switch (effective) {
      case NUMERIC -> ofId(Kind.NUMERIC, parseDecimal(trimmed));
      case HEX -> ofId(Kind.HEX, parseHex(trimmed));
      case FILE -> ofFile(trimmed);
    };
  }

  /**
   * Creates a file identifier, recovering the design id when the name is canonical.
   *
   * @param fileName file name relative to the input directory
   * @return identifier of kind {@link Kind#FILE}
   */
  public static DesignIdentifier ofFile(String fileName) {
    Matcher matcher = CANONICAL_FILE.matcher(fileName);
    OptionalLong id = matcher.matches()
        ? OptionalLong.of(Long.parseUnsignedLong(matcher.group(1), 16))
        : OptionalLong.empty();
    return new DesignIdentifier(Kind.FILE, id, Optional.of(fileName));
  }

  /**
   * Returns the visit encoded in a canonical {@code pfsConfig} file name.
   *
   * @return visit number, or empty when the identifier is not such a file name
   */
  public OptionalInt visitFromFileName() {
    if (fileName.isEmpty()) {
      return OptionalInt.empty();
    }
    Matcher matcher = CANONICAL_FILE.matcher(fileName.get());
    if (matcher.matches() && matcher.group(2) != null) {
      return OptionalInt.of(Integer.parseInt(matcher.group(2)));
    }
    return OptionalInt.empty();
  }

  /**
   * Resolves the file name to read: the supplied one, or the canonical name derived from the id.
   *
   * @param visit exposure visit; present selects the {@code pfsConfig} naming
   * @return file name relative to the input directory
   */
  public String resolveFileName(OptionalInt visit) {
    if (fileName.isPresent()) {
      return fileName.get();
    }
    return canonicalFileName(designId.getAsLong(), visit);
  }

  /**
   * Builds the canonical file name for a design or configuration.
   *
   * @param designId design identifier
   * @param visit exposure visit; present selects {@code pfsConfig-0x...-NNNNNN}
   * @return canonical file name including {@link #EXTENSION}
   */
  public static String canonicalFileName(long designId, OptionalInt visit) {
    if (visit.isPresent()) {
      return String.format(Locale.ROOT, "pfsConfig-0x%016x-%06d%s", designId, visit.getAsInt(), EXTENSION);
    }
    return String.format(Locale.ROOT, "pfsDesign-0x%016x%s", designId, EXTENSION);
  }

  private static DesignIdentifier ofId(Kind kind, long id) {
    return new DesignIdentifier(kind, OptionalLong.of(id), Optional.empty());
  }

  private static Kind detect(String value) {
    if (HEX.matcher(value).matches()) {
      return Kind.HEX;
    }
    if (DECIMAL.matcher(value).matches()) {
      return Kind.NUMERIC;
    }
    if (value.contains(".") || value.startsWith("pfs")) {
      return Kind.FILE;
    }
    throw new IllegalArgumentException("cannot detect design identifier type: " + value);
  }

  private static long parseDecimal(String value) {
    if (!DECIMAL.matcher(value).matches()) {
      throw new IllegalArgumentException("design id must be a decimal integer (was " + value + ")");
    }
    try {
      return Long.parseUnsignedLong(value);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("design id exceeds 64 bits: " + value, ex);
    }
  }

  private static long parseHex(String value) {
    String digits = value;
    Matcher matcher = HEX.matcher(value);
    if (matcher.matches()) {
      digits = matcher.group(1);
    }
    if (digits.isEmpty() || digits.length() > 16 || !digits.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
      throw new IllegalArgumentException("design id must be hexadecimal (was " + value + ")");
    }
    return Long.parseUnsignedLong(digits, 16);
  }
}
