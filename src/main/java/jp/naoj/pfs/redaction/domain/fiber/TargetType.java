package jp.naoj.pfs.redaction.domain.fiber;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Classification of what a fiber was pointed at.
 *
 * <p>Numeric codes follow the PFS datamodel so that files written by other tools round-trip.
 * Only {@link #SCIENCE} rows are candidates for redaction; {@link #SCIENCE_MASKED} marks a science
 * row that was obscured for a foreign proposal.</p>
 *
 * @since 0.1.0
 */
public enum TargetType {
  /** Science target owned by a proposal. */
  SCIENCE(1),
  /** Blank sky fiber. */
  SKY(2),
  /** Flux standard star. */
  FLUXSTD(3),
  /** Fiber not assigned to any target. */
  UNASSIGNED(4),
  /** Engineering fiber. */
  ENGINEERING(5),
  /** SuNSS imaging fiber. */
  SUNSS_IMAGING(6),
  /** SuNSS diffuse fiber. */
  SUNSS_DIFFUSE(7),
  /** Dichroic beam combiner fiber. */
  DCB(8),
  /** Cobra parked at its home position. */
  HOME(9),
  /** Fiber hidden behind a black spot. */
  BLACKSPOT(10),
  /** All-fiber-lamp fiber. */
  AFL(11),
  /** Science fiber redacted for a foreign proposal. */
  SCIENCE_MASKED(12);

  private static final Pattern CODE_PATTERN = Pattern.compile("^[0-9]{1,3}$");

  private final int code;

  TargetType(int code) {
    this.code = code;
  }

  /**
   * Returns the datamodel numeric code.
   *
   * @return numeric code
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a target type from its datamodel code.
   *
   * @param code numeric code
   * @return matching target type
   * @throws IllegalArgumentException when no type carries {@code code}
   */
  public static TargetType fromCode(int code) {
    for (TargetType type : values()) {
      if (type.code == code) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown targetType code: " + code);
  }

  /**
   * Resolves a target type from either its name (case-insensitive) or its numeric code.
   *
   * @param raw name such as {@code SCIENCE_MASKED} or a code such as {@code 12}
   * @return matching target type
   * @throws IllegalArgumentException when {@code raw} matches nothing
   */
  public static TargetType parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("targetType must not be blank");
    }
    String trimmed = raw.trim();
    if (CODE_PATTERN.matcher(trimmed).matches()) {
      return fromCode(Integer.parseInt(trimmed));
    }
    try {
      return valueOf(trimmed.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("unknown targetType: " + raw, ex);
    }
  }
}
