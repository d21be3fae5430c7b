package jp.naoj.pfs.redaction.domain.fiber;

/**
 * Position on the prime focus instrument focal plane, in millimetres.
 *
 * <p>Record equality compares components with {@link Double#compare(double, double)}, so two points
 * that are both {@code (NaN, NaN)} are equal.</p>
 *
 * @param x focal-plane x coordinate
 * @param y focal-plane y coordinate
 * @since 0.1.0
 */
public record FocalPlanePoint(double x, double y) {
  /** Point used for masked fibers. */
  public static final FocalPlanePoint NAN = new FocalPlanePoint(Double.NaN, Double.NaN);

  /**
   * Parses {@code "x,y"} (optionally wrapped in parentheses) into a point.
   *
   * @param raw textual pair such as {@code "NaN,NaN"} or {@code "(1.5,-2.0)"}
   * @return parsed point
   * @throws IllegalArgumentException when the text is not a pair of doubles
   */
  public static FocalPlanePoint parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("focal-plane point must not be blank");
    }
    String trimmed = raw.trim();
    if (trimmed.startsWith("(") && trimmed.endsWith(")")) {
      trimmed = trimmed.substring(1, trimmed.length() - 1);
    }
    String[] parts = trimmed.split(",");
    if (parts.length != 2) {
      throw new IllegalArgumentException("focal-plane point must be 'x,y' (was '" + raw + "')");
    }
    try {
      return new FocalPlanePoint(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("focal-plane point must be numeric (was '" + raw + "')", ex);
    }
  }
}
