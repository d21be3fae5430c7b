package jp.naoj.pfs.redaction.validation;

/**
 * Numeric validation helpers used by CLI and configuration parsing.
 *
 * <p>Stateless; failures raise {@link IllegalArgumentException} naming the offending key.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that a numeric value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer, naming the key in the failure message.
   *
   * @param name configuration key
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a decimal integer
   */
  public static long parseLong(String name, String raw) {
    try {
      return Long.parseLong(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be an integer (was " + raw + ")", ex);
    }
  }

  /**
   * Parses a floating-point value; {@code NaN} and {@code Infinity} are accepted.
   *
   * @param name configuration key
   * @param raw text to parse
   * @return parsed value
   * @throws IllegalArgumentException if {@code raw} is not a number
   */
  public static double parseDouble(String name, String raw) {
    try {
      return Double.parseDouble(Strings.requireNonBlank(name, raw));
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(label(name) + " must be a number (was " + raw + ")", ex);
    }
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
