package jp.naoj.pfs.redaction.validation;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation utilities for strings read from the CLI, YAML and configuration files.
 * <p><strong>Why:</strong> Proposal identifiers and prefixes end up in output file names, so they must be
 * restricted to characters every filesystem accepts.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject blank or control-character inputs.</li>
 *   <li>Restrict file-name tokens to {@code [A-Za-z0-9._-]}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 * <p><strong>Observability:</strong> No logs; violations raise {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 * @see Numbers
 * @see Paths
 */
public final class Strings {
  private static final Pattern TOKEN_PATTERN = Pattern.compile("^([A-Za-z0-9._-]+)$");

  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank, and control-character free.
   *
   * @param name logical parameter name for diagnostics; if {@code null} defaults to {@code "value"}
   * @param value candidate text; must not be {@code null}
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    if (containsControl(raw)) {
      throw new IllegalArgumentException(message(name, "must not contain control characters"));
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    return trimmed;
  }

  /**
   * Validates a token that becomes part of a file name, such as a proposal id or output prefix.
   *
   * @param name logical parameter name included in exception messages
   * @param token candidate token; must be non-null
   * @return trimmed token matching {@code [A-Za-z0-9._-]+}
   * @throws NullPointerException if {@code token} is {@code null}
   * @throws IllegalArgumentException if the token is blank, contains unsupported characters, or is a
   *     relative path segment ({@code .} or {@code ..})
   */
  public static String sanitizeFileToken(String name, String token) {
    String sanitized = requireNonBlank(name, token);
    if (!TOKEN_PATTERN.matcher(sanitized).matches()) {
      throw new IllegalArgumentException(message(name,
          "must only contain letters, digits, dot, underscore, or hyphen (was " + sanitized + ")"));
    }
    if (sanitized.equals(".") || sanitized.equals("..")) {
      throw new IllegalArgumentException(message(name, "must not be a relative path segment"));
    }
    return sanitized;
  }

  /**
   * Returns {@code true} when the value is {@code null}, empty or whitespace only.
   *
   * @param value candidate text
   * @return whether the value carries no content
   */
  public static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
