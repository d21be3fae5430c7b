package jp.naoj.pfs.redaction.logging;

import java.util.Collection;
import java.util.StringJoiner;

/**
 * <strong>What:</strong> Logging hygiene helpers for redaction runs.
 * <p><strong>Why:</strong> Keeps secrets out of operator logs and stops a large proposal list from
 * flooding a single log line.</p>
 * <p><strong>Role:</strong> Cross-cutting utility used by the policy, the engine and the CLI.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 0.1.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Returns a standard redacted placeholder for sensitive content.
   *
   * @param value ignored original value; retained for fluent API usage
   * @return the redacted placeholder string
   */
  public static String redact(String value) {
    return REDACTED_PLACEHOLDER;
  }

  /**
   * Joins the first {@code maxItems} elements of a collection, noting how many were left out.
   *
   * @param values values to render; {@code null} renders as {@code []}
   * @param maxItems maximum number of elements to print; must be positive
   * @return text such as {@code [a, b, ... +3 more]}
   * @throws IllegalArgumentException if {@code maxItems} is not positive
   */
  public static String abbreviate(Collection<?> values, int maxItems) {
    if (maxItems <= 0) {
      throw new IllegalArgumentException("maxItems must be positive");
    }
    StringJoiner joiner = new StringJoiner(", ", "[", "]");
    if (values == null) {
      return joiner.toString();
    }
    int shown = 0;
    for (Object value : values) {
      if (shown == maxItems) {
        joiner.add("... +" + (values.size() - shown) + " more");
        break;
      }
      joiner.add(String.valueOf(value));
      shown++;
    }
    return joiner.toString();
  }
}
