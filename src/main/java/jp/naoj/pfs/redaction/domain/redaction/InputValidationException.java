package jp.naoj.pfs.redaction.domain.redaction;

import java.util.List;

/**
 * Raised when a configuration set is rejected at ingestion, before any proposal is processed.
 *
 * @since 0.1.0
 */
public final class InputValidationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final List<String> problems;

  /**
   * Creates an exception listing every problem found in the input.
   *
   * @param problems one human-readable entry per violation; must not be empty
   */
  public InputValidationException(List<String> problems) {
    super(summarize(problems));
    this.problems = List.copyOf(problems);
  }

  /**
   * Returns every violation found, in row order.
   *
   * @return unmodifiable list of problems
   */
  public List<String> problems() {
    return problems;
  }

  private static String summarize(List<String> problems) {
    if (problems.isEmpty()) {
      throw new IllegalArgumentException("problems must not be empty");
    }
    String first = problems.get(0);
    return problems.size() == 1
        ? "invalid configuration set: " + first
        : "invalid configuration set: " + first + " (and " + (problems.size() - 1) + " more)";
  }
}
