package jp.naoj.pfs.redaction.application.redaction;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import jp.naoj.pfs.redaction.domain.fiber.ConfigurationSet;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;
import jp.naoj.pfs.redaction.domain.fiber.FluxField;
import jp.naoj.pfs.redaction.domain.redaction.InputValidationException;

/**
 * Rejects malformed configurations before any proposal is processed.
 *
 * <p>Checks that fiber ids are unique, that proposal ids are not blank, and that every flux
 * sequence of a row has one entry per filter name. All problems are collected and reported
 * together.</p>
 *
 * @since 0.1.0
 */
public final class ConfigurationSetValidator {
  private static final int MAX_REPORTED = 50;

  /**
   * Validates a configuration.
   *
   * @param source configuration to check
   * @throws InputValidationException listing every problem found
   */
  public void validate(ConfigurationSet source) {
    List<String> problems = new ArrayList<>();
    Set<Integer> fiberIds = new HashSet<>();
    for (int i = 0; i < source.size() && problems.size() < MAX_REPORTED; i++) {
      FiberRecord row = source.row(i);
      if (!fiberIds.add(row.fiberId())) {
        problems.add("row " + i + ": duplicate fiberId " + row.fiberId());
      }
      if (row.proposalId().isBlank()) {
        problems.add("row " + i + " (fiberId " + row.fiberId() + "): blank proposalId");
      }
      int bands = row.filterNames().size();
      for (FluxField field : FluxField.values()) {
        int length = row.fluxLength(field);
        if (length != bands) {
          problems.add("row " + i + " (fiberId " + row.fiberId() + "): " + field.columnName()
              + " has " + length + " values for " + bands + " filters");
        }
      }
    }
    if (!problems.isEmpty()) {
      throw new InputValidationException(problems);
    }
  }
}
