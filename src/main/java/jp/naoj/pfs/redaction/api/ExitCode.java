package jp.naoj.pfs.redaction.api;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import jp.naoj.pfs.redaction.domain.redaction.ConsistencyException;
import jp.naoj.pfs.redaction.domain.redaction.InputValidationException;
import jp.naoj.pfs.redaction.domain.redaction.MaskingConfigurationException;

/**
 * <strong>What:</strong> Exit codes shared by the redaction command-line tools.
 * <p><strong>Why:</strong> Lets observatory pipelines tell bad arguments, unreadable inputs and failed
 * consistency checks apart without parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable and thread-safe.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Reading the input or writing an output failed, including input that is not a parseable document. */
  IO_ERROR(3),
  /** The masking configuration is unusable, e.g. no salt for salted hashing. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure occurred. */
  RUNTIME_FAILURE(5),
  /** The input parsed but its rows are inconsistent, e.g. duplicate fiber ids. */
  INPUT_ERROR(6),
  /** A redacted view failed its consistency check; nothing was written. */
  CONSISTENCY_FAILURE(7),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /**
   * Classifies a failure raised while loading, redacting or writing a configuration.
   *
   * <p>The most specific redaction error wins: {@link InputValidationException} and
   * {@link MaskingConfigurationException} are both {@link IllegalArgumentException}s but keep their own codes;
   * anything unrecognised is a {@link #RUNTIME_FAILURE}.</p>
   *
   * @param failure exception that ended the run; must not be {@code null}
   * @return exit code for the failure, never {@link #SUCCESS}
   */
  public static ExitCode forFailure(Throwable failure) {
    if (failure instanceof InputValidationException) {
      return INPUT_ERROR;
    }
    if (failure instanceof ConsistencyException) {
      return CONSISTENCY_FAILURE;
    }
    if (failure instanceof MaskingConfigurationException) {
      return CONFIG_ERROR;
    }
    if (failure instanceof IOException || failure instanceof UncheckedIOException) {
      return IO_ERROR;
    }
    if (failure instanceof CancellationException || failure instanceof InterruptedException) {
      return INTERRUPTED;
    }
    return RUNTIME_FAILURE;
  }
}
