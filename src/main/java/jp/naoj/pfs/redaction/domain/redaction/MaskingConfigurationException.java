package jp.naoj.pfs.redaction.domain.redaction;

/**
 * Raised when a masking policy cannot be used: a required secret salt is missing, or an override
 * value has the wrong type for its field.
 *
 * <p>Always raised before any row is processed.</p>
 *
 * @since 0.1.0
 */
public final class MaskingConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error naming the offending setting
   */
  public MaskingConfigurationException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error naming the offending setting
   * @param cause parse or lookup failure
   */
  public MaskingConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
