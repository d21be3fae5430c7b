package jp.naoj.pfs.redaction.domain.redaction;

import java.util.Locale;
import java.util.Optional;

/**
 * Selects how a masked fiber's {@code objId} is replaced. The variants are mutually exclusive.
 *
 * @since 0.1.0
 */
public enum ObjectIdStrategy {
  /** Salted SHA-256 of {@code (catId, objId)}; requires a secret salt. */
  SALTED_HASH,
  /** {@code -fiberId}; needs no secret. */
  NEGATED_FIBER_ID;

  /**
   * Creates the deriver for this strategy.
   *
   * @param salt secret salt; required by {@link #SALTED_HASH}, ignored otherwise
   * @return deriver ready for use
   * @throws MaskingConfigurationException when {@link #SALTED_HASH} is selected without a salt
   */
  public ObjectIdDeriver deriver(Optional<String> salt) {
    return switch (this) {
      case SALTED_HASH -> new SaltedHashObjectIdDeriver(salt.orElse(null));
      case NEGATED_FIBER_ID -> NegatedFiberIdDeriver.INSTANCE;
    };
  }

  /**
   * Parses a strategy name, accepting hyphens and any case.
   *
   * @param raw value such as {@code salted-hash}
   * @return matching strategy
   * @throws MaskingConfigurationException when nothing matches
   */
  public static ObjectIdStrategy parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new MaskingConfigurationException("objIdStrategy must not be blank");
    }
    String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return valueOf(normalized);
    } catch (IllegalArgumentException ex) {
      throw new MaskingConfigurationException(
          "objIdStrategy must be SALTED_HASH or NEGATED_FIBER_ID (was " + raw + ")", ex);
    }
  }
}
