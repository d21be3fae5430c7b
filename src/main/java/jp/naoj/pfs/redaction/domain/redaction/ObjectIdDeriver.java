package jp.naoj.pfs.redaction.domain.redaction;

import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;

/**
 * Computes the replacement {@code objId} written into a masked fiber.
 *
 * <p>Implementations read the original, unmasked row and must be deterministic and safe to call
 * from several redaction workers at once.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface ObjectIdDeriver {
  /**
   * Derives the replacement object identifier.
   *
   * @param original the row as it appears in the source configuration
   * @return identifier written into the masked row
   */
  long derive(FiberRecord original);
}
