package jp.naoj.pfs.redaction.domain.redaction;

import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;

/**
 * Replaces {@code objId} with {@code -fiberId}.
 *
 * <p>Reversible by anyone holding the fiber table, but strips the link to the catalog object.</p>
 *
 * @since 0.1.0
 */
public final class NegatedFiberIdDeriver implements ObjectIdDeriver {
  /** Shared stateless instance. */
  public static final NegatedFiberIdDeriver INSTANCE = new NegatedFiberIdDeriver();

  private NegatedFiberIdDeriver() {}

  @Override
  public long derive(FiberRecord original) {
    return -(long) original.fiberId();
  }
}
