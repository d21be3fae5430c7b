package jp.naoj.pfs.redaction.domain.redaction;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import jp.naoj.pfs.redaction.domain.fiber.FiberRecord;

/**
 * Replaces {@code objId} with a salted SHA-256 digest of the original {@code (catId, objId)}.
 *
 * <p>The digest input is the UTF-8 text {@code salt + catId + ":" + objId}; the first eight digest
 * bytes are read as an unsigned little-endian integer and reduced modulo {@link Long#MAX_VALUE},
 * so results are non-negative. Without the salt the mapping cannot be recomputed from public
 * catalog identifiers.</p>
 *
 * @since 0.1.0
 */
public final class SaltedHashObjectIdDeriver implements ObjectIdDeriver {
  private static final String ALGORITHM = "SHA-256";

  private final String salt;

  /**
   * Creates a deriver keyed by a secret salt.
   *
   * @param salt secret salt; must not be {@code null} or blank
   * @throws MaskingConfigurationException when the salt is missing
   */
  public SaltedHashObjectIdDeriver(String salt) {
    if (salt == null || salt.isBlank()) {
      throw new MaskingConfigurationException("secret salt must be provided for the salted-hash objId strategy");
    }
    this.salt = salt;
    // fail at construction rather than on the first masked row
    newDigest();
  }

  @Override
  public long derive(FiberRecord original) {
    return hash(original.catId(), original.objId());
  }

  /**
   * Hashes one catalog object.
   *
   * @param catId catalog identifier
   * @param objId catalog-internal object identifier
   * @return non-negative derived identifier
   */
  public long hash(int catId, long objId) {
    byte[] input = (salt + catId + ":" + objId).getBytes(StandardCharsets.UTF_8);
    byte[] digest = newDigest().digest(input);
    long prefix = ByteBuffer.wrap(digest, 0, Long.BYTES).order(ByteOrder.LITTLE_ENDIAN).getLong();
    return Long.remainderUnsigned(prefix, Long.MAX_VALUE);
  }

  private static MessageDigest newDigest() {
    try {
      return MessageDigest.getInstance(ALGORITHM);
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(ALGORITHM + " is not available in this JVM", ex);
    }
  }

  @Override
  public String toString() {
    return "SaltedHashObjectIdDeriver{algorithm=" + ALGORITHM + "}";
  }
}
