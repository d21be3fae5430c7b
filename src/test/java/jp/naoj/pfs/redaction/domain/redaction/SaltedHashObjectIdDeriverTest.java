package jp.naoj.pfs.redaction.domain.redaction;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import jp.naoj.pfs.redaction.testutil.FiberFixtures;
import org.junit.jupiter.api.Test;

class SaltedHashObjectIdDeriverTest {

  @Test
  void knownVectors() {
    SaltedHashObjectIdDeriver deriver = new SaltedHashObjectIdDeriver("test-salt");

    assertEquals(1523084115464622944L, deriver.hash(1000, 10));
    assertEquals(5569232523098047753L, deriver.hash(1000, 20));
    assertEquals(5150293412392441810L, deriver.hash(2000, 10));
    assertEquals(8531138110683084876L, new SaltedHashObjectIdDeriver("other-salt").hash(1000, 10));
  }

  @Test
  void deriveHashesCatalogAndObjectOfTheOriginalRow() {
    SaltedHashObjectIdDeriver deriver = new SaltedHashObjectIdDeriver("test-salt");

    assertEquals(1523084115464622944L, deriver.derive(FiberFixtures.science(7, "P1", 1000, 10)));
  }

  @Test
  void sameInputAlwaysYieldsTheSameIdentifier() {
    SaltedHashObjectIdDeriver a = new SaltedHashObjectIdDeriver("s");
    SaltedHashObjectIdDeriver b = new SaltedHashObjectIdDeriver("s");

    assertEquals(a.hash(1, 2), b.hash(1, 2));
    assertNotEquals(a.hash(1, 2), a.hash(2, 1));
  }

  @Test
  void resultIsNeverNegative() {
    SaltedHashObjectIdDeriver deriver = new SaltedHashObjectIdDeriver("range-check");
    for (int catId = 0; catId < 50; catId++) {
      for (long objId = -25; objId < 25; objId++) {
        long hashed = deriver.hash(catId, objId);
        assertTrue(hashed >= 0 && hashed < Long.MAX_VALUE, "out of range: " + hashed);
      }
    }
  }

  @Test
  void blankSaltIsAConfigurationError() {
    assertThrows(MaskingConfigurationException.class, () -> new SaltedHashObjectIdDeriver(" "));
    assertThrows(MaskingConfigurationException.class, () -> new SaltedHashObjectIdDeriver(null));
  }

  @Test
  void toStringDoesNotRevealTheSalt() {
    assertFalse(new SaltedHashObjectIdDeriver("hunter2").toString().contains("hunter2"));
  }
}
