package jp.naoj.pfs.redaction.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {

  @Test
  void separatesFlagsFromKeyValues() {
    CliInput input = CliInput.parse(new String[] {"design=0x1", "--Dry-Run", "-v", "out=/tmp/x", "-h"});

    assertArrayEquals(new String[] {"design=0x1", "out=/tmp/x"}, input.keyValueArgs());
    assertEquals(Set.of("--dry-run", "--verbose", "--help"), input.flags());
    assertTrue(input.help());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--DRY-RUN"));
    assertFalse(input.hasFlag("--allow-overwrite"));
    assertFalse(input.hasFlag(" "));
  }

  @Test
  void dashedValuesStayKeyValues() {
    CliInput input = CliInput.parse(new String[] {"-prefix=x"});

    assertArrayEquals(new String[] {"-prefix=x"}, input.keyValueArgs());
    assertTrue(input.flags().isEmpty());
  }

  @Test
  void nullArgumentsYieldEmptyInput() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertFalse(input.help());
  }
}
