package ca.gc.cra.sweep.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromKeyValueArguments() {
    CliInput input = CliInput.parse(new String[] {"--Quick", "mode=smoke", "-v", "--no-resume", "--out=dir"});

    assertTrue(input.verbose());
    assertFalse(input.help());
    assertTrue(input.hasFlag("--quick"));
    assertTrue(input.hasFlag("--NO-RESUME"));
    assertArrayEquals(new String[] {"mode=smoke", "--out=dir"}, input.keyValueArgs());
  }

  @Test
  void reportsOnlyUnrecognizedFlags() {
    CliInput input = CliInput.parse(new String[] {"--help", "--quick", "--turbo", "--debug"});

    assertTrue(input.help());
    assertEquals(List.of("--turbo"), input.unknownFlags(Set.of("--quick")));
  }

  @Test
  void emptyInputHasNoFlags() {
    CliInput input = CliInput.parse(null);

    assertEquals(0, input.keyValueArgs().length);
    assertTrue(input.flags().isEmpty());
    assertFalse(input.hasFlag(" "));
  }
}
