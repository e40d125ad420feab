package io.draftops.draftline.api;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class CliInputTest {
  @Test
  void separatesFlagsFromArguments() {
    CliInput input = CliInput.parse(new String[] {"capture=a.txt", "-v", "--JSON", " ", "teamId=2"});

    assertArrayEquals(new String[] {"capture=a.txt", "teamId=2"}, input.arguments());
    assertTrue(input.verbose());
    assertTrue(input.hasFlag("--json"));
    assertFalse(input.help());
  }

  @Test
  void recognisesHelpAliases() {
    assertTrue(CliInput.parse(new String[] {"-h"}).help());
    assertTrue(CliInput.parse(new String[] {"help"}).help());
    assertFalse(CliInput.parse(null).help());
  }
}
