package io.draftops.draftline.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateKeepsShortValues() {
    assertEquals("SELECTED 1 P1 1", Logs.truncate("SELECTED 1 P1 1", 64));
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void truncateCutsOnCharacterBoundary() {
    String truncated = Logs.truncate("ééééé", 3);

    assertTrue(truncated.startsWith("é..."));
    assertTrue(truncated.endsWith("(truncated, 3 of 10 bytes)"));
  }

  @Test
  void truncateRejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactKeepsCommandOnly() {
    assertEquals("TOKEN [REDACTED]", Logs.redact("  TOKEN abc.def.ghi "));
    assertEquals("[REDACTED]", Logs.redact("TOKEN"));
    assertEquals("<null>", Logs.redact(null));
  }
}
