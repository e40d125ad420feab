package io.draftops.draftline.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrimsValue() {
    assertEquals("league-7", Strings.requireNonBlank("leagueId", "  league-7 "));
  }

  @Test
  void requireNonBlankRejectsNullBlankAndControlCharacters() {
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("leagueId", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("leagueId", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("leagueId", "a\tb"));
  }

  @Test
  void requirePrintableAsciiEnforcesLengthAndCharset() {
    assertEquals("team-1", Strings.requirePrintableAscii("teamId", "team-1", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("teamId", "team-1", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("teamId", "équipe", 16));
  }

  @Test
  void splitCsvDropsEmptyEntries() {
    assertEquals(List.of("3", "1", "2"), Strings.splitCsv("draftOrder", " 3, 1,,2 , "));
    assertEquals(List.of(), Strings.splitCsv("draftOrder", null));
  }
}
