package io.draftops.draftline.domain.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class DraftProtocolParserTest {
  private final DraftProtocolParser parser = new DraftProtocolParser();

  @Test
  void parsesSelectedWithOptionalMember() throws Exception {
    DraftEvent event = parser.parse("SELECTED 3 4039 17 member-9");

    assertEquals(DraftEventType.SELECTED, event.type());
    assertEquals(3, event.teamId());
    assertEquals("4039", event.playerId());
    assertEquals(17, event.pickNumber());
    assertEquals(Optional.of("member-9"), event.memberId());

    DraftEvent withoutMember = parser.parse("SELECTED 3 4039 17");
    assertTrue(withoutMember.memberId().isEmpty());
  }

  @Test
  void parsesSelectingAndClock() throws Exception {
    DraftEvent selecting = parser.parse("SELECTING 7 30000");
    assertEquals(DraftEventType.SELECTING, selecting.type());
    assertEquals(7, selecting.teamId());
    assertEquals(30_000L, selecting.millis());

    DraftEvent clock = parser.parse("CLOCK 7 12500 3");
    assertEquals(DraftEventType.CLOCK, clock.type());
    assertEquals(12_500L, clock.millis());
    assertEquals(Optional.of(3), clock.round());

    assertTrue(parser.parse("CLOCK 7 12500").round().isEmpty());
  }

  @Test
  void commandMatchIsCaseInsensitive() throws Exception {
    DraftEvent event = parser.parse("  selected 1 P1 1  ");

    assertEquals(DraftEventType.SELECTED, event.type());
    assertEquals("P1", event.playerId());
  }

  @Test
  void autodraftAcceptsOnlyBooleans() throws Exception {
    assertTrue(parser.parse("AUTODRAFT 2 TRUE").enabled());
    assertFalse(parser.parse("AUTODRAFT 2 false").enabled());

    ProtocolParseException ex = assertThrows(ProtocolParseException.class,
        () -> parser.parse("AUTODRAFT 2 yes"));
    assertEquals(DraftEventType.AUTODRAFT, ex.command());
    assertEquals("AUTODRAFT 2 yes", ex.frame());
  }

  @Test
  void rejectsMissingArguments() {
    assertThrows(ProtocolParseException.class, () -> parser.parse("SELECTED 1 P1"));
    assertThrows(ProtocolParseException.class, () -> parser.parse("SELECTING 1"));
    assertThrows(ProtocolParseException.class, () -> parser.parse("CLOCK"));
  }

  @Test
  void rejectsMalformedNumbers() {
    ProtocolParseException notNumeric = assertThrows(ProtocolParseException.class,
        () -> parser.parse("SELECTED x P1 1"));
    assertEquals(DraftEventType.SELECTED, notNumeric.command());

    assertThrows(ProtocolParseException.class, () -> parser.parse("SELECTING 1 -5"));
    assertThrows(ProtocolParseException.class, () -> parser.parse("SELECTED 1 P1 99999999999"));
  }

  @Test
  void sessionCommandsKeepArguments() throws Exception {
    DraftEvent token = parser.parse("TOKEN abc.def 3600");

    assertEquals(DraftEventType.TOKEN, token.type());
    assertEquals(List.of("abc.def", "3600"), token.arguments());
    assertTrue(token.type().isSession());
    assertTrue(parser.parse("PING").type().isHeartbeat());
  }

  @Test
  void unknownAndBlankFramesDoNotFail() throws Exception {
    DraftEvent unknown = parser.parse("TRADE 1 2");
    assertEquals(DraftEventType.UNKNOWN, unknown.type());
    assertEquals(List.of("TRADE", "1", "2"), unknown.arguments());

    assertEquals(DraftEventType.UNKNOWN, parser.parse("   ").type());
    assertEquals(DraftEventType.UNKNOWN, parser.parse(null).type());
  }

  @Test
  void toleratesTrailingTokens() throws Exception {
    DraftEvent event = parser.parse("SELECTING 4 30000 extra fields");

    assertEquals(4, event.teamId());
    assertEquals(30_000L, event.millis());
  }
}
