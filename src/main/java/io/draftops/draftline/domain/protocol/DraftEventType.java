package io.draftops.draftline.domain.protocol;

import java.util.Locale;

/**
 * Commands understood on the draft wire protocol.
 *
 * @since 0.1.0
 */
public enum DraftEventType {
  /** A team completed a pick. */
  SELECTED,
  /** A team went on the clock. */
  SELECTING,
  /** Countdown tick for the team on the clock. */
  CLOCK,
  /** A team toggled autodraft. */
  AUTODRAFT,
  /** Session token exchange. */
  TOKEN,
  /** A member joined the draft room. */
  JOINED,
  /** A member left the draft room. */
  LEFT,
  /** Heartbeat request. */
  PING,
  /** Heartbeat reply. */
  PONG,
  /** Any command the parser does not recognise. */
  UNKNOWN;

  /**
   * Indicates whether the command only manages the session and never affects draft state.
   *
   * @return {@code true} for TOKEN, JOINED, LEFT, PING and PONG
   */
  public boolean isSession() {
    return this == TOKEN || this == JOINED || this == LEFT || this == PING || this == PONG;
  }

  /**
   * Indicates whether the command is a heartbeat.
   *
   * @return {@code true} for PING and PONG
   */
  public boolean isHeartbeat() {
    return this == PING || this == PONG;
  }

  /**
   * Resolves a command token case-insensitively.
   *
   * @param token first token of a frame; may be {@code null}
   * @return matching type, or {@link #UNKNOWN}
   */
  public static DraftEventType fromCommand(String token) {
    if (token == null || token.isBlank()) {
      return UNKNOWN;
    }
    String normalized = token.trim().toUpperCase(Locale.ROOT);
    for (DraftEventType type : values()) {
      if (type != UNKNOWN && type.name().equals(normalized)) {
        return type;
      }
    }
    return UNKNOWN;
  }
}
