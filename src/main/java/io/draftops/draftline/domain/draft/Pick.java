package io.draftops.draftline.domain.draft;

import java.util.Objects;

/**
 * A completed selection in the draft.
 *
 * @param pickNumber 1-based overall pick number
 * @param playerId vendor player identifier
 * @param teamId team that made the pick
 * @param position roster bucket the player was placed in when the pick was recorded
 * @param timestampMillis epoch milliseconds at which the pick was applied
 * @since 0.1.0
 */
public record Pick(int pickNumber, String playerId, String teamId, RosterPosition position, long timestampMillis) {

  /**
   * Validates pick fields.
   */
  public Pick {
    Objects.requireNonNull(playerId, "playerId");
    Objects.requireNonNull(teamId, "teamId");
    Objects.requireNonNull(position, "position");
  }
}
