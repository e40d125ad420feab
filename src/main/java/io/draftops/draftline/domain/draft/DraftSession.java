package io.draftops.draftline.domain.draft;

import java.util.Objects;

/**
 * <strong>What:</strong> Identity and shape of the draft being tracked.
 * <p><strong>Why:</strong> Fixes the league, the tracked team and the grid dimensions the snake math relies on.</p>
 * <p><strong>Role:</strong> Domain value created once at startup and shared by the store and validator.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param leagueId vendor league identifier
 * @param myTeamId team whose roster is tracked as "my roster"
 * @param teamCount number of teams in the draft; positive
 * @param rounds number of rounds; positive
 * @since 0.1.0
 */
public record DraftSession(String leagueId, String myTeamId, int teamCount, int rounds) {

  /**
   * Validates the session fields.
   *
   * @throws IllegalArgumentException when team count or rounds are not positive
   */
  public DraftSession {
    Objects.requireNonNull(leagueId, "leagueId");
    Objects.requireNonNull(myTeamId, "myTeamId");
    if (teamCount <= 0) {
      throw new IllegalArgumentException("teamCount must be positive (was " + teamCount + ")");
    }
    if (rounds <= 0) {
      throw new IllegalArgumentException("rounds must be positive (was " + rounds + ")");
    }
  }

  /**
   * Returns the number of picks in a full draft.
   *
   * @return {@code teamCount * rounds}
   */
  public int totalPicks() {
    return teamCount * rounds;
  }
}
