package io.draftops.draftline.domain.draft;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless snake-order arithmetic for a single team.
 * <p>Even rounds (0-based) run in draft order, odd rounds in reverse.</p>
 *
 * @since 0.1.0
 */
public final class SnakeDraftCalculator {
  private final int teamCount;
  private final int rounds;
  private final int myIndex;
  private final List<Integer> pickNumbers;

  /**
   * Precomputes the overall pick numbers owned by the team at {@code myIndex}.
   *
   * @param teamCount number of teams; positive
   * @param rounds number of rounds; positive
   * @param myIndex 0-based position in the draft order; within {@code [0, teamCount)}
   * @throws IllegalArgumentException when any argument is out of range
   */
  public SnakeDraftCalculator(int teamCount, int rounds, int myIndex) {
    if (teamCount <= 0) {
      throw new IllegalArgumentException("teamCount must be positive (was " + teamCount + ")");
    }
    if (rounds <= 0) {
      throw new IllegalArgumentException("rounds must be positive (was " + rounds + ")");
    }
    if (myIndex < 0 || myIndex >= teamCount) {
      throw new IllegalArgumentException(
          "myIndex must be between 0 and " + (teamCount - 1) + " (was " + myIndex + ")");
    }
    this.teamCount = teamCount;
    this.rounds = rounds;
    this.myIndex = myIndex;
    this.pickNumbers = List.copyOf(compute(teamCount, rounds, myIndex));
  }

  /**
   * Returns this team's overall pick numbers in ascending order.
   *
   * @return immutable list with one entry per round
   */
  public List<Integer> pickNumbers() {
    return pickNumbers;
  }

  /**
   * Returns how many picks remain until this team's next turn.
   *
   * @param currentPick overall pick number in progress or last completed
   * @return distance to the next owned pick strictly after {@code currentPick}, or {@code 0} if none remain
   */
  public int picksUntilNext(int currentPick) {
    for (int pick : pickNumbers) {
      if (pick > currentPick) {
        return pick - currentPick;
      }
    }
    return 0;
  }

  /**
   * Returns the 0-based draft-order index of the team owning an overall pick.
   *
   * @param pickNumber 1-based overall pick number
   * @param teamCount number of teams
   * @return owning team index, or {@code -1} when {@code pickNumber} is not positive
   */
  public static int teamIndexForPick(int pickNumber, int teamCount) {
    if (pickNumber <= 0 || teamCount <= 0) {
      return -1;
    }
    int round = (pickNumber - 1) / teamCount;
    int slot = (pickNumber - 1) % teamCount;
    return round % 2 == 0 ? slot : teamCount - 1 - slot;
  }

  /**
   * @return number of picks in the full draft
   */
  public int totalPicks() {
    return teamCount * rounds;
  }

  /**
   * @return 0-based index this calculator was built for
   */
  public int myIndex() {
    return myIndex;
  }

  private static List<Integer> compute(int teamCount, int rounds, int myIndex) {
    List<Integer> picks = new ArrayList<>(rounds);
    for (int round = 0; round < rounds; round++) {
      if (round % 2 == 0) {
        picks.add(round * teamCount + myIndex + 1);
      } else {
        picks.add(round * teamCount + (teamCount - myIndex));
      }
    }
    return picks;
  }
}
