package io.draftops.draftline.application.resolution;

import io.draftops.draftline.domain.draft.RosterPosition;
import java.util.Objects;

/**
 * Display identity and roster position for a player id.
 *
 * @param name display name
 * @param position roster bucket
 * @since 0.1.0
 */
public record ResolvedPlayer(String name, RosterPosition position) {

  public ResolvedPlayer {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(position, "position");
  }

  /**
   * Identity used when a player cannot be resolved.
   *
   * @param playerId vendor id
   * @return {@code "Player #<id>"} on the bench
   */
  public static ResolvedPlayer placeholder(String playerId) {
    return new ResolvedPlayer("Player #" + playerId, RosterPosition.BENCH);
  }
}
