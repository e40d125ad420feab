package io.draftops.draftline.application.port;

import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;

/**
 * Observer of draft progress. All methods run on the single writer thread after the store has been
 * updated; implementations must return quickly. Failures are logged by the caller and never stop
 * processing.
 *
 * @since 0.1.0
 */
public interface DraftEventListener {

  /**
   * A pick was applied.
   *
   * @param pick appended pick
   */
  default void onPickMade(Pick pick) {}

  /**
   * A team went on the clock.
   *
   * @param teamId team now selecting
   * @param pickNumber overall pick number in progress
   * @param timeLimitSeconds time allowed for the pick
   */
  default void onTeamSelecting(String teamId, int pickNumber, double timeLimitSeconds) {}

  /**
   * Clock tick.
   *
   * @param teamId team on the clock
   * @param secondsRemaining clamped time remaining
   */
  default void onClockUpdate(String teamId, double secondsRemaining) {}

  /**
   * A team toggled autodraft.
   *
   * @param teamId team id
   * @param enabled new autodraft flag
   */
  default void onAutodraftChanged(String teamId, boolean enabled) {}

  /**
   * The draft reached its final pick.
   *
   * @param finalState state after completion
   */
  default void onDraftCompleted(DraftSnapshot finalState) {}

  /**
   * A previously applied pick received its resolved roster position.
   *
   * @param pick original pick as recorded in history
   * @param resolvedPosition bucket the player now occupies
   */
  default void onPickUpdated(Pick pick, RosterPosition resolvedPosition) {}

  /**
   * A frame could not be processed.
   *
   * @param frame offending frame text
   * @param error cause
   */
  default void onProcessingError(String frame, Exception error) {}
}
