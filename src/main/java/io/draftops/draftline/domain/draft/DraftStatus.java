package io.draftops.draftline.domain.draft;

/**
 * Lifecycle status of a draft as observed from the event stream.
 *
 * @since 0.1.0
 */
public enum DraftStatus {
  /** No team has been put on the clock yet. */
  WAITING,
  /** Picks are being made. */
  IN_PROGRESS,
  /** Clock halted by the league host. */
  PAUSED,
  /** All picks made or the draft was closed explicitly. */
  COMPLETED
}
