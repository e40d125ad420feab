package io.draftops.draftline.domain.draft;

import java.util.Locale;

/**
 * Roster buckets a drafted player can occupy.
 * <p>{@link #BENCH} is the generic bucket used whenever a player's position is not (yet) known.</p>
 *
 * @since 0.1.0
 */
public enum RosterPosition {
  QB,
  RB,
  WR,
  TE,
  K,
  DST,
  FLEX,
  BENCH;

  /**
   * Maps a free-form position label to a roster bucket.
   *
   * @param label label such as {@code "WR"}, {@code "d/st"} or {@code "PK"}; may be {@code null}
   * @return matching bucket, or {@link #BENCH} when the label is blank or unrecognised
   */
  public static RosterPosition fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return BENCH;
    }
    String normalized = label.trim().toUpperCase(Locale.ROOT);
    return switch (normalized) {
      case "QB" -> QB;
      case "RB" -> RB;
      case "WR" -> WR;
      case "TE" -> TE;
      case "K", "PK" -> K;
      case "DST", "D/ST", "DEF", "D" -> DST;
      case "FLEX", "RB/WR/TE", "W/R/T" -> FLEX;
      default -> BENCH;
    };
  }
}
