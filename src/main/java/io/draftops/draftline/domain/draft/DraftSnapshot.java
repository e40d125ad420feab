package io.draftops.draftline.domain.draft;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable, deep-copied view of the complete draft state at one instant.
 * <p><strong>Why:</strong> Serves both as the rollback unit retained by the state store and as the value handed to
 * concurrent readers, so a reader never observes a half-applied mutation.</p>
 * <p><strong>Role:</strong> Domain value object produced by {@code DraftStateStore}.</p>
 * <p><strong>Thread-safety:</strong> Immutable; every collection is copied in the canonical constructor and wrapped
 * unmodifiable.</p>
 * <p><strong>Performance:</strong> Copy cost is linear in pool size plus pick history; taken once per mutation.</p>
 *
 * @param capturedAtMillis epoch milliseconds when the snapshot was taken
 * @param myTeamId tracked team identifier
 * @param draftedPlayers players already selected
 * @param availablePlayers players still in the pool, in seeding order
 * @param myRoster tracked team's roster, every bucket present
 * @param otherRosters rosters of all other teams keyed by team id
 * @param draftOrder team ids in first-round order; empty until recorded
 * @param currentPick overall pick number in progress or last completed
 * @param picksUntilNext picks remaining before the tracked team selects; {@code 0} when none remain
 * @param timeRemainingSeconds seconds left on the pick clock
 * @param onTheClock team currently selecting, or {@code null}
 * @param status draft lifecycle status
 * @param pickHistory completed picks in application order
 * @since 0.1.0
 */
public record DraftSnapshot(
    long capturedAtMillis,
    String myTeamId,
    Set<String> draftedPlayers,
    List<String> availablePlayers,
    Map<RosterPosition, List<String>> myRoster,
    Map<String, Map<RosterPosition, List<String>>> otherRosters,
    List<String> draftOrder,
    int currentPick,
    int picksUntilNext,
    double timeRemainingSeconds,
    String onTheClock,
    DraftStatus status,
    List<Pick> pickHistory) {

  /**
   * Copies every collection so the snapshot cannot observe later mutations of its sources.
   */
  public DraftSnapshot {
    Objects.requireNonNull(myTeamId, "myTeamId");
    Objects.requireNonNull(status, "status");
    draftedPlayers = Collections.unmodifiableSet(new LinkedHashSet<>(draftedPlayers));
    availablePlayers = List.copyOf(availablePlayers);
    myRoster = copyRoster(myRoster);
    Map<String, Map<RosterPosition, List<String>>> others = new LinkedHashMap<>();
    for (Map.Entry<String, Map<RosterPosition, List<String>>> entry : otherRosters.entrySet()) {
      others.put(entry.getKey(), copyRoster(entry.getValue()));
    }
    otherRosters = Collections.unmodifiableMap(others);
    draftOrder = List.copyOf(draftOrder);
    pickHistory = List.copyOf(pickHistory);
  }

  /**
   * Returns the team on the clock, if any.
   *
   * @return optional team id
   */
  public Optional<String> onTheClockTeam() {
    return Optional.ofNullable(onTheClock);
  }

  /**
   * Returns the number of completed picks.
   *
   * @return pick history size
   */
  public int completedPicks() {
    return pickHistory.size();
  }

  /**
   * Compares draft state while ignoring the capture timestamp.
   *
   * @param other snapshot to compare with
   * @return {@code true} when every state field matches
   */
  public boolean sameStateAs(DraftSnapshot other) {
    if (other == null) {
      return false;
    }
    return myTeamId.equals(other.myTeamId)
        && draftedPlayers.equals(other.draftedPlayers)
        && availablePlayers.equals(other.availablePlayers)
        && myRoster.equals(other.myRoster)
        && otherRosters.equals(other.otherRosters)
        && draftOrder.equals(other.draftOrder)
        && currentPick == other.currentPick
        && picksUntilNext == other.picksUntilNext
        && Double.compare(timeRemainingSeconds, other.timeRemainingSeconds) == 0
        && Objects.equals(onTheClock, other.onTheClock)
        && status == other.status
        && pickHistory.equals(other.pickHistory);
  }

  /**
   * Returns every roster (tracked team first) keyed by team id.
   *
   * @return unmodifiable map of team id to roster buckets
   */
  public Map<String, Map<RosterPosition, List<String>>> allRosters() {
    Map<String, Map<RosterPosition, List<String>>> all = new LinkedHashMap<>();
    all.put(myTeamId, myRoster);
    for (Map.Entry<String, Map<RosterPosition, List<String>>> entry : otherRosters.entrySet()) {
      if (!entry.getKey().equals(myTeamId)) {
        all.put(entry.getKey(), entry.getValue());
      }
    }
    return Collections.unmodifiableMap(all);
  }

  /**
   * Creates an empty roster containing every bucket.
   *
   * @return mutable enum map with one empty list per position
   */
  public static EnumMap<RosterPosition, List<String>> emptyRoster() {
    EnumMap<RosterPosition, List<String>> roster = new EnumMap<>(RosterPosition.class);
    for (RosterPosition position : RosterPosition.values()) {
      roster.put(position, List.of());
    }
    return roster;
  }

  private static Map<RosterPosition, List<String>> copyRoster(Map<RosterPosition, List<String>> source) {
    EnumMap<RosterPosition, List<String>> copy = emptyRoster();
    for (Map.Entry<RosterPosition, List<String>> entry : source.entrySet()) {
      copy.put(entry.getKey(), List.copyOf(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }
}
