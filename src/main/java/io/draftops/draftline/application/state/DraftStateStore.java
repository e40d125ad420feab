package io.draftops.draftline.application.state;

import io.draftops.draftline.application.port.ClockPort;
import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.DraftStatus;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.draft.SnakeDraftCalculator;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Authoritative in-memory draft state with snapshot and rollback.
 * <p><strong>Why:</strong> Every consumer reads one consistent view, and a corrupted state can be reverted to the
 * last known good point without replaying the stream.</p>
 * <p><strong>Role:</strong> Application service mutated by the event processor on the single writer thread and
 * read concurrently by query callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep the available pool and drafted set disjoint while applying picks.</li>
 *   <li>Capture a {@link DraftSnapshot} before every mutation except clock ticks.</li>
 *   <li>Restore any retained snapshot on request, discarding newer ones.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutators hold the write lock for snapshot plus mutation; readers take the
 * read lock and receive immutable copies.</p>
 * <p><strong>Performance:</strong> Each snapshot copies the pool and history; the ring bounds retained copies.</p>
 *
 * @since 0.1.0
 */
public final class DraftStateStore {
  private static final Logger log = LoggerFactory.getLogger(DraftStateStore.class);

  /** Snapshots retained when no capacity is configured. */
  public static final int DEFAULT_SNAPSHOT_CAPACITY = 100;

  private final DraftSession session;
  private final ClockPort clock;
  private final SnapshotRing<DraftSnapshot> snapshots;
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  private final LinkedHashSet<String> available = new LinkedHashSet<>();
  private final LinkedHashSet<String> drafted = new LinkedHashSet<>();
  private final Map<String, EnumMap<RosterPosition, List<String>>> rosters = new LinkedHashMap<>();
  private final List<Pick> history = new ArrayList<>();
  private final List<String> draftOrder = new ArrayList<>();
  private SnakeDraftCalculator calculator;
  private int currentPick;
  private int picksUntilNext;
  private double timeRemainingSeconds;
  private String onTheClock;
  private DraftStatus status = DraftStatus.WAITING;

  /**
   * Creates a store retaining {@link #DEFAULT_SNAPSHOT_CAPACITY} snapshots.
   *
   * @param session draft identity and dimensions
   * @param clock time source for pick and snapshot timestamps
   */
  public DraftStateStore(DraftSession session, ClockPort clock) {
    this(session, clock, DEFAULT_SNAPSHOT_CAPACITY);
  }

  /**
   * Creates a store.
   *
   * @param session draft identity and dimensions
   * @param clock time source for pick and snapshot timestamps
   * @param snapshotCapacity number of snapshots retained; positive
   * @throws IllegalArgumentException when {@code snapshotCapacity} is not positive
   */
  public DraftStateStore(DraftSession session, ClockPort clock, int snapshotCapacity) {
    this.session = Objects.requireNonNull(session, "session");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.snapshots = new SnapshotRing<>(snapshotCapacity);
    rosters.put(session.myTeamId(), newRoster());
  }

  /**
   * Seeds the available pool. Duplicates are collapsed and seeding order is kept.
   *
   * @param playerIds player ids in ranking order
   * @throws IllegalStateException when picks have already been applied
   */
  public void initializePlayerPool(Collection<String> playerIds) {
    Objects.requireNonNull(playerIds, "playerIds");
    write(() -> {
      if (!history.isEmpty()) {
        throw new IllegalStateException(
            "Player pool cannot be re-seeded after " + history.size() + " picks");
      }
      takeSnapshot();
      available.clear();
      for (String id : playerIds) {
        if (id != null && !id.isBlank()) {
          available.add(id.trim());
        }
      }
      log.info("Player pool initialized with {} players", available.size());
      return null;
    });
  }

  /**
   * Records the first-round draft order and precomputes the tracked team's pick numbers.
   *
   * @param teamIdsInOrder team ids in first-round order; must not be empty or contain duplicates
   * @throws IllegalArgumentException when the order is empty or repeats a team
   */
  public void setDraftOrder(List<String> teamIdsInOrder) {
    Objects.requireNonNull(teamIdsInOrder, "teamIdsInOrder");
    if (teamIdsInOrder.isEmpty()) {
      throw new IllegalArgumentException("draft order must not be empty");
    }
    if (new LinkedHashSet<>(teamIdsInOrder).size() != teamIdsInOrder.size()) {
      throw new IllegalArgumentException("draft order repeats a team: " + teamIdsInOrder);
    }
    write(() -> {
      takeSnapshot();
      draftOrder.clear();
      draftOrder.addAll(teamIdsInOrder);
      for (String teamId : teamIdsInOrder) {
        rosters.computeIfAbsent(teamId, id -> newRoster());
      }
      if (teamIdsInOrder.size() != session.teamCount()) {
        log.warn("Draft order lists {} teams but session declares {}", teamIdsInOrder.size(), session.teamCount());
      }
      int myIndex = teamIdsInOrder.indexOf(session.myTeamId());
      if (myIndex >= 0) {
        calculator = new SnakeDraftCalculator(teamIdsInOrder.size(), session.rounds(), myIndex);
        log.info("Tracked team {} drafts at index {}; picks {}", session.myTeamId(), myIndex,
            calculator.pickNumbers());
      } else {
        calculator = null;
        log.warn("Tracked team {} is not in draft order {}", session.myTeamId(), teamIdsInOrder);
      }
      recomputePicksUntilNext();
      return null;
    });
  }

  /**
   * Applies a completed pick.
   *
   * @param playerId selected player
   * @param teamId selecting team
   * @param pickNumber overall pick number
   * @param position roster bucket for the player
   * @return {@code false} without any mutation or snapshot when the player is already drafted, the draft is
   *         completed, or an argument is blank or non-positive
   */
  public boolean applyPick(String playerId, String teamId, int pickNumber, RosterPosition position) {
    if (playerId == null || playerId.isBlank() || teamId == null || teamId.isBlank() || pickNumber <= 0) {
      log.warn("Rejected pick with invalid arguments player={} team={} pick={}", playerId, teamId, pickNumber);
      return false;
    }
    RosterPosition bucket = position == null ? RosterPosition.BENCH : position;
    return write(() -> {
      if (drafted.contains(playerId)) {
        log.warn("Player {} already drafted; ignoring pick {} by team {}", playerId, pickNumber, teamId);
        return false;
      }
      if (status == DraftStatus.COMPLETED) {
        log.warn("Draft completed; ignoring pick {} of player {}", pickNumber, playerId);
        return false;
      }
      takeSnapshot();
      if (!available.remove(playerId)) {
        log.warn("Player {} drafted by team {} was not in the available pool", playerId, teamId);
      }
      drafted.add(playerId);
      rosters.computeIfAbsent(teamId, id -> newRoster()).get(bucket).add(playerId);
      history.add(new Pick(pickNumber, playerId, teamId, bucket, clock.nowMillis()));
      currentPick = pickNumber;
      recomputePicksUntilNext();
      log.debug("Pick {} applied: player={} team={} position={}", pickNumber, playerId, teamId, bucket);
      return true;
    });
  }

  /**
   * Puts a team on the clock for a new pick.
   *
   * @param pickNumber overall pick number now in progress
   * @param teamId selecting team
   * @param timeLimitSeconds time allowed for the pick
   * @return {@code false} when the draft is completed
   */
  public boolean startNewPick(int pickNumber, String teamId, double timeLimitSeconds) {
    return write(() -> {
      if (status == DraftStatus.COMPLETED) {
        log.warn("Draft completed; ignoring start of pick {} for team {}", pickNumber, teamId);
        return false;
      }
      takeSnapshot();
      currentPick = pickNumber;
      onTheClock = teamId;
      timeRemainingSeconds = Math.max(0.0, timeLimitSeconds);
      if (status == DraftStatus.WAITING) {
        status = DraftStatus.IN_PROGRESS;
        log.info("Draft started with pick {} by team {}", pickNumber, teamId);
      }
      recomputePicksUntilNext();
      return true;
    });
  }

  /**
   * Updates the pick clock. Does not take a snapshot.
   *
   * @param secondsRemaining time left; negative values are clamped to zero
   */
  public void updateClock(double secondsRemaining) {
    write(() -> {
      timeRemainingSeconds = Math.max(0.0, secondsRemaining);
      return null;
    });
  }

  /**
   * Marks the draft completed and clears the clock.
   *
   * @return {@code false} when the draft was already completed
   */
  public boolean completeDraft() {
    return write(() -> {
      if (status == DraftStatus.COMPLETED) {
        return false;
      }
      takeSnapshot();
      status = DraftStatus.COMPLETED;
      onTheClock = null;
      timeRemainingSeconds = 0.0;
      log.info("Draft completed after {} picks", history.size());
      return true;
    });
  }

  /**
   * Pauses an in-progress draft.
   *
   * @return {@code false} unless the draft was in progress
   */
  public boolean pauseDraft() {
    return transition(DraftStatus.IN_PROGRESS, DraftStatus.PAUSED);
  }

  /**
   * Resumes a paused draft.
   *
   * @return {@code false} unless the draft was paused
   */
  public boolean resumeDraft() {
    return transition(DraftStatus.PAUSED, DraftStatus.IN_PROGRESS);
  }

  /**
   * Moves a rostered player to another bucket once the player's real position is known. Pick history keeps
   * the position recorded when the pick was applied.
   *
   * @param playerId rostered player
   * @param position resolved bucket
   * @return {@code false} when the player is not rostered or already occupies {@code position}
   */
  public boolean reassignPosition(String playerId, RosterPosition position) {
    Objects.requireNonNull(position, "position");
    return write(() -> {
      for (EnumMap<RosterPosition, List<String>> roster : rosters.values()) {
        for (Map.Entry<RosterPosition, List<String>> bucket : roster.entrySet()) {
          if (!bucket.getValue().contains(playerId)) {
            continue;
          }
          if (bucket.getKey() == position) {
            return false;
          }
          takeSnapshot();
          bucket.getValue().remove(playerId);
          roster.get(position).add(playerId);
          log.debug("Player {} moved from {} to {}", playerId, bucket.getKey(), position);
          return true;
        }
      }
      return false;
    });
  }

  /**
   * Restores a retained snapshot and discards every snapshot newer than it.
   *
   * @param index {@code 0} for the oldest retained snapshot, {@code -1} for the newest
   * @return {@code false} without mutation when the index is outside {@code [-count, count - 1]}
   */
  public boolean rollbackToSnapshot(int index) {
    return write(() -> {
      Optional<DraftSnapshot> target = snapshots.get(index);
      if (target.isEmpty()) {
        log.warn("Rollback index {} outside retained range of {} snapshots", index, snapshots.size());
        return false;
      }
      restore(target.get());
      snapshots.truncateAfter(index);
      log.info("Rolled back to snapshot {} (pick {}, {} picks in history)", index,
          target.get().currentPick(), target.get().completedPicks());
      return true;
    });
  }

  /**
   * Returns a retained snapshot.
   *
   * @param index {@code 0} for the oldest retained snapshot, {@code -1} for the newest
   * @return snapshot, or empty when the index is out of range
   */
  public Optional<DraftSnapshot> getSnapshot(int index) {
    return read(() -> snapshots.get(index));
  }

  /**
   * @return number of retained snapshots
   */
  public int snapshotCount() {
    return read(snapshots::size);
  }

  /**
   * Returns the current state as an immutable value.
   *
   * @return snapshot of the live state stamped with the current time
   */
  public DraftSnapshot view() {
    return read(this::capture);
  }

  public DraftSession session() {
    return session;
  }

  public int currentPick() {
    return read(() -> currentPick);
  }

  public Optional<String> onTheClock() {
    return read(() -> Optional.ofNullable(onTheClock));
  }

  public double timeRemainingSeconds() {
    return read(() -> timeRemainingSeconds);
  }

  public int picksUntilNext() {
    return read(() -> picksUntilNext);
  }

  public DraftStatus status() {
    return read(() -> status);
  }

  public Map<RosterPosition, List<String>> myRoster() {
    return view().myRoster();
  }

  public Map<String, Map<RosterPosition, List<String>>> otherRosters() {
    return view().otherRosters();
  }

  public List<String> availablePlayers() {
    return read(() -> List.copyOf(available));
  }

  public Set<String> draftedPlayers() {
    return read(() -> Set.copyOf(drafted));
  }

  public boolean isDrafted(String playerId) {
    return read(() -> drafted.contains(playerId));
  }

  public List<Pick> pickHistory() {
    return read(() -> List.copyOf(history));
  }

  public int completedPicks() {
    return read(history::size);
  }

  /**
   * @return most recently applied pick, if any
   */
  public Optional<Pick> lastPick() {
    return read(() -> history.isEmpty() ? Optional.<Pick>empty() : Optional.of(history.get(history.size() - 1)));
  }

  /**
   * @param playerId drafted player
   * @return pick that drafted the player, if any
   */
  public Optional<Pick> pickFor(String playerId) {
    return read(() -> history.stream().filter(pick -> pick.playerId().equals(playerId)).findFirst());
  }

  public List<String> draftOrder() {
    return read(() -> List.copyOf(draftOrder));
  }

  /**
   * @return tracked team's overall pick numbers, or an empty list until the draft order includes the team
   */
  public List<Integer> myPickNumbers() {
    return read(() -> calculator == null ? List.<Integer>of() : calculator.pickNumbers());
  }

  /**
   * Looks up which team should own an overall pick under snake ordering.
   *
   * @param pickNumber 1-based overall pick number
   * @return expected team id, or empty when no draft order is recorded or the pick is not positive
   */
  public Optional<String> expectedTeamFor(int pickNumber) {
    return read(() -> {
      if (draftOrder.isEmpty()) {
        return Optional.<String>empty();
      }
      int index = SnakeDraftCalculator.teamIndexForPick(pickNumber, draftOrder.size());
      return index < 0 ? Optional.<String>empty() : Optional.of(draftOrder.get(index));
    });
  }

  private boolean transition(DraftStatus from, DraftStatus to) {
    return write(() -> {
      if (status != from) {
        return false;
      }
      takeSnapshot();
      status = to;
      log.info("Draft status {} -> {}", from, to);
      return true;
    });
  }

  private void takeSnapshot() {
    snapshots.push(capture());
  }

  private DraftSnapshot capture() {
    Map<String, Map<RosterPosition, List<String>>> others = new LinkedHashMap<>();
    for (Map.Entry<String, EnumMap<RosterPosition, List<String>>> entry : rosters.entrySet()) {
      if (!entry.getKey().equals(session.myTeamId())) {
        others.put(entry.getKey(), entry.getValue());
      }
    }
    return new DraftSnapshot(
        clock.nowMillis(),
        session.myTeamId(),
        drafted,
        new ArrayList<>(available),
        rosters.get(session.myTeamId()),
        others,
        draftOrder,
        currentPick,
        picksUntilNext,
        timeRemainingSeconds,
        onTheClock,
        status,
        history);
  }

  private void restore(DraftSnapshot snapshot) {
    available.clear();
    available.addAll(snapshot.availablePlayers());
    drafted.clear();
    drafted.addAll(snapshot.draftedPlayers());
    rosters.clear();
    rosters.put(session.myTeamId(), mutableRoster(snapshot.myRoster()));
    for (Map.Entry<String, Map<RosterPosition, List<String>>> entry : snapshot.otherRosters().entrySet()) {
      rosters.put(entry.getKey(), mutableRoster(entry.getValue()));
    }
    history.clear();
    history.addAll(snapshot.pickHistory());
    draftOrder.clear();
    draftOrder.addAll(snapshot.draftOrder());
    int myIndex = draftOrder.indexOf(session.myTeamId());
    calculator = myIndex >= 0 ? new SnakeDraftCalculator(draftOrder.size(), session.rounds(), myIndex) : null;
    currentPick = snapshot.currentPick();
    picksUntilNext = snapshot.picksUntilNext();
    timeRemainingSeconds = snapshot.timeRemainingSeconds();
    onTheClock = snapshot.onTheClock();
    status = snapshot.status();
  }

  private void recomputePicksUntilNext() {
    picksUntilNext = calculator == null ? 0 : calculator.picksUntilNext(currentPick);
  }

  private static EnumMap<RosterPosition, List<String>> newRoster() {
    EnumMap<RosterPosition, List<String>> roster = new EnumMap<>(RosterPosition.class);
    for (RosterPosition position : RosterPosition.values()) {
      roster.put(position, new ArrayList<>());
    }
    return roster;
  }

  private static EnumMap<RosterPosition, List<String>> mutableRoster(Map<RosterPosition, List<String>> source) {
    EnumMap<RosterPosition, List<String>> roster = newRoster();
    for (Map.Entry<RosterPosition, List<String>> entry : source.entrySet()) {
      roster.get(entry.getKey()).addAll(entry.getValue());
    }
    return roster;
  }

  private <T> T write(Supplier<T> action) {
    ReentrantReadWriteLock.WriteLock writeLock = lock.writeLock();
    writeLock.lock();
    try {
      return action.get();
    } finally {
      writeLock.unlock();
    }
  }

  private <T> T read(Supplier<T> action) {
    ReentrantReadWriteLock.ReadLock readLock = lock.readLock();
    readLock.lock();
    try {
      return action.get();
    } finally {
      readLock.unlock();
    }
  }
}
