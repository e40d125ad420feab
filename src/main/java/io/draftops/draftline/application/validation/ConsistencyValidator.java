package io.draftops.draftline.application.validation;

import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.DraftStatus;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.draft.ValidationResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Checks draft state against its structural invariants and self-heals by rollback.
 * <p><strong>Why:</strong> Out-of-order or duplicated frames can leave the store inconsistent; detecting this
 * early lets the engine revert to the last good snapshot instead of serving corrupt rosters.</p>
 * <p><strong>Role:</strong> Application service run by the pipeline after picks and on demand by callers.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Report invariant violations as errors and soft mismatches as warnings.</li>
 *   <li>Find the newest retained snapshot that validates and restore it.</li>
 *   <li>Check pick eligibility and completion totals.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Validation works on immutable views and is safe from any thread;
 * {@link #validateAndHeal()} should run on the writer thread so no mutation interleaves with the rollback.</p>
 * <p><strong>Observability:</strong> Counts {@code validation.checks}, {@code validation.failures} and
 * {@code validation.recoveries}.</p>
 *
 * @since 0.1.0
 */
public final class ConsistencyValidator {
  private static final Logger log = LoggerFactory.getLogger(ConsistencyValidator.class);

  static final int LARGE_POOL_THRESHOLD = 1000;
  static final int LONG_HISTORY_THRESHOLD = 200;

  private final DraftStateStore store;
  private final MetricsPort metrics;

  public ConsistencyValidator(DraftStateStore store, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Validates the live state.
   *
   * @return validation result
   */
  public ValidationResult validate() {
    metrics.increment("validation.checks");
    ValidationResult result = validate(store.view());
    if (!result.valid()) {
      metrics.increment("validation.failures");
      log.warn("Draft state inconsistent: {}", result.errors());
    } else if (!result.warnings().isEmpty()) {
      log.debug("Draft state warnings: {}", result.warnings());
    }
    return result;
  }

  /**
   * Validates an arbitrary snapshot.
   *
   * @param snapshot state to check
   * @return validation result
   */
  public ValidationResult validate(DraftSnapshot snapshot) {
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    List<String> suggestions = new ArrayList<>();

    Set<String> drafted = snapshot.draftedPlayers();
    Set<String> overlap = new LinkedHashSet<>(snapshot.availablePlayers());
    overlap.retainAll(drafted);
    if (!overlap.isEmpty()) {
      errors.add("Players both drafted and available: " + overlap);
    }

    List<Pick> history = snapshot.pickHistory();
    if (drafted.size() != history.size()) {
      errors.add("Drafted count " + drafted.size() + " does not match pick history size " + history.size());
    }

    int completed = history.size();
    int current = snapshot.currentPick();
    if (current < completed) {
      errors.add("Current pick " + current + " is behind " + completed + " completed picks");
    } else if (current > completed + 1) {
      errors.add("Current pick " + current + " skips ahead of " + completed + " completed picks");
    }

    Map<String, Integer> picksPerTeam = new HashMap<>();
    for (Pick pick : history) {
      picksPerTeam.merge(pick.teamId(), 1, Integer::sum);
    }

    Map<String, String> rosteredBy = new HashMap<>();
    for (Map.Entry<String, Map<RosterPosition, List<String>>> team : snapshot.allRosters().entrySet()) {
      int rosterSize = 0;
      for (List<String> bucket : team.getValue().values()) {
        rosterSize += bucket.size();
        for (String playerId : bucket) {
          String previous = rosteredBy.putIfAbsent(playerId, team.getKey());
          if (previous != null) {
            errors.add(previous.equals(team.getKey())
                ? "Player " + playerId + " appears twice in team " + previous + " roster"
                : "Player " + playerId + " rostered by teams " + previous + " and " + team.getKey());
          }
        }
      }
      int expected = picksPerTeam.getOrDefault(team.getKey(), 0);
      if (rosterSize != expected) {
        errors.add("Team " + team.getKey() + " roster has " + rosterSize + " players but " + expected + " picks");
      }
    }
    for (Map.Entry<String, Integer> team : picksPerTeam.entrySet()) {
      if (!snapshot.allRosters().containsKey(team.getKey())) {
        errors.add("Team " + team.getKey() + " has " + team.getValue() + " picks but no roster");
      }
    }

    Set<String> draftedNotRostered = new LinkedHashSet<>(drafted);
    draftedNotRostered.removeAll(rosteredBy.keySet());
    if (!draftedNotRostered.isEmpty()) {
      warnings.add("Players drafted but not rostered: " + draftedNotRostered);
    }
    Set<String> rosteredNotDrafted = new LinkedHashSet<>(rosteredBy.keySet());
    rosteredNotDrafted.removeAll(drafted);
    if (!rosteredNotDrafted.isEmpty()) {
      errors.add("Players rostered but not drafted: " + rosteredNotDrafted);
    }

    if (snapshot.availablePlayers().size() > LARGE_POOL_THRESHOLD) {
      suggestions.add("Available pool holds " + snapshot.availablePlayers().size()
          + " players; consider pruning it to ranked players");
    }
    if (history.size() > LONG_HISTORY_THRESHOLD) {
      suggestions.add("Pick history holds " + history.size() + " picks; draft is nearing completion");
    }
    return ValidationResult.of(errors, warnings, suggestions);
  }

  /**
   * Checks whether a pick could be applied to the live state without corrupting it. Does not mutate.
   *
   * @param playerId candidate player
   * @param teamId selecting team
   * @param pickNumber proposed overall pick number
   * @return errors for already drafted players or past pick numbers; warnings for skipped picks, players
   *         outside the pool and teams that are not on the clock
   */
  public ValidationResult validatePickEligibility(String playerId, String teamId, int pickNumber) {
    DraftSnapshot snapshot = store.view();
    List<String> errors = new ArrayList<>();
    List<String> warnings = new ArrayList<>();
    if (snapshot.draftedPlayers().contains(playerId)) {
      errors.add("Player " + playerId + " already drafted");
    } else if (!snapshot.availablePlayers().contains(playerId)) {
      warnings.add("Player " + playerId + " not in available pool");
    }
    int expectedPick = snapshot.completedPicks() + 1;
    if (pickNumber < expectedPick) {
      errors.add("Pick number " + pickNumber + " is in the past (expected " + expectedPick + ")");
    } else if (pickNumber > expectedPick) {
      warnings.add("Pick number " + pickNumber + " skips ahead (expected " + expectedPick + ")");
    }
    Optional<String> onTheClock = snapshot.onTheClockTeam();
    if (onTheClock.isPresent() && !onTheClock.get().equals(teamId)) {
      warnings.add("Team " + teamId + " picking but " + onTheClock.get() + " is on the clock");
    }
    return ValidationResult.of(errors, warnings, List.of());
  }

  /**
   * Validates the live state and adds completion warnings for a completed draft.
   *
   * @return validation result; completion mismatches are warnings only
   */
  public ValidationResult validateCompletion() {
    ValidationResult base = validate();
    DraftSnapshot snapshot = store.view();
    if (snapshot.status() != DraftStatus.COMPLETED) {
      return base.withWarnings(List.of("Draft is not completed (status " + snapshot.status() + ")"));
    }
    DraftSession session = store.session();
    List<String> extra = new ArrayList<>();
    if (snapshot.completedPicks() != session.totalPicks()) {
      extra.add("Draft completed with " + snapshot.completedPicks() + " picks (expected "
          + session.totalPicks() + ")");
    }
    Map<String, Integer> sizes = new LinkedHashMap<>();
    for (Map.Entry<String, Map<RosterPosition, List<String>>> team : snapshot.allRosters().entrySet()) {
      sizes.put(team.getKey(), team.getValue().values().stream().mapToInt(List::size).sum());
    }
    sizes.forEach((team, size) -> {
      if (size != session.rounds()) {
        extra.add("Team " + team + " has " + size + " picks (expected " + session.rounds() + ")");
      }
    });
    return base.withWarnings(extra);
  }

  /**
   * Validates the live state and, when it has errors, restores the newest retained snapshot that
   * validates cleanly.
   *
   * @return report describing the original result and any rollback
   * @throws ConsistencyViolationException when no retained snapshot validates
   */
  public HealReport validateAndHeal() {
    ValidationResult current = validate();
    if (current.valid()) {
      return HealReport.healthy(current);
    }
    int count = store.snapshotCount();
    int inspected = 0;
    for (int index = -1; index >= -count; index--) {
      Optional<DraftSnapshot> candidate = store.getSnapshot(index);
      if (candidate.isEmpty()) {
        break;
      }
      inspected++;
      if (validate(candidate.get()).valid() && store.rollbackToSnapshot(index)) {
        metrics.increment("validation.recoveries");
        log.warn("Recovered draft state by rolling back to snapshot {} after inspecting {}", index, inspected);
        return new HealReport(current, index, inspected);
      }
    }
    log.error("No clean snapshot among {} retained; draft state is unrecoverable: {}", inspected,
        current.errors());
    throw new ConsistencyViolationException(current, inspected);
  }
}
