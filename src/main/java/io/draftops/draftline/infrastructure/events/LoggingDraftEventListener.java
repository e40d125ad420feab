package io.draftops.draftline.infrastructure.events;

import io.draftops.draftline.application.port.DraftEventListener;
import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.logging.Logs;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits draft progress as structured key=value log lines and counts them.
 * <p>Clock ticks are only logged once the remaining time drops to the low-clock threshold.</p>
 *
 * @since 0.1.0
 */
public final class LoggingDraftEventListener implements DraftEventListener {
  private static final Logger log = LoggerFactory.getLogger(LoggingDraftEventListener.class);
  static final double LOW_CLOCK_SECONDS = 10.0;

  private final MetricsPort metrics;
  private final String metricPrefix;
  private final Function<String, String> displayNames;
  private final String myTeamId;

  /**
   * @param metrics metrics adapter; falls back to {@link MetricsPort#NO_OP} when {@code null}
   * @param metricPrefix prefix for emitted counters; defaults to {@code draftEvents}
   * @param displayNames player id to display name
   * @param myTeamId tracked team, flagged in pick lines
   */
  public LoggingDraftEventListener(
      MetricsPort metrics, String metricPrefix, Function<String, String> displayNames, String myTeamId) {
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.metricPrefix = metricPrefix == null || metricPrefix.isBlank() ? "draftEvents" : metricPrefix.trim();
    this.displayNames = Objects.requireNonNull(displayNames, "displayNames");
    this.myTeamId = Objects.requireNonNull(myTeamId, "myTeamId");
  }

  @Override
  public void onPickMade(Pick pick) {
    metrics.increment(metricPrefix + ".pick");
    StringJoiner joiner = new StringJoiner(", ");
    joiner.add("pick=" + pick.pickNumber());
    joiner.add("team=" + pick.teamId());
    joiner.add("player=" + pick.playerId());
    joiner.add("name=" + displayNames.apply(pick.playerId()));
    joiner.add("position=" + pick.position());
    if (pick.teamId().equals(myTeamId)) {
      joiner.add("mine=true");
    }
    log.info("draft.pick {}", joiner);
  }

  @Override
  public void onTeamSelecting(String teamId, int pickNumber, double timeLimitSeconds) {
    metrics.increment(metricPrefix + ".selecting");
    log.info("draft.selecting pick={}, team={}, limitSeconds={}", pickNumber, teamId, timeLimitSeconds);
  }

  @Override
  public void onClockUpdate(String teamId, double secondsRemaining) {
    if (secondsRemaining <= LOW_CLOCK_SECONDS) {
      metrics.increment(metricPrefix + ".clock.low");
      log.info("draft.clock team={}, secondsRemaining={}", teamId, secondsRemaining);
    }
  }

  @Override
  public void onAutodraftChanged(String teamId, boolean enabled) {
    log.info("draft.autodraft team={}, enabled={}", teamId, enabled);
  }

  @Override
  public void onPickUpdated(Pick pick, RosterPosition resolvedPosition) {
    metrics.increment(metricPrefix + ".pick.updated");
    log.info("draft.pick.updated pick={}, player={}, name={}, position={}", pick.pickNumber(), pick.playerId(),
        displayNames.apply(pick.playerId()), resolvedPosition);
  }

  @Override
  public void onDraftCompleted(DraftSnapshot finalState) {
    metrics.increment(metricPrefix + ".completed");
    log.info("draft.completed picks={}, myRoster={}", finalState.completedPicks(), finalState.myRoster());
  }

  @Override
  public void onProcessingError(String frame, Exception error) {
    metrics.increment(metricPrefix + ".error");
    log.warn("draft.error frame={}, cause={}", Logs.truncate(frame, 128), error.getMessage());
  }
}
