package io.draftops.draftline.application.pipeline;

import io.draftops.draftline.application.port.DraftEventListener;
import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.protocol.DraftEvent;
import io.draftops.draftline.domain.protocol.DraftEventType;
import io.draftops.draftline.domain.protocol.DraftProtocolParser;
import io.draftops.draftline.domain.protocol.ProtocolParseException;
import io.draftops.draftline.logging.Logs;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes parsed protocol events to the draft state store and notifies listeners.
 * <p>Intended to be driven by exactly one thread (see {@link DraftPipeline}); counters may be read from any
 * thread.</p>
 *
 * @since 0.1.0
 */
public final class DraftEventProcessor {
  private static final Logger log = LoggerFactory.getLogger(DraftEventProcessor.class);
  private static final int LOG_FRAME_BYTES = 256;

  private final DraftStateStore store;
  private final DraftProtocolParser parser;
  private final MetricsPort metrics;
  private final List<DraftEventListener> listeners = new CopyOnWriteArrayList<>();

  private final LongAdder totalMessages = new LongAdder();
  private final LongAdder parseErrors = new LongAdder();
  private final LongAdder stateErrors = new LongAdder();
  private final Map<DraftEventType, LongAdder> byType = new EnumMap<>(DraftEventType.class);

  private volatile Function<String, Optional<RosterPosition>> positionResolver = id -> Optional.empty();

  /**
   * Creates a processor.
   *
   * @param store state store mutated by this processor
   * @param parser frame parser
   * @param metrics metrics sink mirroring the processor counters
   */
  public DraftEventProcessor(DraftStateStore store, DraftProtocolParser parser, MetricsPort metrics) {
    this.store = Objects.requireNonNull(store, "store");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    for (DraftEventType type : DraftEventType.values()) {
      byType.put(type, new LongAdder());
    }
  }

  /**
   * Installs the synchronous position lookup used when a pick is applied. The resolver must not block.
   *
   * @param resolver player id to position; {@code null} restores the bench-only default
   */
  public void setPositionResolver(Function<String, Optional<RosterPosition>> resolver) {
    this.positionResolver = resolver == null ? id -> Optional.empty() : resolver;
  }

  public void addListener(DraftEventListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(DraftEventListener listener) {
    listeners.remove(listener);
  }

  /**
   * Parses and applies one frame.
   *
   * @param frame raw frame text
   * @return {@code true} when the frame was parsed and any state update succeeded
   */
  public boolean process(String frame) {
    totalMessages.increment();
    DraftEvent event;
    try {
      event = parser.parse(frame);
    } catch (ProtocolParseException ex) {
      parseErrors.increment();
      metrics.increment("processor.parse.error");
      log.warn("Skipping malformed {} frame: {} ({})", ex.command(), Logs.truncate(frame, LOG_FRAME_BYTES),
          ex.getMessage());
      notifyListeners(l -> l.onProcessingError(frame, ex));
      return false;
    }
    byType.get(event.type()).increment();
    metrics.increment("processor.message." + event.type().name().toLowerCase(Locale.ROOT));
    try {
      return apply(event);
    } catch (RuntimeException ex) {
      recordStateError(frame, ex);
      log.error("Failed to apply frame {}", Logs.truncate(frame, LOG_FRAME_BYTES), ex);
      return false;
    }
  }

  /**
   * Applies a late position resolution on the writer thread and re-emits the affected pick.
   *
   * @param playerId drafted player
   * @param position resolved position
   * @return {@code true} when the roster entry moved
   */
  public boolean applyPositionPatch(String playerId, RosterPosition position) {
    if (!store.reassignPosition(playerId, position)) {
      return false;
    }
    Optional<Pick> pick = store.pickFor(playerId);
    if (pick.isPresent()) {
      Pick original = pick.get();
      notifyListeners(l -> l.onPickUpdated(original, position));
    }
    metrics.increment("processor.position.patched");
    return true;
  }

  /**
   * @return immutable copy of the counters
   */
  public ProcessingStats stats() {
    Map<DraftEventType, Long> counts = new EnumMap<>(DraftEventType.class);
    for (Map.Entry<DraftEventType, LongAdder> entry : byType.entrySet()) {
      long value = entry.getValue().sum();
      if (value > 0) {
        counts.put(entry.getKey(), value);
      }
    }
    return new ProcessingStats(totalMessages.sum(), counts, parseErrors.sum(), stateErrors.sum());
  }

  /** Resets every counter to zero. */
  public void resetStats() {
    totalMessages.reset();
    parseErrors.reset();
    stateErrors.reset();
    byType.values().forEach(LongAdder::reset);
  }

  private boolean apply(DraftEvent event) {
    switch (event.type()) {
      case SELECTED:
        return onSelected(event);
      case SELECTING:
        return onSelecting(event);
      case CLOCK:
        store.updateClock(event.millis() / 1000.0);
        double remaining = store.timeRemainingSeconds();
        String clockTeam = String.valueOf(event.teamId());
        notifyListeners(l -> l.onClockUpdate(clockTeam, remaining));
        return true;
      case AUTODRAFT:
        String autodraftTeam = String.valueOf(event.teamId());
        log.info("Team {} autodraft {}", autodraftTeam, event.enabled() ? "enabled" : "disabled");
        notifyListeners(l -> l.onAutodraftChanged(autodraftTeam, event.enabled()));
        return true;
      case TOKEN:
        log.debug("Session token frame {}", Logs.redact(event.raw()));
        return true;
      case JOINED:
      case LEFT:
      case PING:
      case PONG:
        log.debug("Session frame {} {}", event.type(), event.arguments());
        return true;
      default:
        log.debug("Ignoring unrecognised frame {}", Logs.truncate(event.raw(), LOG_FRAME_BYTES));
        return true;
    }
  }

  private boolean onSelected(DraftEvent event) {
    String teamId = String.valueOf(event.teamId());
    Optional<RosterPosition> resolved = lookupPosition(event.playerId());
    RosterPosition position = resolved.orElse(RosterPosition.BENCH);
    if (!store.applyPick(event.playerId(), teamId, event.pickNumber(), position)) {
      recordStateError(event.raw(), new IllegalStateException(
          "Pick " + event.pickNumber() + " of player " + event.playerId() + " by team " + teamId + " rejected"));
      return false;
    }
    Optional<Pick> applied = store.lastPick();
    applied.ifPresent(pick -> notifyListeners(l -> l.onPickMade(pick)));
    if (resolved.isEmpty()) {
      // A resolution finishing before applyPick saw the player undrafted and queued no patch.
      lookupPosition(event.playerId()).ifPresent(late -> applyPositionPatch(event.playerId(), late));
    }
    int totalPicks = store.session().totalPicks();
    if (store.completedPicks() >= totalPicks && store.completeDraft()) {
      DraftSnapshot finalState = store.view();
      notifyListeners(l -> l.onDraftCompleted(finalState));
    }
    return true;
  }

  private boolean onSelecting(DraftEvent event) {
    String teamId = String.valueOf(event.teamId());
    int pickNumber = store.currentPick() + 1;
    Optional<String> expected = store.expectedTeamFor(pickNumber);
    if (expected.isPresent() && !expected.get().equals(teamId)) {
      metrics.increment("processor.selecting.unexpectedTeam");
      log.warn("Team {} selecting for pick {} but snake order expects team {}", teamId, pickNumber, expected.get());
    }
    double timeLimitSeconds = event.millis() / 1000.0;
    if (!store.startNewPick(pickNumber, teamId, timeLimitSeconds)) {
      recordStateError(event.raw(), new IllegalStateException(
          "Pick " + pickNumber + " for team " + teamId + " could not start"));
      return false;
    }
    notifyListeners(l -> l.onTeamSelecting(teamId, pickNumber, timeLimitSeconds));
    return true;
  }

  private Optional<RosterPosition> lookupPosition(String playerId) {
    try {
      Optional<RosterPosition> resolved = positionResolver.apply(playerId);
      return resolved == null ? Optional.empty() : resolved;
    } catch (RuntimeException ex) {
      metrics.increment("processor.resolve.error");
      log.warn("Position lookup failed for player {}; using {}", playerId, RosterPosition.BENCH, ex);
      return Optional.of(RosterPosition.BENCH);
    }
  }

  private void recordStateError(String frame, Exception cause) {
    stateErrors.increment();
    metrics.increment("processor.state.error");
    log.warn("State update rejected: {}", cause.getMessage());
    notifyListeners(l -> l.onProcessingError(frame, cause));
  }

  private void notifyListeners(Consumer<DraftEventListener> call) {
    for (DraftEventListener listener : listeners) {
      try {
        call.accept(listener);
      } catch (RuntimeException ex) {
        metrics.increment("processor.listener.error");
        log.warn("Draft listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }
}
