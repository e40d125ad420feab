package io.draftops.draftline.application;

import io.draftops.draftline.application.pipeline.DraftEventProcessor;
import io.draftops.draftline.application.pipeline.DraftPipeline;
import io.draftops.draftline.application.pipeline.ProcessingStats;
import io.draftops.draftline.application.port.DraftEventListener;
import io.draftops.draftline.application.port.ResilienceListener;
import io.draftops.draftline.application.resilience.ConnectionResilienceManager;
import io.draftops.draftline.application.resilience.ConnectionState;
import io.draftops.draftline.application.resolution.PlayerResolutionService;
import io.draftops.draftline.application.resolution.ResolvedPlayer;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.application.validation.ConsistencyValidator;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.draft.ValidationResult;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Facade over the running draft engine and its query surface.
 * <p><strong>Why:</strong> Downstream consumers (UIs, recommendation agents) need one object to start, stop and
 * query the engine without knowing how its threads are wired.</p>
 * <p><strong>Role:</strong> Application entry point built by {@code CompositionRoot}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Wire late player resolution into the single writer pipeline.</li>
 *   <li>Start and stop the resolver, the writer and the connection in order.</li>
 *   <li>Answer state queries from immutable views.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Queries are safe from any thread; {@link #start(String)} and
 * {@link #shutdown()} are expected from one controlling thread.</p>
 *
 * @since 0.1.0
 */
public final class DraftEngine implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(DraftEngine.class);
  private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

  private final DraftStateStore store;
  private final DraftEventProcessor processor;
  private final ConsistencyValidator validator;
  private final DraftPipeline pipeline;
  private final PlayerResolutionService resolution;
  private final ConnectionResilienceManager connection;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopped = new AtomicBoolean();

  /**
   * Wires the components together.
   *
   * @param store state store
   * @param processor event processor
   * @param validator consistency validator
   * @param pipeline single writer pipeline
   * @param resolution player resolution service
   * @param connection connection resilience manager feeding {@code pipeline}
   */
  public DraftEngine(
      DraftStateStore store,
      DraftEventProcessor processor,
      ConsistencyValidator validator,
      DraftPipeline pipeline,
      PlayerResolutionService resolution,
      ConnectionResilienceManager connection) {
    this.store = Objects.requireNonNull(store, "store");
    this.processor = Objects.requireNonNull(processor, "processor");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
    this.resolution = Objects.requireNonNull(resolution, "resolution");
    this.connection = Objects.requireNonNull(connection, "connection");
    processor.setPositionResolver(resolution::positionFor);
    resolution.setPatchCallback(this::submitPatch);
  }

  /**
   * Seeds the available player pool and queues every id for resolution. Must be called before
   * {@link #start(String)}.
   *
   * @param playerIds pool in ranking order
   * @throws IllegalStateException when the engine already started or picks exist
   */
  public void initializePlayerPool(Collection<String> playerIds) {
    requireNotStarted("initializePlayerPool");
    store.initializePlayerPool(playerIds);
    store.availablePlayers().forEach(resolution::request);
  }

  /**
   * Records the round-one team order. Must be called before {@link #start(String)}.
   *
   * @param teamIds team ids in round-one order
   * @throws IllegalStateException when the engine already started
   * @throws IllegalArgumentException when the order is empty or repeats a team
   */
  public void setDraftOrder(List<String> teamIds) {
    requireNotStarted("setDraftOrder");
    store.setDraftOrder(teamIds);
  }

  /**
   * Starts resolution and the writer, then connects the transport.
   *
   * @param target transport address
   * @return {@code true} when the transport connected
   * @throws IllegalStateException when already started or shut down
   */
  public boolean start(String target) {
    if (stopped.get() || !started.compareAndSet(false, true)) {
      throw new IllegalStateException("Draft engine already started");
    }
    resolution.start();
    pipeline.start();
    boolean connected = connection.connect(target);
    if (!connected) {
      log.warn("Initial connection to {} failed", target);
    }
    return connected;
  }

  /**
   * Disconnects, drains the writer and stops resolution. Safe to call repeatedly.
   */
  public void shutdown() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    connection.shutdown();
    pipeline.shutdown(DRAIN_TIMEOUT);
    resolution.shutdown();
    log.info("Draft engine stopped at pick {}", store.currentPick());
  }

  @Override
  public void close() {
    shutdown();
  }

  /**
   * Waits until every frame received so far has been applied.
   *
   * @param timeout maximum wait
   * @return {@code true} when idle before the timeout
   * @throws InterruptedException when interrupted
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    return pipeline.awaitIdle(timeout);
  }

  public void addDraftListener(DraftEventListener listener) {
    processor.addListener(listener);
  }

  public void addResilienceListener(ResilienceListener listener) {
    connection.addListener(listener);
  }

  public int currentPick() {
    return store.currentPick();
  }

  public Optional<String> onTheClock() {
    return store.onTheClock();
  }

  public double timeRemainingSeconds() {
    return store.timeRemainingSeconds();
  }

  public int picksUntilNext() {
    return store.picksUntilNext();
  }

  public Map<RosterPosition, List<String>> myRoster() {
    return store.myRoster();
  }

  public Map<String, Map<RosterPosition, List<String>>> otherRosters() {
    return store.otherRosters();
  }

  public List<String> availablePlayers() {
    return store.availablePlayers();
  }

  /**
   * Returns available players whose resolved position matches. Players not yet resolved are excluded.
   *
   * @param position position filter
   * @return available players in pool order
   */
  public List<String> availablePlayers(RosterPosition position) {
    Objects.requireNonNull(position, "position");
    return store.availablePlayers().stream()
        .filter(id -> resolution.resolved(id).map(ResolvedPlayer::position).filter(position::equals).isPresent())
        .collect(Collectors.toList());
  }

  public List<Pick> pickHistory() {
    return store.pickHistory();
  }

  public List<Integer> myPickNumbers() {
    return store.myPickNumbers();
  }

  public String displayName(String playerId) {
    return resolution.displayName(playerId);
  }

  public ProcessingStats stats() {
    return processor.stats();
  }

  public ValidationResult validate() {
    return validator.validate();
  }

  public ValidationResult validateCompletion() {
    return validator.validateCompletion();
  }

  public DraftSnapshot view() {
    return store.view();
  }

  public ConnectionState connectionState() {
    return connection.state();
  }

  /**
   * @return fatal writer failure, if the state became unrecoverable
   */
  public Optional<RuntimeException> failure() {
    return pipeline.failure();
  }

  DraftStateStore store() {
    return store;
  }

  private void requireNotStarted(String operation) {
    if (started.get() || stopped.get()) {
      throw new IllegalStateException(operation + " is only allowed before the engine starts");
    }
  }

  private void submitPatch(String playerId, ResolvedPlayer player) {
    // Undrafted players pick the cached position up when applied; the processor re-checks after applyPick.
    if (!store.isDrafted(playerId)) {
      return;
    }
    if (!pipeline.submitPositionPatch(playerId, player.position())) {
      log.debug("Position patch for player {} not queued", playerId);
    }
  }
}
