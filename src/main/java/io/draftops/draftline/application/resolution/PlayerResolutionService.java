package io.draftops.draftline.application.resolution;

import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.port.PlayerDirectory;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Cache-first player identity lookup with a background batch resolver.
 * <p><strong>Why:</strong> Picks must be applied immediately, but names and positions come from a directory that
 * may be slow; misses are resolved later and patched in.</p>
 * <p><strong>Role:</strong> Application service whose {@link #positionFor(String)} is the event processor's
 * position resolver.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Answer position lookups from the cache without blocking.</li>
 *   <li>Queue each missed id once and resolve queued ids in batches on a worker thread.</li>
 *   <li>Fall back to a {@code Player #<id>} placeholder on the bench when resolution fails.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Lookups are safe from any thread; resolution runs on one worker thread
 * (named <code>draftline-resolver-</code>).</p>
 * <p><strong>Observability:</strong> Counts {@code resolution.resolved}, {@code resolution.miss} and
 * {@code resolution.error}.</p>
 *
 * @since 0.1.0
 */
public final class PlayerResolutionService {
  private static final Logger log = LoggerFactory.getLogger(PlayerResolutionService.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final PlayerDirectory directory;
  private final MetricsPort metrics;
  private final Settings settings;
  private final Map<String, ResolvedPlayer> cache = new ConcurrentHashMap<>();
  private final Set<String> pending = ConcurrentHashMap.newKeySet();
  private final BlockingQueue<String> queue = new LinkedBlockingQueue<>();
  private final AtomicBoolean running = new AtomicBoolean();

  private volatile BiConsumer<String, ResolvedPlayer> patchCallback = (id, player) -> {};
  private volatile ExecutorService worker;

  public PlayerResolutionService(PlayerDirectory directory, MetricsPort metrics, Settings settings) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Registers the receiver of completed resolutions. Invoked on the resolver thread.
   *
   * @param callback player id and its resolution; {@code null} disables patching
   */
  public void setPatchCallback(BiConsumer<String, ResolvedPlayer> callback) {
    this.patchCallback = callback == null ? (id, player) -> {} : callback;
  }

  /**
   * Returns the cached position, queueing the id for resolution on a miss.
   *
   * @param playerId player id
   * @return cached position, or empty when not yet resolved
   */
  public Optional<RosterPosition> positionFor(String playerId) {
    ResolvedPlayer cached = cache.get(playerId);
    if (cached != null) {
      return Optional.of(cached.position());
    }
    request(playerId);
    return Optional.empty();
  }

  /**
   * Queues a player id unless it is cached or already queued.
   *
   * @param playerId player id
   * @return {@code true} when newly queued
   */
  public boolean request(String playerId) {
    if (playerId == null || cache.containsKey(playerId) || !pending.add(playerId)) {
      return false;
    }
    queue.offer(playerId);
    return true;
  }

  /**
   * @param playerId player id
   * @return cached resolution, if any
   */
  public Optional<ResolvedPlayer> resolved(String playerId) {
    return Optional.ofNullable(cache.get(playerId));
  }

  /**
   * @param playerId player id
   * @return cached display name, or the placeholder name
   */
  public String displayName(String playerId) {
    ResolvedPlayer cached = cache.get(playerId);
    return cached != null ? cached.name() : ResolvedPlayer.placeholder(playerId).name();
  }

  /**
   * @return ids waiting for resolution
   */
  public int pendingCount() {
    return pending.size();
  }

  /**
   * Starts the resolver thread.
   *
   * @throws IllegalStateException when already running
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Player resolution already running");
    }
    worker = ExecutorFactories.newSingleWorker("draftline-resolver", true,
        (thread, ex) -> log.error("Resolver thread {} crashed", thread.getName(), ex));
    worker.execute(this::runLoop);
  }

  /**
   * Stops the resolver thread and discards queued ids. Safe to call repeatedly.
   */
  public void shutdown() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    ExecutorService current = worker;
    worker = null;
    if (current != null) {
      current.shutdownNow();
      try {
        if (!current.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
          log.error("Resolver thread failed to terminate within {} ms", SHUTDOWN_TIMEOUT.toMillis());
        }
      } catch (InterruptedException ie) {
        Thread.currentThread().interrupt();
      }
    }
    int discarded = queue.size();
    queue.clear();
    pending.clear();
    if (discarded > 0) {
      log.info("Discarded {} unresolved player ids", discarded);
    }
  }

  /**
   * Resolves a batch synchronously, caching every outcome and handing it to the patch callback.
   *
   * @param playerIds ids to resolve
   */
  void resolveBatch(List<String> playerIds) {
    if (playerIds.isEmpty()) {
      return;
    }
    Map<String, ResolvedPlayer> found;
    try {
      Map<String, ResolvedPlayer> result = directory.resolveAll(Collections.unmodifiableList(playerIds));
      found = result == null ? Map.of() : result;
    } catch (Exception ex) {
      metrics.increment("resolution.error");
      log.warn("Resolving {} players failed; using placeholders", playerIds.size(), ex);
      found = Map.of();
    }
    for (String playerId : playerIds) {
      ResolvedPlayer player = found.get(playerId);
      if (player == null) {
        metrics.increment("resolution.miss");
        log.debug("Player {} not found in directory", playerId);
        player = ResolvedPlayer.placeholder(playerId);
      } else {
        metrics.increment("resolution.resolved");
      }
      cache.put(playerId, player);
      pending.remove(playerId);
      try {
        patchCallback.accept(playerId, player);
      } catch (RuntimeException ex) {
        log.warn("Position patch for player {} failed", playerId, ex);
      }
    }
  }

  private void runLoop() {
    List<String> batch = new ArrayList<>(settings.batchSize());
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      String first;
      try {
        first = queue.poll(settings.pollMillis(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException interrupted) {
        Thread.currentThread().interrupt();
        return;
      }
      if (first == null) {
        continue;
      }
      batch.add(first);
      queue.drainTo(batch, settings.batchSize() - 1);
      try {
        resolveBatch(batch);
      } finally {
        batch.clear();
      }
    }
  }

  /** Resolver tuning. */
  public record Settings(int batchSize, long pollMillis) {
    /**
     * Clamps the batch size and poll interval to at least one.
     */
    public Settings {
      batchSize = Math.max(1, batchSize);
      pollMillis = Math.max(1L, pollMillis);
    }

    /**
     * @return batches of 25 ids polled every 100 ms
     */
    public static Settings defaults() {
      return new Settings(25, 100L);
    }
  }
}
