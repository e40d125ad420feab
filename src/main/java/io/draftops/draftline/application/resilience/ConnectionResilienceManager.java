package io.draftops.draftline.application.resilience;

import io.draftops.draftline.application.port.ClockPort;
import io.draftops.draftline.application.port.DraftTransport;
import io.draftops.draftline.application.port.FrameHandler;
import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.port.ResilienceListener;
import io.draftops.draftline.domain.net.TransportFrame;
import io.draftops.draftline.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Keeps the draft transport alive: heartbeat monitoring, backoff reconnection and
 * resynchronization reporting.
 * <p><strong>Why:</strong> Draft rooms drop connections mid-pick; the engine must reconnect without losing its
 * pick history and must know how many picks it missed.</p>
 * <p><strong>Role:</strong> Application service sitting between the {@link DraftTransport} and the downstream
 * {@link FrameHandler} (the draft pipeline).</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Refresh the heartbeat on every frame and forward inbound frames downstream.</li>
 *   <li>Detect silence longer than the timeout on a scheduler thread.</li>
 *   <li>Run a single reconnection sequence at a time on a dedicated recovery thread.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> State transitions use compare-and-set; concurrent disconnect reports yield
 * exactly one recovery.</p>
 * <p><strong>Observability:</strong> Counts {@code resilience.disconnect}, {@code resilience.reconnect.attempt},
 * {@code resilience.reconnect.success} and {@code resilience.reconnect.failed}.</p>
 *
 * @since 0.1.0
 */
public final class ConnectionResilienceManager implements FrameHandler, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionResilienceManager.class);
  private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  private final DraftTransport transport;
  private final FrameHandler downstream;
  private final ReconnectPolicy policy;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final IntSupplier lastKnownPick;
  private final BackoffSleeper sleeper;
  private final List<ResilienceListener> listeners = new CopyOnWriteArrayList<>();

  private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);
  private final AtomicBoolean shutdown = new AtomicBoolean();
  private final AtomicLong messageCount = new AtomicLong();
  private final AtomicInteger reconnectAttempts = new AtomicInteger();
  private final AtomicReference<DisconnectRecord> lastDisconnect = new AtomicReference<>();
  private final ScheduledExecutorService scheduler;
  private final ExecutorService recoveryExecutor;

  private volatile long lastHeartbeatMillis;
  private volatile String lastTarget;
  private ScheduledFuture<?> heartbeatTask;

  /**
   * Creates a manager and registers itself as the transport's frame handler.
   *
   * @param transport connection to supervise
   * @param downstream receiver of inbound frames
   * @param policy heartbeat and backoff tuning
   * @param clock time source for heartbeats
   * @param metrics metrics sink
   * @param lastKnownPick supplies the store's current pick number for disconnect records
   * @param sleeper backoff wait strategy
   */
  public ConnectionResilienceManager(
      DraftTransport transport,
      FrameHandler downstream,
      ReconnectPolicy policy,
      ClockPort clock,
      MetricsPort metrics,
      IntSupplier lastKnownPick,
      BackoffSleeper sleeper) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.downstream = Objects.requireNonNull(downstream, "downstream");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.lastKnownPick = Objects.requireNonNull(lastKnownPick, "lastKnownPick");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    this.scheduler = ExecutorFactories.newScheduler("draftline-heartbeat", this::handleCrash);
    this.recoveryExecutor = ExecutorFactories.newSingleWorker("draftline-recovery", true, this::handleCrash);
    this.lastHeartbeatMillis = clock.nowMillis();
    transport.setFrameHandler(this);
  }

  public void addListener(ResilienceListener listener) {
    listeners.add(Objects.requireNonNull(listener, "listener"));
  }

  public void removeListener(ResilienceListener listener) {
    listeners.remove(listener);
  }

  /**
   * Opens the transport and starts heartbeat monitoring.
   *
   * @param target transport specific address
   * @return {@code true} when connected; on failure the state returns to {@link ConnectionState#DISCONNECTED}
   * @throws IllegalStateException after {@link #shutdown()}
   */
  public boolean connect(String target) {
    if (shutdown.get()) {
      throw new IllegalStateException("Resilience manager is shut down");
    }
    lastTarget = Objects.requireNonNull(target, "target");
    ConnectionState previous = state.getAndSet(ConnectionState.CONNECTING);
    notifyListeners(l -> l.onStateChanged(previous, ConnectionState.CONNECTING));
    boolean connected;
    try {
      connected = transport.connect(target);
    } catch (Exception ex) {
      log.warn("Connecting to {} failed", target, ex);
      connected = false;
    }
    if (!connected) {
      transition(ConnectionState.CONNECTING, ConnectionState.DISCONNECTED);
      metrics.increment("resilience.connect.failed");
      return false;
    }
    lastHeartbeatMillis = clock.nowMillis();
    transition(ConnectionState.CONNECTING, ConnectionState.CONNECTED);
    startHeartbeat();
    log.info("Connected to {}", target);
    return true;
  }

  /**
   * Refreshes the heartbeat; inbound frames are also counted and forwarded downstream.
   *
   * @param frame observed frame
   */
  @Override
  public void onFrame(TransportFrame frame) {
    lastHeartbeatMillis = clock.nowMillis();
    if (!frame.inbound()) {
      return;
    }
    messageCount.incrementAndGet();
    downstream.onFrame(frame);
  }

  /**
   * Routes transport-reported closure into recovery.
   *
   * @param reason closure cause
   */
  @Override
  public void onClosed(String reason) {
    handleDisconnection("transport closed: " + reason);
  }

  /**
   * Checks for heartbeat silence. Only acts while {@link ConnectionState#CONNECTED}.
   *
   * @return {@code true} when a timeout was detected and recovery started
   */
  public boolean checkHeartbeat() {
    if (state.get() != ConnectionState.CONNECTED) {
      return false;
    }
    long silentMillis = clock.nowMillis() - lastHeartbeatMillis;
    if (silentMillis > policy.heartbeatTimeout().toMillis()) {
      metrics.increment("resilience.heartbeat.timeout");
      log.warn("No frames for {} ms (timeout {} ms)", silentMillis, policy.heartbeatTimeout().toMillis());
      return handleDisconnection("heartbeat timeout");
    }
    return false;
  }

  /**
   * Records the disconnection and starts recovery on the recovery thread.
   *
   * @param reason cause of the disconnection
   * @return {@code true} when this call started recovery; {@code false} when recovery is already running, the
   *         manager has failed, or it is shut down
   */
  public boolean handleDisconnection(String reason) {
    if (shutdown.get()) {
      return false;
    }
    ConnectionState previous;
    do {
      previous = state.get();
      if (previous == ConnectionState.RECONNECTING || previous == ConnectionState.FAILED) {
        log.debug("Ignoring disconnection ({}) while {}", reason, previous);
        return false;
      }
    } while (!state.compareAndSet(previous, ConnectionState.RECONNECTING));

    DisconnectRecord record =
        new DisconnectRecord(lastKnownPick.getAsInt(), messageCount.get(), clock.nowMillis(), reason);
    lastDisconnect.set(record);
    stopHeartbeat();
    metrics.increment("resilience.disconnect");
    log.warn("Connection lost ({}) at pick {} after {} frames", reason, record.lastKnownPickNumber(),
        record.messageCount());
    ConnectionState from = previous;
    notifyListeners(l -> l.onStateChanged(from, ConnectionState.RECONNECTING));
    notifyListeners(l -> l.onDisconnected(record));
    try {
      recoveryExecutor.execute(() -> reconnect(record));
    } catch (RejectedExecutionException ex) {
      log.debug("Recovery not started; manager shutting down");
      return false;
    }
    return true;
  }

  /**
   * Stops heartbeat checks, interrupts any backoff wait, waits for both threads and closes the transport.
   * Idempotent.
   */
  public void shutdown() {
    if (!shutdown.compareAndSet(false, true)) {
      return;
    }
    stopHeartbeat();
    scheduler.shutdownNow();
    recoveryExecutor.shutdownNow();
    awaitTermination(scheduler, "heartbeat");
    awaitTermination(recoveryExecutor, "recovery");
    try {
      transport.close();
    } catch (RuntimeException ex) {
      log.warn("Closing transport failed", ex);
    }
    ConnectionState previous = state.get();
    if (previous != ConnectionState.FAILED && state.compareAndSet(previous, ConnectionState.DISCONNECTED)) {
      notifyListeners(l -> l.onStateChanged(previous, ConnectionState.DISCONNECTED));
    }
    log.info("Resilience manager shut down after {} frames", messageCount.get());
  }

  @Override
  public void close() {
    shutdown();
  }

  public ConnectionState state() {
    return state.get();
  }

  public long messageCount() {
    return messageCount.get();
  }

  public long lastHeartbeatMillis() {
    return lastHeartbeatMillis;
  }

  public int reconnectAttempts() {
    return reconnectAttempts.get();
  }

  public Optional<DisconnectRecord> lastDisconnect() {
    return Optional.ofNullable(lastDisconnect.get());
  }

  public boolean isShutdown() {
    return shutdown.get();
  }

  private void reconnect(DisconnectRecord record) {
    int maxAttempts = policy.maxAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (shutdown.get() || Thread.currentThread().isInterrupted()) {
        return;
      }
      Duration delay = policy.delayBeforeAttempt(attempt);
      reconnectAttempts.set(attempt);
      int current = attempt;
      notifyListeners(l -> l.onReconnectAttempt(current, delay.toMillis()));
      if (!delay.isZero()) {
        try {
          sleeper.sleep(delay);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          log.debug("Reconnect backoff interrupted");
          return;
        }
      }
      metrics.increment("resilience.reconnect.attempt");
      log.info("Reconnect attempt {}/{} to {}", attempt, maxAttempts, lastTarget);
      if (attemptReconnect()) {
        reconnectAttempts.set(0);
        lastHeartbeatMillis = clock.nowMillis();
        if (!transition(ConnectionState.RECONNECTING, ConnectionState.CONNECTED)) {
          return;
        }
        startHeartbeat();
        metrics.increment("resilience.reconnect.success");
        resynchronize(record);
        return;
      }
    }
    if (transition(ConnectionState.RECONNECTING, ConnectionState.FAILED)) {
      metrics.increment("resilience.reconnect.failed");
      log.error("Reconnection failed after {} attempts; last disconnect {}", maxAttempts, record);
      notifyListeners(l -> l.onRecoveryFailed(record, maxAttempts));
    }
  }

  private boolean attemptReconnect() {
    try {
      if (transport.refreshSession()) {
        log.info("Session refreshed");
        return true;
      }
    } catch (Exception ex) {
      log.warn("Session refresh failed", ex);
    }
    if (Thread.currentThread().isInterrupted()) {
      return false;
    }
    try {
      transport.close();
      return transport.connect(lastTarget);
    } catch (Exception ex) {
      log.warn("Reconnect to {} failed", lastTarget, ex);
      return false;
    }
  }

  private void resynchronize(DisconnectRecord record) {
    int after = lastKnownPick.getAsInt();
    int missed = Math.max(0, after - record.lastKnownPickNumber());
    ResyncReport report = new ResyncReport(
        record.lastKnownPickNumber(),
        after,
        missed,
        messageCount.get() - record.messageCount(),
        clock.nowMillis() - record.timestampMillis());
    metrics.observe("resilience.resync.missedPicks", missed);
    if (report.missedAny()) {
      log.warn("Reconnected; {} picks happened while disconnected ({} -> {})", missed, report.pickBefore(),
          report.pickAfter());
    } else {
      log.info("Reconnected after {} ms; no picks missed", report.downtimeMillis());
    }
    notifyListeners(l -> l.onReconnected(report));
  }

  private synchronized void startHeartbeat() {
    if (shutdown.get()) {
      return;
    }
    if (heartbeatTask != null) {
      heartbeatTask.cancel(false);
    }
    long interval = policy.heartbeatInterval().toMillis();
    try {
      heartbeatTask = scheduler.scheduleAtFixedRate(this::runHeartbeatCheck, interval, interval,
          TimeUnit.MILLISECONDS);
    } catch (RejectedExecutionException ex) {
      log.debug("Heartbeat not scheduled; manager shutting down");
    }
  }

  private synchronized void stopHeartbeat() {
    if (heartbeatTask != null) {
      heartbeatTask.cancel(false);
      heartbeatTask = null;
    }
  }

  private void runHeartbeatCheck() {
    try {
      checkHeartbeat();
    } catch (RuntimeException ex) {
      metrics.increment("resilience.heartbeat.error");
      log.error("Heartbeat check failed", ex);
    }
  }

  private boolean transition(ConnectionState from, ConnectionState to) {
    if (!state.compareAndSet(from, to)) {
      return false;
    }
    notifyListeners(l -> l.onStateChanged(from, to));
    return true;
  }

  private void notifyListeners(Consumer<ResilienceListener> call) {
    for (ResilienceListener listener : listeners) {
      try {
        call.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Resilience listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }

  private void awaitTermination(ExecutorService executor, String name) {
    try {
      if (!executor.awaitTermination(SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
        log.error("{} thread failed to terminate within {} ms", name, SHUTDOWN_TIMEOUT.toMillis());
      }
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
    }
  }

  private void handleCrash(Thread thread, Throwable throwable) {
    metrics.increment("resilience.worker.uncaught");
    log.error("Resilience thread {} threw an uncaught exception", thread.getName(), throwable);
  }
}
