package io.draftops.draftline.application.pipeline;

import io.draftops.draftline.application.port.FrameHandler;
import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.application.validation.ConsistencyValidator;
import io.draftops.draftline.application.validation.ConsistencyViolationException;
import io.draftops.draftline.application.validation.HealReport;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.net.TransportFrame;
import io.draftops.draftline.infrastructure.exec.ExecutorFactories;
import io.draftops.draftline.logging.Logs;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Single-writer command loop in front of the draft state store.
 * <p>Transport threads and the resolution worker enqueue commands; exactly one thread (named
 * <code>draftline-writer-</code>) dequeues them and drives the {@link DraftEventProcessor}, so every live
 * mutation is serialized. Consistency validation runs on the same thread every configured number of picks.
 * A failed self-heal stops the loop and is exposed through {@link #failure()}.</p>
 *
 * @since 0.1.0
 */
public final class DraftPipeline implements FrameHandler {
  private static final Logger log = LoggerFactory.getLogger(DraftPipeline.class);

  private static final long WORKER_IDLE_POLL_MILLIS = 25L;
  private static final long ENQUEUE_MAX_WAIT_MILLIS = 5_000L;
  private static final int LOG_FRAME_BYTES = 256;

  private final DraftEventProcessor processor;
  private final DraftStateStore store;
  private final ConsistencyValidator validator;
  private final MetricsPort metrics;
  private final Settings settings;
  private final BlockingQueue<Command> queue;
  private final AtomicBoolean started = new AtomicBoolean();
  private final AtomicBoolean stopRequested = new AtomicBoolean();
  private final AtomicReference<RuntimeException> failure = new AtomicReference<>();
  private final AtomicLong submitted = new AtomicLong();
  private final AtomicLong completed = new AtomicLong();
  private final Object idleMonitor = new Object();

  private volatile ExecutorService executor;
  private int picksSinceValidation;

  /**
   * Creates a pipeline.
   *
   * @param processor event processor driven by the writer thread
   * @param store store observed for pick progress
   * @param validator validator run after picks
   * @param metrics metrics sink
   * @param settings queue and validation tuning
   */
  public DraftPipeline(
      DraftEventProcessor processor,
      DraftStateStore store,
      ConsistencyValidator validator,
      MetricsPort metrics,
      Settings settings) {
    this.processor = Objects.requireNonNull(processor, "processor");
    this.store = Objects.requireNonNull(store, "store");
    this.validator = Objects.requireNonNull(validator, "validator");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
    this.queue = new ArrayBlockingQueue<>(settings.queueCapacity());
  }

  /**
   * Starts the writer thread.
   *
   * @throws IllegalStateException when already started
   */
  public void start() {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Draft pipeline already started");
    }
    stopRequested.set(false);
    executor = ExecutorFactories.newSingleWorker("draftline-writer", false, this::handleCrash);
    executor.execute(this::runLoop);
    log.info("Draft pipeline started (queue capacity {}, validate every {} picks)",
        settings.queueCapacity(), settings.validateEveryPicks());
  }

  /**
   * Forwards inbound frames to the writer queue. Outbound frames are ignored.
   *
   * @param frame transport frame
   */
  @Override
  public void onFrame(TransportFrame frame) {
    if (frame.inbound()) {
      submitFrame(frame.payload());
    }
  }

  /**
   * Enqueues a raw frame for processing.
   *
   * @param payload frame text
   * @return {@code false} when the pipeline is stopped, failed, or the queue stayed full
   */
  public boolean submitFrame(String payload) {
    return enqueue(new FrameCommand(Objects.requireNonNull(payload, "payload")));
  }

  /**
   * Enqueues a late position resolution.
   *
   * @param playerId drafted player
   * @param position resolved position
   * @return {@code false} when the command could not be queued
   */
  public boolean submitPositionPatch(String playerId, RosterPosition position) {
    return enqueue(new PatchCommand(Objects.requireNonNull(playerId, "playerId"),
        Objects.requireNonNull(position, "position")));
  }

  /**
   * Waits until every command submitted so far has been processed.
   *
   * @param timeout maximum wait
   * @return {@code true} when idle before the timeout
   * @throws InterruptedException when the caller is interrupted
   */
  public boolean awaitIdle(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (idleMonitor) {
      while (completed.get() < submitted.get()) {
        if (failure.get() != null) {
          return false;
        }
        long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
        if (remainingMillis <= 0) {
          return false;
        }
        idleMonitor.wait(remainingMillis);
      }
    }
    return true;
  }

  /**
   * Stops accepting commands, drains the queue within {@code drainTimeout}, then stops the writer thread.
   * Safe to call repeatedly.
   *
   * @param drainTimeout bounded wait for queued commands
   */
  public void shutdown(Duration drainTimeout) {
    if (!started.get() || !stopRequested.compareAndSet(false, true)) {
      return;
    }
    ExecutorService current = executor;
    if (current != null) {
      current.shutdown();
      boolean terminated = false;
      try {
        terminated = current.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!terminated) {
          metrics.increment("pipeline.shutdown.force");
          log.warn("Draft writer busy after {} ms; {} commands discarded", drainTimeout.toMillis(), queue.size());
          current.shutdownNow();
          terminated = current.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }
      } catch (InterruptedException ie) {
        metrics.increment("pipeline.shutdown.interrupted");
        current.shutdownNow();
        Thread.currentThread().interrupt();
      }
      if (!terminated) {
        log.error("Draft writer failed to terminate cleanly");
      }
    }
    queue.clear();
    executor = null;
    started.set(false);
    wakeIdleWaiters();
    log.info("Draft pipeline stopped after {} commands", completed.get());
  }

  /**
   * @return fatal failure that stopped the writer, if any
   */
  public Optional<RuntimeException> failure() {
    return Optional.ofNullable(failure.get());
  }

  /**
   * @return commands waiting for the writer
   */
  public int queueDepth() {
    return queue.size();
  }

  private boolean enqueue(Command command) {
    if (stopRequested.get() || failure.get() != null) {
      metrics.increment("pipeline.enqueue.rejected");
      return false;
    }
    submitted.incrementAndGet();
    try {
      if (queue.offer(command, ENQUEUE_MAX_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
        metrics.observe("pipeline.queue.depth", queue.size());
        return true;
      }
      metrics.increment("pipeline.enqueue.dropped");
      log.error("Draft writer queue full for {} ms; dropped {}", ENQUEUE_MAX_WAIT_MILLIS, command);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      metrics.increment("pipeline.enqueue.interrupted");
    }
    markCompleted();
    return false;
  }

  private void runLoop() {
    MDC.put("pipeline", "draft-writer");
    try {
      while (!(stopRequested.get() && queue.isEmpty())) {
        Command command;
        try {
          command = queue.poll(WORKER_IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException interrupted) {
          Thread.currentThread().interrupt();
          break;
        }
        if (command == null) {
          continue;
        }
        try {
          execute(command);
        } catch (ConsistencyViolationException fatal) {
          metrics.increment("pipeline.fatal");
          failure.compareAndSet(null, fatal);
          log.error("Draft writer stopping: state is unrecoverable", fatal);
          break;
        } catch (RuntimeException ex) {
          metrics.increment("pipeline.command.error");
          log.error("Draft writer failed on {}", command, ex);
        } finally {
          markCompleted();
        }
      }
    } finally {
      MDC.remove("pipeline");
      wakeIdleWaiters();
    }
  }

  private void execute(Command command) {
    if (command instanceof FrameCommand frame) {
      int before = store.completedPicks();
      processor.process(frame.payload());
      if (store.completedPicks() > before) {
        picksSinceValidation++;
        if (picksSinceValidation >= settings.validateEveryPicks()) {
          picksSinceValidation = 0;
          HealReport report = validator.validateAndHeal();
          if (report.rolledBack()) {
            log.warn("State healed by rolling back to snapshot {}", report.restoredIndex());
          }
        }
      }
    } else if (command instanceof PatchCommand patch) {
      processor.applyPositionPatch(patch.playerId(), patch.position());
    }
  }

  private void markCompleted() {
    completed.incrementAndGet();
    wakeIdleWaiters();
  }

  private void wakeIdleWaiters() {
    synchronized (idleMonitor) {
      idleMonitor.notifyAll();
    }
  }

  private void handleCrash(Thread thread, Throwable throwable) {
    metrics.increment("pipeline.worker.uncaught");
    log.error("Draft writer {} threw an uncaught exception", thread.getName(), throwable);
    RuntimeException crash = throwable instanceof RuntimeException ex
        ? ex
        : new IllegalStateException("Draft writer crashed", throwable);
    failure.compareAndSet(null, crash);
    wakeIdleWaiters();
  }

  /** Pipeline tuning parameters. */
  public record Settings(int queueCapacity, int validateEveryPicks) {
    /**
     * Clamps both values to at least one.
     */
    public Settings {
      queueCapacity = Math.max(1, queueCapacity);
      validateEveryPicks = Math.max(1, validateEveryPicks);
    }

    /**
     * @return 1024-slot queue, validation after every pick
     */
    public static Settings defaults() {
      return new Settings(1024, 1);
    }
  }

  private interface Command {}

  private record FrameCommand(String payload) implements Command {
    @Override
    public String toString() {
      return "frame " + Logs.truncate(payload, LOG_FRAME_BYTES);
    }
  }

  private record PatchCommand(String playerId, RosterPosition position) implements Command {}
}
