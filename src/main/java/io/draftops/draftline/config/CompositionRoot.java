package io.draftops.draftline.config;

import io.draftops.draftline.application.DraftEngine;
import io.draftops.draftline.application.pipeline.DraftEventProcessor;
import io.draftops.draftline.application.pipeline.DraftPipeline;
import io.draftops.draftline.application.port.ClockPort;
import io.draftops.draftline.application.port.DraftTransport;
import io.draftops.draftline.application.port.MetricsPort;
import io.draftops.draftline.application.port.PlayerDirectory;
import io.draftops.draftline.application.resilience.BackoffSleeper;
import io.draftops.draftline.application.resilience.ConnectionResilienceManager;
import io.draftops.draftline.application.resolution.PlayerResolutionService;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.application.validation.ConsistencyValidator;
import io.draftops.draftline.domain.protocol.DraftProtocolParser;
import io.draftops.draftline.infrastructure.events.LoggingDraftEventListener;
import io.draftops.draftline.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.draftops.draftline.infrastructure.time.SystemClockAdapter;
import io.draftops.draftline.infrastructure.transport.CaptureReplayTransport;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that wires the draft engine to concrete adapters.
 * <p><strong>Why:</strong> Keeps the translation from {@link EngineConfig} to a runnable object graph in one place.</p>
 * <p><strong>Role:</strong> Configuration layer invoked by the CLI and by integration tests.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Create the store, processor, validator, writer pipeline and resolution service for one draft.</li>
 *   <li>Put the resilience manager between the transport and the writer pipeline.</li>
 *   <li>Attach the logging listener so pick events reach the log and metrics.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not synchronized; used during startup only.</p>
 *
 * @since 0.1.0
 * @see DraftEngine
 */
public final class CompositionRoot implements AutoCloseable {
  private final EngineConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final BackoffSleeper sleeper;

  /**
   * Creates a root backed by OpenTelemetry metrics and the system clock.
   *
   * @param config engine configuration
   */
  public CompositionRoot(EngineConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter(), BackoffSleeper.THREAD);
  }

  /**
   * Creates a root with explicit infrastructure, mainly for tests.
   *
   * @param config engine configuration
   * @param metrics metrics sink shared by every component
   * @param clock time source
   * @param sleeper reconnect backoff sleeper
   */
  public CompositionRoot(EngineConfig config, MetricsPort metrics, ClockPort clock, BackoffSleeper sleeper) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public EngineConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Builds a transport that replays a capture file.
   *
   * @param frameDelay pause between replayed frames
   * @return new replay transport
   */
  public CaptureReplayTransport replayTransport(Duration frameDelay) {
    return new CaptureReplayTransport(clock, frameDelay);
  }

  /**
   * Builds a fully wired engine over {@code transport}. The configured draft order, when present, is
   * applied before the engine is returned.
   *
   * @param transport vendor transport; the engine takes ownership
   * @param directory player identity source
   * @return engine ready for {@link DraftEngine#start(String)}
   */
  public DraftEngine draftEngine(DraftTransport transport, PlayerDirectory directory) {
    Objects.requireNonNull(transport, "transport");
    Objects.requireNonNull(directory, "directory");

    DraftStateStore store = new DraftStateStore(config.session(), clock, config.snapshotCapacity());
    DraftEventProcessor processor = new DraftEventProcessor(store, new DraftProtocolParser(), metrics);
    ConsistencyValidator validator = new ConsistencyValidator(store, metrics);
    DraftPipeline pipeline = new DraftPipeline(processor, store, validator, metrics, config.pipelineSettings());
    PlayerResolutionService resolution =
        new PlayerResolutionService(directory, metrics, config.resolutionSettings());
    ConnectionResilienceManager connection = new ConnectionResilienceManager(
        transport, pipeline, config.reconnectPolicy(), clock, metrics, store::currentPick, sleeper);

    DraftEngine engine = new DraftEngine(store, processor, validator, pipeline, resolution, connection);
    if (!config.draftOrder().isEmpty()) {
      engine.setDraftOrder(config.draftOrder());
    }
    engine.addDraftListener(
        new LoggingDraftEventListener(metrics, "draftEvents", resolution::displayName, config.teamId()));
    return engine;
  }

  /**
   * Flushes and releases the metrics sink when it holds exporter resources.
   *
   * @throws Exception when the metrics sink fails to close
   */
  @Override
  public void close() throws Exception {
    if (metrics instanceof AutoCloseable closeable) {
      closeable.close();
    }
  }
}
