package io.draftops.draftline.application;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.draftops.draftline.application.pipeline.DraftEventProcessor;
import io.draftops.draftline.application.pipeline.DraftPipeline;
import io.draftops.draftline.application.port.DraftEventListener;
import io.draftops.draftline.application.port.DraftTransport;
import io.draftops.draftline.application.port.FrameHandler;
import io.draftops.draftline.application.resilience.BackoffSleeper;
import io.draftops.draftline.application.resilience.ConnectionResilienceManager;
import io.draftops.draftline.application.resilience.ConnectionState;
import io.draftops.draftline.application.resilience.ReconnectPolicy;
import io.draftops.draftline.application.resolution.PlayerResolutionService;
import io.draftops.draftline.application.resolution.ResolvedPlayer;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.application.validation.ConsistencyValidator;
import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.DraftStatus;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.net.TransportFrame;
import io.draftops.draftline.domain.protocol.DraftEventType;
import io.draftops.draftline.domain.protocol.DraftProtocolParser;
import io.draftops.draftline.infrastructure.directory.InMemoryPlayerDirectory;
import io.draftops.draftline.support.ManualClock;
import io.draftops.draftline.support.RecordingMetrics;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class DraftEngineTest {
  private static final Duration WAIT = Duration.ofSeconds(5);

  private final RecordingMetrics metrics = new RecordingMetrics();
  private final ManualClock clock = new ManualClock(1_000L);
  private final StubTransport transport = new StubTransport();
  private DraftEventProcessor processor;
  private PlayerResolutionService resolution;
  private DraftEngine engine;

  @AfterEach
  void tearDown() {
    if (engine != null) {
      engine.shutdown();
    }
  }

  private DraftEngine newEngine() {
    DraftStateStore store = new DraftStateStore(new DraftSession("L1", "1", 2, 2), clock, 50);
    processor = new DraftEventProcessor(store, new DraftProtocolParser(), metrics);
    ConsistencyValidator validator = new ConsistencyValidator(store, metrics);
    DraftPipeline pipeline =
        new DraftPipeline(processor, store, validator, metrics, DraftPipeline.Settings.defaults());
    InMemoryPlayerDirectory directory = new InMemoryPlayerDirectory(Map.of(
        "P1", new ResolvedPlayer("Alpha", RosterPosition.QB),
        "P2", new ResolvedPlayer("Bravo", RosterPosition.RB),
        "P3", new ResolvedPlayer("Charlie", RosterPosition.QB)));
    resolution = new PlayerResolutionService(directory, metrics, new PlayerResolutionService.Settings(10, 5L));
    ConnectionResilienceManager connection = new ConnectionResilienceManager(transport, pipeline,
        ReconnectPolicy.defaults(), clock, metrics, store::currentPick, BackoffSleeper.THREAD);
    engine = new DraftEngine(store, processor, validator, pipeline, resolution, connection);
    return engine;
  }

  @Test
  void runsSnakeDraftToCompletion() throws Exception {
    DraftEngine engine = newEngine();
    engine.initializePlayerPool(List.of("P1", "P2", "P3", "P4", "P5"));
    engine.setDraftOrder(List.of("1", "2"));
    CountDownLatch completed = new CountDownLatch(1);
    engine.addDraftListener(new DraftEventListener() {
      @Override
      public void onDraftCompleted(DraftSnapshot finalState) {
        completed.countDown();
      }
    });

    assertTrue(engine.start("stub://room"));
    assertEquals(ConnectionState.CONNECTED, engine.connectionState());
    await(() -> engine.displayName("P3").equals("Charlie"));

    transport.deliver("SELECTING 1 30000");
    transport.deliver("SELECTED 1 P1 1");
    transport.deliver("SELECTED 2 P2 2");
    transport.deliver("SELECTED 2 P4 3");
    assertTrue(engine.awaitIdle(WAIT));

    assertEquals(List.of("P3", "P5"), engine.availablePlayers());
    assertEquals(List.of("P3"), engine.availablePlayers(RosterPosition.QB));
    assertEquals(List.of(1, 4), engine.myPickNumbers());
    assertEquals(1, engine.picksUntilNext());
    assertEquals(List.of("P1"), engine.myRoster().get(RosterPosition.QB));
    assertEquals(List.of("P2"), engine.otherRosters().get("2").get(RosterPosition.RB));

    transport.deliver("SELECTED 1 P3 4");
    assertTrue(completed.await(5, TimeUnit.SECONDS));
    assertTrue(engine.awaitIdle(WAIT));

    assertEquals(DraftStatus.COMPLETED, engine.view().status());
    assertEquals(4, engine.pickHistory().size());
    assertTrue(engine.validateCompletion().valid());
    assertTrue(engine.failure().isEmpty());
    assertEquals(4L, engine.stats().count(DraftEventType.SELECTED));
  }

  @Test
  void unresolvedPickIsPatchedOncePositionArrives() throws Exception {
    DraftEngine engine = newEngine();
    engine.start("stub://room");

    transport.deliver("SELECTED 1 P2 1");
    assertTrue(engine.awaitIdle(WAIT));
    await(() -> engine.myRoster().get(RosterPosition.RB).contains("P2"));

    assertFalse(engine.myRoster().get(RosterPosition.BENCH).contains("P2"));
    assertEquals("Bravo", engine.displayName("P2"));
  }

  @Test
  void resolutionFinishingBeforePickIsRecordedStillMovesRosterEntry() throws Exception {
    DraftEngine engine = newEngine();
    // Writer misses the cache, then stalls until the resolver has finished and seen P2 undrafted.
    processor.setPositionResolver(id -> {
      Optional<RosterPosition> position = resolution.positionFor(id);
      if (position.isEmpty()) {
        try {
          await(() -> resolution.resolved(id).isPresent() && resolution.pendingCount() == 0);
          Thread.sleep(100L);
        } catch (InterruptedException ex) {
          Thread.currentThread().interrupt();
        }
      }
      return position;
    });
    List<String> updates = new CopyOnWriteArrayList<>();
    engine.addDraftListener(new DraftEventListener() {
      @Override
      public void onPickUpdated(Pick pick, RosterPosition resolvedPosition) {
        updates.add(pick.playerId() + "->" + resolvedPosition);
      }
    });
    engine.start("stub://room");

    transport.deliver("SELECTED 1 P2 1");
    await(() -> engine.myRoster().get(RosterPosition.RB).contains("P2"));
    assertTrue(engine.awaitIdle(WAIT));

    assertEquals(List.of("P2"), engine.myRoster().get(RosterPosition.RB));
    assertTrue(engine.myRoster().get(RosterPosition.BENCH).isEmpty());
    assertEquals(List.of("P2->RB"), updates);
    assertEquals(RosterPosition.BENCH, engine.pickHistory().get(0).position());
  }

  @Test
  void seedingIsRejectedAfterStart() {
    DraftEngine engine = newEngine();
    engine.start("stub://room");

    assertThrows(IllegalStateException.class, () -> engine.initializePlayerPool(List.of("P1")));
    assertThrows(IllegalStateException.class, () -> engine.setDraftOrder(List.of("1", "2")));
    assertThrows(IllegalStateException.class, () -> engine.start("stub://room"));
  }

  @Test
  void shutdownIsIdempotentAndFinal() {
    DraftEngine engine = newEngine();
    engine.start("stub://room");

    engine.shutdown();
    engine.close();

    assertEquals(ConnectionState.DISCONNECTED, engine.connectionState());
    assertTrue(transport.closed);
    assertThrows(IllegalStateException.class, () -> engine.start("stub://room"));
  }

  private static void await(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + WAIT.toNanos();
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        throw new AssertionError("Condition not met within " + WAIT);
      }
      Thread.sleep(5L);
    }
  }

  private static final class StubTransport implements DraftTransport {
    private volatile FrameHandler handler;
    private volatile boolean closed;

    @Override
    public void setFrameHandler(FrameHandler handler) {
      this.handler = handler;
    }

    @Override
    public boolean connect(String target) {
      return true;
    }

    @Override
    public boolean refreshSession() {
      return false;
    }

    @Override
    public void close() {
      closed = true;
    }

    void deliver(String payload) {
      handler.onFrame(TransportFrame.received(payload, 0L));
    }
  }
}
