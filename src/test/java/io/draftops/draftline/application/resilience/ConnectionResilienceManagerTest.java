package io.draftops.draftline.application.resilience;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.draftops.draftline.application.port.DraftTransport;
import io.draftops.draftline.application.port.FrameHandler;
import io.draftops.draftline.application.port.ResilienceListener;
import io.draftops.draftline.domain.net.TransportFrame;
import io.draftops.draftline.support.ManualClock;
import io.draftops.draftline.support.RecordingMetrics;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ConnectionResilienceManagerTest {
  private static final ReconnectPolicy POLICY = new ReconnectPolicy(
      5,
      List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4), Duration.ofSeconds(8),
          Duration.ofSeconds(16)),
      Duration.ofHours(1),
      Duration.ofSeconds(30));

  private final ManualClock clock = new ManualClock(100_000L);
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final FakeTransport transport = new FakeTransport();
  private final RecordingSleeper sleeper = new RecordingSleeper();
  private final List<TransportFrame> delivered = new CopyOnWriteArrayList<>();
  private final AtomicInteger currentPick = new AtomicInteger();
  private final RecordingListener listener = new RecordingListener();
  private ConnectionResilienceManager manager;

  @AfterEach
  void tearDown() {
    if (manager != null) {
      manager.shutdown();
    }
  }

  private ConnectionResilienceManager newManager() {
    manager = new ConnectionResilienceManager(
        transport, delivered::add, POLICY, clock, metrics, currentPick::get, sleeper);
    manager.addListener(listener);
    return manager;
  }

  @Test
  void connectsAndForwardsInboundFrames() {
    ConnectionResilienceManager manager = newManager();

    assertTrue(manager.connect("wss://draft"));
    assertEquals(ConnectionState.CONNECTED, manager.state());

    transport.handler.onFrame(TransportFrame.received("PING", 0L));
    transport.handler.onFrame(TransportFrame.sent("PONG", 0L));

    assertEquals(1, delivered.size());
    assertEquals(1L, manager.messageCount());
    assertEquals(List.of(ConnectionState.CONNECTING, ConnectionState.CONNECTED), listener.states);
  }

  @Test
  void failedInitialConnectLeavesDisconnected() {
    transport.connectResults.add(false);
    ConnectionResilienceManager manager = newManager();

    assertFalse(manager.connect("wss://draft"));

    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1L, metrics.counter("resilience.connect.failed"));
  }

  @Test
  void reconnectsWithImmediateFirstAttemptThenBackoff() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");
    transport.connectResults.add(false);
    transport.connectResults.add(false);
    transport.connectResults.add(true);
    currentPick.set(3);
    transport.onConnect = () -> currentPick.set(7);

    assertTrue(manager.handleDisconnection("socket reset"));

    assertTrue(listener.reconnected.await(5, TimeUnit.SECONDS));
    assertEquals(ConnectionState.CONNECTED, manager.state());
    assertEquals(List.of(0L, 1_000L, 2_000L), listener.attemptDelays);
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2)), sleeper.sleeps);
    ResyncReport report = listener.reports.get(0);
    assertEquals(3, report.pickBefore());
    assertEquals(7, report.pickAfter());
    assertEquals(4, report.missedPicks());
    assertTrue(report.missedAny());
    assertEquals(3, manager.lastDisconnect().orElseThrow().lastKnownPickNumber());
    assertEquals(0, manager.reconnectAttempts());
    assertEquals(1L, metrics.counter("resilience.reconnect.success"));
  }

  @Test
  void refreshedSessionSkipsReconnect() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");
    transport.refreshResult = true;

    manager.handleDisconnection("token expired");

    assertTrue(listener.reconnected.await(5, TimeUnit.SECONDS));
    assertEquals(1, transport.connects.get());
    assertTrue(sleeper.sleeps.isEmpty());
  }

  @Test
  void failsAfterMaxAttempts() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");
    for (int i = 0; i < 5; i++) {
      transport.connectResults.add(false);
    }

    manager.handleDisconnection("socket reset");

    assertTrue(listener.failed.await(5, TimeUnit.SECONDS));
    assertEquals(ConnectionState.FAILED, manager.state());
    assertEquals(List.of(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4),
        Duration.ofSeconds(8)), sleeper.sleeps);
    assertEquals(5, listener.failedAttempts.get());
    assertEquals(5L, metrics.counter("resilience.reconnect.attempt"));
    assertFalse(manager.handleDisconnection("again"));
  }

  @Test
  void recoveryIsSingleFlight() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");
    CountDownLatch release = new CountDownLatch(1);
    transport.refreshGate = release;
    transport.refreshResult = true;

    List<Thread> threads = new ArrayList<>();
    AtomicInteger started = new AtomicInteger();
    for (int i = 0; i < 8; i++) {
      Thread thread = new Thread(() -> {
        if (manager.handleDisconnection("concurrent")) {
          started.incrementAndGet();
        }
      });
      threads.add(thread);
      thread.start();
    }
    for (Thread thread : threads) {
      thread.join(5_000L);
    }
    assertFalse(manager.handleDisconnection("late"));
    release.countDown();

    assertTrue(listener.reconnected.await(5, TimeUnit.SECONDS));
    assertEquals(1, started.get());
    assertEquals(1L, metrics.counter("resilience.disconnect"));
    assertEquals(1, listener.disconnects.get());
  }

  @Test
  void heartbeatTimeoutTriggersRecovery() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");
    transport.refreshResult = true;

    clock.advance(20_000L);
    assertFalse(manager.checkHeartbeat());
    transport.handler.onFrame(TransportFrame.received("PING", 0L));
    clock.advance(20_000L);
    assertFalse(manager.checkHeartbeat());
    clock.advance(10_001L);

    assertTrue(manager.checkHeartbeat());
    assertTrue(listener.reconnected.await(5, TimeUnit.SECONDS));
    assertEquals(1L, metrics.counter("resilience.heartbeat.timeout"));
    assertEquals("heartbeat timeout", manager.lastDisconnect().orElseThrow().reason());
  }

  @Test
  void transportCloseStartsRecovery() throws Exception {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");

    transport.handler.onClosed("server restart");

    assertTrue(listener.reconnected.await(5, TimeUnit.SECONDS));
    assertEquals("transport closed: server restart", manager.lastDisconnect().orElseThrow().reason());
  }

  @Test
  void shutdownIsIdempotent() {
    ConnectionResilienceManager manager = newManager();
    manager.connect("wss://draft");

    manager.shutdown();
    manager.shutdown();

    assertTrue(manager.isShutdown());
    assertEquals(ConnectionState.DISCONNECTED, manager.state());
    assertEquals(1, transport.closes.get());
    assertFalse(manager.handleDisconnection("after shutdown"));
    assertThrows(IllegalStateException.class, () -> manager.connect("wss://draft"));
  }

  private static final class FakeTransport implements DraftTransport {
    final Deque<Boolean> connectResults = new ArrayDeque<>();
    final AtomicInteger connects = new AtomicInteger();
    final AtomicInteger closes = new AtomicInteger();
    volatile boolean refreshResult;
    volatile CountDownLatch refreshGate;
    volatile Runnable onConnect = () -> {};
    volatile FrameHandler handler;

    @Override
    public void setFrameHandler(FrameHandler handler) {
      this.handler = handler;
    }

    @Override
    public synchronized boolean connect(String target) {
      connects.incrementAndGet();
      Boolean result = connectResults.poll();
      boolean connected = result == null || result;
      if (connected) {
        onConnect.run();
      }
      return connected;
    }

    @Override
    public boolean refreshSession() throws InterruptedException {
      CountDownLatch gate = refreshGate;
      if (gate != null) {
        gate.await(5, TimeUnit.SECONDS);
      }
      return refreshResult;
    }

    @Override
    public void close() {
      closes.incrementAndGet();
    }
  }

  private static final class RecordingSleeper implements BackoffSleeper {
    final List<Duration> sleeps = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
      sleeps.add(duration);
    }
  }

  private static final class RecordingListener implements ResilienceListener {
    final List<ConnectionState> states = new CopyOnWriteArrayList<>();
    final List<Long> attemptDelays = new CopyOnWriteArrayList<>();
    final List<ResyncReport> reports = new CopyOnWriteArrayList<>();
    final AtomicInteger disconnects = new AtomicInteger();
    final AtomicInteger failedAttempts = new AtomicInteger();
    final CountDownLatch reconnected = new CountDownLatch(1);
    final CountDownLatch failed = new CountDownLatch(1);

    @Override
    public void onStateChanged(ConnectionState previous, ConnectionState current) {
      states.add(current);
    }

    @Override
    public void onDisconnected(DisconnectRecord record) {
      disconnects.incrementAndGet();
    }

    @Override
    public void onReconnectAttempt(int attempt, long delayMillis) {
      attemptDelays.add(delayMillis);
    }

    @Override
    public void onReconnected(ResyncReport report) {
      reports.add(report);
      reconnected.countDown();
    }

    @Override
    public void onRecoveryFailed(DisconnectRecord record, int attempts) {
      failedAttempts.set(attempts);
      failed.countDown();
    }
  }
}
