package io.draftops.draftline.application.resolution;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.draftops.draftline.application.port.PlayerDirectory;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.support.RecordingMetrics;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class PlayerResolutionServiceTest {
  private final RecordingMetrics metrics = new RecordingMetrics();
  private final Map<String, ResolvedPlayer> known = new ConcurrentHashMap<>(Map.of(
      "10", new ResolvedPlayer("Quarter Back", RosterPosition.QB),
      "20", new ResolvedPlayer("Wide Out", RosterPosition.WR)));
  private final List<Collection<String>> batches = new CopyOnWriteArrayList<>();

  private final PlayerDirectory directory = ids -> {
    batches.add(List.copyOf(ids));
    Map<String, ResolvedPlayer> found = new ConcurrentHashMap<>();
    for (String id : ids) {
      ResolvedPlayer player = known.get(id);
      if (player != null) {
        found.put(id, player);
      }
    }
    return found;
  };

  @Test
  void missQueuesOnceAndReturnsEmpty() {
    PlayerResolutionService service = new PlayerResolutionService(directory, metrics,
        PlayerResolutionService.Settings.defaults());

    assertEquals(Optional.empty(), service.positionFor("10"));
    assertEquals(Optional.empty(), service.positionFor("10"));
    assertFalse(service.request("10"));

    assertEquals(1, service.pendingCount());
    assertTrue(batches.isEmpty());
  }

  @Test
  void resolveBatchCachesHitsAndPlaceholdersMisses() {
    PlayerResolutionService service = new PlayerResolutionService(directory, metrics,
        PlayerResolutionService.Settings.defaults());
    Map<String, ResolvedPlayer> patched = new ConcurrentHashMap<>();
    service.setPatchCallback(patched::put);
    service.request("10");
    service.request("99");

    service.resolveBatch(List.of("10", "99"));

    assertEquals(Optional.of(RosterPosition.QB), service.positionFor("10"));
    assertEquals(Optional.of(RosterPosition.BENCH), service.positionFor("99"));
    assertEquals("Player #99", service.displayName("99"));
    assertEquals("Quarter Back", service.displayName("10"));
    assertEquals(0, service.pendingCount());
    assertEquals(2, patched.size());
    assertEquals(1L, metrics.counter("resolution.resolved"));
    assertEquals(1L, metrics.counter("resolution.miss"));
    assertFalse(service.request("99"));
  }

  @Test
  void directoryFailureFallsBackToPlaceholders() {
    PlayerDirectory failing = ids -> {
      throw new IllegalStateException("directory offline");
    };
    PlayerResolutionService service = new PlayerResolutionService(failing, metrics,
        PlayerResolutionService.Settings.defaults());

    service.resolveBatch(List.of("10"));

    assertEquals(ResolvedPlayer.placeholder("10"), service.resolved("10").orElseThrow());
    assertEquals(1L, metrics.counter("resolution.error"));
  }

  @Test
  void failingPatchCallbackDoesNotStopBatch() {
    PlayerResolutionService service = new PlayerResolutionService(directory, metrics,
        PlayerResolutionService.Settings.defaults());
    service.setPatchCallback((id, player) -> {
      throw new IllegalStateException("patch rejected");
    });

    service.resolveBatch(List.of("10", "20"));

    assertTrue(service.resolved("20").isPresent());
  }

  @Test
  void workerResolvesQueuedIdsInBatches() throws Exception {
    PlayerResolutionService service = new PlayerResolutionService(directory, metrics,
        new PlayerResolutionService.Settings(2, 10L));
    CountDownLatch done = new CountDownLatch(3);
    service.setPatchCallback((id, player) -> done.countDown());
    service.request("10");
    service.request("20");
    service.request("30");

    service.start();
    try {
      assertTrue(done.await(5, TimeUnit.SECONDS));
      assertThrows(IllegalStateException.class, service::start);
    } finally {
      service.shutdown();
    }

    assertTrue(batches.stream().allMatch(batch -> batch.size() <= 2));
    assertEquals(Optional.of(RosterPosition.WR), service.positionFor("20"));
    service.shutdown();
  }

  @Test
  void settingsClampToOne() {
    PlayerResolutionService.Settings settings = new PlayerResolutionService.Settings(0, -5L);

    assertEquals(1, settings.batchSize());
    assertEquals(1L, settings.pollMillis());
  }
}
