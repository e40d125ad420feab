package io.draftops.draftline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.draftops.draftline.application.resilience.ReconnectPolicy;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class EngineConfigTest {

  @Test
  void defaultsDescribeTwelveTeamSixteenRoundDraft() {
    EngineConfig config = EngineConfig.defaults();

    assertEquals(12, config.session().teamCount());
    assertEquals(16, config.rounds());
    assertEquals(List.of(), config.draftOrder());
    assertEquals(100, config.snapshotCapacity());
    assertEquals(1024, config.pipelineSettings().queueCapacity());
    assertEquals(25, config.resolutionSettings().batchSize());
  }

  @Test
  void reconnectPolicyMirrorsBackoffList() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        EngineConfig.BACKOFF_SECONDS, "0, 3",
        EngineConfig.MAX_ATTEMPTS, "4",
        EngineConfig.HEARTBEAT_TIMEOUT, "9000"));

    ReconnectPolicy policy = config.reconnectPolicy();

    assertEquals(4, policy.maxAttempts());
    assertEquals(List.of(Duration.ZERO, Duration.ofSeconds(3)), policy.backoff());
    assertEquals(Duration.ofSeconds(9), policy.heartbeatTimeout());
    assertEquals(Duration.ofSeconds(3), policy.delayBeforeAttempt(5));
  }

  @Test
  void draftOrderIsParsedFromCsv() {
    EngineConfig config = EngineConfig.fromMap(Map.of(
        EngineConfig.TEAM_COUNT, "3", EngineConfig.DRAFT_ORDER, "b, a ,c"));

    assertEquals(List.of("b", "a", "c"), config.draftOrder());
  }

  @Test
  void rejectsInvalidValues() {
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.TEAM_COUNT, "33")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.ROUNDS, "0")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.DRAFT_ORDER, "1,2,1")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.BACKOFF_SECONDS, " , ")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.TEAM_ID, "tëam")));
    assertThrows(IllegalArgumentException.class,
        () -> EngineConfig.fromMap(Map.of(EngineConfig.WRITER_QUEUE_CAPACITY, "lots")));
  }

  @Test
  void nullValuesFallBackToDefaults() {
    Map<String, String> values = new HashMap<>();
    values.put(EngineConfig.ROUNDS, null);

    assertEquals(16, EngineConfig.fromMap(values).rounds());
  }
}
