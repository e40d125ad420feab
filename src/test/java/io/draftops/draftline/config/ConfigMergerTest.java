package io.draftops.draftline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class ConfigMergerTest {

  @Test
  void cliOverridesYamlAndEmitsWarning() {
    Map<String, String> defaults = Map.of("teamCount", "12", "rounds", "16");
    Map<String, String> yaml = Map.of("teamCount", "10", "leagueId", "L7");
    Map<String, String> cli = Map.of("teamCount", "8");
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged =
        ConfigMerger.buildEffectiveConfig(Optional.of(yaml), cli, defaults, warnings::add);

    assertEquals("8", merged.get("teamCount"));
    assertEquals("L7", merged.get("leagueId"));
    assertEquals("16", merged.get("rounds"));
    assertEquals(List.of("CLI overrides YAML for key: teamCount"), warnings);
  }

  @Test
  void cliKeysAbsentFromYamlDoNotWarn() {
    List<String> warnings = new ArrayList<>();

    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of("rounds", "3"), EngineConfig.defaultValues(), warnings::add);

    assertEquals("3", merged.get("rounds"));
    assertTrue(warnings.isEmpty());
  }

  @Test
  void heartbeatIntervalMustNotExceedTimeout() {
    Map<String, String> cli = Map.of(
        EngineConfig.HEARTBEAT_INTERVAL, "60000",
        EngineConfig.HEARTBEAT_TIMEOUT, "30000");

    assertThrows(IllegalArgumentException.class, () -> ConfigMerger.buildEffectiveConfig(
        Optional.empty(), cli, EngineConfig.defaultValues(), msg -> {}));
  }

  @Test
  void nonNumericHeartbeatIsLeftToEngineConfig() {
    Map<String, String> merged = ConfigMerger.buildEffectiveConfig(
        Optional.empty(), Map.of(EngineConfig.HEARTBEAT_INTERVAL, "soon"), EngineConfig.defaultValues(), null);

    assertThrows(IllegalArgumentException.class, () -> EngineConfig.fromMap(merged));
  }
}
