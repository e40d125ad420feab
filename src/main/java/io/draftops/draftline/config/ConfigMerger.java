package io.draftops.draftline.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and invariants.
 */
public final class ConfigMerger {
  private static final Pattern DIGITS = Pattern.compile("^[0-9]{1,9}$");

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI > YAML > defaults.
   *
   * @param yaml optional YAML-derived settings for the active profile
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when the merged values contradict each other
   */
  public static Map<String, String> buildEffectiveConfig(
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      String value = entry.getValue();
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (value != null) {
        merged.put(key, value);
      }
    }

    validate(merged);
    return Map.copyOf(merged);
  }

  private static void validate(Map<String, String> effective) {
    long heartbeatInterval = parseLong(effective.get(EngineConfig.HEARTBEAT_INTERVAL));
    long heartbeatTimeout = parseLong(effective.get(EngineConfig.HEARTBEAT_TIMEOUT));
    if (heartbeatInterval > 0 && heartbeatTimeout > 0 && heartbeatInterval > heartbeatTimeout) {
      throw new IllegalArgumentException(EngineConfig.HEARTBEAT_INTERVAL
          + " must not exceed " + EngineConfig.HEARTBEAT_TIMEOUT);
    }
  }

  private static long parseLong(String value) {
    if (value == null || !DIGITS.matcher(value.trim()).matches()) {
      return -1L;
    }
    return Long.parseLong(value.trim());
  }
}
