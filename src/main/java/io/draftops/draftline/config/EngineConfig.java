package io.draftops.draftline.config;

import io.draftops.draftline.application.pipeline.DraftPipeline;
import io.draftops.draftline.application.resilience.ReconnectPolicy;
import io.draftops.draftline.application.resolution.PlayerResolutionService;
import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.validation.Numbers;
import io.draftops.draftline.validation.Strings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Engine configuration covering the draft shape, writer tuning, reconnection and player resolution.
 *
 * @param leagueId vendor league identifier
 * @param teamId tracked team
 * @param teamCount teams in the draft
 * @param rounds rounds in the draft
 * @param draftOrder round-one team order; empty until supplied
 * @param snapshotCapacity snapshots retained for rollback
 * @param validateEveryPicks picks between consistency checks
 * @param writerQueueCapacity bounded writer queue size
 * @param heartbeatIntervalMillis period of the heartbeat check
 * @param heartbeatTimeoutMillis silence tolerated before reconnecting
 * @param maxReconnectAttempts reconnect attempts before giving up
 * @param backoffSeconds waits before reconnect attempts 2, 3, ...
 * @param resolutionBatchSize player ids resolved per directory call
 * @param resolutionPollMillis resolver queue poll interval
 * @since 0.1.0
 */
public record EngineConfig(
    String leagueId,
    String teamId,
    int teamCount,
    int rounds,
    List<String> draftOrder,
    int snapshotCapacity,
    int validateEveryPicks,
    int writerQueueCapacity,
    int heartbeatIntervalMillis,
    int heartbeatTimeoutMillis,
    int maxReconnectAttempts,
    List<Integer> backoffSeconds,
    int resolutionBatchSize,
    int resolutionPollMillis) {

  public static final String LEAGUE_ID = "leagueId";
  public static final String TEAM_ID = "teamId";
  public static final String TEAM_COUNT = "teamCount";
  public static final String ROUNDS = "rounds";
  public static final String DRAFT_ORDER = "draftOrder";
  public static final String SNAPSHOT_CAPACITY = "snapshotCapacity";
  public static final String VALIDATE_EVERY_PICKS = "validateEveryPicks";
  public static final String WRITER_QUEUE_CAPACITY = "writerQueueCapacity";
  public static final String HEARTBEAT_INTERVAL = "resilience.heartbeatIntervalMillis";
  public static final String HEARTBEAT_TIMEOUT = "resilience.heartbeatTimeoutMillis";
  public static final String MAX_ATTEMPTS = "resilience.maxAttempts";
  public static final String BACKOFF_SECONDS = "resilience.backoffSeconds";
  public static final String RESOLUTION_BATCH_SIZE = "resolution.batchSize";
  public static final String RESOLUTION_POLL_MILLIS = "resolution.pollMillis";

  private static final int MAX_TEAMS = 32;
  private static final int MAX_ROUNDS = 64;
  private static final int MAX_SNAPSHOTS = 10_000;
  private static final int MAX_QUEUE_CAPACITY = 65_536;
  private static final int MAX_HEARTBEAT_MILLIS = 600_000;
  private static final int MAX_ATTEMPTS_LIMIT = 100;
  private static final int MAX_BACKOFF_SECONDS = 3_600;
  private static final int MAX_BATCH_SIZE = 1_000;
  private static final int MAX_POLL_MILLIS = 60_000;
  private static final int MAX_ID_LENGTH = 128;

  /**
   * Validates every field.
   *
   * @throws IllegalArgumentException when a value is missing or out of range
   */
  public EngineConfig {
    leagueId = Strings.requirePrintableAscii(LEAGUE_ID, leagueId, MAX_ID_LENGTH);
    teamId = Strings.requirePrintableAscii(TEAM_ID, teamId, MAX_ID_LENGTH);
    Numbers.requireRange(TEAM_COUNT, teamCount, 1, MAX_TEAMS);
    Numbers.requireRange(ROUNDS, rounds, 1, MAX_ROUNDS);
    draftOrder = List.copyOf(Objects.requireNonNull(draftOrder, DRAFT_ORDER));
    if (draftOrder.size() != draftOrder.stream().distinct().count()) {
      throw new IllegalArgumentException(DRAFT_ORDER + " must not repeat a team (was " + draftOrder + ")");
    }
    Numbers.requireRange(SNAPSHOT_CAPACITY, snapshotCapacity, 1, MAX_SNAPSHOTS);
    Numbers.requireRange(VALIDATE_EVERY_PICKS, validateEveryPicks, 1, MAX_TEAMS * MAX_ROUNDS);
    Numbers.requireRange(WRITER_QUEUE_CAPACITY, writerQueueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange(HEARTBEAT_INTERVAL, heartbeatIntervalMillis, 1, MAX_HEARTBEAT_MILLIS);
    Numbers.requireRange(HEARTBEAT_TIMEOUT, heartbeatTimeoutMillis, 1, MAX_HEARTBEAT_MILLIS);
    Numbers.requireRange(MAX_ATTEMPTS, maxReconnectAttempts, 1, MAX_ATTEMPTS_LIMIT);
    backoffSeconds = List.copyOf(Objects.requireNonNull(backoffSeconds, BACKOFF_SECONDS));
    if (backoffSeconds.isEmpty()) {
      throw new IllegalArgumentException(BACKOFF_SECONDS + " must not be empty");
    }
    for (int seconds : backoffSeconds) {
      Numbers.requireRange(BACKOFF_SECONDS, seconds, 0, MAX_BACKOFF_SECONDS);
    }
    Numbers.requireRange(RESOLUTION_BATCH_SIZE, resolutionBatchSize, 1, MAX_BATCH_SIZE);
    Numbers.requireRange(RESOLUTION_POLL_MILLIS, resolutionPollMillis, 1, MAX_POLL_MILLIS);
  }

  /**
   * @return 12 teams, 16 rounds, tracked team {@code 1}, and the engine's default tuning
   */
  public static EngineConfig defaults() {
    return fromMap(defaultValues());
  }

  /**
   * Returns the defaults as flat configuration keys, the lowest layer for {@link ConfigMerger}.
   *
   * @return ordered map of default values
   */
  public static Map<String, String> defaultValues() {
    Map<String, String> values = new LinkedHashMap<>();
    values.put(LEAGUE_ID, "local");
    values.put(TEAM_ID, "1");
    values.put(TEAM_COUNT, "12");
    values.put(ROUNDS, "16");
    values.put(DRAFT_ORDER, "");
    values.put(SNAPSHOT_CAPACITY, "100");
    values.put(VALIDATE_EVERY_PICKS, "1");
    values.put(WRITER_QUEUE_CAPACITY, "1024");
    values.put(HEARTBEAT_INTERVAL, "5000");
    values.put(HEARTBEAT_TIMEOUT, "30000");
    values.put(MAX_ATTEMPTS, "5");
    values.put(BACKOFF_SECONDS, "1,2,4,8,16");
    values.put(RESOLUTION_BATCH_SIZE, "25");
    values.put(RESOLUTION_POLL_MILLIS, "100");
    return values;
  }

  /**
   * Builds a configuration from flat keys, falling back to {@link #defaultValues()} for missing ones.
   *
   * @param values flat key/value configuration
   * @return validated configuration
   * @throws IllegalArgumentException when a value cannot be parsed or is out of range
   */
  public static EngineConfig fromMap(Map<String, String> values) {
    Map<String, String> merged = new LinkedHashMap<>(defaultValues());
    if (values != null) {
      values.forEach((key, value) -> {
        if (key != null && value != null) {
          merged.put(key, value);
        }
      });
    }
    return new EngineConfig(
        merged.get(LEAGUE_ID),
        merged.get(TEAM_ID),
        Numbers.parseIntInRange(TEAM_COUNT, merged.get(TEAM_COUNT), 1, MAX_TEAMS),
        Numbers.parseIntInRange(ROUNDS, merged.get(ROUNDS), 1, MAX_ROUNDS),
        Strings.splitCsv(DRAFT_ORDER, merged.get(DRAFT_ORDER)),
        Numbers.parseIntInRange(SNAPSHOT_CAPACITY, merged.get(SNAPSHOT_CAPACITY), 1, MAX_SNAPSHOTS),
        Numbers.parseIntInRange(VALIDATE_EVERY_PICKS, merged.get(VALIDATE_EVERY_PICKS), 1, MAX_TEAMS * MAX_ROUNDS),
        Numbers.parseIntInRange(WRITER_QUEUE_CAPACITY, merged.get(WRITER_QUEUE_CAPACITY), 1, MAX_QUEUE_CAPACITY),
        Numbers.parseIntInRange(HEARTBEAT_INTERVAL, merged.get(HEARTBEAT_INTERVAL), 1, MAX_HEARTBEAT_MILLIS),
        Numbers.parseIntInRange(HEARTBEAT_TIMEOUT, merged.get(HEARTBEAT_TIMEOUT), 1, MAX_HEARTBEAT_MILLIS),
        Numbers.parseIntInRange(MAX_ATTEMPTS, merged.get(MAX_ATTEMPTS), 1, MAX_ATTEMPTS_LIMIT),
        parseBackoff(merged.get(BACKOFF_SECONDS)),
        Numbers.parseIntInRange(RESOLUTION_BATCH_SIZE, merged.get(RESOLUTION_BATCH_SIZE), 1, MAX_BATCH_SIZE),
        Numbers.parseIntInRange(RESOLUTION_POLL_MILLIS, merged.get(RESOLUTION_POLL_MILLIS), 1, MAX_POLL_MILLIS));
  }

  public DraftSession session() {
    return new DraftSession(leagueId, teamId, teamCount, rounds);
  }

  public ReconnectPolicy reconnectPolicy() {
    List<Duration> backoff = new ArrayList<>(backoffSeconds.size());
    for (int seconds : backoffSeconds) {
      backoff.add(Duration.ofSeconds(seconds));
    }
    return new ReconnectPolicy(
        maxReconnectAttempts,
        backoff,
        Duration.ofMillis(heartbeatIntervalMillis),
        Duration.ofMillis(heartbeatTimeoutMillis));
  }

  public DraftPipeline.Settings pipelineSettings() {
    return new DraftPipeline.Settings(writerQueueCapacity, validateEveryPicks);
  }

  public PlayerResolutionService.Settings resolutionSettings() {
    return new PlayerResolutionService.Settings(resolutionBatchSize, resolutionPollMillis);
  }

  private static List<Integer> parseBackoff(String raw) {
    List<Integer> seconds = new ArrayList<>();
    for (String item : Strings.splitCsv(BACKOFF_SECONDS, raw)) {
      seconds.add(Numbers.parseIntInRange(BACKOFF_SECONDS, item, 0, MAX_BACKOFF_SECONDS));
    }
    return seconds;
  }
}
