package io.draftops.draftline.api;

import io.draftops.draftline.application.DraftEngine;
import io.draftops.draftline.application.pipeline.ProcessingStats;
import io.draftops.draftline.application.port.PlayerDirectory;
import io.draftops.draftline.config.CompositionRoot;
import io.draftops.draftline.config.ConfigMerger;
import io.draftops.draftline.config.EngineConfig;
import io.draftops.draftline.config.YamlConfigLoader;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.draft.ValidationResult;
import io.draftops.draftline.infrastructure.directory.InMemoryPlayerDirectory;
import io.draftops.draftline.infrastructure.json.DraftStateJsonWriter;
import io.draftops.draftline.infrastructure.transport.CaptureReplayTransport;
import io.draftops.draftline.logging.LoggingConfigurator;
import io.draftops.draftline.validation.Numbers;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Replays a recorded draft capture through the full engine and reports the resulting state.
 *
 * @since 0.1.0
 */
public final class ReplayCli {
  private static final Logger log = LoggerFactory.getLogger(ReplayCli.class);
  private static final String SUMMARY_USAGE =
      "usage: replay capture=<file> [teamId=ID] [leagueId=ID] [teamCount=1-32] [rounds=1-64] "
          + "[draftOrder=a,b,...] [pool=<file>] [players=<csv>] [config=<yaml>] [profile=NAME] "
          + "[frameDelayMillis=0-10000] [timeoutSeconds=1-3600] [--json] [--verbose]";
  private static final String HELP_TEXT = """
      DRAFTLINE capture replay

      Usage:
        replay capture=<file> [options]

      Required:
        capture=PATH              Capture file (RECV<TAB>frame, SENT<TAB>frame or bare frames)

      Optional:
        teamId=ID                 Tracked team (default 1)
        leagueId=ID               League identifier (default local)
        teamCount=1-32            Teams in the draft (default 12)
        rounds=1-64               Rounds in the draft (default 16)
        draftOrder=a,b,...        Round-one team order; enables picks-until-next
        pool=PATH                 Player pool, one id per line in ranking order
        players=PATH              Player directory CSV (id,name,position)
        config=PATH               YAML configuration (common section plus profile section)
        profile=NAME              YAML profile section (default replay)
        frameDelayMillis=0-10000  Pause between replayed frames (default 0)
        timeoutSeconds=1-3600     Maximum replay time (default 60)
        metricsExporter=otlp|none Metrics exporter (default otlp)
        otelEndpoint=URL          OTLP metrics endpoint when exporter=otlp
        --json                    Print the final state as JSON
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private static final String DEFAULT_PROFILE = "replay";

  private ReplayCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs a replay and returns the exit code without terminating the JVM.
   *
   * @param args raw CLI arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for replay CLI");
    }

    Map<String, String> kv;
    String capture;
    String pool;
    String players;
    String configPath;
    String profile;
    int frameDelayMillis;
    int timeoutSeconds;
    try {
      kv = CliArgsParser.toMap(input.arguments());
      TelemetryConfigurator.configureMetrics(kv);
      capture = kv.remove("capture");
      if (capture == null) {
        throw new IllegalArgumentException("capture is required");
      }
      pool = kv.remove("pool");
      players = kv.remove("players");
      configPath = kv.remove("config");
      profile = Optional.ofNullable(kv.remove("profile")).orElse(DEFAULT_PROFILE);
      frameDelayMillis = Numbers.parseIntInRange(
          "frameDelayMillis", Optional.ofNullable(kv.remove("frameDelayMillis")).orElse("0"), 0, 10_000);
      timeoutSeconds = Numbers.parseIntInRange(
          "timeoutSeconds", Optional.ofNullable(kv.remove("timeoutSeconds")).orElse("60"), 1, 3_600);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      try {
        yaml = YamlConfigLoader.load(Path.of(configPath), profile);
      } catch (IOException ex) {
        log.error("Unable to read config {}", configPath, ex);
        return ExitCode.IO_ERROR;
      } catch (IllegalArgumentException ex) {
        log.error("Invalid config {}: {}", configPath, ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      }
      if (yaml.isEmpty()) {
        log.error("Config file {} does not exist", configPath);
        return ExitCode.CONFIG_ERROR;
      }
    }

    EngineConfig config;
    try {
      Map<String, String> effective =
          ConfigMerger.buildEffectiveConfig(yaml, kv, EngineConfig.defaultValues(), log::warn);
      config = EngineConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid engine configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    PlayerDirectory directory;
    List<String> poolIds;
    try {
      directory = players == null ? new InMemoryPlayerDirectory() : InMemoryPlayerDirectory.fromCsv(Path.of(players));
      poolIds = pool == null ? List.of() : readPool(Path.of(pool));
    } catch (IOException ex) {
      log.error("Unable to read player inputs", ex);
      return ExitCode.IO_ERROR;
    }

    try (CompositionRoot root = new CompositionRoot(config)) {
      return replay(root, directory, poolIds, capture, Duration.ofMillis(frameDelayMillis),
          Duration.ofSeconds(timeoutSeconds), input.hasFlag("--json"));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Replay interrupted", ex);
      return ExitCode.INTERRUPTED;
    } catch (IllegalArgumentException | IllegalStateException ex) {
      log.error("Replay configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception during replay", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode replay(
      CompositionRoot root,
      PlayerDirectory directory,
      List<String> poolIds,
      String capture,
      Duration frameDelay,
      Duration timeout,
      boolean json) throws InterruptedException {
    if (!Files.isReadable(Path.of(capture))) {
      log.error("Capture file {} is not readable", capture);
      return ExitCode.IO_ERROR;
    }
    CaptureReplayTransport transport = root.replayTransport(frameDelay);
    try (DraftEngine engine = root.draftEngine(transport, directory)) {
      if (!poolIds.isEmpty()) {
        engine.initializePlayerPool(poolIds);
      }
      log.info("Replaying {} for team {} in league {}", capture, root.config().teamId(), root.config().leagueId());
      if (!engine.start(capture)) {
        log.error("Unable to open capture {}", capture);
        return ExitCode.IO_ERROR;
      }
      boolean exhausted = transport.awaitExhausted(timeout);
      boolean idle = engine.awaitIdle(timeout);
      if (!exhausted || !idle) {
        log.error("Replay did not finish within {} s (exhausted={}, idle={})", timeout.toSeconds(), exhausted, idle);
        return ExitCode.RUNTIME_FAILURE;
      }

      DraftSnapshot snapshot = engine.view();
      ProcessingStats stats = engine.stats();
      ValidationResult validation = engine.validate();
      CliPrinter.printLines(summary(engine, snapshot, stats, validation));
      if (json) {
        CliPrinter.println(new DraftStateJsonWriter(engine::displayName).write(snapshot, stats, true));
      }
      if (engine.failure().isPresent()) {
        log.error("Draft writer failed", engine.failure().get());
        return ExitCode.RUNTIME_FAILURE;
      }
      return validation.valid() ? ExitCode.SUCCESS : ExitCode.RUNTIME_FAILURE;
    }
  }

  static List<String> summary(
      DraftEngine engine, DraftSnapshot snapshot, ProcessingStats stats, ValidationResult validation) {
    List<String> lines = new ArrayList<>();
    lines.add("Replay summary");
    lines.add(" Status           : " + snapshot.status());
    lines.add(" Current pick     : " + snapshot.currentPick());
    lines.add(" Completed picks  : " + snapshot.completedPicks());
    lines.add(" On the clock     : " + snapshot.onTheClockTeam().orElse("<none>"));
    lines.add(" Picks until next : " + snapshot.picksUntilNext());
    lines.add(" Available players: " + snapshot.availablePlayers().size());
    lines.add(" Connection       : " + engine.connectionState());
    lines.add(String.format(" Frames           : %d (parse errors %d, state errors %d, success %.1f%%)",
        stats.totalMessages(), stats.parseErrors(), stats.stateErrors(), stats.successRate() * 100.0));
    lines.add(" My roster (team " + snapshot.myTeamId() + ")");
    for (RosterPosition position : RosterPosition.values()) {
      List<String> ids = snapshot.myRoster().getOrDefault(position, List.of());
      if (!ids.isEmpty()) {
        List<String> names = new ArrayList<>(ids.size());
        for (String id : ids) {
          names.add(engine.displayName(id));
        }
        lines.add("   " + position + ": " + String.join(", ", names));
      }
    }
    lines.add(" Validation       : " + (validation.valid() ? "valid" : "INVALID"));
    validation.errors().forEach(error -> lines.add("   error: " + error));
    validation.warnings().forEach(warning -> lines.add("   warning: " + warning));
    validation.suggestions().forEach(suggestion -> lines.add("   suggestion: " + suggestion));
    return lines;
  }

  static List<String> readPool(Path path) throws IOException {
    List<String> ids = new ArrayList<>();
    for (String line : Files.readAllLines(path, StandardCharsets.UTF_8)) {
      String trimmed = line.strip();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      int comma = trimmed.indexOf(',');
      String id = (comma >= 0 ? trimmed.substring(0, comma) : trimmed).strip();
      if (!id.isEmpty()) {
        ids.add(id);
      }
    }
    return ids;
  }
}
