package io.draftops.draftline.infrastructure.directory;

import io.draftops.draftline.application.port.PlayerDirectory;
import io.draftops.draftline.application.resolution.ResolvedPlayer;
import io.draftops.draftline.domain.draft.RosterPosition;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link PlayerDirectory} backed by an in-memory map, optionally loaded from a CSV file of
 * {@code id,name,position} rows.
 *
 * @since 0.1.0
 */
public final class InMemoryPlayerDirectory implements PlayerDirectory {
  private static final Logger log = LoggerFactory.getLogger(InMemoryPlayerDirectory.class);

  private final Map<String, ResolvedPlayer> players = new ConcurrentHashMap<>();

  public InMemoryPlayerDirectory() {}

  public InMemoryPlayerDirectory(Map<String, ResolvedPlayer> players) {
    this.players.putAll(Objects.requireNonNull(players, "players"));
  }

  /**
   * Loads a directory from CSV. Blank lines, lines starting with {@code #} and a leading {@code id,...} header
   * are skipped; rows with fewer than two columns are ignored with a warning.
   *
   * @param csv file path
   * @return populated directory
   * @throws IOException when the file cannot be read
   */
  public static InMemoryPlayerDirectory fromCsv(Path csv) throws IOException {
    InMemoryPlayerDirectory directory = new InMemoryPlayerDirectory();
    int lineNumber = 0;
    try (BufferedReader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        String trimmed = line.trim();
        if (trimmed.isEmpty() || trimmed.startsWith("#")) {
          continue;
        }
        String[] columns = trimmed.split(",", -1);
        if (lineNumber == 1 && "id".equalsIgnoreCase(columns[0].trim())) {
          continue;
        }
        if (columns.length < 2 || columns[0].isBlank()) {
          log.warn("Skipping malformed player row {} in {}", lineNumber, csv);
          continue;
        }
        RosterPosition position = columns.length > 2 ? RosterPosition.fromLabel(columns[2]) : RosterPosition.BENCH;
        directory.put(columns[0].trim(), new ResolvedPlayer(columns[1].trim(), position));
      }
    }
    log.info("Loaded {} players from {}", directory.size(), csv);
    return directory;
  }

  public void put(String playerId, ResolvedPlayer player) {
    players.put(Objects.requireNonNull(playerId, "playerId"), Objects.requireNonNull(player, "player"));
  }

  public int size() {
    return players.size();
  }

  @Override
  public Map<String, ResolvedPlayer> resolveAll(Collection<String> playerIds) {
    Map<String, ResolvedPlayer> found = new LinkedHashMap<>();
    for (String id : playerIds) {
      ResolvedPlayer player = players.get(id);
      if (player != null) {
        found.put(id, player);
      }
    }
    return found;
  }
}
