package io.draftops.draftline.infrastructure.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.draftops.draftline.application.pipeline.ProcessingStats;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.protocol.DraftEventType;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Renders a {@link DraftSnapshot} and processor statistics as a JSON document for downstream consumers.
 * <p>Uses the Jackson streaming generator; field order is stable.</p>
 *
 * @since 0.1.0
 */
public final class DraftStateJsonWriter {
  static final int SCHEMA_VERSION = 1;

  private final JsonFactory jsonFactory = new JsonFactory();
  private final Function<String, String> displayNames;

  /**
   * @param displayNames player id to display name; used for roster entries
   */
  public DraftStateJsonWriter(Function<String, String> displayNames) {
    this.displayNames = Objects.requireNonNull(displayNames, "displayNames");
  }

  /**
   * Renders the document into a string.
   *
   * @param snapshot draft state
   * @param stats processor counters
   * @param pretty whether to indent the output
   * @return JSON text
   */
  public String write(DraftSnapshot snapshot, ProcessingStats stats, boolean pretty) {
    StringWriter out = new StringWriter();
    try {
      write(snapshot, stats, pretty, out);
    } catch (IOException ex) {
      throw new IllegalStateException("Writing JSON to memory failed", ex);
    }
    return out.toString();
  }

  /**
   * Streams the document to {@code out}. The writer is flushed but not closed.
   *
   * @param snapshot draft state
   * @param stats processor counters
   * @param pretty whether to indent the output
   * @param out destination
   * @throws IOException when the destination fails
   */
  public void write(DraftSnapshot snapshot, ProcessingStats stats, boolean pretty, Writer out) throws IOException {
    Objects.requireNonNull(snapshot, "snapshot");
    Objects.requireNonNull(stats, "stats");
    try (JsonGenerator gen = jsonFactory.createGenerator(out)) {
      gen.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
      if (pretty) {
        gen.useDefaultPrettyPrinter();
      }
      gen.writeStartObject();
      gen.writeNumberField("schemaVersion", SCHEMA_VERSION);
      gen.writeNumberField("capturedAt", snapshot.capturedAtMillis());
      gen.writeStringField("status", snapshot.status().name());
      gen.writeNumberField("currentPick", snapshot.currentPick());
      gen.writeNumberField("completedPicks", snapshot.completedPicks());
      gen.writeNumberField("picksUntilNext", snapshot.picksUntilNext());
      gen.writeNumberField("timeRemainingSeconds", snapshot.timeRemainingSeconds());
      if (snapshot.onTheClock() != null) {
        gen.writeStringField("onTheClock", snapshot.onTheClock());
      } else {
        gen.writeNullField("onTheClock");
      }
      writeStringArray(gen, "draftOrder", snapshot.draftOrder());
      gen.writeStringField("myTeamId", snapshot.myTeamId());
      gen.writeFieldName("myRoster");
      writeRoster(gen, snapshot.myRoster());
      gen.writeObjectFieldStart("otherRosters");
      for (Map.Entry<String, Map<RosterPosition, List<String>>> entry : snapshot.otherRosters().entrySet()) {
        gen.writeFieldName(entry.getKey());
        writeRoster(gen, entry.getValue());
      }
      gen.writeEndObject();
      gen.writeNumberField("availableCount", snapshot.availablePlayers().size());
      writePicks(gen, snapshot.pickHistory());
      writeStats(gen, stats);
      gen.writeEndObject();
    }
    out.flush();
  }

  private void writeRoster(JsonGenerator gen, Map<RosterPosition, List<String>> roster) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<RosterPosition, List<String>> bucket : roster.entrySet()) {
      gen.writeArrayFieldStart(bucket.getKey().name());
      for (String playerId : bucket.getValue()) {
        gen.writeStartObject();
        gen.writeStringField("id", playerId);
        gen.writeStringField("name", displayNames.apply(playerId));
        gen.writeEndObject();
      }
      gen.writeEndArray();
    }
    gen.writeEndObject();
  }

  private void writePicks(JsonGenerator gen, List<Pick> picks) throws IOException {
    gen.writeArrayFieldStart("picks");
    for (Pick pick : picks) {
      gen.writeStartObject();
      gen.writeNumberField("pick", pick.pickNumber());
      gen.writeStringField("playerId", pick.playerId());
      gen.writeStringField("teamId", pick.teamId());
      gen.writeStringField("position", pick.position().name());
      gen.writeNumberField("timestamp", pick.timestampMillis());
      gen.writeEndObject();
    }
    gen.writeEndArray();
  }

  private static void writeStats(JsonGenerator gen, ProcessingStats stats) throws IOException {
    gen.writeObjectFieldStart("processing");
    gen.writeNumberField("totalMessages", stats.totalMessages());
    gen.writeNumberField("parseErrors", stats.parseErrors());
    gen.writeNumberField("stateErrors", stats.stateErrors());
    gen.writeNumberField("successRate", stats.successRate());
    gen.writeObjectFieldStart("byType");
    for (DraftEventType type : DraftEventType.values()) {
      long count = stats.count(type);
      if (count > 0) {
        gen.writeNumberField(type.name(), count);
      }
    }
    gen.writeEndObject();
    gen.writeEndObject();
  }

  private static void writeStringArray(JsonGenerator gen, String field, List<String> values) throws IOException {
    gen.writeArrayFieldStart(field);
    for (String value : values) {
      gen.writeString(value);
    }
    gen.writeEndArray();
  }
}
