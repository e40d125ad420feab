package io.draftops.draftline.infrastructure.json;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.draftops.draftline.application.pipeline.ProcessingStats;
import io.draftops.draftline.application.state.DraftStateStore;
import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.domain.protocol.DraftEventType;
import io.draftops.draftline.support.ManualClock;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DraftStateJsonWriterTest {
  private final DraftStateJsonWriter writer = new DraftStateJsonWriter(id -> "Name " + id);

  private DraftStateStore store() {
    DraftStateStore store = new DraftStateStore(new DraftSession("L1", "1", 2, 2), new ManualClock(42L));
    store.initializePlayerPool(List.of("P1", "P2", "P3"));
    store.setDraftOrder(List.of("1", "2"));
    store.startNewPick(1, "1", 30.0);
    store.applyPick("P1", "1", 1, RosterPosition.QB);
    store.startNewPick(2, "2", 30.0);
    return store;
  }

  @Test
  void writesCompactDocument() {
    ProcessingStats stats = new ProcessingStats(3, Map.of(DraftEventType.SELECTED, 1L), 1, 0);

    String json = writer.write(store().view(), stats, false);

    assertTrue(json.startsWith("{\"schemaVersion\":1,\"capturedAt\":42,\"status\":\"IN_PROGRESS\""));
    assertTrue(json.contains("\"onTheClock\":\"2\""));
    assertTrue(json.contains("\"draftOrder\":[\"1\",\"2\"]"));
    assertTrue(json.contains("\"QB\":[{\"id\":\"P1\",\"name\":\"Name P1\"}]"));
    assertTrue(json.contains("\"byType\":{\"SELECTED\":1}"));
    assertTrue(json.contains("\"availableCount\":2"));
  }

  @Test
  void documentParsesBack() throws IOException {
    String json = writer.write(store().view(), new ProcessingStats(0, Map.of(), 0, 0), true);

    Map<String, String> scalars = new HashMap<>();
    int picks = 0;
    try (JsonParser parser = new JsonFactory().createParser(json)) {
      assertEquals(JsonToken.START_OBJECT, parser.nextToken());
      while (parser.nextToken() != JsonToken.END_OBJECT) {
        String field = parser.getCurrentName();
        JsonToken value = parser.nextToken();
        if ("picks".equals(field)) {
          while (parser.nextToken() != JsonToken.END_ARRAY) {
            picks++;
            parser.skipChildren();
          }
        } else if (value.isStructStart()) {
          parser.skipChildren();
        } else {
          scalars.put(field, parser.getValueAsString());
        }
      }
    }

    assertEquals("2", scalars.get("currentPick"));
    assertEquals("1", scalars.get("completedPicks"));
    assertEquals("1", scalars.get("myTeamId"));
    assertEquals(1, picks);
  }

  @Test
  void nullClockIsWrittenAsNull() {
    DraftStateStore store = new DraftStateStore(new DraftSession("L1", "1", 2, 2), new ManualClock(0L));

    String json = writer.write(store.view(), new ProcessingStats(0, Map.of(), 0, 0), false);

    assertTrue(json.contains("\"onTheClock\":null"));
    assertTrue(json.contains("\"status\":\"WAITING\""));
  }
}
