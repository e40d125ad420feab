package io.draftops.draftline.application.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class SnapshotRingTest {

  @Test
  void supportsNegativeIndexes() {
    SnapshotRing<String> ring = new SnapshotRing<>(4);
    ring.push("a");
    ring.push("b");
    ring.push("c");

    assertEquals(Optional.of("a"), ring.get(0));
    assertEquals(Optional.of("c"), ring.get(-1));
    assertEquals(Optional.of("a"), ring.get(-3));
    assertTrue(ring.get(3).isEmpty());
    assertTrue(ring.get(-4).isEmpty());
  }

  @Test
  void evictsOldestWhenFull() {
    SnapshotRing<String> ring = new SnapshotRing<>(2);
    ring.push("a");
    ring.push("b");
    ring.push("c");

    assertEquals(2, ring.size());
    assertEquals(Optional.of("b"), ring.get(0));
    assertEquals(Optional.of("c"), ring.get(1));
  }

  @Test
  void truncateAfterKeepsTarget() {
    SnapshotRing<String> ring = new SnapshotRing<>(3);
    ring.push("a");
    ring.push("b");
    ring.push("c");
    ring.push("d");

    assertTrue(ring.truncateAfter(-2));
    assertEquals(2, ring.size());
    assertEquals(Optional.of("c"), ring.get(-1));
    ring.push("e");
    assertEquals(Optional.of("b"), ring.get(0));
    assertEquals(Optional.of("e"), ring.get(-1));
    assertFalse(ring.truncateAfter(5));
    assertEquals(3, ring.size());
  }

  @Test
  void rejectsNonPositiveCapacity() {
    assertThrows(IllegalArgumentException.class, () -> new SnapshotRing<String>(0));
  }
}
