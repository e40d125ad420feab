package io.draftops.draftline.application.state;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.draftops.draftline.domain.draft.DraftSession;
import io.draftops.draftline.domain.draft.DraftSnapshot;
import io.draftops.draftline.domain.draft.DraftStatus;
import io.draftops.draftline.domain.draft.Pick;
import io.draftops.draftline.domain.draft.RosterPosition;
import io.draftops.draftline.support.ManualClock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.junit.jupiter.api.Test;

class DraftStateStoreTest {
  private final ManualClock clock = new ManualClock(1_000L);

  private DraftStateStore newStore() {
    return new DraftStateStore(new DraftSession("L1", "1", 2, 3), clock);
  }

  @Test
  void picksMoveFromPoolToRoster() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1", "P2", "P3", "P2", " "));

    assertEquals(List.of("P1", "P2", "P3"), store.availablePlayers());
    assertTrue(store.applyPick("P1", "1", 1, RosterPosition.QB));
    assertTrue(store.applyPick("P2", "2", 2, null));

    assertEquals(List.of("P3"), store.availablePlayers());
    assertEquals(Set.of("P1", "P2"), store.draftedPlayers());
    assertEquals(List.of("P1"), store.myRoster().get(RosterPosition.QB));
    assertEquals(List.of("P2"), store.otherRosters().get("2").get(RosterPosition.BENCH));
    assertEquals(2, store.currentPick());
    assertEquals(List.of(new Pick(1, "P1", "1", RosterPosition.QB, 1_000L),
        new Pick(2, "P2", "2", RosterPosition.BENCH, 1_000L)), store.pickHistory());
  }

  @Test
  void availableAndDraftedStayDisjoint() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1", "P2", "P3", "P4"));
    store.applyPick("P3", "1", 1, RosterPosition.WR);
    store.applyPick("X9", "2", 2, RosterPosition.RB);

    Set<String> overlap = new HashSet<>(store.availablePlayers());
    overlap.retainAll(store.draftedPlayers());
    assertTrue(overlap.isEmpty());
    assertTrue(store.isDrafted("X9"));
  }

  @Test
  void repeatedPickIsRejectedWithoutChangingState() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1", "P2"));
    assertTrue(store.applyPick("P1", "1", 1, RosterPosition.QB));
    DraftSnapshot before = store.view();
    int snapshots = store.snapshotCount();

    assertFalse(store.applyPick("P1", "2", 2, RosterPosition.QB));

    assertTrue(store.view().sameStateAs(before));
    assertEquals(snapshots, store.snapshotCount());
  }

  @Test
  void rejectsInvalidPickArguments() {
    DraftStateStore store = newStore();

    assertFalse(store.applyPick("", "1", 1, RosterPosition.QB));
    assertFalse(store.applyPick("P1", null, 1, RosterPosition.QB));
    assertFalse(store.applyPick("P1", "1", 0, RosterPosition.QB));
    assertEquals(0, store.snapshotCount());
  }

  @Test
  void rollbackRestoresEveryRetainedSnapshot() {
    int mutations = 6;
    for (int index = -mutations; index < mutations; index++) {
      DraftStateStore store = newStore();
      store.initializePlayerPool(List.of("P1", "P2", "P3", "P4"));
      store.setDraftOrder(List.of("1", "2"));
      store.startNewPick(1, "1", 30.0);
      store.applyPick("P1", "1", 1, RosterPosition.QB);
      store.startNewPick(2, "2", 30.0);
      store.applyPick("P2", "2", 2, RosterPosition.RB);
      assertEquals(mutations, store.snapshotCount());

      DraftSnapshot expected = store.getSnapshot(index).orElseThrow();
      assertTrue(store.rollbackToSnapshot(index), "rollback to " + index);
      assertTrue(store.view().sameStateAs(expected), "state after rollback to " + index);
      int retained = index < 0 ? mutations + index + 1 : index + 1;
      assertEquals(retained, store.snapshotCount(), "snapshots kept after rollback to " + index);
      assertTrue(store.getSnapshot(-1).orElseThrow().sameStateAs(expected), "newest snapshot is the target");
    }
  }

  @Test
  void rollbackOutsideRetainedRangeIsRejected() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1"));
    store.applyPick("P1", "1", 1, RosterPosition.QB);
    DraftSnapshot before = store.view();

    assertFalse(store.rollbackToSnapshot(2));
    assertFalse(store.rollbackToSnapshot(-3));
    assertTrue(store.view().sameStateAs(before));
  }

  @Test
  void rollbackUndoesLastPickAndRebuildsSchedule() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1", "P2"));
    store.setDraftOrder(List.of("2", "1"));
    store.applyPick("P1", "2", 1, RosterPosition.QB);

    assertTrue(store.rollbackToSnapshot(-1));

    assertEquals(List.of("P1", "P2"), store.availablePlayers());
    assertTrue(store.pickHistory().isEmpty());
    assertEquals(List.of(2, 3, 6), store.myPickNumbers());
    assertEquals(2, store.picksUntilNext());
  }

  @Test
  void snapshotCapacityEvictsOldest() {
    DraftStateStore store = new DraftStateStore(new DraftSession("L1", "1", 2, 3), clock, 2);
    store.initializePlayerPool(List.of("P1", "P2", "P3"));
    store.applyPick("P1", "1", 1, null);
    store.applyPick("P2", "2", 2, null);

    assertEquals(2, store.snapshotCount());
    assertEquals(3, store.getSnapshot(0).orElseThrow().availablePlayers().size());
    assertEquals(1, store.getSnapshot(-1).orElseThrow().completedPicks());
  }

  @Test
  void poolCannotBeReseededAfterPicks() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1"));
    store.applyPick("P1", "1", 1, RosterPosition.QB);

    assertThrows(IllegalStateException.class, () -> store.initializePlayerPool(List.of("P9")));
  }

  @Test
  void draftOrderDrivesPicksUntilNext() {
    DraftStateStore store = new DraftStateStore(new DraftSession("L1", "5", 12, 16), clock);
    List<String> order = new ArrayList<>();
    for (int team = 1; team <= 12; team++) {
      order.add(String.valueOf(team));
    }
    store.setDraftOrder(order);

    assertEquals(List.of(5, 20, 29, 44, 53), store.myPickNumbers().subList(0, 5));
    assertEquals(5, store.picksUntilNext());
    assertEquals(Optional.of("12"), store.expectedTeamFor(13));
    assertThrows(IllegalArgumentException.class, () -> store.setDraftOrder(List.of("1", "1")));
    assertThrows(IllegalArgumentException.class, () -> store.setDraftOrder(List.of()));
  }

  @Test
  void statusTransitions() {
    DraftStateStore store = newStore();
    assertEquals(DraftStatus.WAITING, store.status());
    assertFalse(store.pauseDraft());

    store.startNewPick(1, "1", 30.0);
    assertEquals(DraftStatus.IN_PROGRESS, store.status());
    assertEquals(Optional.of("1"), store.onTheClock());
    assertTrue(store.pauseDraft());
    assertTrue(store.resumeDraft());

    assertTrue(store.completeDraft());
    assertFalse(store.completeDraft());
    assertEquals(DraftStatus.COMPLETED, store.status());
    assertTrue(store.onTheClock().isEmpty());
    assertFalse(store.startNewPick(2, "2", 30.0));
    assertFalse(store.applyPick("P1", "1", 2, RosterPosition.QB));
  }

  @Test
  void clockUpdatesClampWithoutSnapshots() {
    DraftStateStore store = newStore();
    store.startNewPick(1, "1", 30.0);
    int snapshots = store.snapshotCount();

    store.updateClock(-4.0);

    assertEquals(0.0, store.timeRemainingSeconds());
    assertEquals(snapshots, store.snapshotCount());
  }

  @Test
  void reassignPositionMovesRosteredPlayerOnly() {
    DraftStateStore store = newStore();
    store.applyPick("P1", "1", 1, RosterPosition.BENCH);

    assertTrue(store.reassignPosition("P1", RosterPosition.WR));
    assertEquals(List.of("P1"), store.myRoster().get(RosterPosition.WR));
    assertTrue(store.myRoster().get(RosterPosition.BENCH).isEmpty());
    assertFalse(store.reassignPosition("P1", RosterPosition.WR));
    assertFalse(store.reassignPosition("NOPE", RosterPosition.QB));
    assertEquals(RosterPosition.BENCH, store.pickFor("P1").orElseThrow().position());
  }

  @Test
  void viewsAreImmutableCopies() {
    DraftStateStore store = newStore();
    store.initializePlayerPool(List.of("P1"));
    DraftSnapshot view = store.view();

    assertThrows(UnsupportedOperationException.class, () -> view.availablePlayers().add("X"));
    assertThrows(UnsupportedOperationException.class,
        () -> view.myRoster().get(RosterPosition.QB).add("X"));
    store.applyPick("P1", "1", 1, RosterPosition.QB);
    assertEquals(List.of("P1"), view.availablePlayers());
  }
}
