package com.questrail.intersection.core;

import com.questrail.intersection.api.LanePhase;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LaneStateStoreTest {

    @Test
    void registrationOrderIsPreserved() {
        LaneStateStore store = new LaneStateStore();
        store.register(List.of("N", "E", "S", "W"));

        assertEquals(List.of("N", "E", "S", "W"), store.laneIds());
        assertEquals(2, store.indexOf("S"));
        assertEquals("W", store.idAt(3));
        assertEquals(LaneState.initial("E"), store.at(1));
        assertTrue(store.contains("N"));
        assertFalse(store.contains("X"));
    }

    @Test
    void freshLanesAreRedWithNoAging() {
        LaneStateStore store = new LaneStateStore();
        store.register(List.of("A"));

        LaneState a = store.get("A");
        assertEquals(LanePhase.RED, a.phase());
        assertEquals(0, a.waitCycles());
        assertEquals(0, a.normal());
    }

    @Test
    void laneSetComparisonIgnoresOrder() {
        LaneStateStore store = new LaneStateStore();
        store.register(List.of("A", "B"));

        assertTrue(store.hasLaneSet(Set.of("B", "A")));
        assertFalse(store.hasLaneSet(List.of("A")));
        assertFalse(store.hasLaneSet(List.of("A", "B", "C")));
        assertFalse(store.hasLaneSet(List.of("A", "C")));
    }

    @Test
    void reRegistrationDiscardsState() {
        LaneStateStore store = new LaneStateStore();
        store.register(List.of("A", "B"));
        store.put(store.get("A").withWaitIncremented().withPhase(LanePhase.GREEN));

        store.register(List.of("A", "B", "C"));

        assertEquals(LaneState.initial("A"), store.get("A"));
        assertEquals(3, store.size());
    }

    @Test
    void duplicateIdsAreRejected() {
        LaneStateStore store = new LaneStateStore();
        assertThrows(IllegalArgumentException.class, () -> store.register(List.of("A", "A")));
    }

    @Test
    void unknownLaneIsRejected() {
        LaneStateStore store = new LaneStateStore();
        store.register(List.of("A"));
        assertThrows(IllegalArgumentException.class, () -> store.indexOf("Z"));
    }
}
