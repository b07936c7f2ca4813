package com.questrail.intersection.api;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionReportTest {

    @Test
    void lampTriplesFollowRedYellowGreenOrder() {
        assertArrayEquals(new int[] {1, 0, 0}, LanePhase.RED.lamps());
        assertArrayEquals(new int[] {0, 1, 0}, LanePhase.YELLOW.lamps());
        assertArrayEquals(new int[] {0, 0, 1}, LanePhase.GREEN.lamps());
    }

    @Test
    void preservesLaneOrderAndIsUnmodifiable() {
        Map<String, LaneReport> lanes = new LinkedHashMap<>();
        lanes.put("W", LaneReport.waiting(LanePhase.RED, 2));
        lanes.put("E", LaneReport.green(0, 4.0));

        DecisionReport r = DecisionReport.of(lanes, "E", SelectionReason.FAIRNESS, 4.0);
        lanes.put("N", LaneReport.waiting(LanePhase.RED, 0));

        assertEquals(List.of("W", "E"), List.copyOf(r.lanes().keySet()));
        assertThrows(UnsupportedOperationException.class,
                () -> r.lanes().put("S", LaneReport.waiting(LanePhase.RED, 0)));
    }

    @Test
    void chosenLaneMustBeReported() {
        Map<String, LaneReport> lanes = Map.of("A", LaneReport.waiting(LanePhase.RED, 0));
        assertThrows(IllegalArgumentException.class,
                () -> DecisionReport.of(lanes, "B", SelectionReason.HOLD, 3.0));
    }

    @Test
    void unknownLaneLookupFails() {
        assertThrows(IllegalArgumentException.class, () -> DecisionReport.empty().lane("A"));
    }

    @Test
    void emptyReportHasNoChoice() {
        DecisionReport r = DecisionReport.empty();
        assertTrue(r.isEmpty());
        assertTrue(r.chosenLane().isEmpty());
        assertTrue(r.reason().isEmpty());
        assertEquals(0.0, r.greenTime());
    }
}
