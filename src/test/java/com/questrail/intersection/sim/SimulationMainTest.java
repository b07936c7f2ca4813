package com.questrail.intersection.sim;

import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LanePhase;
import com.questrail.intersection.config.SignalTimingPolicy;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimulationMainTest {

    @Test
    void runsRequestedCyclesWithinGreenBounds() {
        SignalTimingPolicy policy = SignalTimingPolicy.hostDefaults();
        List<DecisionReport> reports = new SimulationMain(4, 11L).run(25);

        assertEquals(25, reports.size());
        for (DecisionReport r : reports) {
            assertEquals(4, r.lanes().size());
            assertEquals(1, r.lanes().values().stream().filter(l -> l.phase() == LanePhase.GREEN).count());
            assertTrue(r.greenTime() >= policy.minGreen() && r.greenTime() <= policy.maxGreen());
        }
    }

    @Test
    void sameSeedReplaysSameDecisions() {
        List<DecisionReport> a = new SimulationMain(3, 42L).run(15);
        List<DecisionReport> b = new SimulationMain(3, 42L).run(15);

        for (int i = 0; i < a.size(); i++) {
            assertEquals(a.get(i).chosenLane(), b.get(i).chosenLane());
            assertEquals(a.get(i).greenTime(), b.get(i).greenTime());
        }
    }

    @Test
    void simulatedTimeLetsEveryGreenExpire() {
        List<DecisionReport> reports = new SimulationMain(2, 3L).run(10);
        assertTrue(reports.stream().noneMatch(r -> r.reason().map(Enum::name).orElse("").equals("HOLD")));
    }

    @Test
    void laneNamesAreNumbered() {
        SimulationMain sim = new SimulationMain(2, 1L);
        sim.run(1);
        assertEquals("Lane_1", sim.snapshot().lanes().get(0).laneId());
    }

    @Test
    void rejectsNonPositiveLaneCount() {
        assertThrows(IllegalArgumentException.class, () -> new SimulationMain(0, 1L));
    }
}
