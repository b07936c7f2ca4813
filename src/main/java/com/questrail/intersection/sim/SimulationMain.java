package com.questrail.intersection.sim;

import com.questrail.intersection.api.ControllerSnapshot;
import com.questrail.intersection.api.DecisionReport;
import com.questrail.intersection.api.LaneReading;
import com.questrail.intersection.api.LaneSnapshot;
import com.questrail.intersection.config.SignalTimingPolicy;
import com.questrail.intersection.core.AdaptiveSignalController;
import com.questrail.intersection.core.UniformArrivalGenerator;
import com.questrail.intersection.observability.Slf4jSignalObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * SimulationMain
 * =============================================================================
 * Offline driver for the decision loop.
 *
 * <pre>
 *   SimulationMain [cycles] [lanes] [seed]
 * </pre>
 *
 * Each cycle feeds the controller the queue lengths it evolved in the previous
 * cycle plus fresh traffic: 0-3 new vehicles per lane and, with probability
 * 0.1 per lane, one emergency vehicle. Simulated time advances by each cycle's
 * green time, so a held green always expires before the next decision.
 */
public final class SimulationMain
{
    private static final Logger log = LoggerFactory.getLogger(SimulationMain.class);

    static final int DEFAULT_CYCLES = 20;
    static final int DEFAULT_LANES = 4;
    static final double EMERGENCY_PROBABILITY = 0.1;

    private final AdaptiveSignalController controller;
    private final SimulatedClock clock;
    private final Random traffic;
    private final List<String> laneIds;

    SimulationMain(int lanes, long seed) {
        if (lanes < 1) {
            throw new IllegalArgumentException("lanes must be >= 1: " + lanes);
        }
        this.clock = new SimulatedClock();
        this.traffic = new Random(seed);
        this.laneIds = new ArrayList<>(lanes);
        for (int i = 1; i <= lanes; i++) {
            laneIds.add("Lane_" + i);
        }
        this.controller = AdaptiveSignalController.builder()
                .withPolicy(SignalTimingPolicy.hostDefaults())
                .withArrivalGenerator(UniformArrivalGenerator.seeded(seed))
                .withClock(clock)
                .withObservabilitySink(new Slf4jSignalObservabilitySink())
                .withLanes(laneIds)
                .build();
    }

    public static void main(String[] args) {
        try {
            int cycles = args.length > 0 ? Integer.parseInt(args[0]) : DEFAULT_CYCLES;
            int lanes = args.length > 1 ? Integer.parseInt(args[1]) : DEFAULT_LANES;
            long seed = args.length > 2 ? Long.parseLong(args[2]) : System.nanoTime();

            log.info("Simulating {} cycles over {} lanes (seed {})", cycles, lanes, seed);
            new SimulationMain(lanes, seed).run(cycles);
        }
        catch (IllegalArgumentException e) {
            log.error("Usage: SimulationMain [cycles] [lanes] [seed] ({})", e.getMessage());
            System.exit(2);
        }
    }

    List<DecisionReport> run(int cycles) {
        if (cycles < 0) {
            throw new IllegalArgumentException("cycles must be >= 0: " + cycles);
        }
        List<DecisionReport> reports = new ArrayList<>(cycles);
        for (int c = 1; c <= cycles; c++) {
            DecisionReport report = controller.decide(nextReadings());
            log.info("Cycle {}: {} green for {}s ({})",
                    c,
                    report.chosenLane().orElse("-"),
                    String.format("%.1f", report.greenTime()),
                    report.reason().map(Enum::name).orElse("-"));
            clock.advanceSeconds(report.greenTime());
            reports.add(report);
        }
        return reports;
    }

    ControllerSnapshot snapshot() {
        return controller.inspect();
    }

    private List<LaneReading> nextReadings() {
        ControllerSnapshot snap = controller.inspect();
        List<LaneReading> readings = new ArrayList<>(laneIds.size());
        for (String id : laneIds) {
            int queued = snap.lane(id).map(LaneSnapshot::normal).orElse(0);
            int arrivals = traffic.nextInt(UniformArrivalGenerator.DEFAULT_MAX_ARRIVALS + 1);
            int emergency = traffic.nextDouble() < EMERGENCY_PROBABILITY ? 1 : 0;
            readings.add(LaneReading.of(id, queued + arrivals, emergency));
        }
        return readings;
    }
}
