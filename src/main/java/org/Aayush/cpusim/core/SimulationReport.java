package org.Aayush.cpusim.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.cpusim.scheduling.SchedulePlan;
import org.Aayush.cpusim.scheduling.SchedulingAlgorithm;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Structured result set of one simulation set: one plan per algorithm, in
 * {@link SchedulingAlgorithm} declaration order.
 */
@Value
@Builder
public class SimulationReport {
    /** Number of processes in the simulated table. */
    int processCount;
    /** Completed plan per algorithm. */
    @Singular("plan")
    Map<SchedulingAlgorithm, SchedulePlan> plans;

    /**
     * Mean turnaround of one algorithm.
     *
     * @throws IllegalArgumentException when the algorithm was not part of this report.
     */
    public double meanTurnaround(SchedulingAlgorithm algorithm) {
        SchedulePlan plan = plans.get(algorithm);
        if (plan == null) {
            throw new IllegalArgumentException("no plan for " + algorithm);
        }
        return plan.getMeanTurnaround();
    }

    /**
     * Algorithm name to mean turnaround, in report order.
     */
    public Map<String, Double> meanTurnaroundByName() {
        Map<String, Double> byName = new LinkedHashMap<>();
        for (Map.Entry<SchedulingAlgorithm, SchedulePlan> entry : plans.entrySet()) {
            byName.put(entry.getKey().name(), entry.getValue().getMeanTurnaround());
        }
        return byName;
    }
}
