package org.Aayush.cpusim.core;

import org.Aayush.cpusim.process.ProcessTable;
import org.Aayush.cpusim.scheduling.SchedulePlan;
import org.Aayush.cpusim.scheduling.SchedulingAlgorithm;

/**
 * Client-facing simulation contract.
 */
public interface SimulatorService {
    /**
     * Runs one discipline over {@code table}.
     */
    SchedulePlan run(SchedulingAlgorithm algorithm, ProcessTable table);

    /**
     * Runs every discipline over {@code table}, each on its own private copy.
     */
    SimulationReport simulateAll(ProcessTable table);
}
