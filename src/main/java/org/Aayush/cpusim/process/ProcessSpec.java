package org.Aayush.cpusim.process;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.Aayush.cpusim.core.SimulationException;

/**
 * Immutable description of one schedulable process.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProcessSpec {
    /** Position in the original input order. Diagnostics and final tie-break only. */
    int id;
    /** Tick at which the process becomes eligible for the CPU. */
    int arrivalTime;
    /** Total CPU ticks required to finish. */
    int burstTime;

    /**
     * Creates a validated process description.
     *
     * @param id input-order position.
     * @param arrivalTime arrival tick, must be {@code >= 0}.
     * @param burstTime CPU burst, must be {@code > 0}.
     * @return immutable process description.
     * @throws SimulationException with {@link ProcessTable#REASON_INVALID_PROCESS_SPEC}
     *         when arrival or burst is out of range.
     */
    public static ProcessSpec of(int id, int arrivalTime, int burstTime) {
        if (id < 0) {
            throw new IllegalArgumentException("id must be non-negative");
        }
        if (arrivalTime < 0) {
            throw new SimulationException(
                    ProcessTable.REASON_INVALID_PROCESS_SPEC,
                    "process " + id + ": arrivalTime must be >= 0, got " + arrivalTime
            );
        }
        if (burstTime <= 0) {
            throw new SimulationException(
                    ProcessTable.REASON_INVALID_PROCESS_SPEC,
                    "process " + id + ": burstTime must be > 0, got " + burstTime
            );
        }
        return new ProcessSpec(id, arrivalTime, burstTime);
    }
}
