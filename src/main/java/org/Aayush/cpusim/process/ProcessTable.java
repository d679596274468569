package org.Aayush.cpusim.process;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.cpusim.core.SimulationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable input dataset for one simulation set.
 *
 * <p>Processes are kept in input order; {@link ProcessSpec#getId()} equals the list
 * position. Tables are never mutated by schedulers, each run works on its own copy.</p>
 */
public final class ProcessTable {
    public static final String REASON_INVALID_PROCESS_SPEC = "INVALID_PROCESS_SPEC";
    public static final String REASON_CAPACITY_EXCEEDED = "CAPACITY_EXCEEDED";

    static final int UNBOUNDED = Integer.MAX_VALUE;

    /**
     * Latest tick the simulation clock can reach. A table is accepted only when its
     * latest arrival plus its total burst stays within this bound, which caps every
     * clock value and completion time of every discipline.
     */
    public static final long MAX_HORIZON = Integer.MAX_VALUE;

    @Getter
    @Accessors(fluent = true)
    private final List<ProcessSpec> processes;

    private ProcessTable(List<ProcessSpec> processes) {
        this.processes = List.copyOf(processes);
    }

    /**
     * Builds a table from {@code {arrival, burst}} pairs without a capacity bound.
     *
     * @param pairs arrival/burst pairs in input order.
     * @return validated table.
     */
    public static ProcessTable ofPairs(int[]... pairs) {
        Builder builder = builder();
        for (int[] pair : pairs) {
            if (pair == null || pair.length != 2) {
                throw new IllegalArgumentException("each pair must be {arrivalTime, burstTime}");
            }
            builder.add(pair[0], pair[1]);
        }
        return builder.build();
    }

    /**
     * Returns an empty table.
     */
    public static ProcessTable empty() {
        return new ProcessTable(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Number of processes in this table.
     */
    public int size() {
        return processes.size();
    }

    public boolean isEmpty() {
        return processes.isEmpty();
    }

    /**
     * Returns the process at input position {@code id}.
     */
    public ProcessSpec get(int id) {
        return processes.get(id);
    }

    /**
     * Fails with {@link #REASON_CAPACITY_EXCEEDED} when this table holds more than
     * {@code maxProcesses} entries.
     */
    public void checkCapacity(int maxProcesses) {
        checkCapacity(processes.size(), maxProcesses);
    }

    static void checkCapacity(int count, int maxProcesses) {
        if (count > maxProcesses) {
            throw new SimulationException(
                    REASON_CAPACITY_EXCEEDED,
                    "process count " + count + " exceeds capacity " + maxProcesses
            );
        }
    }

    @Override
    public String toString() {
        return "ProcessTable" + processes;
    }

    /**
     * Incremental table builder assigning input-order ids.
     */
    public static final class Builder {
        private final List<ProcessSpec> processes = new ArrayList<>();
        private int maxProcesses = UNBOUNDED;
        private long latestArrival;
        private long totalBurst;

        private Builder() {
        }

        /**
         * Sets the capacity enforced on every {@link #add(int, int)}.
         */
        public Builder maxProcesses(int maxProcesses) {
            if (maxProcesses <= 0) {
                throw new IllegalArgumentException("maxProcesses must be > 0");
            }
            this.maxProcesses = maxProcesses;
            return this;
        }

        /**
         * Appends one process; its id is the current table size.
         *
         * @throws SimulationException with {@link #REASON_INVALID_PROCESS_SPEC} when the
         *         process pushes the simulation horizon past {@link #MAX_HORIZON}.
         */
        public Builder add(int arrivalTime, int burstTime) {
            checkCapacity(processes.size() + 1, maxProcesses);
            ProcessSpec spec = ProcessSpec.of(processes.size(), arrivalTime, burstTime);
            long arrival = Math.max(latestArrival, spec.getArrivalTime());
            long burst = totalBurst + spec.getBurstTime();
            if (arrival + burst > MAX_HORIZON) {
                throw new SimulationException(
                        REASON_INVALID_PROCESS_SPEC,
                        "process " + spec.getId() + ": latest arrival " + arrival + " plus total burst " + burst
                                + " exceeds the simulation horizon " + MAX_HORIZON
                );
            }
            latestArrival = arrival;
            totalBurst = burst;
            processes.add(spec);
            return this;
        }

        public ProcessTable build() {
            return new ProcessTable(processes);
        }
    }
}
