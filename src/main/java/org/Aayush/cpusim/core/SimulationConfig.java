package org.Aayush.cpusim.core;

import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration bound once when a {@link SimulationCore} is created.
 */
@Value
@Builder
public class SimulationConfig {
    public static final String REASON_INVALID_CONFIGURATION = "INVALID_CONFIGURATION";

    public static final int DEFAULT_ROUND_ROBIN_QUANTUM = 2;
    public static final int DEFAULT_MAX_PROCESSES = 100;

    public static final String PROP_ROUND_ROBIN_QUANTUM = "cpusim.roundRobin.quantum";
    public static final String PROP_MAX_PROCESSES = "cpusim.maxProcesses";

    /** Round Robin time slice in simulation ticks. */
    @Builder.Default
    int roundRobinQuantum = DEFAULT_ROUND_ROBIN_QUANTUM;

    /** Maximum accepted process-table size. */
    @Builder.Default
    int maxProcesses = DEFAULT_MAX_PROCESSES;

    /**
     * Loads configuration from system properties, falling back to defaults for
     * missing or unparsable values.
     */
    public static SimulationConfig defaults() {
        return SimulationConfig.builder()
                .roundRobinQuantum(readInt(PROP_ROUND_ROBIN_QUANTUM, DEFAULT_ROUND_ROBIN_QUANTUM))
                .maxProcesses(readInt(PROP_MAX_PROCESSES, DEFAULT_MAX_PROCESSES))
                .build();
    }

    /**
     * Validates configured bounds.
     *
     * @return this config.
     * @throws SimulationException when quantum or capacity is not positive.
     */
    public SimulationConfig validate() {
        if (roundRobinQuantum <= 0) {
            throw new SimulationException(
                    REASON_INVALID_CONFIGURATION,
                    "roundRobinQuantum must be > 0, got " + roundRobinQuantum
            );
        }
        if (maxProcesses <= 0) {
            throw new SimulationException(
                    REASON_INVALID_CONFIGURATION,
                    "maxProcesses must be > 0, got " + maxProcesses
            );
        }
        return this;
    }

    private static int readInt(String property, int fallback) {
        String raw = System.getProperty(property);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return fallback;
        }
    }
}
