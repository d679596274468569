package org.Aayush.cpusim.core;

import org.Aayush.cpusim.metric.TurnaroundMetric;
import org.Aayush.cpusim.process.ProcessTable;
import org.Aayush.cpusim.scheduling.SchedulePlan;
import org.Aayush.cpusim.scheduling.SchedulingAlgorithm;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("SimulationCore Tests")
class SimulationCoreTest {

    private static final ProcessTable CONVOY = ProcessTable.ofPairs(
            new int[]{0, 10},
            new int[]{1, 1},
            new int[]{2, 1}
    );

    @AfterEach
    void clearProperties() {
        System.clearProperty(SimulationConfig.PROP_ROUND_ROBIN_QUANTUM);
        System.clearProperty(SimulationConfig.PROP_MAX_PROCESSES);
    }

    @Test
    @DisplayName("Validation: algorithm must be non-null")
    void testAlgorithmRequired() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        SimulationException ex = assertThrows(SimulationException.class, () -> core.run(null, CONVOY));
        assertEquals(SimulationCore.REASON_ALGORITHM_REQUIRED, ex.getReasonCode());
    }

    @Test
    @DisplayName("Validation: table must be non-null")
    void testTableRequired() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        SimulationException ex = assertThrows(SimulationException.class, () -> core.simulateAll(null));
        assertEquals(SimulationCore.REASON_TABLE_REQUIRED, ex.getReasonCode());
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -2})
    @DisplayName("Validation: non-positive quantum or capacity is rejected at construction")
    void testInvalidConfigurationRejected(int value) {
        SimulationException quantum = assertThrows(
                SimulationException.class,
                () -> new SimulationCore(SimulationConfig.builder().roundRobinQuantum(value).build())
        );
        assertEquals(SimulationConfig.REASON_INVALID_CONFIGURATION, quantum.getReasonCode());

        SimulationException capacity = assertThrows(
                SimulationException.class,
                () -> new SimulationCore(SimulationConfig.builder().maxProcesses(value).build())
        );
        assertEquals(SimulationConfig.REASON_INVALID_CONFIGURATION, capacity.getReasonCode());
    }

    @Test
    @DisplayName("Validation: tables above configured capacity are rejected")
    void testCapacityExceeded() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().maxProcesses(2).build());
        SimulationException ex = assertThrows(SimulationException.class, () -> core.simulateAll(CONVOY));
        assertEquals(ProcessTable.REASON_CAPACITY_EXCEEDED, ex.getReasonCode());
    }

    @Test
    @DisplayName("simulateAll reports every algorithm in declaration order")
    void testSimulateAll() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        SimulationReport report = core.simulateAll(CONVOY);

        assertEquals(3, report.getProcessCount());
        assertEquals(List.of(SchedulingAlgorithm.values()), List.copyOf(report.getPlans().keySet()));
        assertEquals(10.0d, report.meanTurnaround(SchedulingAlgorithm.FCFS), 1e-9);
        assertEquals(10.0d, report.meanTurnaround(SchedulingAlgorithm.LCFS_NON_PREEMPTIVE), 1e-9);
        assertEquals(14.0d / 3.0d, report.meanTurnaround(SchedulingAlgorithm.LCFS_PREEMPTIVE), 1e-9);
        assertEquals(16.0d / 3.0d, report.meanTurnaround(SchedulingAlgorithm.ROUND_ROBIN), 1e-9);
        assertEquals(10.0d, report.meanTurnaround(SchedulingAlgorithm.SJF), 1e-9);

        Map<String, Double> byName = report.meanTurnaroundByName();
        assertEquals(List.of("FCFS", "LCFS_NON_PREEMPTIVE", "LCFS_PREEMPTIVE", "ROUND_ROBIN", "SJF"),
                List.copyOf(byName.keySet()));
    }

    @Test
    @DisplayName("run executes a single algorithm with the configured quantum")
    void testRunUsesConfiguredQuantum() {
        ProcessTable table = ProcessTable.ofPairs(new int[]{0, 4}, new int[]{1, 4});

        SchedulePlan quantumTwo = new SimulationCore(SimulationConfig.builder().build())
                .run(SchedulingAlgorithm.ROUND_ROBIN, table);
        SchedulePlan quantumFour = new SimulationCore(SimulationConfig.builder().roundRobinQuantum(4).build())
                .run(SchedulingAlgorithm.ROUND_ROBIN, table);

        assertEquals(List.of(6, 8), quantumTwo.getCompletionTimes());
        assertEquals(List.of(4, 8), quantumFour.getCompletionTimes());
    }

    @Test
    @DisplayName("Empty table fails the whole simulation set with EMPTY_INPUT")
    void testEmptyTable() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        SimulationException ex = assertThrows(SimulationException.class, () -> core.simulateAll(ProcessTable.empty()));
        assertEquals(TurnaroundMetric.REASON_EMPTY_INPUT, ex.getReasonCode());
    }

    @Test
    @Timeout(10)
    @DisplayName("Parallel execution matches sequential execution")
    void testParallelMatchesSequential() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        Random random = new Random(5L);
        ProcessTable.Builder builder = ProcessTable.builder();
        for (int i = 0; i < 60; i++) {
            builder.add(random.nextInt(100), 1 + random.nextInt(12));
        }
        ProcessTable table = builder.build();

        ExecutorService executor = Executors.newFixedThreadPool(SchedulingAlgorithm.values().length);
        try {
            assertEquals(core.simulateAll(table), core.simulateAll(table, executor));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @Timeout(10)
    @DisplayName("Parallel execution surfaces the reason-coded failure unwrapped")
    void testParallelFailureUnwrapped() {
        SimulationCore core = new SimulationCore(SimulationConfig.builder().build());
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            SimulationException ex = assertThrows(
                    SimulationException.class,
                    () -> core.simulateAll(ProcessTable.empty(), executor)
            );
            assertEquals(TurnaroundMetric.REASON_EMPTY_INPUT, ex.getReasonCode());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Defaults are read from system properties, unparsable values fall back")
    void testDefaultsFromSystemProperties() {
        SimulationConfig fallback = SimulationConfig.defaults();
        assertEquals(SimulationConfig.DEFAULT_ROUND_ROBIN_QUANTUM, fallback.getRoundRobinQuantum());
        assertEquals(SimulationConfig.DEFAULT_MAX_PROCESSES, fallback.getMaxProcesses());

        System.setProperty(SimulationConfig.PROP_ROUND_ROBIN_QUANTUM, "3");
        System.setProperty(SimulationConfig.PROP_MAX_PROCESSES, "not-a-number");
        SimulationConfig config = SimulationConfig.defaults();
        assertEquals(3, config.getRoundRobinQuantum());
        assertEquals(SimulationConfig.DEFAULT_MAX_PROCESSES, config.getMaxProcesses());
        assertEquals(3, new SimulationCore().config().getRoundRobinQuantum());
    }
}
