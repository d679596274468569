package org.Aayush.cpusim.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.cpusim.process.ProcessTable;
import org.Aayush.cpusim.scheduling.FcfsScheduler;
import org.Aayush.cpusim.scheduling.LcfsNonPreemptiveScheduler;
import org.Aayush.cpusim.scheduling.LcfsPreemptiveScheduler;
import org.Aayush.cpusim.scheduling.RoundRobinScheduler;
import org.Aayush.cpusim.scheduling.SchedulePlan;
import org.Aayush.cpusim.scheduling.Scheduler;
import org.Aayush.cpusim.scheduling.SchedulingAlgorithm;
import org.Aayush.cpusim.scheduling.ShortestJobFirstScheduler;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Main simulation entry point.
 *
 * <p>The facade validates configuration once, checks every table against the
 * configured capacity and dispatches to one {@link Scheduler} per algorithm. Each
 * scheduler works on a private copy of the table, so the facade holds no mutable
 * state and may be shared across threads.</p>
 */
public final class SimulationCore implements SimulatorService {
    public static final String REASON_ALGORITHM_REQUIRED = "ALGORITHM_REQUIRED";
    public static final String REASON_TABLE_REQUIRED = "TABLE_REQUIRED";

    private static final Logger logger = LogManager.getLogger();

    @Getter
    @Accessors(fluent = true)
    private final SimulationConfig config;
    private final Map<SchedulingAlgorithm, Scheduler> schedulers = new EnumMap<>(SchedulingAlgorithm.class);

    /**
     * Creates a core bound to system-property configuration.
     */
    public SimulationCore() {
        this(SimulationConfig.defaults());
    }

    /**
     * Creates a core bound to {@code config}.
     *
     * @throws SimulationException with {@link SimulationConfig#REASON_INVALID_CONFIGURATION}.
     */
    public SimulationCore(SimulationConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
        for (SchedulingAlgorithm algorithm : SchedulingAlgorithm.values()) {
            schedulers.put(algorithm, createScheduler(algorithm));
        }
    }

    @Override
    public SchedulePlan run(SchedulingAlgorithm algorithm, ProcessTable table) {
        if (algorithm == null) {
            throw new SimulationException(REASON_ALGORITHM_REQUIRED, "algorithm must be provided");
        }
        requireTable(table);
        return schedulers.get(algorithm).schedule(table);
    }

    @Override
    public SimulationReport simulateAll(ProcessTable table) {
        requireTable(table);
        SimulationReport.SimulationReportBuilder builder = SimulationReport.builder()
                .processCount(table.size());
        for (SchedulingAlgorithm algorithm : SchedulingAlgorithm.values()) {
            builder.plan(algorithm, schedulers.get(algorithm).schedule(table));
        }
        return logged(builder.build());
    }

    /**
     * Runs every algorithm concurrently on {@code executor}. Results are identical to
     * {@link #simulateAll(ProcessTable)}.
     *
     * @throws SimulationException the first algorithm failure, unwrapped.
     */
    public SimulationReport simulateAll(ProcessTable table, Executor executor) {
        requireTable(table);
        Objects.requireNonNull(executor, "executor");

        Map<SchedulingAlgorithm, CompletableFuture<SchedulePlan>> futures = new EnumMap<>(SchedulingAlgorithm.class);
        for (SchedulingAlgorithm algorithm : SchedulingAlgorithm.values()) {
            Scheduler scheduler = schedulers.get(algorithm);
            futures.put(algorithm, CompletableFuture.supplyAsync(() -> scheduler.schedule(table), executor));
        }

        SimulationReport.SimulationReportBuilder builder = SimulationReport.builder()
                .processCount(table.size());
        for (Map.Entry<SchedulingAlgorithm, CompletableFuture<SchedulePlan>> entry : futures.entrySet()) {
            try {
                builder.plan(entry.getKey(), entry.getValue().join());
            } catch (CompletionException ex) {
                if (ex.getCause() instanceof SimulationException) {
                    throw (SimulationException) ex.getCause();
                }
                throw ex;
            }
        }
        return logged(builder.build());
    }

    private void requireTable(ProcessTable table) {
        if (table == null) {
            throw new SimulationException(REASON_TABLE_REQUIRED, "process table must be provided");
        }
        table.checkCapacity(config.getMaxProcesses());
    }

    private Scheduler createScheduler(SchedulingAlgorithm algorithm) {
        return switch (algorithm) {
            case FCFS -> new FcfsScheduler();
            case LCFS_NON_PREEMPTIVE -> new LcfsNonPreemptiveScheduler();
            case LCFS_PREEMPTIVE -> new LcfsPreemptiveScheduler();
            case ROUND_ROBIN -> new RoundRobinScheduler(config.getRoundRobinQuantum());
            case SJF -> new ShortestJobFirstScheduler();
        };
    }

    private static SimulationReport logged(SimulationReport report) {
        if (logger.isInfoEnabled()) {
            logger.info("Simulated {} processes: {}", report.getProcessCount(), report.meanTurnaroundByName());
        }
        return report;
    }
}
