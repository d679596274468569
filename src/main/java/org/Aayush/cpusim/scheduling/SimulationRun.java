package org.Aayush.cpusim.scheduling;

import org.Aayush.cpusim.core.SimulationException;
import org.Aayush.cpusim.metric.TurnaroundMetric;
import org.Aayush.cpusim.process.ProcessOrdering;
import org.Aayush.cpusim.process.ProcessSpec;
import org.Aayush.cpusim.process.ProcessTable;
import org.Aayush.cpusim.process.SimProcess;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.IntConsumer;

/**
 * Private working state of one algorithm run: the simulation clock plus a deep copy
 * of the process table sorted by arrival.
 *
 * <p>Processes are addressed by their index in arrival order. Shared primitives:</p>
 * <ul>
 * <li>{@link #admitArrived(IntConsumer)} hands each arrived process to the ready
 * structure exactly once.</li>
 * <li>{@link #idleAdvance()} jumps the clock over idle gaps.</li>
 * <li>{@link #runFor(int, int)} / {@link #runToCompletion(int)} serve CPU time and
 * record completions.</li>
 * <li>{@link #finish()} checks coverage and computes the plan.</li>
 * </ul>
 *
 * <p>Not thread-safe; a run is confined to the thread executing its scheduler.</p>
 */
public final class SimulationRun {
    private static final Logger logger = LogManager.getLogger();

    private static final IntConsumer DISCARD = index -> {
    };

    private final SchedulingAlgorithm algorithm;
    private final SimProcess[] byArrival;
    private int now;
    private int completed;
    // Arrival-order index of the next process that has not been admitted.
    private int admitCursor;

    private SimulationRun(SchedulingAlgorithm algorithm, SimProcess[] byArrival) {
        this.algorithm = algorithm;
        this.byArrival = byArrival;
    }

    /**
     * Copies {@code table} into a fresh run sorted by arrival time, ties by input order.
     */
    public static SimulationRun start(SchedulingAlgorithm algorithm, ProcessTable table) {
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(table, "table");
        List<ProcessSpec> sorted = ProcessOrdering.sorted(table.processes(), ProcessOrdering.SortKey.ARRIVAL);
        SimProcess[] copies = new SimProcess[sorted.size()];
        for (int i = 0; i < copies.length; i++) {
            copies[i] = new SimProcess(sorted.get(i));
        }
        logger.debug("{}: starting run over {} processes", algorithm, copies.length);
        return new SimulationRun(algorithm, copies);
    }

    public SchedulingAlgorithm algorithm() {
        return algorithm;
    }

    public int size() {
        return byArrival.length;
    }

    /**
     * Current simulation tick.
     */
    public int now() {
        return now;
    }

    public int completedCount() {
        return completed;
    }

    public boolean isFinished() {
        return completed == byArrival.length;
    }

    /**
     * Working copy at arrival-order position {@code index}.
     */
    public SimProcess process(int index) {
        return byArrival[index];
    }

    /**
     * Moves the clock forward to {@code tick}; never moves it backwards.
     */
    public void advanceTo(int tick) {
        if (tick > now) {
            now = tick;
        }
    }

    /**
     * Admits every process that has arrived by {@link #now()} and was not admitted
     * before, in arrival order. Each process reaches {@code sink} once per run.
     *
     * @param sink receives arrival-order indexes of newly admitted processes.
     * @return number of processes admitted by this call.
     */
    public int admitArrived(IntConsumer sink) {
        int admitted = 0;
        while (admitCursor < byArrival.length && byArrival[admitCursor].arrivalTime() <= now) {
            SimProcess process = byArrival[admitCursor];
            process.admit();
            sink.accept(admitCursor);
            admitCursor++;
            admitted++;
        }
        return admitted;
    }

    /**
     * Admits arrived processes without a ready structure, for disciplines that
     * select by scanning.
     */
    public int admitArrived() {
        return admitArrived(DISCARD);
    }

    /**
     * Idle-time advance: jumps the clock to the earliest future arrival among
     * uncompleted processes.
     *
     * @throws SimulationException with {@link SimProcess#REASON_INVARIANT_VIOLATION}
     *         when processes remain but none arrives later.
     */
    public void idleAdvance() {
        boolean found = false;
        int next = 0;
        for (SimProcess process : byArrival) {
            if (!process.isCompleted() && process.arrivalTime() > now && (!found || process.arrivalTime() < next)) {
                next = process.arrivalTime();
                found = true;
            }
        }
        if (!found) {
            throw new SimulationException(
                    SimProcess.REASON_INVARIANT_VIOLATION,
                    algorithm + ": no future arrival at t=" + now + " while "
                            + (byArrival.length - completed) + " processes remain unscheduled"
            );
        }
        logger.trace("{}: idle {} -> {}", algorithm, now, next);
        now = next;
    }

    /**
     * Serves up to {@code ticks} units to the process at {@code index}, completing it
     * when its remaining time reaches zero.
     */
    public void runFor(int index, int ticks) {
        SimProcess process = byArrival[index];
        process.serve(ticks);
        // Bounded by ProcessTable.MAX_HORIZON.
        now = Math.addExact(now, ticks);
        if (process.remainingTime() == 0) {
            complete(process);
        }
    }

    /**
     * Serves all remaining time of the process at {@code index}.
     */
    public void runToCompletion(int index) {
        SimProcess process = byArrival[index];
        advanceTo(process.arrivalTime());
        runFor(index, process.remainingTime());
    }

    /**
     * Marks the running process at {@code index} as waiting again.
     */
    public void preempt(int index) {
        byArrival[index].preempt();
    }

    /**
     * Verifies every process completed exactly once and computes the plan.
     *
     * @throws SimulationException with {@link TurnaroundMetric#REASON_EMPTY_INPUT} for
     *         an empty table, or an invariant violation for incomplete coverage.
     */
    public SchedulePlan finish() {
        if (!isFinished()) {
            throw new SimulationException(
                    SimProcess.REASON_INVARIANT_VIOLATION,
                    algorithm + ": run ended with " + completed + " of " + byArrival.length + " processes completed"
            );
        }
        double mean = TurnaroundMetric.meanTurnaround(Arrays.asList(byArrival));

        Integer[] completionById = new Integer[byArrival.length];
        for (SimProcess process : byArrival) {
            completionById[process.id()] = process.completionTime();
        }
        logger.debug("{}: mean turnaround {}", algorithm, mean);
        return SchedulePlan.builder()
                .algorithm(algorithm)
                .meanTurnaround(mean)
                .completionTimes(Arrays.asList(completionById))
                .build();
    }

    private void complete(SimProcess process) {
        process.complete(now);
        completed++;
        logger.trace("{}: P{} completed at {}", algorithm, process.id(), now);
    }
}
