package org.Aayush.cpusim.scheduling;

import org.Aayush.cpusim.process.ProcessTable;

/**
 * One scheduling discipline.
 *
 * <p>Implementations drive a private {@link SimulationRun} until every process has
 * completed. They hold no per-run state, so one instance may serve concurrent runs.</p>
 */
public interface Scheduler {

    /**
     * Discipline implemented by this scheduler.
     */
    SchedulingAlgorithm algorithm();

    /**
     * Drives {@code run} until {@link SimulationRun#isFinished()}.
     *
     * @param run private working copy, already sorted by arrival.
     */
    void execute(SimulationRun run);

    /**
     * Runs this discipline over a private copy of {@code table}.
     *
     * @param table immutable input table, left untouched.
     * @return completed plan.
     * @throws org.Aayush.cpusim.core.SimulationException on empty input or broken invariants.
     */
    default SchedulePlan schedule(ProcessTable table) {
        SimulationRun run = SimulationRun.start(algorithm(), table);
        execute(run);
        return run.finish();
    }
}
