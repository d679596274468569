package org.Aayush.cpusim.scheduling;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * Last-come, first-served without preemption.
 *
 * <p>Arrived processes are pushed onto a stack once each; the most recently arrived
 * one is popped and run to completion.</p>
 */
public final class LcfsNonPreemptiveScheduler implements Scheduler {

    @Override
    public SchedulingAlgorithm algorithm() {
        return SchedulingAlgorithm.LCFS_NON_PREEMPTIVE;
    }

    @Override
    public void execute(SimulationRun run) {
        IntArrayList stack = new IntArrayList(run.size());
        while (!run.isFinished()) {
            run.admitArrived(stack::push);
            if (stack.isEmpty()) {
                run.idleAdvance();
                continue;
            }
            run.runToCompletion(stack.popInt());
        }
    }
}
