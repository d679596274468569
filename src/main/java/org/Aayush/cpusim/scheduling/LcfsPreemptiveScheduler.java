package org.Aayush.cpusim.scheduling;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import org.Aayush.cpusim.process.SimProcess;

/**
 * Last-come, first-served with preemption.
 *
 * <p>Time advances one tick at a time. The top of the stack runs; processes arriving
 * meanwhile are pushed above it and take the CPU on the next tick.</p>
 */
public final class LcfsPreemptiveScheduler implements Scheduler {

    @Override
    public SchedulingAlgorithm algorithm() {
        return SchedulingAlgorithm.LCFS_PREEMPTIVE;
    }

    @Override
    public void execute(SimulationRun run) {
        IntArrayList stack = new IntArrayList(run.size());
        run.admitArrived(stack::push);
        while (!run.isFinished()) {
            if (stack.isEmpty()) {
                run.idleAdvance();
                run.admitArrived(stack::push);
                continue;
            }

            int top = stack.topInt();
            SimProcess process = run.process(top);
            if (process.isCompleted()) {
                // Stale entry; admission is once per process so this only guards.
                stack.popInt();
                continue;
            }

            run.runFor(top, 1);
            if (process.isCompleted()) {
                stack.popInt();
            }
            if (run.admitArrived(stack::push) > 0 && !process.isCompleted()) {
                run.preempt(top);
            }
        }
    }
}
