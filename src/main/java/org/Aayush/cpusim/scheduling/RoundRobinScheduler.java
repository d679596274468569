package org.Aayush.cpusim.scheduling;

import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import org.Aayush.cpusim.process.SimProcess;

/**
 * Round Robin with a fixed time quantum.
 *
 * <p>A preempted process goes to the rear of the queue only after every process
 * that arrived during its quantum has been enqueued.</p>
 */
public final class RoundRobinScheduler implements Scheduler {
    private final int quantum;

    /**
     * @param quantum time slice in ticks, must be {@code > 0}.
     */
    public RoundRobinScheduler(int quantum) {
        if (quantum <= 0) {
            throw new IllegalArgumentException("quantum must be > 0");
        }
        this.quantum = quantum;
    }

    @Override
    public SchedulingAlgorithm algorithm() {
        return SchedulingAlgorithm.ROUND_ROBIN;
    }

    @Override
    public void execute(SimulationRun run) {
        IntArrayFIFOQueue queue = new IntArrayFIFOQueue(Math.max(1, run.size()));
        while (!run.isFinished()) {
            run.admitArrived(queue::enqueue);
            if (queue.isEmpty()) {
                run.idleAdvance();
                continue;
            }

            int index = queue.dequeueInt();
            SimProcess process = run.process(index);
            if (process.remainingTime() <= quantum) {
                run.runToCompletion(index);
                continue;
            }

            run.runFor(index, quantum);
            run.admitArrived(queue::enqueue);
            run.preempt(index);
            queue.enqueue(index);
        }
    }
}
