package org.Aayush.cpusim.scheduling;

/**
 * First-come, first-served. Non-preemptive; the arrival-sorted run order is the
 * ready queue.
 */
public final class FcfsScheduler implements Scheduler {

    @Override
    public SchedulingAlgorithm algorithm() {
        return SchedulingAlgorithm.FCFS;
    }

    @Override
    public void execute(SimulationRun run) {
        for (int index = 0; index < run.size(); index++) {
            run.advanceTo(run.process(index).arrivalTime());
            run.admitArrived();
            run.runToCompletion(index);
        }
    }
}
