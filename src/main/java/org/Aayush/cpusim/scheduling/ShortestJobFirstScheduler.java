package org.Aayush.cpusim.scheduling;

import org.Aayush.cpusim.process.SimProcess;

import java.util.Comparator;

/**
 * Non-preemptive shortest job first.
 *
 * <p>Every decision point rescans all processes and picks the ready one with the
 * least remaining time; ties go to the earlier arrival, then the lower input id.</p>
 */
public final class ShortestJobFirstScheduler implements Scheduler {
    static final Comparator<SimProcess> SELECTION_ORDER = Comparator
            .comparingInt(SimProcess::remainingTime)
            .thenComparingInt(SimProcess::arrivalTime)
            .thenComparingInt(SimProcess::id);

    @Override
    public SchedulingAlgorithm algorithm() {
        return SchedulingAlgorithm.SJF;
    }

    @Override
    public void execute(SimulationRun run) {
        while (!run.isFinished()) {
            run.admitArrived();
            int shortest = -1;
            for (int index = 0; index < run.size(); index++) {
                SimProcess candidate = run.process(index);
                if (!candidate.isReadyAt(run.now())) {
                    continue;
                }
                if (shortest < 0 || SELECTION_ORDER.compare(candidate, run.process(shortest)) < 0) {
                    shortest = index;
                }
            }

            if (shortest < 0) {
                run.idleAdvance();
            } else {
                run.runToCompletion(shortest);
            }
        }
    }
}
