package org.Aayush.cpusim.scheduling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Result of one algorithm run over a process table.
 *
 * <p>A plan only exists for a fully completed run: every process has a completion
 * time, listed by input-order id.</p>
 */
@Value
@Builder
public class SchedulePlan {
    /** Discipline that produced this plan. */
    SchedulingAlgorithm algorithm;
    /** Mean of completion minus arrival over all processes. */
    double meanTurnaround;
    /** Completion tick per process id. */
    @Singular("completionTime")
    List<Integer> completionTimes;

    /**
     * Completion tick of the process with input-order id {@code processId}.
     */
    public int completionTimeOf(int processId) {
        return completionTimes.get(processId);
    }

    public int processCount() {
        return completionTimes.size();
    }
}
