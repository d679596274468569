package org.Aayush.cpusim.metric;

import lombok.experimental.UtilityClass;
import org.Aayush.cpusim.core.SimulationException;
import org.Aayush.cpusim.process.SimProcess;

import java.util.Collection;
import java.util.Objects;

/**
 * Mean turnaround over a fully completed run.
 */
@UtilityClass
public final class TurnaroundMetric {
    public static final String REASON_EMPTY_INPUT = "EMPTY_INPUT";

    /**
     * Computes the arithmetic mean of {@code completionTime - arrivalTime}.
     *
     * @param processes completed working copies.
     * @return mean turnaround in ticks.
     * @throws SimulationException with {@link #REASON_EMPTY_INPUT} for zero processes,
     *         or {@link SimProcess#REASON_INVARIANT_VIOLATION} when a process has no
     *         completion time.
     */
    public static double meanTurnaround(Collection<SimProcess> processes) {
        Objects.requireNonNull(processes, "processes");
        if (processes.isEmpty()) {
            throw new SimulationException(REASON_EMPTY_INPUT, "mean turnaround undefined for zero processes");
        }
        long total = 0L;
        for (SimProcess process : processes) {
            total += process.turnaroundTime();
        }
        return (double) total / processes.size();
    }
}
