package org.Aayush.cpusim.process;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.Aayush.cpusim.core.SimulationException;

import java.util.Objects;

/**
 * Mutable per-run working copy of one {@link ProcessSpec}.
 *
 * <p>Every mutator enforces the run invariants itself: a process is admitted once,
 * never served beyond its burst and completed exactly once. Violations abort the run
 * with {@link #REASON_INVARIANT_VIOLATION}.</p>
 *
 * <p>Not thread-safe; instances are confined to a single run.</p>
 */
@Getter
@Accessors(fluent = true)
public final class SimProcess {
    public static final String REASON_INVARIANT_VIOLATION = "SIMULATION_INVARIANT_VIOLATION";
    public static final int UNSET = -1;

    private final ProcessSpec spec;
    private int remainingTime;
    private int completionTime = UNSET;
    private AdmissionState state = AdmissionState.NOT_ARRIVED;

    public SimProcess(ProcessSpec spec) {
        this.spec = Objects.requireNonNull(spec, "spec");
        this.remainingTime = spec.getBurstTime();
    }

    public int id() {
        return spec.getId();
    }

    public int arrivalTime() {
        return spec.getArrivalTime();
    }

    public int burstTime() {
        return spec.getBurstTime();
    }

    public boolean isCompleted() {
        return state == AdmissionState.COMPLETED;
    }

    /**
     * Readiness predicate: arrived by {@code now} and not completed.
     */
    public boolean isReadyAt(int now) {
        return spec.getArrivalTime() <= now && state != AdmissionState.COMPLETED;
    }

    /**
     * Moves the process into the ready structure. Allowed once per run.
     */
    public void admit() {
        if (state != AdmissionState.NOT_ARRIVED) {
            throw violation("process " + id() + " admitted twice (state " + state + ")");
        }
        state = AdmissionState.READY;
    }

    /**
     * Serves {@code ticks} units of CPU; the process must be admitted and unfinished.
     */
    public void serve(int ticks) {
        if (state != AdmissionState.READY && state != AdmissionState.RUNNING) {
            throw violation("process " + id() + " scheduled while " + state);
        }
        if (ticks <= 0 || ticks > remainingTime) {
            throw violation("process " + id() + " served " + ticks + " ticks with " + remainingTime + " remaining");
        }
        state = AdmissionState.RUNNING;
        remainingTime -= ticks;
    }

    /**
     * Returns a preempted process to the waiting side of the ready structure.
     */
    public void preempt() {
        if (state != AdmissionState.RUNNING || remainingTime == 0) {
            throw violation("process " + id() + " preempted while " + state + " with " + remainingTime + " remaining");
        }
        state = AdmissionState.READY;
    }

    /**
     * Records completion at tick {@code now}. Requires all burst time served.
     */
    public void complete(int now) {
        if (state == AdmissionState.COMPLETED) {
            throw violation("process " + id() + " completed twice");
        }
        if (remainingTime != 0) {
            throw violation("process " + id() + " completed with " + remainingTime + " ticks remaining");
        }
        if (now - spec.getArrivalTime() < spec.getBurstTime()) {
            throw violation("process " + id() + " completed at " + now + " before arrival + burst");
        }
        completionTime = now;
        state = AdmissionState.COMPLETED;
    }

    /**
     * Turnaround of a completed process.
     */
    public int turnaroundTime() {
        if (state != AdmissionState.COMPLETED) {
            throw violation("process " + id() + " has no completion time");
        }
        return completionTime - spec.getArrivalTime();
    }

    private static SimulationException violation(String message) {
        return new SimulationException(REASON_INVARIANT_VIOLATION, message);
    }

    @Override
    public String toString() {
        return "P" + id() + "[" + state + ", remaining=" + remainingTime + ", completion=" + completionTime + "]";
    }
}
