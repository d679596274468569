package org.Aayush.cpusim.process;

/**
 * Per-run lifecycle of one working-copy process.
 *
 * <p>Transitions are one-way: {@code NOT_ARRIVED -> READY -> RUNNING -> COMPLETED}.
 * Preemptive disciplines move a process between {@code RUNNING} and {@code READY}
 * while it stays inside the ready structure.</p>
 */
public enum AdmissionState {
    /** Not yet handed to the ready structure. */
    NOT_ARRIVED,
    /** Admitted to the ready structure, waiting for the CPU. */
    READY,
    /** Currently holding the CPU. */
    RUNNING,
    /** Finished; completion time recorded. */
    COMPLETED
}
