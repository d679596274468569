package org.Aayush.cpusim.scheduling;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Scheduling discipline selector. Declaration order is report order.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public enum SchedulingAlgorithm {
    FCFS("FCFS"),
    LCFS_NON_PREEMPTIVE("LCFS (NP)"),
    LCFS_PREEMPTIVE("LCFS (P)"),
    ROUND_ROBIN("RR"),
    SJF("SJF");

    /** Short label used in reports. */
    private final String label;
}
