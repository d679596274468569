package org.Aayush.cpusim.core;

import lombok.Getter;

import java.util.Objects;

/**
 * Failure of a simulation request, tagged with a deterministic reason code.
 *
 * <p>Reason codes are owned by the component that detects the failure:</p>
 * <ul>
 * <li>{@code ProcessTable.REASON_INVALID_PROCESS_SPEC} / {@code REASON_CAPACITY_EXCEEDED}:
 * rejected input, raised before any algorithm runs.</li>
 * <li>{@code TurnaroundMetric.REASON_EMPTY_INPUT}: mean turnaround over zero processes.</li>
 * <li>{@code SimProcess.REASON_INVARIANT_VIOLATION}: a run tried to admit, serve or complete
 * a process out of order, or ended with processes unscheduled.</li>
 * <li>{@link SimulationConfig#REASON_INVALID_CONFIGURATION}, {@link SimulationCore#REASON_ALGORITHM_REQUIRED},
 * {@link SimulationCore#REASON_TABLE_REQUIRED} and {@code ProcessTableLoader.REASON_INPUT_FORMAT}.</li>
 * </ul>
 *
 * <p>A thrown instance always aborts the whole algorithm run; no partial plan exists
 * alongside it. The message is {@code [REASON] detail}.</p>
 */
@Getter
public final class SimulationException extends RuntimeException {
    private final String reasonCode;

    /**
     * @param reasonCode non-blank reason code.
     * @param message failure detail.
     */
    public SimulationException(String reasonCode, String message) {
        this(reasonCode, message, null);
    }

    /**
     * @param reasonCode non-blank reason code.
     * @param message failure detail.
     * @param cause underlying cause, may be {@code null}.
     */
    public SimulationException(String reasonCode, String message, Throwable cause) {
        super(prefixed(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * Whether this failure carries {@code code}.
     */
    public boolean hasReason(String code) {
        return reasonCode.equals(code);
    }

    private static String prefixed(String reasonCode, String message) {
        Objects.requireNonNull(reasonCode, "reasonCode");
        if (reasonCode.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return "[" + reasonCode + "] " + Objects.requireNonNull(message, "message");
    }
}
