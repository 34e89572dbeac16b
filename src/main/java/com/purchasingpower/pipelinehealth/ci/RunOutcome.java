package com.purchasingpower.pipelinehealth.ci;

/**
 * Outcome of a run or job.
 *
 * <p>Only {@code success}, {@code failure} and {@code cancelled} are tracked.
 * Anything else, including a run that has not concluded yet, is {@link #OTHER}.
 */
public enum RunOutcome {
    SUCCESS,
    FAILURE,
    CANCELLED,
    OTHER;

    /**
     * Whether the outcome contributes a duration sample.
     */
    public boolean isTimed() {
        return this == SUCCESS || this == FAILURE;
    }

    /**
     * Map a provider conclusion by exact match. Null and unknown values never fail.
     */
    public static RunOutcome fromWire(String conclusion) {
        if (conclusion == null) {
            return OTHER;
        }
        return switch (conclusion) {
            case "success" -> SUCCESS;
            case "failure" -> FAILURE;
            case "cancelled" -> CANCELLED;
            default -> OTHER;
        };
    }
}
