package com.purchasingpower.pipelinehealth.analysis;

import java.util.List;

/**
 * Outcome of inspecting failed runs.
 *
 * @param failures Failed jobs, grouped by run in run order
 * @param skippedRuns Failed runs whose jobs could not be fetched and contributed nothing
 */
public record FailureInspection(List<FailureRecord> failures, int skippedRuns) {

    public static FailureInspection empty() {
        return new FailureInspection(List.of(), 0);
    }

    public FailureInspection {
        failures = List.copyOf(failures);
    }

    public boolean isDegraded() {
        return skippedRuns > 0;
    }
}
