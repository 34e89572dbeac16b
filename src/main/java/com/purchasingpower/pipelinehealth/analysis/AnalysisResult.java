package com.purchasingpower.pipelinehealth.analysis;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Result of one analysis call: either the full health report or a single
 * error description. Never both.
 *
 * @since 1.0.0
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AnalysisResult {

    private final boolean success;
    private final RunSummary summary;
    private final List<Recommendation> recommendations;
    private final List<FailureRecord> recentFailures;
    private final int skippedRuns;
    private final String error;

    public static AnalysisResult success(RunSummary summary,
                                         List<Recommendation> recommendations,
                                         FailureInspection inspection) {
        return new AnalysisResult(true, summary,
            List.copyOf(recommendations),
            inspection.failures(),
            inspection.skippedRuns(),
            null);
    }

    public static AnalysisResult error(String error) {
        return new AnalysisResult(false, null, List.of(), List.of(), 0, error);
    }
}
