package com.purchasingpower.pipelinehealth.analysis;

/**
 * Error descriptions returned to callers when an analysis cannot complete.
 */
public final class AnalysisErrors {

    public static final String MISSING_PARAMETERS =
        "Missing required parameters: repo_owner and repo_name are required";
    public static final String ACCESS_FAILED = "Repository access verification failed";
    public static final String FETCH_FAILED = "Failed to fetch pipeline data: ";
    public static final String NO_RUNS = "No pipeline runs found for the specified criteria";
    public static final String ANALYSIS_FAILED = "Pipeline analysis failed: ";

    private AnalysisErrors() {
    }
}
