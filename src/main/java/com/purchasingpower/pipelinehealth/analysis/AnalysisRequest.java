package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.ci.ProjectRef;

/**
 * A request to analyze a project's pipeline health.
 *
 * @param project Project to analyze
 * @param workflowId Optional workflow narrowing the runs listed
 * @param runId Optional single run; when set, the workflow and the day window are ignored
 * @param windowDays Trailing window in days; zero or negative means unbounded
 */
public record AnalysisRequest(ProjectRef project, String workflowId, String runId, int windowDays) {

    public boolean isSingleRun() {
        return runId != null && !runId.isBlank();
    }
}
