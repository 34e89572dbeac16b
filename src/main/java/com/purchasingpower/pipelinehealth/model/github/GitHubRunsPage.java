package com.purchasingpower.pipelinehealth.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubRunsPage(
    @JsonProperty("total_count") int totalCount,
    @JsonProperty("workflow_runs") List<GitHubWorkflowRun> workflowRuns
) {
}
