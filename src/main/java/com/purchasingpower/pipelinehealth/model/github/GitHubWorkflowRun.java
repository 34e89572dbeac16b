package com.purchasingpower.pipelinehealth.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Workflow run as returned by {@code GET /repos/{owner}/{repo}/actions/runs}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubWorkflowRun(
    Long id,
    String name,
    String status,
    String conclusion,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("updated_at") String updatedAt,
    @JsonProperty("jobs_url") String jobsUrl
) {
}
