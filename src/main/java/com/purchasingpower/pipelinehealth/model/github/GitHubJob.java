package com.purchasingpower.pipelinehealth.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job of a workflow run as returned by the run's {@code jobs_url}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubJob(
    Long id,
    String name,
    String status,
    String conclusion,
    @JsonProperty("completed_at") String completedAt
) {
}
