package com.purchasingpower.pipelinehealth.model.github;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record GitHubJobsPage(
    @JsonProperty("total_count") int totalCount,
    List<GitHubJob> jobs
) {
}
