package com.purchasingpower.pipelinehealth.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pipeline analysis request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzePipelineRequest {

    private String repoOwner;
    private String repoName;
    private String workflowId;
    private String runId;

    /**
     * Trailing window in days. Null uses the configured default, zero or less means unbounded.
     */
    private Integer days;
}
