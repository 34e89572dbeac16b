package com.purchasingpower.pipelinehealth.ci;

import java.time.Instant;

/**
 * One job within a run. Job names are not unique across runs.
 *
 * @param completedAt Null while the job has not completed
 */
public record PipelineJob(String name, RunOutcome outcome, Instant completedAt) {

    public PipelineJob {
        outcome = outcome == null ? RunOutcome.OTHER : outcome;
    }
}
