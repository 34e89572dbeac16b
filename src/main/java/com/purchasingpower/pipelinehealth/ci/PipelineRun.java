package com.purchasingpower.pipelinehealth.ci;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * One execution of a CI workflow, as fetched from the provider.
 *
 * @param id Provider run id
 * @param name Workflow name, informational only
 * @param outcome Conclusion of the run
 * @param createdAt When the run was created
 * @param updatedAt When the run was last updated
 * @param jobsUrl Reference used to list the run's jobs
 */
public record PipelineRun(
    String id,
    String name,
    RunOutcome outcome,
    Instant createdAt,
    Instant updatedAt,
    String jobsUrl
) {

    public PipelineRun {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        outcome = outcome == null ? RunOutcome.OTHER : outcome;
    }

    /**
     * Wall-clock time between creation and last update, in minutes.
     */
    public double durationMinutes() {
        return Duration.between(createdAt, updatedAt).getSeconds() / 60.0;
    }
}
