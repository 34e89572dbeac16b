package com.purchasingpower.pipelinehealth.analysis;

import java.time.Instant;

/**
 * A failed job inside a failed run.
 */
public record FailureRecord(String jobName, Instant failedAt) {
}
