package com.purchasingpower.pipelinehealth.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

/**
 * Thresholds and limits for pipeline health analysis.
 *
 * <p>Defaults match the rules the analysis has always applied; they can be
 * tuned per deployment under {@code app.analysis}:
 * <pre>
 * app:
 *   analysis:
 *     default-window-days: 7
 *     success-rate-threshold: 80.0
 *     duration-threshold-minutes: 30.0
 *     failure-pattern-min-count: 2
 *     job-fetch-concurrency: 4
 *     job-fetch-timeout: 30s
 * </pre>
 */
@Data
public class AnalysisProperties {

    /**
     * Trailing window applied when a request does not name one.
     * Zero or negative disables the window.
     */
    private int defaultWindowDays = 7;

    /**
     * Success rates strictly below this percentage raise a high priority finding.
     */
    private double successRateThreshold = 80.0;

    /**
     * Average durations strictly above this many minutes raise a medium priority finding.
     */
    private double durationThresholdMinutes = 30.0;

    /**
     * Minimum failures of the same job name before it is reported as a pattern.
     */
    @Min(1)
    private int failurePatternMinCount = 2;

    /**
     * Upper bound on concurrent job listings while inspecting failed runs.
     */
    @Min(1)
    private int jobFetchConcurrency = 4;

    @NotNull
    private Duration jobFetchTimeout = Duration.ofSeconds(30);
}
