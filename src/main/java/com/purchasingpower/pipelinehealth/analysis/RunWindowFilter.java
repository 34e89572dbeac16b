package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Restricts runs to those created inside a trailing window of days.
 *
 * @since 1.0.0
 */
@Component
@RequiredArgsConstructor
public class RunWindowFilter {

    private final Clock clock;

    /**
     * Keep runs created strictly after {@code now - windowDays}.
     *
     * @param runs Runs as listed by the provider
     * @param windowDays Window size; zero or negative returns the runs unchanged
     * @param singleRun Whether the runs were selected by run id, in which case they are never filtered
     */
    public List<PipelineRun> apply(List<PipelineRun> runs, int windowDays, boolean singleRun) {
        if (singleRun || windowDays <= 0) {
            return runs;
        }
        Instant cutoff = clock.instant().minus(Duration.ofDays(windowDays));
        return runs.stream()
            .filter(run -> run.createdAt().isAfter(cutoff))
            .toList();
    }
}
