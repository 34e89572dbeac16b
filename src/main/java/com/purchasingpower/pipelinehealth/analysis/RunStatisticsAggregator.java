package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.ci.RunOutcome;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Computes outcome counts, success rate and average duration over a run window.
 *
 * @since 1.0.0
 */
@Component
public class RunStatisticsAggregator {

    /**
     * @param runs Non-empty, already filtered runs
     * @throws IllegalArgumentException if {@code runs} is empty
     */
    public RunSummary summarize(List<PipelineRun> runs) {
        if (runs.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty run window");
        }

        int total = runs.size();
        int successful = count(runs, RunOutcome.SUCCESS);
        int failed = count(runs, RunOutcome.FAILURE);
        int cancelled = count(runs, RunOutcome.CANCELLED);

        // Denominator is every run, including those that have not concluded
        double successRate = 100.0 * successful / total;

        double averageDuration = runs.stream()
            .filter(run -> run.outcome().isTimed())
            .mapToDouble(PipelineRun::durationMinutes)
            .average()
            .orElse(0.0);

        return new RunSummary(total, successful, failed, cancelled, successRate, averageDuration);
    }

    private static int count(List<PipelineRun> runs, RunOutcome outcome) {
        return (int) runs.stream()
            .filter(run -> run.outcome() == outcome)
            .count();
    }
}
