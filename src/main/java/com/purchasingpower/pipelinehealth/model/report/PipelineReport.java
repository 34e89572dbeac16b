package com.purchasingpower.pipelinehealth.model.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.purchasingpower.pipelinehealth.analysis.AnalysisResult;
import com.purchasingpower.pipelinehealth.analysis.FailureRecord;
import com.purchasingpower.pipelinehealth.analysis.Recommendation;
import com.purchasingpower.pipelinehealth.analysis.RunSummary;
import com.purchasingpower.pipelinehealth.ci.CiTimestamps;

import java.util.List;

/**
 * Wire form of a successful analysis, shared by the REST API and the
 * {@code analyze_pipeline_results} tool.
 */
public record PipelineReport(
    Summary summary,
    List<Recommendation> recommendations,
    @JsonProperty("recent_failures") List<Failure> recentFailures,
    @JsonProperty("skipped_runs") int skippedRuns
) {

    /**
     * @throws IllegalArgumentException if the result is an error
     */
    public static PipelineReport from(AnalysisResult result) {
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("No report for a failed analysis: " + result.getError());
        }
        return new PipelineReport(
            Summary.from(result.getSummary()),
            result.getRecommendations(),
            result.getRecentFailures().stream().map(Failure::from).toList(),
            result.getSkippedRuns());
    }

    public record Summary(
        @JsonProperty("total_runs") int totalRuns,
        @JsonProperty("successful_runs") int successfulRuns,
        @JsonProperty("failed_runs") int failedRuns,
        @JsonProperty("cancelled_runs") int cancelledRuns,
        @JsonProperty("success_rate") String successRate,
        @JsonProperty("average_duration") String averageDuration
    ) {

        static Summary from(RunSummary summary) {
            return new Summary(
                summary.totalRuns(),
                summary.successfulRuns(),
                summary.failedRuns(),
                summary.cancelledRuns(),
                summary.formattedSuccessRate(),
                summary.formattedAverageDuration());
        }
    }

    public record Failure(
        @JsonProperty("job_name") String jobName,
        @JsonProperty("failed_at") String failedAt
    ) {

        static Failure from(FailureRecord record) {
            return new Failure(record.jobName(), CiTimestamps.format(record.failedAt()));
        }
    }
}
