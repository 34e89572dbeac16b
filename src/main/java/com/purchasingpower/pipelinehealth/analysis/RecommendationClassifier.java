package com.purchasingpower.pipelinehealth.analysis;

import com.purchasingpower.pipelinehealth.configuration.AnalysisProperties;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Applies the threshold rules to a summary and a failure tally.
 *
 * <p>Rules run in a fixed order and their output keeps that order:
 * <ol>
 *   <li>success rate below threshold - high</li>
 *   <li>average duration above threshold - medium</li>
 *   <li>one entry per job name failing at least the minimum count, in order of first failure - high</li>
 * </ol>
 *
 * @since 1.0.0
 */
@Component
public class RecommendationClassifier {

    private final AnalysisProperties thresholds;

    public RecommendationClassifier(AppProperties props) {
        this.thresholds = props.getAnalysis();
    }

    public List<Recommendation> classify(RunSummary summary, List<FailureRecord> failures) {
        List<Recommendation> recommendations = new ArrayList<>();

        if (summary.successRate() < thresholds.getSuccessRateThreshold()) {
            recommendations.add(new Recommendation(
                RecommendationType.SUCCESS_RATE,
                RecommendationPriority.HIGH,
                "Low success rate (" + summary.formattedSuccessRate() + "). "
                    + "Review recent failures and consider improving test coverage."));
        }

        if (summary.averageDurationMinutes() > thresholds.getDurationThresholdMinutes()) {
            recommendations.add(new Recommendation(
                RecommendationType.DURATION,
                RecommendationPriority.MEDIUM,
                "Long average pipeline duration (" + summary.formattedAverageDuration() + "). "
                    + "Consider optimizing pipeline steps or using caching."));
        }

        for (Map.Entry<String, Integer> entry : countByJobName(failures).entrySet()) {
            if (entry.getValue() >= thresholds.getFailurePatternMinCount()) {
                recommendations.add(new Recommendation(
                    RecommendationType.FAILURE_PATTERN,
                    RecommendationPriority.HIGH,
                    "Job '" + entry.getKey() + "' failed " + entry.getValue()
                        + " times. Review and fix recurring issues."));
            }
        }

        return recommendations;
    }

    private static Map<String, Integer> countByJobName(List<FailureRecord> failures) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FailureRecord failure : failures) {
            counts.merge(failure.jobName(), 1, Integer::sum);
        }
        return counts;
    }
}
