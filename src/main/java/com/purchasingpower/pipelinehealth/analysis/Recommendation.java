package com.purchasingpower.pipelinehealth.analysis;

/**
 * A prioritized finding derived from the run statistics or the failure tally.
 */
public record Recommendation(RecommendationType type, RecommendationPriority priority, String message) {
}
