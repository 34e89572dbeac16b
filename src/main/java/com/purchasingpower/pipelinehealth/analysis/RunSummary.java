package com.purchasingpower.pipelinehealth.analysis;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Aggregate statistics over the analyzed runs.
 *
 * <p>{@code successful + failed + cancelled <= total}; runs with any other
 * outcome are only counted in {@code totalRuns}.
 */
public record RunSummary(
    int totalRuns,
    int successfulRuns,
    int failedRuns,
    int cancelledRuns,
    double successRate,
    double averageDurationMinutes
) {

    /**
     * Success rate to one decimal, e.g. {@code 72.5%}.
     */
    public String formattedSuccessRate() {
        return oneDecimal(successRate) + "%";
    }

    /**
     * Average duration to one decimal, e.g. {@code 12.0 minutes}.
     */
    public String formattedAverageDuration() {
        return oneDecimal(averageDurationMinutes) + " minutes";
    }

    /**
     * Rounds the exact binary value half-even, so {@code 1.25} prints {@code 1.2}.
     */
    static String oneDecimal(double value) {
        return new BigDecimal(value).setScale(1, RoundingMode.HALF_EVEN).toPlainString();
    }
}
