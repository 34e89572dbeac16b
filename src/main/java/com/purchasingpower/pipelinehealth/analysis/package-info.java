/**
 * Pipeline health analysis engine.
 *
 * <p>Turns a window of pipeline runs into a health summary, a tally of
 * failing jobs, and prioritized recommendations:
 * <ul>
 *   <li>{@code RunWindowFilter} - Keeps runs created inside the trailing window</li>
 *   <li>{@code RunStatisticsAggregator} - Outcome counts, success rate, average duration</li>
 *   <li>{@code FailureInspector} - Failed jobs of failed runs, fetched concurrently</li>
 *   <li>{@code RecommendationClassifier} - Threshold rules producing recommendations</li>
 * </ul>
 *
 * <p>The pieces are composed by {@code PipelineAnalysisService}.
 *
 * @since 1.0.0
 */
package com.purchasingpower.pipelinehealth.analysis;
