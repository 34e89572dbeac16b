package com.purchasingpower.pipelinehealth.service.impl;

import com.purchasingpower.pipelinehealth.analysis.AnalysisErrors;
import com.purchasingpower.pipelinehealth.analysis.AnalysisRequest;
import com.purchasingpower.pipelinehealth.analysis.AnalysisResult;
import com.purchasingpower.pipelinehealth.analysis.FailureInspection;
import com.purchasingpower.pipelinehealth.analysis.FailureInspector;
import com.purchasingpower.pipelinehealth.analysis.Recommendation;
import com.purchasingpower.pipelinehealth.analysis.RecommendationClassifier;
import com.purchasingpower.pipelinehealth.analysis.RunStatisticsAggregator;
import com.purchasingpower.pipelinehealth.analysis.RunSummary;
import com.purchasingpower.pipelinehealth.analysis.RunWindowFilter;
import com.purchasingpower.pipelinehealth.ci.CiProvider;
import com.purchasingpower.pipelinehealth.ci.PipelineRun;
import com.purchasingpower.pipelinehealth.configuration.AppProperties;
import com.purchasingpower.pipelinehealth.exception.CiProviderException;
import com.purchasingpower.pipelinehealth.service.PipelineAnalysisService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Linear analysis pipeline:
 * verify access, list runs, filter to the window, aggregate,
 * inspect failures, classify.
 *
 * <p>Any failure up to and including the run listing ends the call with an
 * error result. Job listing failures during inspection are absorbed by
 * {@link FailureInspector}.
 */
@Slf4j
@Service
public class PipelineAnalysisServiceImpl implements PipelineAnalysisService {

    private final CiProvider ciProvider;
    private final RunWindowFilter windowFilter;
    private final RunStatisticsAggregator aggregator;
    private final FailureInspector failureInspector;
    private final RecommendationClassifier classifier;
    private final AppProperties props;

    public PipelineAnalysisServiceImpl(CiProvider ciProvider,
                                       RunWindowFilter windowFilter,
                                       RunStatisticsAggregator aggregator,
                                       FailureInspector failureInspector,
                                       RecommendationClassifier classifier,
                                       AppProperties props) {
        this.ciProvider = ciProvider;
        this.windowFilter = windowFilter;
        this.aggregator = aggregator;
        this.failureInspector = failureInspector;
        this.classifier = classifier;
        this.props = props;
    }

    @Override
    public AnalysisResult analyze(AnalysisRequest request) {
        if (request == null || request.project() == null) {
            return AnalysisResult.error(AnalysisErrors.MISSING_PARAMETERS);
        }

        log.info("Analyzing pipeline health of {} (workflow={}, run={}, days={})",
            request.project(), request.workflowId(), request.runId(), request.windowDays());

        try {
            try {
                ciProvider.verifyAccess(request.project());
            } catch (CiProviderException e) {
                log.error("Access verification failed for {}: {}", request.project(), e.getMessage());
                return AnalysisResult.error(AnalysisErrors.ACCESS_FAILED);
            }

            List<PipelineRun> runs;
            try {
                runs = ciProvider.listRuns(request.project(), request.workflowId(), request.runId());
            } catch (CiProviderException e) {
                log.error("Listing runs failed for {}: {}", request.project(), e.getMessage());
                return AnalysisResult.error(AnalysisErrors.FETCH_FAILED + e.getMessage());
            }

            runs = windowFilter.apply(runs, request.windowDays(), request.isSingleRun());
            if (runs.isEmpty()) {
                log.info("No runs to analyze for {}", request.project());
                return AnalysisResult.error(AnalysisErrors.NO_RUNS);
            }

            RunSummary summary = aggregator.summarize(runs);
            FailureInspection inspection = failureInspector.inspect(runs, summary.failedRuns());
            List<Recommendation> recommendations = classifier.classify(summary, inspection.failures());

            log.info("Analysis of {} done: {} runs, success rate {}, {} recommendations, {} skipped runs",
                request.project(), summary.totalRuns(), summary.formattedSuccessRate(),
                recommendations.size(), inspection.skippedRuns());

            return AnalysisResult.success(summary, recommendations, inspection);

        } catch (Exception e) {
            log.error("Pipeline analysis failed for {}", request.project(), e);
            return AnalysisResult.error(AnalysisErrors.ANALYSIS_FAILED + e.getMessage());
        }
    }

    @Override
    public int getDefaultWindowDays() {
        return props.getAnalysis().getDefaultWindowDays();
    }
}
