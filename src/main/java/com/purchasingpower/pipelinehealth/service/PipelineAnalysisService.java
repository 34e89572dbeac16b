package com.purchasingpower.pipelinehealth.service;

import com.purchasingpower.pipelinehealth.analysis.AnalysisRequest;
import com.purchasingpower.pipelinehealth.analysis.AnalysisResult;

/**
 * Analyzes the health of a project's CI pipeline.
 */
public interface PipelineAnalysisService {

    /**
     * Run one analysis to completion.
     *
     * <p>Never throws for provider or data problems: every terminal failure is
     * returned as {@link AnalysisResult#error(String)}.
     *
     * @param request What to analyze
     * @return The health report, or the reason it could not be produced
     */
    AnalysisResult analyze(AnalysisRequest request);

    /**
     * Window applied when a caller does not specify one.
     */
    int getDefaultWindowDays();
}
