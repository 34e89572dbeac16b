package com.purchasingpower.pipelinehealth.api;

import com.purchasingpower.pipelinehealth.analysis.AnalysisErrors;
import com.purchasingpower.pipelinehealth.analysis.AnalysisRequest;
import com.purchasingpower.pipelinehealth.analysis.AnalysisResult;
import com.purchasingpower.pipelinehealth.ci.ProjectRef;
import com.purchasingpower.pipelinehealth.model.report.PipelineReport;
import com.purchasingpower.pipelinehealth.service.PipelineAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for pipeline health analysis.
 *
 * <p>Analysis failures (no access, provider errors, no runs) are returned as
 * an error payload with status 200; only missing parameters are a 400.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipelines")
@RequiredArgsConstructor
public class PipelineAnalysisController {

    private final PipelineAnalysisService analysisService;

    /**
     * Analyze a repository's pipeline runs.
     *
     * POST /api/v1/pipelines/analyze
     */
    @PostMapping("/analyze")
    public ResponseEntity<AnalyzePipelineResponse> analyze(@RequestBody AnalyzePipelineRequest request) {
        try {
            if (isBlank(request.getRepoOwner()) || isBlank(request.getRepoName())) {
                return ResponseEntity.badRequest()
                    .body(AnalyzePipelineResponse.error(AnalysisErrors.MISSING_PARAMETERS));
            }

            int days = request.getDays() != null ? request.getDays() : analysisService.getDefaultWindowDays();
            AnalysisRequest analysisRequest = new AnalysisRequest(
                new ProjectRef(request.getRepoOwner().trim(), request.getRepoName().trim()),
                blankToNull(request.getWorkflowId()),
                blankToNull(request.getRunId()),
                days);

            AnalysisResult result = analysisService.analyze(analysisRequest);
            if (!result.isSuccess()) {
                return ResponseEntity.ok(AnalyzePipelineResponse.error(result.getError()));
            }
            return ResponseEntity.ok(AnalyzePipelineResponse.success(PipelineReport.from(result)));

        } catch (Exception e) {
            log.error("Pipeline analysis request failed", e);
            return ResponseEntity.internalServerError()
                .body(AnalyzePipelineResponse.error(AnalysisErrors.ANALYSIS_FAILED + e.getMessage()));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String blankToNull(String value) {
        return isBlank(value) ? null : value.trim();
    }
}
