package com.purchasingpower.pipelinehealth.agent.tools;

import com.purchasingpower.pipelinehealth.agent.Tool;
import com.purchasingpower.pipelinehealth.agent.ToolContext;
import com.purchasingpower.pipelinehealth.agent.ToolResult;
import com.purchasingpower.pipelinehealth.analysis.AnalysisErrors;
import com.purchasingpower.pipelinehealth.analysis.AnalysisRequest;
import com.purchasingpower.pipelinehealth.analysis.AnalysisResult;
import com.purchasingpower.pipelinehealth.ci.ProjectRef;
import com.purchasingpower.pipelinehealth.model.report.PipelineReport;
import com.purchasingpower.pipelinehealth.service.PipelineAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Tool that analyzes CI pipeline runs and recommends improvements.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalyzePipelineTool implements Tool {

    private final PipelineAnalysisService analysisService;

    @Override
    public String getName() {
        return "analyze_pipeline_results";
    }

    @Override
    public String getDescription() {
        return "Analyze recent GitHub Actions pipeline runs of a repository: success rate, average duration, "
            + "recurring job failures, and prioritized recommendations.";
    }

    @Override
    public String getParameterSchema() {
        return "{\"repo_owner\": \"string (required)\", \"repo_name\": \"string (required)\", "
            + "\"workflow_id\": \"string (optional) - workflow id or file name\", "
            + "\"run_id\": \"string (optional) - analyze only this run, ignoring days and workflow_id\", "
            + "\"days\": \"integer (optional, default " + analysisService.getDefaultWindowDays()
            + ", 0 or less for no limit)\"}";
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String owner = stringParam(parameters, "repo_owner");
        String name = stringParam(parameters, "repo_name");
        if (owner == null || name == null) {
            return ToolResult.failure(AnalysisErrors.MISSING_PARAMETERS);
        }

        int days;
        try {
            days = daysParam(parameters.get("days"));
        } catch (NumberFormatException e) {
            return ToolResult.failure("days must be an integer, got: " + parameters.get("days"));
        }

        AnalysisRequest request = new AnalysisRequest(
            new ProjectRef(owner, name),
            stringParam(parameters, "workflow_id"),
            stringParam(parameters, "run_id"),
            days);

        AnalysisResult result = analysisService.analyze(request);
        if (!result.isSuccess()) {
            return ToolResult.failure(result.getError());
        }

        PipelineReport report = PipelineReport.from(result);
        return ToolResult.success(
            report,
            "Analyzed " + report.summary().totalRuns() + " runs of " + request.project(),
            Map.of("skippedRuns", result.getSkippedRuns()));
    }

    private int daysParam(Object value) {
        if (value == null) {
            return analysisService.getDefaultWindowDays();
        }
        if (value instanceof Number number) {
            return number.intValue();
        }
        String text = value.toString().trim();
        return text.isEmpty() ? analysisService.getDefaultWindowDays() : Integer.parseInt(text);
    }

    private static String stringParam(Map<String, Object> parameters, String key) {
        Object value = parameters.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }
}
