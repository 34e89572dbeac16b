package com.purchasingpower.pipelinehealth.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.pipelinehealth.model.report.PipelineReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pipeline analysis response: {@code {"status": "success", "data": {...}}}
 * or {@code {"status": "error", "error": "..."}}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalyzePipelineResponse {

    private String status;
    private PipelineReport data;
    private String error;

    public static AnalyzePipelineResponse success(PipelineReport data) {
        return AnalyzePipelineResponse.builder()
            .status("success")
            .data(data)
            .build();
    }

    public static AnalyzePipelineResponse error(String error) {
        return AnalyzePipelineResponse.builder()
            .status("error")
            .error(error)
            .build();
    }
}
