package com.purchasingpower.pipelinehealth.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.purchasingpower.pipelinehealth.agent.ToolResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Tool invocation response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ToolInvocationResponse {

    private boolean success;
    private String invocationId;
    private String message;
    private Object data;
    private Map<String, Object> metadata;

    public static ToolInvocationResponse from(String invocationId, ToolResult result) {
        return ToolInvocationResponse.builder()
            .success(result.isSuccess())
            .invocationId(invocationId)
            .message(result.getMessage())
            .data(result.getData())
            .metadata(result.getMetadata())
            .build();
    }

    public static ToolInvocationResponse error(String message) {
        return ToolInvocationResponse.builder()
            .success(false)
            .message(message)
            .build();
    }
}
