package com.purchasingpower.pipelinehealth.agent;

import java.util.Map;

/**
 * Base interface for invocable tools.
 *
 * <p>Each tool has a clear contract: input parameters, output format, and a
 * description that tells the caller when to use it.
 *
 * @since 1.0.0
 */
public interface Tool {

    /**
     * Unique name for this tool (e.g., "analyze_pipeline_results").
     */
    String getName();

    /**
     * Human-readable description of what the tool does and when to use it.
     */
    String getDescription();

    /**
     * JSON schema for the tool's parameters.
     *
     * @return JSON schema string
     */
    String getParameterSchema();

    /**
     * Execute this tool with the given parameters.
     *
     * <p>Invalid parameters are reported as a failed result, not thrown.
     *
     * @param parameters Input parameters from the caller
     * @param context Execution context
     * @return Tool execution result
     */
    ToolResult execute(Map<String, Object> parameters, ToolContext context);
}
