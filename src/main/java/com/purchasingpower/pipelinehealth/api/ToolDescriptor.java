package com.purchasingpower.pipelinehealth.api;

import com.purchasingpower.pipelinehealth.agent.Tool;

/**
 * Listing entry for a registered tool.
 */
public record ToolDescriptor(String name, String description, String parameterSchema) {

    public static ToolDescriptor of(Tool tool) {
        return new ToolDescriptor(tool.getName(), tool.getDescription(), tool.getParameterSchema());
    }
}
