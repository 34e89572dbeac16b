package com.purchasingpower.pipelinehealth.agent.impl;

import com.purchasingpower.pipelinehealth.agent.ToolContext;
import lombok.Builder;
import lombok.Data;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Default implementation of ToolContext.
 *
 * @since 1.0.0
 */
@Data
@Builder
public class ToolContextImpl implements ToolContext {

    @Builder.Default
    private String invocationId = UUID.randomUUID().toString().substring(0, 8);

    private String caller;

    @Builder.Default
    private Map<String, Object> variables = new HashMap<>();

    @Override
    public Object getVariable(String key) {
        return variables.get(key);
    }

    @Override
    public void setVariable(String key, Object value) {
        variables.put(key, value);
    }

    public static ToolContextImpl create(String caller) {
        return ToolContextImpl.builder()
            .caller(caller)
            .build();
    }
}
