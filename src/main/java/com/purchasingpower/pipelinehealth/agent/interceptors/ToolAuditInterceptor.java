package com.purchasingpower.pipelinehealth.agent.interceptors;

import com.purchasingpower.pipelinehealth.agent.Tool;
import com.purchasingpower.pipelinehealth.agent.ToolContext;
import com.purchasingpower.pipelinehealth.agent.ToolInterceptor;
import com.purchasingpower.pipelinehealth.agent.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Logs every tool invocation with its caller, outcome and duration.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolAuditInterceptor implements ToolInterceptor {

    static final String STARTED_AT = "audit.startedAt";

    @Override
    public void beforeExecute(Tool tool, ToolContext context) {
        context.setVariable(STARTED_AT, System.currentTimeMillis());
        log.info("Tool {} invoked by {} [{}]", tool.getName(), context.getCaller(), context.getInvocationId());
    }

    @Override
    public void afterExecute(Tool tool, ToolContext context, ToolResult result) {
        Object startedAt = context.getVariable(STARTED_AT);
        long durationMs = startedAt instanceof Long start ? System.currentTimeMillis() - start : -1;

        if (result.isSuccess()) {
            log.info("Tool {} succeeded [{}] ({}ms): {}",
                tool.getName(), context.getInvocationId(), durationMs, result.getMessage());
        } else {
            log.warn("Tool {} failed [{}] ({}ms): {}",
                tool.getName(), context.getInvocationId(), durationMs, result.getMessage());
        }
    }
}
