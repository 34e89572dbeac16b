package com.purchasingpower.pipelinehealth.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of all tools known to the application.
 *
 * <p>Resolves tools by name and runs the applicable {@link ToolInterceptor}s
 * around each execution.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, Tool> tools = new LinkedHashMap<>();
    private final List<ToolInterceptor> interceptors;

    public ToolRegistry(List<Tool> tools, List<ToolInterceptor> interceptors) {
        for (Tool tool : tools) {
            Tool previous = this.tools.putIfAbsent(tool.getName(), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }
        this.interceptors = List.copyOf(interceptors);
        log.info("Registered {} tools: {}", this.tools.size(), this.tools.keySet());
    }

    public Optional<Tool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public Collection<Tool> getTools() {
        return Collections.unmodifiableCollection(tools.values());
    }

    /**
     * Execute a tool with its interceptors.
     *
     * <p>An exception escaping the tool or an interceptor's {@code beforeExecute}
     * becomes a failed result.
     */
    public ToolResult execute(Tool tool, Map<String, Object> parameters, ToolContext context) {
        List<ToolInterceptor> applicable = interceptors.stream()
            .filter(interceptor -> interceptor.appliesTo(tool))
            .toList();

        ToolResult result;
        try {
            for (ToolInterceptor interceptor : applicable) {
                interceptor.beforeExecute(tool, context);
            }
            result = tool.execute(parameters, context);
        } catch (Exception e) {
            log.error("Tool {} failed [{}]", tool.getName(), context.getInvocationId(), e);
            result = ToolResult.failure("Tool " + tool.getName() + " failed: " + e.getMessage());
        }

        for (ToolInterceptor interceptor : applicable) {
            interceptor.afterExecute(tool, context, result);
        }
        return result;
    }
}
