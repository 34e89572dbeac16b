package com.purchasingpower.pipelinehealth.agent;

/**
 * Hook around every tool invocation made through {@link ToolRegistry}.
 *
 * <p>{@code beforeExecute} may veto an invocation by throwing; the registry
 * then reports a failed result without calling the tool. {@code afterExecute}
 * sees every outcome, vetoed ones included.
 *
 * @since 1.0.0
 */
public interface ToolInterceptor {

    void beforeExecute(Tool tool, ToolContext context);

    default void afterExecute(Tool tool, ToolContext context, ToolResult result) {
    }

    /**
     * Restricts the interceptor to some tools. Applies to all by default.
     */
    default boolean appliesTo(Tool tool) {
        return true;
    }
}
