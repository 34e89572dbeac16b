package com.purchasingpower.pipelinehealth.agent;

/**
 * Context provided to tools during execution.
 *
 * @since 1.0.0
 */
public interface ToolContext {

    /**
     * Unique id of this invocation, used to correlate log lines.
     */
    String getInvocationId();

    /**
     * Who asked for the invocation (user, agent, API client), if known.
     */
    String getCaller();

    /**
     * Get a context variable by key.
     *
     * @param key Variable key
     * @return Variable value or null
     */
    Object getVariable(String key);

    /**
     * Set a context variable.
     *
     * @param key Variable key
     * @param value Variable value
     */
    void setVariable(String key, Object value);
}
