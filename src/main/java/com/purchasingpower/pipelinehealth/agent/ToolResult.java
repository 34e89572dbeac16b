package com.purchasingpower.pipelinehealth.agent;

import java.util.Map;

/**
 * Result from a tool execution.
 *
 * @since 1.0.0
 */
public interface ToolResult {

    /**
     * Whether the tool executed successfully.
     */
    boolean isSuccess();

    /**
     * Payload serialized to the caller, e.g. a pipeline report. Null for failures.
     */
    Object getData();

    /**
     * Human-readable message about the result. For failures, the error description.
     */
    String getMessage();

    /**
     * Additional metadata about the execution.
     */
    Map<String, Object> getMetadata();

    /**
     * Create a successful result.
     */
    static ToolResult success(Object data, String message) {
        return new ToolResultImpl(true, data, message, Map.of());
    }

    /**
     * Create a successful result carrying metadata.
     */
    static ToolResult success(Object data, String message, Map<String, Object> metadata) {
        return new ToolResultImpl(true, data, message, Map.copyOf(metadata));
    }

    /**
     * Create a failed result.
     */
    static ToolResult failure(String message) {
        return new ToolResultImpl(false, null, message, Map.of());
    }
}

/**
 * Default implementation of ToolResult.
 */
record ToolResultImpl(
    boolean isSuccess,
    Object data,
    String message,
    Map<String, Object> metadata
) implements ToolResult {

    @Override
    public boolean isSuccess() {
        return isSuccess;
    }

    @Override
    public Object getData() {
        return data;
    }

    @Override
    public String getMessage() {
        return message;
    }

    @Override
    public Map<String, Object> getMetadata() {
        return metadata;
    }
}
