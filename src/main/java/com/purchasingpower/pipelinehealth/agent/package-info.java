/**
 * Tool invocation boundary: exposes the analysis to agents and other callers
 * that invoke named tools with loosely typed parameters.
 *
 * <p>Key classes:
 * <ul>
 *   <li>{@code Tool} - Base interface for all tools</li>
 *   <li>{@code ToolRegistry} - Resolves tools by name and runs interceptors around them</li>
 *   <li>{@code AnalyzePipelineTool} - The {@code analyze_pipeline_results} tool</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.pipelinehealth.agent;
