/**
 * REST API layer: controllers and DTOs.
 *
 * <ul>
 *   <li>{@code PipelineAnalysisController} - Pipeline health analysis</li>
 *   <li>{@code ToolController} - Lists and invokes registered tools</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.purchasingpower.pipelinehealth.api;
