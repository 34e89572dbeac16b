package com.purchasingpower.pipelinehealth.api;

import com.purchasingpower.pipelinehealth.agent.Tool;
import com.purchasingpower.pipelinehealth.agent.ToolRegistry;
import com.purchasingpower.pipelinehealth.agent.ToolResult;
import com.purchasingpower.pipelinehealth.agent.impl.ToolContextImpl;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * REST controller exposing registered tools to external callers.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tools")
@RequiredArgsConstructor
public class ToolController {

    private final ToolRegistry toolRegistry;

    /**
     * List registered tools.
     *
     * GET /api/v1/tools
     */
    @GetMapping
    public List<ToolDescriptor> listTools() {
        return toolRegistry.getTools().stream()
            .map(ToolDescriptor::of)
            .toList();
    }

    /**
     * Invoke a tool by name.
     *
     * POST /api/v1/tools/{name}/invoke
     */
    @PostMapping("/{name}/invoke")
    public ResponseEntity<ToolInvocationResponse> invoke(
            @PathVariable String name,
            @RequestBody(required = false) Map<String, Object> parameters,
            @RequestHeader(value = "X-Caller", required = false) String caller) {

        Optional<Tool> tool = toolRegistry.find(name);
        if (tool.isEmpty()) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ToolInvocationResponse.error("Unknown tool: " + name));
        }

        ToolContextImpl context = ToolContextImpl.create(caller != null ? caller : "api");
        ToolResult result = toolRegistry.execute(tool.get(), parameters != null ? parameters : Map.of(), context);
        return ResponseEntity.ok(ToolInvocationResponse.from(context.getInvocationId(), result));
    }
}
