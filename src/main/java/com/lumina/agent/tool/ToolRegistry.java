package com.lumina.agent.tool;

import com.lumina.agent.config.ToolProperties;
import com.lumina.agent.model.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Central registry for all AgentTool implementations.
 *
 * Spring auto-discovers every @Component that implements AgentTool
 * and injects them as a List<AgentTool>. We index them by name for O(1) dispatch.
 *
 * The registry is the only authority on approval: the flag is resolved once at
 * startup from the tool's default and the "tools.approval" overrides, so
 * {@link #requiresApproval(String)} is a pure lookup.
 *
 * Tool execution errors are caught here and returned as failed ToolResults
 * so the agent loop always continues and the model can decide what to do next.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new LinkedHashMap<>();
    private final Map<String, Boolean> approval = new LinkedHashMap<>();

    public ToolRegistry(List<AgentTool> toolBeans, ToolProperties toolProperties) {
        toolBeans.forEach(tool -> {
            if (tools.putIfAbsent(tool.getName(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
            boolean needsApproval = toolProperties.getApproval()
                    .getOrDefault(tool.getName(), tool.requiresApproval());
            approval.put(tool.getName(), needsApproval);
            log.info("Registered tool: [{}] approval={}", tool.getName(), needsApproval);
        });
        log.info("Total tools registered: {}", tools.size());
    }

    public List<ToolDefinition> getAllDefinitions() {
        return tools.values().stream()
                .map(tool -> ToolDefinition.from(tool, approval.get(tool.getName())))
                .toList();
    }

    public Set<String> getToolNames() {
        return Collections.unmodifiableSet(tools.keySet());
    }

    public boolean requiresApproval(String name) {
        return approval.getOrDefault(name, false);
    }

    /**
     * Dispatches a tool call and returns its result.
     * Never throws: all failures come back as {@code success=false} for the model to handle.
     */
    public ToolResult execute(String name, Map<String, Object> params, ToolContext context) {
        AgentTool tool = tools.get(name);

        if (tool == null) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s", name, tools.keySet());
            log.warn(msg);
            return ToolResult.failure(msg);
        }

        log.info("Executing tool: [{}] with params: {}", name, params.keySet());

        try {
            ToolResult result = tool.execute(params, context);
            if (result == null) {
                return ToolResult.failure("Tool '" + name + "' returned no result");
            }
            log.debug("Tool [{}] returned success={} content={}", name, result.isSuccess(), result.getContent());
            return result;
        } catch (Exception e) {
            log.error("Unexpected error in tool [{}]", name, e);
            return ToolResult.failure("Tool execution failed: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
        }
    }

    public int toolCount() {
        return tools.size();
    }
}
