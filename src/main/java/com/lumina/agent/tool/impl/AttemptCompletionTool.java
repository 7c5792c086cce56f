package com.lumina.agent.tool.impl;

import com.lumina.agent.core.MessageParser;
import com.lumina.agent.model.ToolResult;
import com.lumina.agent.tool.AgentTool;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolParameter;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Signals that the task is done. The loop ends the task after the turn that calls it.
 */
@Component
public class AttemptCompletionTool implements AgentTool {

    public static final String NAME = MessageParser.COMPLETION_TOOL;

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return """
                Call this once the task is finished, with a short summary of what you did.
                Only call it after every tool you used has reported success.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.required("result", "Summary of the outcome for the user"));
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String result = WorkspaceFiles.param(params, "result");
        return ToolResult.ok(WorkspaceFiles.isBlank(result) ? "Task completed." : result.strip());
    }
}
