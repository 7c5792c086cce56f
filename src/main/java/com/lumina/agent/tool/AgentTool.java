package com.lumina.agent.tool;

import com.lumina.agent.model.ToolResult;

import java.util.List;
import java.util.Map;

/**
 * Contract every workspace tool must implement.
 *
 * The model invokes a tool by writing its name as a tag with one child tag per
 * parameter, e.g. {@code <read_note><path>inbox.md</path></read_note>}.
 *
 * Tool execution errors should NOT throw. Return {@link ToolResult#failure} instead.
 * The registry catches anything that escapes, but a tool knows best how to
 * explain its own failure to the model.
 */
public interface AgentTool {

    /** Unique snake_case name, doubling as the invocation tag */
    String getName();

    /**
     * Human-readable description. This is the primary signal the model uses
     * to decide when to call this tool.
     */
    String getDescription();

    List<ToolParameter> getParameters();

    /**
     * Whether a human must approve each call before it runs. Anything that writes
     * to or deletes from the workspace should say yes.
     */
    default boolean requiresApproval() {
        return false;
    }

    ToolResult execute(Map<String, Object> params, ToolContext context);
}
