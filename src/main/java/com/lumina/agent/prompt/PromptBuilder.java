package com.lumina.agent.prompt;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.core.MessageParser;
import com.lumina.agent.model.AgentMode;
import com.lumina.agent.model.RagResult;
import com.lumina.agent.model.TaskContext;
import com.lumina.agent.tool.ToolDefinition;
import com.lumina.agent.tool.ToolRegistry;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Renders the system prompt and the user turn of a task.
 * Both methods are pure: same context, same text.
 */
@Component
public class PromptBuilder {

    private final ToolRegistry toolRegistry;
    private final AgentProperties.Rag rag;

    public PromptBuilder(ToolRegistry toolRegistry, AgentProperties agentProperties) {
        this.toolRegistry = toolRegistry;
        this.rag = agentProperties.getRag();
    }

    public String build(TaskContext context) {
        AgentMode mode = context.getMode() != null ? context.getMode() : AgentMode.EDITOR;
        StringBuilder sb = new StringBuilder();

        sb.append(mode.getRoleDefinition()).append("\n\n");

        sb.append("""
                # Tool use

                You work in the user's note workspace through tools. Call a tool with XML-style tags:

                <tool_name>
                <parameter_name>value</parameter_name>
                </tool_name>

                You may call several tools in one reply; they run in the order written.
                Each result comes back in the next user message. Think inside <thinking> tags before acting;
                tags written inside <thinking> are never executed.

                # Tools

                """);

        for (ToolDefinition definition : toolRegistry.getAllDefinitions()) {
            sb.append(definition.toPromptSection()).append('\n');
        }

        sb.append("# Rules\n\n");
        sb.append("- File paths are relative to the workspace root.\n");
        sb.append("- Read a note before editing it unless its content is already in the conversation.\n");
        sb.append("- If a tool fails, read the error, fix the call and try again.\n");
        sb.append("- If you need information only the user has, ask one direct question.\n");
        sb.append("- When the task is done, call <").append(MessageParser.COMPLETION_TOOL)
                .append("> with a short summary, or end your reply with ")
                .append(MessageParser.COMPLETION_MARKER).append(".\n\n");

        sb.append("# Context\n\n");
        sb.append("- Mode: ").append(mode.getDisplayName()).append('\n');
        if (context.getWorkspacePath() != null) {
            sb.append("- Workspace: ").append(context.getWorkspacePath()).append('\n');
        }
        if (context.getActiveNote() != null && !context.getActiveNote().isBlank()) {
            sb.append("- Open note: ").append(context.getActiveNote()).append('\n');
        }
        return sb.toString();
    }

    public String buildUserContent(String userMessage, TaskContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("<task>\n").append(userMessage).append("\n</task>");

        if (context.hasActiveNote()) {
            sb.append("\n\n<current_note path=\"").append(context.getActiveNote()).append("\">\n")
                    .append(context.getActiveNoteContent())
                    .append("\n</current_note>");
        }

        if (context.hasRagResults()) {
            List<RagResult> related = context.getRagResults().stream()
                    .filter(r -> !r.getFilePath().equals(context.getActiveNote()))
                    .limit(rag.getTopResults())
                    .toList();
            if (!related.isEmpty()) {
                sb.append("\n\n<related_notes>");
                for (RagResult r : related) {
                    sb.append("\n<note path=\"").append(r.getFilePath()).append('"');
                    if (r.getHeading() != null) {
                        sb.append(" heading=\"").append(r.getHeading()).append('"');
                    }
                    sb.append(">\n").append(preview(r.getContent())).append("\n</note>");
                }
                sb.append("\n</related_notes>");
            }
        }
        return sb.toString();
    }

    private String preview(String content) {
        if (content.length() <= rag.getPreviewChars()) {
            return content;
        }
        return content.substring(0, rag.getPreviewChars()) + "...";
    }
}
