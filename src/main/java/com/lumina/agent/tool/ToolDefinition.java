package com.lumina.agent.tool;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Immutable snapshot of a tool's contract, rendered into the system prompt.
 * Decouples the prompt format from the AgentTool implementation.
 */
@Data
@Builder
public class ToolDefinition {

    private String name;
    private String description;
    private List<ToolParameter> parameters;
    private boolean requiresApproval;

    public static ToolDefinition from(AgentTool tool, boolean requiresApproval) {
        return ToolDefinition.builder()
                .name(tool.getName())
                .description(tool.getDescription().strip())
                .parameters(List.copyOf(tool.getParameters()))
                .requiresApproval(requiresApproval)
                .build();
    }

    /**
     * Renders the section the model reads, ending with a usage example in tag form.
     */
    public String toPromptSection() {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(name).append('\n');
        sb.append("Description: ").append(description).append('\n');
        if (requiresApproval) {
            sb.append("Note: the user must approve this tool before it runs.\n");
        }
        if (!parameters.isEmpty()) {
            sb.append("Parameters:\n");
            for (ToolParameter p : parameters) {
                sb.append("- ").append(p.getName())
                        .append(p.isRequired() ? ": (required) " : ": (optional) ")
                        .append(p.getDescription()).append('\n');
            }
        }
        sb.append("Usage:\n<").append(name).append(">\n");
        for (ToolParameter p : parameters) {
            sb.append('<').append(p.getName()).append('>')
                    .append(p.getName()).append(" here")
                    .append("</").append(p.getName()).append(">\n");
        }
        sb.append("</").append(name).append(">\n");
        return sb.toString();
    }
}
