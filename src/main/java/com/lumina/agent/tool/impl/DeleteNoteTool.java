package com.lumina.agent.tool.impl;

import com.lumina.agent.model.ToolResult;
import com.lumina.agent.tool.AgentTool;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolParameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class DeleteNoteTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "delete_note";
    }

    @Override
    public String getDescription() {
        return "Delete a note from the workspace. Folders are not deleted by this tool.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.required("path", "Path of the note to delete"));
    }

    @Override
    public boolean requiresApproval() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String relative = WorkspaceFiles.param(params, "path");
        if (WorkspaceFiles.isBlank(relative)) {
            return ToolResult.failure("Missing parameter 'path'");
        }
        try {
            Path path = files.resolve(context, relative);
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("Note not found: " + relative);
            }
            Files.delete(path);
            log.info("Deleted note: {}", relative);
            return ToolResult.ok("Deleted: " + relative);
        } catch (IOException | RuntimeException e) {
            log.warn("delete_note failed [path={}]: {}", relative, e.getMessage());
            return ToolResult.failure("Failed to delete note: " + e.getMessage());
        }
    }
}
