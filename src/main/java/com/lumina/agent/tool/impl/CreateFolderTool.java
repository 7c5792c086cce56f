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
public class CreateFolderTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "create_folder";
    }

    @Override
    public String getDescription() {
        return "Create a folder (and any missing parents) in the workspace.";
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.required("path", "Folder path relative to the workspace"));
    }

    @Override
    public boolean requiresApproval() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String relative = WorkspaceFiles.param(params, "path");
        if (WorkspaceFiles.isBlank(relative)) {
            return ToolResult.failure("Missing parameter 'path'.\n\nCorrect usage:\n"
                    + "<create_folder>\n<path>new/folder</path>\n</create_folder>");
        }
        try {
            Path path = files.resolve(context, relative);
            if (Files.exists(path)) {
                return ToolResult.failure("Folder already exists: " + relative);
            }
            Files.createDirectories(path);
            log.info("Created folder: {}", relative);
            return ToolResult.ok("Created folder: " + relative);
        } catch (IOException | RuntimeException e) {
            log.warn("create_folder failed [path={}]: {}", relative, e.getMessage());
            return ToolResult.failure("Failed to create folder: " + e.getMessage());
        }
    }
}
