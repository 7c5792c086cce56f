package com.lumina.agent.tool.impl;

import com.lumina.agent.model.ToolResult;
import com.lumina.agent.tool.AgentTool;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolParameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

@Component
@Slf4j
@RequiredArgsConstructor
public class ReadNoteTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "read_note";
    }

    @Override
    public String getDescription() {
        return """
                Read the full content of a note in the workspace.
                Use this before editing a note so your changes build on what is already there.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.required("path", "Note path relative to the workspace, e.g. 'projects/plan.md'"));
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String relative = WorkspaceFiles.param(params, "path");
        if (WorkspaceFiles.isBlank(relative)) {
            return ToolResult.failure("Missing parameter 'path'.\n\nCorrect usage:\n"
                    + "<read_note>\n<path>folder/note.md</path>\n</read_note>");
        }
        try {
            Path path = files.resolve(context, relative);
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("Note not found: " + relative);
            }
            long size = Files.size(path);
            if (size > files.maxBytes()) {
                return ToolResult.failure(String.format("Note too large (%d KB). Max allowed: %d KB",
                        size / 1024, files.maxBytes() / 1024));
            }
            String content = Files.readString(path, StandardCharsets.UTF_8);
            log.info("Read note: {} ({} chars)", relative, content.length());
            return ToolResult.ok(content);
        } catch (IOException | RuntimeException e) {
            log.warn("read_note failed [path={}]: {}", relative, e.getMessage());
            return ToolResult.failure("Failed to read note: " + e.getMessage());
        }
    }
}
