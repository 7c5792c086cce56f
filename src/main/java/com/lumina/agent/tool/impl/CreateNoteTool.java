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
import java.util.Optional;

/**
 * Creates a new note. Refuses to overwrite; existing notes go through edit_note.
 * Parent folders are created as needed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CreateNoteTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "create_note";
    }

    @Override
    public String getDescription() {
        return """
                Create a new note with the given content. Missing parent folders are created.
                Fails if the note already exists; use edit_note to change an existing note.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.required("path", "Path of the new note, e.g. 'notes/meeting.md'"),
                ToolParameter.required("content", "Full Markdown content of the note"));
    }

    @Override
    public boolean requiresApproval() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String relative = WorkspaceFiles.param(params, "path");
        String content = WorkspaceFiles.param(params, "content");
        if (WorkspaceFiles.isBlank(relative)) {
            return ToolResult.failure("Missing parameter 'path'.\n\nCorrect usage:\n"
                    + "<create_note>\n<path>folder/note.md</path>\n<content>...</content>\n</create_note>");
        }
        if (content == null) {
            return ToolResult.failure("Missing parameter 'content'");
        }
        try {
            Path path = files.resolve(context, relative);
            Optional<String> extensionError = files.checkExtension(path);
            if (extensionError.isPresent()) {
                return ToolResult.failure(extensionError.get());
            }
            if (Files.exists(path)) {
                return ToolResult.failure("Note already exists: " + relative + ". Use edit_note to change it.");
            }
            byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
            if (bytes.length > files.maxBytes()) {
                return ToolResult.failure(String.format("Content too large (%d bytes). Max: %d KB",
                        bytes.length, files.maxBytes() / 1024));
            }
            Files.createDirectories(path.getParent());
            Files.write(path, bytes);
            log.info("Created note: {} ({} bytes)", relative, bytes.length);
            return ToolResult.ok("Created note: " + relative);
        } catch (IOException | RuntimeException e) {
            log.warn("create_note failed [path={}]: {}", relative, e.getMessage());
            return ToolResult.failure("Failed to create note: " + e.getMessage());
        }
    }
}
