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

/**
 * Changes an existing note in one of three ways:
 * - replace: whole-content rewrite
 * - append:  add content to the end
 * - patch:   replace the first occurrence of 'search' with 'content'
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class EditNoteTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "edit_note";
    }

    @Override
    public String getDescription() {
        return """
                Modify an existing note. mode 'replace' (default) rewrites the whole note,
                'append' adds content at the end, 'patch' replaces the exact text given in
                'search' with 'content'. Read the note first so 'search' matches exactly.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.required("path", "Path of the note to modify"),
                ToolParameter.required("content", "New content, appended text, or replacement text"),
                ToolParameter.optional("mode", "replace | append | patch"),
                ToolParameter.optional("search", "Exact text to replace when mode is 'patch'"));
    }

    @Override
    public boolean requiresApproval() {
        return true;
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String relative = WorkspaceFiles.param(params, "path");
        String content = WorkspaceFiles.param(params, "content");
        String mode = WorkspaceFiles.param(params, "mode");
        mode = WorkspaceFiles.isBlank(mode) ? "replace" : mode.strip().toLowerCase();

        if (WorkspaceFiles.isBlank(relative)) {
            return ToolResult.failure("Missing parameter 'path'");
        }
        if (content == null) {
            return ToolResult.failure("Missing parameter 'content'");
        }
        try {
            Path path = files.resolve(context, relative);
            if (!Files.isRegularFile(path)) {
                return ToolResult.failure("Note not found: " + relative + ". Use create_note for new notes.");
            }
            String current = Files.readString(path, StandardCharsets.UTF_8);
            String updated;
            switch (mode) {
                case "replace" -> updated = content;
                case "append" -> updated = current.endsWith("\n") || current.isEmpty()
                        ? current + content : current + "\n" + content;
                case "patch" -> {
                    String search = WorkspaceFiles.param(params, "search");
                    if (search == null || search.isEmpty()) {
                        return ToolResult.failure("Mode 'patch' needs a 'search' parameter");
                    }
                    int at = current.indexOf(search);
                    if (at < 0) {
                        return ToolResult.failure("Text given in 'search' was not found in " + relative
                                + ". Read the note again and copy the text exactly.");
                    }
                    updated = current.substring(0, at) + content + current.substring(at + search.length());
                }
                default -> {
                    return ToolResult.failure("Unknown mode '" + mode + "'. Use replace, append or patch.");
                }
            }
            byte[] bytes = updated.getBytes(StandardCharsets.UTF_8);
            if (bytes.length > files.maxBytes()) {
                return ToolResult.failure(String.format("Resulting note too large (%d bytes). Max: %d KB",
                        bytes.length, files.maxBytes() / 1024));
            }
            Files.write(path, bytes);
            log.info("Edited note: {} [mode={}, {} bytes]", relative, mode, bytes.length);
            return ToolResult.ok("Updated note: " + relative + " (" + mode + ")");
        } catch (IOException | RuntimeException e) {
            log.warn("edit_note failed [path={}]: {}", relative, e.getMessage());
            return ToolResult.failure("Failed to edit note: " + e.getMessage());
        }
    }
}
