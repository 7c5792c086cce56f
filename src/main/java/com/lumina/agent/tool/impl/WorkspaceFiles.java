package com.lumina.agent.tool.impl;

import com.lumina.agent.config.ToolProperties;
import com.lumina.agent.tool.ToolContext;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;

/**
 * Shared sandboxing for the note tools.
 *
 * Security model:
 * - Every path is resolved against the task's workspace root
 * - Path traversal prevention: the normalized path must stay under the root
 * - Extension allowlist for anything read or written as a note
 * - Size cap on reads and writes
 */
@Component
public class WorkspaceFiles {

    private final ToolProperties toolProperties;

    public WorkspaceFiles(ToolProperties toolProperties) {
        this.toolProperties = toolProperties;
    }

    /**
     * Resolves a workspace-relative path. Throws SecurityException if it escapes the root.
     */
    public Path resolve(ToolContext context, String relative) throws IOException {
        Path root = root(context);
        Path resolved = root.resolve(stripLeadingSlash(relative)).normalize();
        if (!resolved.startsWith(root)) {
            throw new SecurityException("Path escapes the workspace: '" + relative + "'");
        }
        return resolved;
    }

    public Path root(ToolContext context) throws IOException {
        String workspace = context.getWorkspacePath();
        if (workspace == null || workspace.isBlank()) {
            throw new IllegalStateException("No workspace is open");
        }
        Path root = Paths.get(workspace).toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            throw new IllegalStateException("Workspace does not exist: " + workspace);
        }
        return root.toRealPath(LinkOption.NOFOLLOW_LINKS);
    }

    public String relativize(ToolContext context, Path path) throws IOException {
        return root(context).relativize(path).toString().replace('\\', '/');
    }

    /** Returns an error message if the extension is not allowed, empty otherwise. */
    public Optional<String> checkExtension(Path path) {
        String ext = extension(path.getFileName().toString());
        if (!toolProperties.getWorkspace().getAllowedExtensionList().contains(ext)) {
            return Optional.of("Extension '." + ext + "' not allowed. Allowed: "
                    + toolProperties.getWorkspace().getAllowedExtensionList());
        }
        return Optional.empty();
    }

    public boolean isNote(Path path) {
        return toolProperties.getWorkspace().getAllowedExtensionList()
                .contains(extension(path.getFileName().toString()));
    }

    public int maxBytes() {
        return toolProperties.getWorkspace().getMaxFileSizeKb() * 1024;
    }

    public int listDepth() {
        return toolProperties.getWorkspace().getListDepth();
    }

    public int searchLimit() {
        return toolProperties.getWorkspace().getSearchLimit();
    }

    /**
     * Reads a parameter as text. Structured values (parsed from JSON) are
     * rendered back with toString; absent values come back null.
     */
    public static String param(Map<String, Object> params, String name) {
        Object value = params.get(name);
        return value != null ? value.toString() : null;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String stripLeadingSlash(String path) {
        String p = path.strip();
        while (p.startsWith("/") || p.startsWith("\\")) {
            p = p.substring(1);
        }
        return p;
    }

    private static String extension(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot >= 0 ? filename.substring(dot + 1).toLowerCase() : "";
    }
}
