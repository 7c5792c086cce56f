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
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

@Component
@Slf4j
@RequiredArgsConstructor
public class ListNotesTool implements AgentTool {

    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "list_notes";
    }

    @Override
    public String getDescription() {
        return """
                List folders and notes under a workspace directory (the root when omitted).
                Use this to discover where things live before reading or organizing.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(ToolParameter.optional("directory", "Directory relative to the workspace; root if omitted"));
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String directory = WorkspaceFiles.param(params, "directory");
        try {
            Path dir = WorkspaceFiles.isBlank(directory) ? files.root(context) : files.resolve(context, directory);
            if (!Files.isDirectory(dir)) {
                return ToolResult.failure("Directory not found: " + directory);
            }

            List<String> lines = new ArrayList<>();
            try (Stream<Path> stream = Files.walk(dir, files.listDepth())) {
                for (Path p : stream.filter(p -> !p.equals(dir)).sorted().toList()) {
                    if (p.getFileName().toString().startsWith(".")) continue;
                    String rel = files.relativize(context, p);
                    if (Files.isDirectory(p)) {
                        lines.add(rel + "/");
                    } else if (files.isNote(p)) {
                        lines.add(rel);
                    }
                }
            }
            if (lines.isEmpty()) {
                return ToolResult.ok("No notes found in '" + (WorkspaceFiles.isBlank(directory) ? "/" : directory) + "'.");
            }
            return ToolResult.ok(String.join("\n", lines));
        } catch (IOException | RuntimeException e) {
            log.warn("list_notes failed [directory={}]: {}", directory, e.getMessage());
            return ToolResult.failure("Failed to list notes: " + e.getMessage());
        }
    }
}
