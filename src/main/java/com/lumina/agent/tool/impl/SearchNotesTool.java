package com.lumina.agent.tool.impl;

import com.lumina.agent.model.ToolResult;
import com.lumina.agent.search.SearchCapability;
import com.lumina.agent.search.SearchHit;
import com.lumina.agent.tool.AgentTool;
import com.lumina.agent.tool.ToolContext;
import com.lumina.agent.tool.ToolParameter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Component
@Slf4j
@RequiredArgsConstructor
public class SearchNotesTool implements AgentTool {

    private static final int PREVIEW_CHARS = 300;

    private final SearchCapability searchCapability;
    private final WorkspaceFiles files;

    @Override
    public String getName() {
        return "search_notes";
    }

    @Override
    public String getDescription() {
        return """
                Search the workspace for notes related to a query. Returns the best matching
                passages with their note path and heading. Read the note for full content.
                """;
    }

    @Override
    public List<ToolParameter> getParameters() {
        return List.of(
                ToolParameter.required("query", "What to look for, in natural language or keywords"),
                ToolParameter.optional("limit", "Maximum number of results (default 5)"));
    }

    @Override
    public ToolResult execute(Map<String, Object> params, ToolContext context) {
        String query = WorkspaceFiles.param(params, "query");
        if (WorkspaceFiles.isBlank(query)) {
            return ToolResult.failure("Missing parameter 'query'");
        }
        if (!searchCapability.isReady()) {
            return ToolResult.failure("Search index is not available yet");
        }

        int limit = files.searchLimit();
        String rawLimit = WorkspaceFiles.param(params, "limit");
        if (!WorkspaceFiles.isBlank(rawLimit)) {
            try {
                limit = Math.max(1, Integer.parseInt(rawLimit.strip()));
            } catch (NumberFormatException e) {
                return ToolResult.failure("Parameter 'limit' must be a number, got '" + rawLimit + "'");
            }
        }

        List<SearchHit> hits = searchCapability.search(query, limit);
        if (hits.isEmpty()) {
            return ToolResult.ok("No notes matched '" + query + "'.");
        }
        log.info("search_notes found {} hits for '{}'", hits.size(), query);
        return ToolResult.ok("Found " + hits.size() + " results:\n" + hits.stream()
                .map(this::format)
                .collect(Collectors.joining("\n\n")));
    }

    private String format(SearchHit hit) {
        String preview = hit.content().length() > PREVIEW_CHARS
                ? hit.content().substring(0, PREVIEW_CHARS) + "..." : hit.content();
        return String.format("- %s%s (score %.2f)\n%s",
                hit.filePath(), hit.heading() != null ? " › " + hit.heading() : "", hit.score(), preview);
    }
}
