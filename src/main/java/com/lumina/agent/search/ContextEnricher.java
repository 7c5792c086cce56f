package com.lumina.agent.search;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.model.RagResult;
import com.lumina.agent.model.TaskContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds notes related to the instruction into the task context.
 *
 * Runs at most once per task start. Any search failure is logged and the
 * context is returned unchanged.
 */
@Component
@Slf4j
public class ContextEnricher {

    private final SearchCapability searchCapability;
    private final AgentProperties.Rag rag;

    public ContextEnricher(SearchCapability searchCapability, AgentProperties agentProperties) {
        this.searchCapability = searchCapability;
        this.rag = agentProperties.getRag();
    }

    public TaskContext enrich(String userMessage, TaskContext context) {
        if (userMessage == null || userMessage.length() < rag.getMinQueryLength()) {
            return context;
        }
        if (!rag.isEnabled() || !searchCapability.isReady()) {
            return context;
        }

        try {
            List<SearchHit> hits = searchCapability.search(userMessage, rag.getLimit());
            if (hits == null || hits.isEmpty()) {
                return context;
            }

            List<RagResult> results = hits.stream()
                    .filter(h -> h.filePath() != null && !h.filePath().isBlank())
                    .filter(h -> h.content() != null && !h.content().isBlank())
                    .map(h -> RagResult.builder()
                            .filePath(h.filePath())
                            .content(h.content())
                            .score(Double.isNaN(h.score()) ? 0 : h.score())
                            .heading(h.heading() != null && !h.heading().isBlank() ? h.heading() : null)
                            .build())
                    .toList();

            if (results.isEmpty()) {
                return context;
            }
            log.info("Context enriched with {} related notes", results.size());
            return context.withRagResults(results);

        } catch (Exception e) {
            log.error("Related-note search failed, continuing without it", e);
            return context;
        }
    }
}
