package com.lumina.agent.search;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.model.TaskContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ContextEnricherTest {

    @Mock
    private SearchCapability searchCapability;

    private AgentProperties properties;
    private ContextEnricher enricher;
    private final TaskContext context = TaskContext.builder().workspacePath("/vault").build();

    @BeforeEach
    void setUp() {
        properties = new AgentProperties();
        enricher = new ContextEnricher(searchCapability, properties);
    }

    @Test
    void enrich_attachesValidHits() {
        when(searchCapability.isReady()).thenReturn(true);
        when(searchCapability.search("plan the garden", 10)).thenReturn(List.of(
                new SearchHit("garden.md", "Tomatoes", Double.NaN, " "),
                new SearchHit("", "orphan", 0.5, null),
                new SearchHit("empty.md", "  ", 0.5, null)));

        TaskContext enriched = enricher.enrich("plan the garden", context);

        assertThat(enriched.getRagResults()).hasSize(1);
        assertThat(enriched.getRagResults().get(0).getFilePath()).isEqualTo("garden.md");
        assertThat(enriched.getRagResults().get(0).getScore()).isZero();
        assertThat(enriched.getRagResults().get(0).getHeading()).isNull();
        assertThat(enriched.getWorkspacePath()).isEqualTo("/vault");
    }

    @Test
    void enrich_shortMessage_skipsSearch() {
        assertThat(enricher.enrich("hi", context)).isSameAs(context);
        verify(searchCapability, never()).search(anyString(), anyInt());
    }

    @Test
    void enrich_disabled_skipsSearch() {
        properties.getRag().setEnabled(false);

        assertThat(enricher.enrich("plan the garden", context)).isSameAs(context);
        verify(searchCapability, never()).isReady();
    }

    @Test
    void enrich_searchFailure_returnsContextUnchanged() {
        when(searchCapability.isReady()).thenReturn(true);
        when(searchCapability.search(anyString(), anyInt())).thenThrow(new IllegalStateException("index corrupt"));

        assertThat(enricher.enrich("plan the garden", context)).isSameAs(context);
    }
}
