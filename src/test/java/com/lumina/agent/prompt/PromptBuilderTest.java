package com.lumina.agent.prompt;

import com.lumina.agent.config.AgentProperties;
import com.lumina.agent.config.ToolProperties;
import com.lumina.agent.model.AgentMode;
import com.lumina.agent.model.RagResult;
import com.lumina.agent.model.TaskContext;
import com.lumina.agent.tool.ToolRegistry;
import com.lumina.agent.tool.impl.AttemptCompletionTool;
import com.lumina.agent.tool.impl.ReadNoteTool;
import com.lumina.agent.tool.impl.WorkspaceFiles;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PromptBuilderTest {

    private PromptBuilder builder;

    @BeforeEach
    void setUp() {
        ToolProperties toolProperties = new ToolProperties();
        ToolRegistry registry = new ToolRegistry(
                List.of(new ReadNoteTool(new WorkspaceFiles(toolProperties)), new AttemptCompletionTool()),
                toolProperties);
        builder = new PromptBuilder(registry, new AgentProperties());
    }

    private static RagResult hit(String path, String content) {
        return RagResult.builder().filePath(path).content(content).score(0.5).build();
    }

    @Test
    void build_containsRoleToolsAndContext() {
        TaskContext ctx = TaskContext.builder()
                .mode(AgentMode.ORGANIZER)
                .workspacePath("/vault")
                .activeNote("inbox.md")
                .build();

        String prompt = builder.build(ctx);

        assertThat(prompt).startsWith(AgentMode.ORGANIZER.getRoleDefinition())
                .contains("## read_note")
                .contains("## attempt_completion")
                .contains("[TASK_COMPLETE]")
                .contains("- Workspace: /vault")
                .contains("- Open note: inbox.md");
    }

    @Test
    void build_isPure() {
        TaskContext ctx = TaskContext.builder().workspacePath("/vault").build();

        assertThat(builder.build(ctx)).isEqualTo(builder.build(ctx));
    }

    @Test
    void buildUserContent_wrapsTaskAndCurrentNote() {
        TaskContext ctx = TaskContext.builder()
                .activeNote("inbox.md")
                .activeNoteContent("- buy milk")
                .build();

        String content = builder.buildUserContent("tidy this note", ctx);

        assertThat(content).isEqualTo("""
                <task>
                tidy this note
                </task>

                <current_note path="inbox.md">
                - buy milk
                </current_note>""");
    }

    @Test
    void buildUserContent_inlinesTopThreeRelatedNotes_withTruncatedPreviews() {
        String longBody = "x".repeat(700);
        TaskContext ctx = TaskContext.builder()
                .ragResults(List.of(hit("a.md", longBody), hit("b.md", "B"), hit("c.md", "C"), hit("d.md", "D")))
                .build();

        String content = builder.buildUserContent("find related", ctx);

        assertThat(content).contains("<related_notes>")
                .contains("<note path=\"a.md\">\n" + "x".repeat(600) + "...\n</note>")
                .contains("<note path=\"c.md\">")
                .doesNotContain("d.md")
                .doesNotContain("<current_note");
    }

    @Test
    void buildUserContent_skipsRelatedHitForTheOpenNote() {
        TaskContext ctx = TaskContext.builder()
                .activeNote("a.md")
                .activeNoteContent("A")
                .ragResults(List.of(hit("a.md", "A"), hit("b.md", "B")))
                .build();

        String content = builder.buildUserContent("find related", ctx);

        assertThat(content).contains("<note path=\"b.md\">").doesNotContain("<note path=\"a.md\">");
    }
}
