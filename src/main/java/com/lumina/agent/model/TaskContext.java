package com.lumina.agent.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.util.List;

/**
 * Immutable input to a task. RAG results are attached once, at task start,
 * through {@link #withRagResults(List)}.
 */
@Value
@Builder
@With
public class TaskContext {

    String workspacePath;
    String activeNote;
    String activeNoteContent;

    @Builder.Default
    AgentMode mode = AgentMode.EDITOR;

    TaskIntent intent;

    @Builder.Default
    List<RagResult> ragResults = List.of();

    /**
     * Short form of the user message (e.g. without inlined file contents). When set it
     * becomes the task label in the agent state; the model still receives the full message.
     */
    String displayMessage;

    public boolean hasActiveNote() {
        return activeNote != null && !activeNote.isBlank()
                && activeNoteContent != null && !activeNoteContent.isEmpty();
    }

    public boolean hasRagResults() {
        return ragResults != null && !ragResults.isEmpty();
    }
}
