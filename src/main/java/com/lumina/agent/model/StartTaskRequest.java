package com.lumina.agent.model;

import com.lumina.agent.llm.LlmConfigOverride;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class StartTaskRequest {

    @NotBlank(message = "message must not be blank")
    private String message;

    /**
     * Optional. Absolute path of the workspace the tools operate on.
     * Defaults to the configured index root.
     */
    private String workspacePath;

    private String activeNote;
    private String activeNoteContent;

    /** Defaults to editor */
    private AgentMode mode;

    private TaskIntent intent;

    /** Label shown for the task when the message carries inlined note contents */
    private String displayMessage;

    /** Optional per-task provider/model/sampling override */
    private LlmConfigOverride llmConfig;

    public TaskContext toContext(String defaultWorkspace) {
        return TaskContext.builder()
                .workspacePath(workspacePath != null && !workspacePath.isBlank() ? workspacePath : defaultWorkspace)
                .activeNote(activeNote)
                .activeNoteContent(activeNoteContent)
                .mode(mode != null ? mode : AgentMode.EDITOR)
                .intent(intent)
                .displayMessage(displayMessage)
                .build();
    }
}
