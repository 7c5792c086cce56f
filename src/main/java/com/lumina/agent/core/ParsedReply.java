package com.lumina.agent.core;

import com.lumina.agent.model.ToolCall;
import lombok.Value;

import java.util.List;

/**
 * Structured view of one assistant reply: the tool calls in document order, and
 * whether the reply signals that the task is done (completion marker or an
 * attempt_completion call).
 */
@Value
public class ParsedReply {

    List<ToolCall> toolCalls;
    boolean completion;

    /** Reply text without reasoning blocks, recognized tool fragments and the completion marker */
    String cleanedText;

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    public boolean containsTool(String name) {
        return toolCalls.stream().anyMatch(c -> name.equals(c.getName()));
    }
}
