package com.lumina.agent.observability;

import com.lumina.agent.llm.TokenUsage;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable per-task record of what the loop did, for the task-end log line.
 * Created at task start, filled in by the loop thread only.
 *
 * Kept apart from StateManager so telemetry does not leak into the state
 * observers see.
 */
@Data
public class RunContext {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int modelCalls;
    private int promptTokens;
    private int completionTokens;

    public void recordModelCall(TokenUsage usage) {
        modelCalls++;
        if (usage != null) {
            promptTokens += usage.promptTokens();
            completionTokens += usage.completionTokens();
        }
    }

    public void recordToolCall(String toolName, long latencyMs, boolean success) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, success));
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }

    public long failedToolCalls() {
        return toolCallRecords.stream().filter(r -> !r.success()).count();
    }

    public record ToolCallRecord(
            String toolName,
            long latencyMs,
            boolean success
    ) {}
}
