package com.lumina.agent.core;

import com.lumina.agent.model.AgentStatus;
import com.lumina.agent.model.Message;
import com.lumina.agent.model.ToolCall;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Immutable snapshot of a loop's state, safe to hand to other threads.
 */
@Value
@Builder
public class AgentState {

    AgentStatus status;
    List<Message> messages;
    ToolCall pendingTool;
    int consecutiveErrorCount;

    /** Epoch millis of the in-flight model call, null when none is in flight */
    Long llmRequestStartTime;
    int llmRequestCount;

    String task;

    /** Human-readable reason, set only when status = error */
    String errorMessage;
}
