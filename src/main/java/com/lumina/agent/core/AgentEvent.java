package com.lumina.agent.core;

import lombok.Value;

import java.time.Instant;

/**
 * A state change published by {@link StateManager}.
 *
 * Payload by type: STATUS_CHANGED → AgentStatus, MESSAGE_ADDED → Message,
 * MESSAGES_REPLACED → List&lt;Message&gt;, PENDING_TOOL → ToolCall, ERROR → String,
 * REQUEST_TIMEOUT → Map (elapsedMs, thresholdMs), STREAM_CHUNK → StreamChunk.
 */
@Value
public class AgentEvent {

    AgentEventType type;
    Object payload;
    Instant timestamp;

    public static AgentEvent of(AgentEventType type, Object payload) {
        return new AgentEvent(type, payload, Instant.now());
    }
}
