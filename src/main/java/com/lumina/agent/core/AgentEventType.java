package com.lumina.agent.core;

public enum AgentEventType {
    STATUS_CHANGED,
    MESSAGE_ADDED,
    MESSAGES_REPLACED,
    PENDING_TOOL,
    ERROR,
    REQUEST_TIMEOUT,
    STREAM_CHUNK
}
