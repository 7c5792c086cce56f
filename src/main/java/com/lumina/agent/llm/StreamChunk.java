package com.lumina.agent.llm;

import lombok.Value;

/**
 * One increment of a streamed model reply.
 */
@Value
public class StreamChunk {

    public enum Type {
        TEXT, REASONING, USAGE, ERROR
    }

    Type type;
    String text;
    TokenUsage usage;
    String error;

    public static StreamChunk text(String text) {
        return new StreamChunk(Type.TEXT, text, null, null);
    }

    public static StreamChunk reasoning(String text) {
        return new StreamChunk(Type.REASONING, text, null, null);
    }

    public static StreamChunk usage(TokenUsage usage) {
        return new StreamChunk(Type.USAGE, null, usage, null);
    }

    public static StreamChunk error(String error) {
        return new StreamChunk(Type.ERROR, null, null, error);
    }
}
