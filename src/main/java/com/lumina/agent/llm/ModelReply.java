package com.lumina.agent.llm;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ModelReply {

    String content;

    /** Null when the provider does not report usage */
    TokenUsage usage;

    public static ModelReply of(String content) {
        return ModelReply.builder().content(content).build();
    }
}
